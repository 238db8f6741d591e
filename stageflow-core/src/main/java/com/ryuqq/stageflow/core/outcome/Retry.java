package com.ryuqq.stageflow.core.outcome;

import com.ryuqq.stageflow.core.error.ErrorType;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>핸들러가 명시적으로 반환하거나, 던진 예외가 재시도 가능으로 분류된 경우입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>저장소 연결 끊김, 커넥션 풀 타임아웃</li>
 *   <li>외부 플랫폼 Rate Limit (429)</li>
 *   <li>엔티티 락 획득 시간 초과</li>
 * </ul>
 *
 * @param errorType 실패 분류
 * @param reason 재시도 사유
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record Retry(
    ErrorType errorType,
    String reason
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    /**
     * Retry 생성.
     *
     * @param errorType 실패 분류
     * @param reason 재시도 사유
     * @return Retry 인스턴스
     */
    public static Retry of(ErrorType errorType, String reason) {
        return new Retry(errorType, reason);
    }
}
