package com.ryuqq.stageflow.core.outcome;

import com.ryuqq.stageflow.core.error.ErrorType;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>문서 형식 오류 (파싱 불가)</li>
 *   <li>재시도 한도 내에 해소되지 않은 자연 키 충돌</li>
 *   <li>다른 Workflow에 락을 빼앗김</li>
 * </ul>
 *
 * @param errorType 실패 분류
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record Fail(
    ErrorType errorType,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorType이 null이거나 message가 비어있는 경우
     */
    public Fail {
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param errorType 실패 분류
     * @param message 오류 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorType errorType, String message, String cause) {
        return new Fail(errorType, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorType 실패 분류
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorType errorType, String message) {
        return new Fail(errorType, message, null);
    }
}
