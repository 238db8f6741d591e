package com.ryuqq.stageflow.core.stage;

import com.ryuqq.stageflow.core.outcome.Outcome;

/**
 * Stage 업무 로직 실행 계약.
 *
 * <p>핸들러는 같은 입력에 대해 멱등이어야 합니다. 임대 만료 후 재전달이나
 * 재시도 시 같은 Stage가 다시 실행될 수 있으며, 결과는 해당 Stage의
 * 네임스페이스만 덮어씁니다.</p>
 *
 * <p><strong>결과 전달 방식:</strong></p>
 * <ul>
 *   <li>{@code Ok}, {@code Retry}, {@code Fail} 반환</li>
 *   <li>예외 throw: {@code StageflowException}은 자체 재시도 플래그로,
 *       그 외 예외는 {@link #isRetryable(Throwable)}과 일시 장애 분류기로 분류</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StageHandler {

    /**
     * Stage 실행.
     *
     * @param context 실행 컨텍스트 (제출 Payload, 누적 결과, 진행률 보고)
     * @return 실행 결과
     */
    Outcome handle(StageContext context);

    /**
     * 실행 전제 조건.
     *
     * <p>false이면 Stage는 빈 결과로 완료 처리되고 즉시 다음 Stage로 진행합니다
     * (예: 첨부할 이미지가 없는 경우).</p>
     *
     * @param context 실행 컨텍스트
     * @return 실행해야 하면 true
     */
    default boolean shouldRun(StageContext context) {
        return true;
    }

    /**
     * 핸들러 고유 예외의 재시도 가능 여부.
     *
     * @param error 핸들러가 던진 예외
     * @return 재시도 가능하면 true
     */
    default boolean isRetryable(Throwable error) {
        return false;
    }
}
