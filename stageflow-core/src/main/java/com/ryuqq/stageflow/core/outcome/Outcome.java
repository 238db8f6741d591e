package com.ryuqq.stageflow.core.outcome;

/**
 * Stage 핸들러 한 번 실행의 결과.
 *
 * <table>
 *   <caption>결과별 오케스트레이터 처리</caption>
 *   <tr><th>결과</th><th>처리</th></tr>
 *   <tr><td>{@link Ok}</td><td>부분 결과 저장 후 다음 Stage Job 발행 (마지막이면 COMPLETED)</td></tr>
 *   <tr><td>{@link Retry}</td><td>시도 횟수가 남았으면 백오프 후 같은 Stage 재발행, 아니면 FAILED</td></tr>
 *   <tr><td>{@link Fail}</td><td>즉시 FAILED, 락 해제, 누적 결과 정리</td></tr>
 * </table>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 로그용 한 줄 요약.
     *
     * @return 예: {@code OK}, {@code RETRY[TRANSIENT_INFRASTRUCTURE] pool timeout}
     */
    default String summary() {
        if (this instanceof Retry retry) {
            return "RETRY[" + retry.errorType() + "] " + retry.reason();
        }
        if (this instanceof Fail fail) {
            return "FAIL[" + fail.errorType() + "] " + fail.message();
        }
        return "OK";
    }
}
