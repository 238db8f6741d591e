package com.ryuqq.stageflow.core.stage;

/**
 * Stage 내부 진행률 보고 콜백.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * 진행률 보고.
     *
     * @param subPercent Stage 내부 진행률 (0~100)
     * @param message 표시 메시지 (null이면 Stage 기본 메시지)
     */
    void report(int subPercent, String message);

    /**
     * 아무것도 하지 않는 Reporter.
     *
     * @return no-op ProgressReporter
     */
    static ProgressReporter noop() {
        return (subPercent, message) -> { };
    }
}
