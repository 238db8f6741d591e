package com.ryuqq.stageflow.adapter.runner;

import java.time.Duration;

/**
 * InlineFastPathRunner 설정 (불변 record).
 *
 * <ul>
 *   <li>timeBudget: 호출 하나가 Stage를 직접 실행할 수 있는 시간 (기본 270초)</li>
 *   <li>stopMargin: 남은 예산이 이 값 이하이면 다음 Stage를 시작하지 않음 (기본 30초)</li>
 *   <li>pollIntervalMs: 실행할 Job이 아직 보이지 않을 때 다시 확인하는 간격 (기본 10ms)</li>
 *   <li>dlqEnabled: Workflow가 FAILED로 끝난 Job의 DLQ 전송 여부 (기본 true)</li>
 * </ul>
 *
 * <p>timeBudget은 호출 환경의 실행 시간 제한보다 짧게, stopMargin은 가장 긴 Stage 하나보다 길게 잡습니다.</p>
 *
 * @param timeBudget 기본 시간 예산 (stopMargin보다 커야 함)
 * @param stopMargin 정지 여유 시간 (0 이상)
 * @param pollIntervalMs 폴링 간격 (밀리초, 양수)
 * @param dlqEnabled DLQ 전송 활성화 여부
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record InlineRunnerConfig(
    Duration timeBudget,
    Duration stopMargin,
    long pollIntervalMs,
    boolean dlqEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeBudget=270s, stopMargin=30s, pollIntervalMs=10ms, dlqEnabled=true</p>
     */
    public InlineRunnerConfig() {
        this(Duration.ofSeconds(270), Duration.ofSeconds(30), 10, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InlineRunnerConfig {
        if (stopMargin == null || stopMargin.isNegative()) {
            throw new IllegalArgumentException("stopMargin cannot be null or negative (current: " + stopMargin + ")");
        }
        requireUsableBudget(timeBudget, stopMargin);
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
    }

    /**
     * 호출별 시간 예산 검증.
     *
     * @param budget 시간 예산
     * @throws IllegalArgumentException 예산이 null이거나 stopMargin 이하인 경우
     */
    public void validateBudget(Duration budget) {
        requireUsableBudget(budget, stopMargin);
    }

    private static void requireUsableBudget(Duration budget, Duration margin) {
        if (budget == null || budget.compareTo(margin) <= 0) {
            throw new IllegalArgumentException(
                "timeBudget must be longer than stopMargin " + margin + " (current: " + budget + ")"
            );
        }
    }

    public InlineRunnerConfig withTimeBudget(Duration timeBudget) {
        return new InlineRunnerConfig(timeBudget, stopMargin, pollIntervalMs, dlqEnabled);
    }

    public InlineRunnerConfig withStopMargin(Duration stopMargin) {
        return new InlineRunnerConfig(timeBudget, stopMargin, pollIntervalMs, dlqEnabled);
    }

    public InlineRunnerConfig withPollIntervalMs(long pollIntervalMs) {
        return new InlineRunnerConfig(timeBudget, stopMargin, pollIntervalMs, dlqEnabled);
    }

    public InlineRunnerConfig withDlqEnabled(boolean dlqEnabled) {
        return new InlineRunnerConfig(timeBudget, stopMargin, pollIntervalMs, dlqEnabled);
    }
}
