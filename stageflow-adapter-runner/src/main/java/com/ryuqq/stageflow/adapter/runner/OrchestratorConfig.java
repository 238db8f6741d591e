package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.resilience.BackoffCalculator;

/**
 * StagePipelineOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultMaxAttempts: Stage별 값이 없을 때의 최대 시도 횟수 (기본 3)</li>
 *   <li>retryBaseDelayMs: Stage 재발행 기본 지연 (기본 1000ms)</li>
 *   <li>retryMaxDelayMs: Stage 재발행 최대 지연 (기본 60000ms)</li>
 *   <li>retryJitterFactor: 지연 jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * <p>Stage 재발행 지연은 {@code base × 2^(attempt-1)}에 jitter를 더한 값이며,
 * {@code retryMaxDelayMs}를 넘지 않습니다.</p>
 *
 * @param defaultMaxAttempts 기본 최대 시도 횟수 (1 이상)
 * @param retryBaseDelayMs 재발행 기본 지연 (밀리초, 양수)
 * @param retryMaxDelayMs 재발행 최대 지연 (밀리초, base 이상)
 * @param retryJitterFactor jitter 비율 (0.0 ~ 1.0)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    int defaultMaxAttempts,
    long retryBaseDelayMs,
    long retryMaxDelayMs,
    double retryJitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultMaxAttempts=3, retryBaseDelayMs=1000ms,
     * retryMaxDelayMs=60000ms, retryJitterFactor=0.1</p>
     */
    public OrchestratorConfig() {
        this(3, 1000L, 60_000L, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (defaultMaxAttempts <= 0) {
            throw new IllegalArgumentException(
                "defaultMaxAttempts must be positive (current: " + defaultMaxAttempts + ")"
            );
        }
        if (retryBaseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "retryBaseDelayMs must be positive (current: " + retryBaseDelayMs + ")"
            );
        }
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException(
                "retryMaxDelayMs must be >= retryBaseDelayMs (current: " + retryMaxDelayMs + ")"
            );
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "retryJitterFactor must be between 0.0 and 1.0 (current: " + retryJitterFactor + ")"
            );
        }
    }

    public OrchestratorConfig withDefaultMaxAttempts(int defaultMaxAttempts) {
        return new OrchestratorConfig(defaultMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor);
    }

    public OrchestratorConfig withRetryBaseDelayMs(long retryBaseDelayMs) {
        return new OrchestratorConfig(defaultMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor);
    }

    public OrchestratorConfig withRetryMaxDelayMs(long retryMaxDelayMs) {
        return new OrchestratorConfig(defaultMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor);
    }

    public OrchestratorConfig withRetryJitterFactor(double retryJitterFactor) {
        return new OrchestratorConfig(defaultMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor);
    }

    /**
     * Stage 재발행용 백오프 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator toBackoff() {
        return new BackoffCalculator(retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor);
    }
}
