package com.ryuqq.stageflow.application.resilience;

/**
 * 저장소 연산 재시도 정책.
 *
 * <p>일시적 인프라 장애에 대해 지수 백오프(jitter 포함)로 재시도합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxAttempts: 5 (최초 시도 포함)</li>
 *   <li>baseDelayMs: 200</li>
 *   <li>maxDelayMs: 2000</li>
 *   <li>jitterFactor: 0.1</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 첫 재시도 대기 시간 (밀리초)
 * @param maxDelayMs 대기 시간 상한 (밀리초)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정으로 생성.
     */
    public RetryPolicy() {
        this(5, 200, 2000, 0.1);
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 설정값이 유효하지 않은 경우
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, Math.max(maxDelayMs, baseDelayMs), jitterFactor);
    }

    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 이 정책의 백오프 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator toBackoff() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }
}
