package com.ryuqq.stageflow.application.resilience;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 재시도 지연 계산기 (지수 증가 + 상한 + 지터).
 *
 * <p>세 곳에서 공유합니다:</p>
 * <ul>
 *   <li>{@link StoreOperationRetrier}: 저장소 연결 장애 재시도</li>
 *   <li>ConflictResolver: 자연 키 충돌 재시도</li>
 *   <li>오케스트레이터: 실패한 Stage Job 재발행 지연</li>
 * </ul>
 *
 * <pre>
 * n번째 시도 지연 = min(base × 2^(n-1), max) + U(0, 그 값 × jitterFactor), 다시 max로 제한
 * base=200ms, max=2000ms → 200, 400, 800, 1600, 2000, 2000 ...
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    // 2^30 배를 넘으면 어떤 설정이든 상한에 닿음
    private static final int MAX_DOUBLINGS = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 생성자.
     *
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수)
     * @param maxDelayMs 지연 상한 (밀리초, baseDelayMs 이상)
     * @param jitterFactor 지터 비율 (0.0 ~ 1.0, 0이면 결정적)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 지연 계산.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터)
     * @return 다음 시도까지 대기할 시간 (밀리초, maxDelayMs 이하)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        long delay = cappedExponential(attempt);
        if (jitterFactor > 0.0) {
            long spread = (long) (delay * jitterFactor);
            if (spread > 0) {
                delay += ThreadLocalRandom.current().nextLong(spread + 1);
            }
        }
        return Math.min(delay, maxDelayMs);
    }

    private long cappedExponential(int attempt) {
        int doublings = Math.min(attempt - 1, MAX_DOUBLINGS);
        long multiplier = 1L << doublings;
        if (baseDelayMs > maxDelayMs / multiplier) {
            return maxDelayMs;
        }
        return baseDelayMs * multiplier;
    }

    @Override
    public String toString() {
        return "BackoffCalculator{base=" + baseDelayMs + "ms, max=" + maxDelayMs + "ms, jitter=" + jitterFactor + "}";
    }
}
