package com.ryuqq.stageflow.application.lock;

import java.time.Duration;

/**
 * 엔티티 락 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>staleThreshold: 2분 (이보다 오래 갱신되지 않은 락은 회수 가능)</li>
 *   <li>acquireTimeout: 10초</li>
 *   <li>pollInterval: 100ms</li>
 *   <li>lockTtl: 30분 (저장소 레벨 안전장치, staleThreshold보다 길어야 함)</li>
 * </ul>
 *
 * @param staleThreshold 락 staleness 임계값
 * @param acquireTimeout 획득 대기 최대 시간
 * @param pollInterval 재확인 간격
 * @param lockTtl 락 키 TTL
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record LockConfig(
    Duration staleThreshold,
    Duration acquireTimeout,
    Duration pollInterval,
    Duration lockTtl
) {

    /**
     * 기본 설정으로 생성.
     */
    public LockConfig() {
        this(Duration.ofMinutes(2), Duration.ofSeconds(10), Duration.ofMillis(100), Duration.ofMinutes(30));
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 설정값이 유효하지 않은 경우
     */
    public LockConfig {
        requirePositive("staleThreshold", staleThreshold);
        requirePositive("pollInterval", pollInterval);
        requirePositive("lockTtl", lockTtl);
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("acquireTimeout must be non-negative (current: " + acquireTimeout + ")");
        }
        if (lockTtl.compareTo(staleThreshold) <= 0) {
            throw new IllegalArgumentException(
                "lockTtl must be greater than staleThreshold (ttl: " + lockTtl + ", stale: " + staleThreshold + ")");
        }
    }

    public LockConfig withStaleThreshold(Duration staleThreshold) {
        return new LockConfig(staleThreshold, acquireTimeout, pollInterval, lockTtl);
    }

    public LockConfig withAcquireTimeout(Duration acquireTimeout) {
        return new LockConfig(staleThreshold, acquireTimeout, pollInterval, lockTtl);
    }

    public LockConfig withPollInterval(Duration pollInterval) {
        return new LockConfig(staleThreshold, acquireTimeout, pollInterval, lockTtl);
    }

    public LockConfig withLockTtl(Duration lockTtl) {
        return new LockConfig(staleThreshold, acquireTimeout, pollInterval, lockTtl);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
