package com.ryuqq.stageflow.application.accumulator;

import java.time.Duration;

/**
 * Stage 결과 저장소 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>ttl: 2시간 (명시적 정리가 누락되어도 결국 만료)</li>
 *   <li>cleanupGrace: 30초 (종료 후 결과 조회를 위한 유예)</li>
 *   <li>keyPrefix: "workflow"</li>
 * </ul>
 *
 * @param ttl 결과 키 TTL
 * @param cleanupGrace 종료 후 정리까지의 유예 시간 (0이면 즉시 정리)
 * @param keyPrefix 키 접두어
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record StageResultStoreConfig(
    Duration ttl,
    Duration cleanupGrace,
    String keyPrefix
) {

    /**
     * 기본 설정으로 생성.
     */
    public StageResultStoreConfig() {
        this(Duration.ofHours(2), Duration.ofSeconds(30), "workflow");
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 설정값이 유효하지 않은 경우
     */
    public StageResultStoreConfig {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (cleanupGrace == null || cleanupGrace.isNegative()) {
            throw new IllegalArgumentException("cleanupGrace must be non-negative (current: " + cleanupGrace + ")");
        }
        if (keyPrefix == null || keyPrefix.isBlank() || keyPrefix.contains(":")) {
            throw new IllegalArgumentException("keyPrefix must be non-blank without ':' (current: " + keyPrefix + ")");
        }
    }

    public StageResultStoreConfig withTtl(Duration ttl) {
        return new StageResultStoreConfig(ttl, cleanupGrace, keyPrefix);
    }

    public StageResultStoreConfig withCleanupGrace(Duration cleanupGrace) {
        return new StageResultStoreConfig(ttl, cleanupGrace, keyPrefix);
    }

    public StageResultStoreConfig withKeyPrefix(String keyPrefix) {
        return new StageResultStoreConfig(ttl, cleanupGrace, keyPrefix);
    }
}
