package com.ryuqq.stageflow.adapter.runner;

import java.time.Duration;

/**
 * Reaper 설정.
 *
 * <p>stuckThreshold는 가장 느린 Stage의 처리 상한과 최대 재시도 백오프의 합보다 길게 잡습니다.
 * 그보다 짧으면 정상 진행 중인 Workflow를 stuck으로 오판합니다.</p>
 *
 * @param scanInterval 주기 스캔 간격 (기본 5분)
 * @param stuckThreshold 마지막 갱신 이후 이 시간이 지나면 stuck (기본 10분)
 * @param batchSize 스캔 1회당 최대 처리 수 (기본 50)
 * @param strategy stuck Workflow 처리 방식 (기본 FAIL)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record ReaperConfig(
    Duration scanInterval,
    Duration stuckThreshold,
    int batchSize,
    ReconcileStrategy strategy
) {

    private static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofMinutes(5);
    private static final Duration DEFAULT_STUCK_THRESHOLD = Duration.ofMinutes(10);

    public ReaperConfig() {
        this(DEFAULT_SCAN_INTERVAL, DEFAULT_STUCK_THRESHOLD, 50, ReconcileStrategy.FAIL);
    }

    public ReaperConfig {
        requirePositive("scanInterval", scanInterval);
        requirePositive("stuckThreshold", stuckThreshold);
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public ReaperConfig withScanInterval(Duration scanInterval) {
        return new ReaperConfig(scanInterval, stuckThreshold, batchSize, strategy);
    }

    public ReaperConfig withStuckThreshold(Duration stuckThreshold) {
        return new ReaperConfig(scanInterval, stuckThreshold, batchSize, strategy);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanInterval, stuckThreshold, batchSize, strategy);
    }

    public ReaperConfig withStrategy(ReconcileStrategy strategy) {
        return new ReaperConfig(scanInterval, stuckThreshold, batchSize, strategy);
    }
}
