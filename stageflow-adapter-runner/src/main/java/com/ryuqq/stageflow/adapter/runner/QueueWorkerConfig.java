package com.ryuqq.stageflow.adapter.runner;

import java.util.HashMap;
import java.util.Map;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 큐 폴링 간격 (기본 100ms)</li>
 *   <li>batchSize: Stage당 한 번에 dequeue할 최대 Job 수 (기본 10)</li>
 *   <li>concurrency: 워커 스레드 수 (기본 5)</li>
 *   <li>perStageConcurrency: Stage별 동시 실행 한도 기본값 (기본 5)</li>
 *   <li>stageConcurrency: Stage 이름별 동시 실행 한도 (없으면 perStageConcurrency)</li>
 *   <li>maxProcessingTimeMs: Job 하나의 처리 시간 상한, lease ceiling (기본 300000ms = 5분)</li>
 *   <li>maxDeliveries: 정산되지 않고 재전달될 수 있는 최대 횟수, 초과 시 현재 시도를 실패 처리 (기본 5)</li>
 *   <li>dlqEnabled: Workflow가 FAILED로 끝난 Job의 DLQ 전송 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>AI 파싱처럼 외부 호출이 긴 Stage: stageConcurrency로 한도를 낮춰 외부 rate limit 보호</li>
 *   <li>높은 처리량: concurrency를 Stage 한도 합계 수준으로 증가</li>
 *   <li>maxProcessingTimeMs는 큐 backend의 lease 시간보다 짧게 설정</li>
 * </ul>
 *
 * @param pollingIntervalMs 큐 폴링 간격 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param concurrency 워커 스레드 수 (1 이상)
 * @param perStageConcurrency Stage별 기본 동시 실행 한도 (1 이상)
 * @param stageConcurrency Stage 이름별 동시 실행 한도 (null이면 빈 Map)
 * @param maxProcessingTimeMs 처리 시간 상한 (밀리초, 양수)
 * @param maxDeliveries 최대 전달 횟수 (1 이상)
 * @param dlqEnabled DLQ 전송 활성화 여부
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record QueueWorkerConfig(
    long pollingIntervalMs,
    int batchSize,
    int concurrency,
    int perStageConcurrency,
    Map<String, Integer> stageConcurrency,
    long maxProcessingTimeMs,
    int maxDeliveries,
    boolean dlqEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=100ms, batchSize=10, concurrency=5, perStageConcurrency=5,
     * stageConcurrency=없음, maxProcessingTimeMs=300000ms, maxDeliveries=5, dlqEnabled=true</p>
     */
    public QueueWorkerConfig() {
        this(100, 10, 5, 5, Map.of(), 300_000L, 5, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueWorkerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (perStageConcurrency <= 0) {
            throw new IllegalArgumentException(
                "perStageConcurrency must be positive (current: " + perStageConcurrency + ")"
            );
        }
        if (maxProcessingTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxProcessingTimeMs must be positive (current: " + maxProcessingTimeMs + ")"
            );
        }
        if (maxDeliveries <= 0) {
            throw new IllegalArgumentException(
                "maxDeliveries must be positive (current: " + maxDeliveries + ")"
            );
        }
        Map<String, Integer> limits = new HashMap<>();
        if (stageConcurrency != null) {
            for (Map.Entry<String, Integer> entry : stageConcurrency.entrySet()) {
                Integer limit = entry.getValue();
                if (limit == null || limit <= 0) {
                    throw new IllegalArgumentException(
                        "stageConcurrency for " + entry.getKey() + " must be positive (current: " + limit + ")"
                    );
                }
                limits.put(entry.getKey(), limit);
            }
        }
        stageConcurrency = Map.copyOf(limits);
    }

    /**
     * Stage의 동시 실행 한도.
     *
     * @param stage Stage 이름
     * @return Stage 전용 한도가 있으면 그 값, 없으면 perStageConcurrency
     */
    public int concurrencyFor(String stage) {
        return stageConcurrency.getOrDefault(stage, perStageConcurrency);
    }

    public QueueWorkerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    public QueueWorkerConfig withBatchSize(int batchSize) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    public QueueWorkerConfig withConcurrency(int concurrency) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    public QueueWorkerConfig withPerStageConcurrency(int perStageConcurrency) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    /**
     * 한 Stage의 동시 실행 한도만 변경한 새 인스턴스 생성.
     *
     * @param stage Stage 이름
     * @param limit 동시 실행 한도 (1 이상)
     * @return 새 설정
     */
    public QueueWorkerConfig withStageConcurrency(String stage, int limit) {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        Map<String, Integer> limits = new HashMap<>(stageConcurrency);
        limits.put(stage, limit);
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            limits, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    public QueueWorkerConfig withMaxProcessingTimeMs(long maxProcessingTimeMs) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    public QueueWorkerConfig withMaxDeliveries(int maxDeliveries) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }

    public QueueWorkerConfig withDlqEnabled(boolean dlqEnabled) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, concurrency, perStageConcurrency,
            stageConcurrency, maxProcessingTimeMs, maxDeliveries, dlqEnabled);
    }
}
