package com.ryuqq.stageflow.application.accumulator;

import com.ryuqq.stageflow.core.model.AccumulatedStageData;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Workflow 단위 Stage 결과 누적 저장소.
 *
 * <p>각 Stage의 부분 결과를 {@code {prefix}:{workflowId}:stage:{stage}:result} 키에
 * 독립적으로 저장합니다. 같은 Stage의 재실행은 해당 네임스페이스만 덮어쓰며,
 * 다른 Stage의 결과에는 영향을 주지 않습니다.</p>
 *
 * <p><strong>저장 형식:</strong></p>
 * <pre>
 * workflow:wf_123:stage:AI_PARSING:result → { stage, savedAt, result }
 * </pre>
 *
 * <p>저장소 클라이언트는 매 호출마다 provider로 조회하며 캐싱하지 않습니다.
 * TTL은 명시적 정리가 누락된 경우의 안전장치입니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class StageResultStore {

    private static final Logger log = LoggerFactory.getLogger(StageResultStore.class);

    static final String FIELD_STAGE = "stage";
    static final String FIELD_SAVED_AT = "savedAt";
    static final String FIELD_RESULT = "result";

    private final Supplier<? extends KeyValueStore> storeProvider;
    private final StageResultStoreConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param storeProvider 저장소 클라이언트 provider
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public StageResultStore(Supplier<? extends KeyValueStore> storeProvider, StageResultStoreConfig config, Clock clock) {
        if (storeProvider == null) {
            throw new IllegalArgumentException("storeProvider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.storeProvider = storeProvider;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Stage 부분 결과 저장.
     *
     * <p>반환 시점에 저장이 완료되어 있으므로, 호출자는 이후 다음 Stage를 발행해도
     * 다음 Stage가 이 결과를 읽을 수 있습니다.</p>
     *
     * @param workflowId Workflow ID
     * @param stage Stage 이름
     * @param partialResult 부분 결과 (null이면 빈 결과)
     */
    public void saveStageResult(WorkflowId workflowId, String stage, Payload partialResult) {
        requireStage(stage);
        Map<String, Object> value = new HashMap<>();
        value.put(FIELD_STAGE, stage);
        value.put(FIELD_SAVED_AT, clock.millis());
        value.put(FIELD_RESULT, partialResult == null ? Map.of() : new LinkedHashMap<>(partialResult.asMap()));

        storeProvider.get().put(resultKey(workflowId, stage), value, config.ttl());
        log.debug("Saved stage result: workflowId={}, stage={}, keys={}",
            workflowId.getValue(), stage, partialResult == null ? 0 : partialResult.asMap().size());
    }

    /**
     * 특정 Stage의 부분 결과 조회.
     *
     * @param workflowId Workflow ID
     * @param stage Stage 이름
     * @return 부분 결과 (없거나 만료되었으면 empty)
     */
    public Optional<Payload> getStageResult(WorkflowId workflowId, String stage) {
        requireStage(stage);
        return storeProvider.get().get(resultKey(workflowId, stage)).map(StageResultStore::toPayload);
    }

    /**
     * 모든 Stage 결과의 누적본 조회.
     *
     * <p>네임스페이스는 저장 시각 순으로 정렬되므로, 평탄화 뷰에서는
     * 나중에 완료된 Stage가 같은 키를 가립니다.</p>
     *
     * @param workflowId Workflow ID
     * @return 누적본 (결과가 없으면 빈 누적본)
     */
    public AccumulatedStageData getAccumulatedData(WorkflowId workflowId) {
        KeyValueStore store = storeProvider.get();
        List<Map<String, Object>> entries = new ArrayList<>();
        for (String key : store.keys(workflowPrefix(workflowId))) {
            if (key.endsWith(":result")) {
                store.get(key).ifPresent(entries::add);
            }
        }
        entries.sort(Comparator
            .comparingLong((Map<String, Object> entry) -> savedAt(entry))
            .thenComparing(entry -> String.valueOf(entry.get(FIELD_STAGE))));

        Map<String, Payload> namespaces = new LinkedHashMap<>();
        for (Map<String, Object> entry : entries) {
            namespaces.put(String.valueOf(entry.get(FIELD_STAGE)), toPayload(entry));
        }
        return AccumulatedStageData.of(namespaces);
    }

    /**
     * Workflow의 모든 Stage 결과 삭제.
     *
     * @param workflowId Workflow ID
     * @return 삭제된 키 수
     */
    public int clearWorkflowResults(WorkflowId workflowId) {
        KeyValueStore store = storeProvider.get();
        int deleted = 0;
        for (String key : store.keys(workflowPrefix(workflowId))) {
            if (store.delete(key)) {
                deleted++;
            }
        }
        log.debug("Cleared {} stage results for workflowId={}", deleted, workflowId.getValue());
        return deleted;
    }

    /**
     * 장기 실행 Workflow의 결과 TTL 연장.
     *
     * @param workflowId Workflow ID
     * @param ttl 새 TTL
     * @return TTL이 갱신된 키 수
     */
    public int extendTtl(WorkflowId workflowId, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        KeyValueStore store = storeProvider.get();
        int extended = 0;
        for (String key : store.keys(workflowPrefix(workflowId))) {
            if (store.expire(key, ttl)) {
                extended++;
            }
        }
        return extended;
    }

    /**
     * Stage 결과 키 생성.
     *
     * @param workflowId Workflow ID
     * @param stage Stage 이름
     * @return 저장소 키
     */
    public String resultKey(WorkflowId workflowId, String stage) {
        return workflowPrefix(workflowId) + "stage:" + stage + ":result";
    }

    public StageResultStoreConfig getConfig() {
        return config;
    }

    private String workflowPrefix(WorkflowId workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return config.keyPrefix() + ":" + workflowId.getValue() + ":";
    }

    private static void requireStage(String stage) {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
    }

    @SuppressWarnings("unchecked")
    private static Payload toPayload(Map<String, Object> entry) {
        Object result = entry.get(FIELD_RESULT);
        if (result instanceof Map<?, ?> map) {
            return Payload.of((Map<String, ?>) map);
        }
        return Payload.empty();
    }

    private static long savedAt(Map<String, Object> entry) {
        Object value = entry.get(FIELD_SAVED_AT);
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
