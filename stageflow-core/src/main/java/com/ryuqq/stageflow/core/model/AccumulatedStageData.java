package com.ryuqq.stageflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Workflow의 완료된 Stage 결과 누적본.
 *
 * <p>두 가지 뷰를 제공합니다:</p>
 * <ul>
 *   <li><strong>namespaced:</strong> Stage 이름 → 해당 Stage의 부분 결과.
 *       서로 다른 Stage의 결과는 절대 덮어쓰지 않습니다.</li>
 *   <li><strong>merged:</strong> 모든 부분 결과를 Stage 완료 순서로 평탄화한 뷰.
 *       같은 키는 나중 Stage가 가리지만, namespaced 뷰는 변하지 않습니다.</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class AccumulatedStageData {

    private static final AccumulatedStageData EMPTY = new AccumulatedStageData(Collections.emptyMap());

    private final Map<String, Payload> namespaces;

    private AccumulatedStageData(Map<String, Payload> namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * 누적본 생성.
     *
     * @param namespaces Stage 이름 → 부분 결과 (반복 순서 = Stage 완료 순서)
     * @return AccumulatedStageData
     */
    public static AccumulatedStageData of(Map<String, Payload> namespaces) {
        if (namespaces == null || namespaces.isEmpty()) {
            return EMPTY;
        }
        Map<String, Payload> copy = new LinkedHashMap<>();
        namespaces.forEach((stage, result) -> {
            if (stage == null) {
                throw new IllegalArgumentException("stage namespace cannot be null");
            }
            copy.put(stage, result == null ? Payload.empty() : result);
        });
        return new AccumulatedStageData(Collections.unmodifiableMap(copy));
    }

    public static AccumulatedStageData empty() {
        return EMPTY;
    }

    /**
     * 특정 Stage의 부분 결과 조회.
     *
     * @param stage Stage 이름
     * @return 부분 결과 (해당 Stage가 기록되지 않았으면 empty)
     */
    public Optional<Payload> forStage(String stage) {
        return Optional.ofNullable(namespaces.get(stage));
    }

    /**
     * Stage별 부분 결과 (읽기 전용).
     *
     * @return Stage 이름 → 부분 결과
     */
    public Map<String, Payload> namespaced() {
        return namespaces;
    }

    /**
     * 평탄화된 결과 뷰.
     *
     * @return 모든 부분 결과를 완료 순서로 병합한 Payload
     */
    public Payload merged() {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Payload result : namespaces.values()) {
            merged.putAll(result.asMap());
        }
        return Payload.of(merged);
    }

    /**
     * 평탄화된 뷰에서 값 조회.
     *
     * @param key 키
     * @return 값 (가장 나중에 완료된 Stage의 값)
     */
    public Optional<Object> get(String key) {
        return merged().get(key);
    }

    public Set<String> stages() {
        return namespaces.keySet();
    }

    public boolean isEmpty() {
        return namespaces.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccumulatedStageData that = (AccumulatedStageData) o;
        return namespaces.equals(that.namespaces);
    }

    @Override
    public int hashCode() {
        return namespaces.hashCode();
    }

    @Override
    public String toString() {
        return "AccumulatedStageData{stages=" + namespaces.keySet() + '}';
    }
}
