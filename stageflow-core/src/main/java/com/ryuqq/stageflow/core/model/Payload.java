package com.ryuqq.stageflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Workflow 제출 데이터 또는 Stage 출력의 불변 키-값 묶음.
 *
 * <p>Payload는 업무 로직에 필요한 데이터를 Stage 사이에 전달합니다.
 * 키 순서는 입력 순서를 유지하며, 값으로 null을 허용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>제출: Payload.of(Map.of("ownerId", "merchant-1", "uploadId", "up-9"))</li>
 *   <li>Stage 출력: Payload.of(Map.of("naturalKey", "PO-1001", "lineItems", 12))</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 방어적 복사, 이후 값 변경 불가</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> values;

    private Payload(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Payload 생성.
     *
     * @param values 키-값 (null이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException 키에 null이 포함된 경우
     */
    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Payload keys cannot be null");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return new Payload(Collections.unmodifiableMap(copy));
    }

    /**
     * 빈 Payload 생성.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없거나 null이면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 문자열 값 조회.
     *
     * @param key 키
     * @return 문자열 값 (없으면 null)
     */
    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * 키 존재 여부 확인.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 주어진 값을 덮어쓴 새 Payload 생성.
     *
     * @param overrides 덮어쓸 키-값
     * @return 병합된 Payload
     */
    public Payload with(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides);
        return of(merged);
    }

    /**
     * 읽기 전용 Map 뷰.
     *
     * @return 불변 Map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + values.size() + " keys}";
    }
}
