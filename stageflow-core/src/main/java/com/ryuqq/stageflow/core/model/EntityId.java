package com.ryuqq.stageflow.core.model;

/**
 * 파이프라인이 생성/갱신하는 대상 엔티티의 시스템 식별자.
 *
 * <p>EntityId는 엔티티 락의 단위이며, 동시에 하나의 활성 Workflow만
 * 동일한 EntityId를 대상으로 할 수 있습니다.</p>
 *
 * <p>업무적 의미를 갖는 자연 키(natural key, 예: 발주서 번호)와는 구분됩니다.
 * 자연 키는 {@link TargetEntity#naturalKey()}에 저장됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class EntityId {

    private final String value;

    private EntityId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityId cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("EntityId length cannot exceed 100 characters");
        }
        this.value = value;
    }

    /**
     * EntityId 생성.
     *
     * @param value EntityId 값
     * @return EntityId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityId of(String value) {
        return new EntityId(value);
    }

    /**
     * EntityId 값 조회.
     *
     * @return EntityId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityId entityId = (EntityId) o;
        return value.equals(entityId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityId{" + value + '}';
    }
}
