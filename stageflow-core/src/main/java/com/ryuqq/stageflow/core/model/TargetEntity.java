package com.ryuqq.stageflow.core.model;

import java.util.Objects;

/**
 * 파이프라인이 최종적으로 생성/갱신하는 대상 레코드.
 *
 * <p>{@code naturalKey}는 소유자 범위 내에서 유일해야 하며,
 * 충돌 처리 중에도 null로 저장되지 않습니다.</p>
 *
 * @param id 엔티티 ID
 * @param ownerId 소유자 (유일성 범위)
 * @param naturalKey 업무 자연 키 (예: 발주서 번호)
 * @param attributes 기타 속성
 * @param sourceWorkflowId 이 레코드를 마지막으로 기록한 Workflow (선택, null 가능)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record TargetEntity(
    EntityId id,
    String ownerId,
    String naturalKey,
    Payload attributes,
    WorkflowId sourceWorkflowId
) {

    public TargetEntity {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (naturalKey == null || naturalKey.isBlank()) {
            throw new IllegalArgumentException("naturalKey cannot be null or blank");
        }
        if (attributes == null) {
            attributes = Payload.empty();
        }
    }

    /**
     * 자연 키만 바꾼 사본 생성.
     *
     * @param newNaturalKey 새 자연 키
     * @return 사본
     */
    public TargetEntity withNaturalKey(String newNaturalKey) {
        if (Objects.equals(naturalKey, newNaturalKey)) {
            return this;
        }
        return new TargetEntity(id, ownerId, newNaturalKey, attributes, sourceWorkflowId);
    }
}
