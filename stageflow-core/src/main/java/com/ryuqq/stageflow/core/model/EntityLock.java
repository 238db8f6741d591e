package com.ryuqq.stageflow.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 엔티티 단위 배타 락 레코드.
 *
 * <p>{@code refreshedAt}은 Stage 시작마다 갱신되는 heartbeat이며,
 * 이 값이 staleness 임계값보다 오래되면 다른 Workflow가 회수할 수 있습니다.</p>
 *
 * @param entityId 락 대상 엔티티
 * @param workflowId 보유 Workflow
 * @param stage 마지막으로 락을 갱신한 Stage 이름
 * @param acquiredAt 최초 획득 시각
 * @param refreshedAt 마지막 갱신 시각
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record EntityLock(
    EntityId entityId,
    WorkflowId workflowId,
    String stage,
    Instant acquiredAt,
    Instant refreshedAt
) {

    public EntityLock {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        if (acquiredAt == null) {
            throw new IllegalArgumentException("acquiredAt cannot be null");
        }
        if (refreshedAt == null) {
            throw new IllegalArgumentException("refreshedAt cannot be null");
        }
    }

    /**
     * 보유자 확인.
     *
     * @param candidate 확인할 Workflow ID
     * @return 보유자이면 true
     */
    public boolean isHeldBy(WorkflowId candidate) {
        return workflowId.equals(candidate);
    }

    /**
     * Stale 여부 확인.
     *
     * @param now 현재 시각
     * @param staleThreshold 임계값
     * @return 마지막 갱신이 임계값보다 오래되었으면 true
     */
    public boolean isStale(Instant now, Duration staleThreshold) {
        return refreshedAt.plus(staleThreshold).isBefore(now);
    }

    /**
     * heartbeat 갱신본 생성.
     *
     * @param currentStage 현재 Stage 이름
     * @param now 현재 시각
     * @return 갱신된 EntityLock
     */
    public EntityLock refreshed(String currentStage, Instant now) {
        return new EntityLock(entityId, workflowId, currentStage, acquiredAt, now);
    }
}
