package com.ryuqq.stageflow.core.error;

import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowId;

/**
 * 보유 중이던 엔티티 락을 잃음 (재시도 불가).
 *
 * <p>락이 stale로 판단되어 다른 Workflow가 회수한 뒤, 원래 보유자가
 * 진행을 시도하면 발생합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class LockLostException extends StageflowException {

    private final EntityId entityId;
    private final WorkflowId currentHolder;

    public LockLostException(EntityId entityId, WorkflowId expectedHolder, WorkflowId currentHolder) {
        super(ErrorType.LOCK_LOST,
            "Lock on " + entityId + " is no longer held by " + expectedHolder + " (current holder: " + currentHolder + ")");
        this.entityId = entityId;
        this.currentHolder = currentHolder;
    }

    public EntityId getEntityId() {
        return entityId;
    }

    /**
     * 현재 락 보유자.
     *
     * @return 보유 Workflow ID (락이 없으면 null)
     */
    public WorkflowId getCurrentHolder() {
        return currentHolder;
    }
}
