package com.ryuqq.stageflow.core.error;

import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowId;

/**
 * 엔티티 락 획득 시간 초과 (재시도 가능).
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class LockTimeoutException extends StageflowException {

    private final EntityId entityId;
    private final WorkflowId holder;

    public LockTimeoutException(EntityId entityId, WorkflowId holder, long waitedMillis) {
        super(ErrorType.LOCK_TIMEOUT,
            "Timed out acquiring lock on " + entityId + " after " + waitedMillis + "ms (holder: " + holder + ")");
        this.entityId = entityId;
        this.holder = holder;
    }

    public EntityId getEntityId() {
        return entityId;
    }

    /**
     * 시간 초과 시점의 락 보유자.
     *
     * @return 보유 Workflow ID (관측 시점에 해제되었으면 null)
     */
    public WorkflowId getHolder() {
        return holder;
    }
}
