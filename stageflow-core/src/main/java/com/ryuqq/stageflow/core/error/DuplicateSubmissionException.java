package com.ryuqq.stageflow.core.error;

import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowId;

/**
 * 같은 엔티티에 대해 종료되지 않은 Workflow가 이미 존재함.
 *
 * <p>WorkflowStore 구현체가 삽입을 원자적으로 거부할 때 던지며,
 * 오케스트레이터는 {@link #getExistingWorkflowId()}를 제출 결과로 반환합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class DuplicateSubmissionException extends StageflowException {

    private final WorkflowId existingWorkflowId;

    public DuplicateSubmissionException(EntityId entityId, WorkflowId existingWorkflowId) {
        super(ErrorType.VALIDATION_FAILURE,
            "Active workflow already exists for " + entityId + ": " + existingWorkflowId);
        if (existingWorkflowId == null) {
            throw new IllegalArgumentException("existingWorkflowId cannot be null");
        }
        this.existingWorkflowId = existingWorkflowId;
    }

    public WorkflowId getExistingWorkflowId() {
        return existingWorkflowId;
    }
}
