package com.ryuqq.stageflow.core.error;

import com.ryuqq.stageflow.core.model.WorkflowId;

/**
 * 존재하지 않는 Workflow 조회.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class WorkflowNotFoundException extends StageflowException {

    public WorkflowNotFoundException(WorkflowId workflowId) {
        super(ErrorType.VALIDATION_FAILURE, "Workflow not found: " + workflowId);
    }
}
