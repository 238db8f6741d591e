package com.ryuqq.stageflow.core.model;

import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Instant;

/**
 * 진행 상황 알림 이벤트 (best effort).
 *
 * @param workflowId Workflow ID
 * @param stage 현재 Stage 이름
 * @param progressPercent 진행률 (0~100)
 * @param message 표시 메시지
 * @param status Workflow 상태
 * @param at 발생 시각
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record StatusEvent(
    WorkflowId workflowId,
    String stage,
    int progressPercent,
    String message,
    WorkflowStatus status,
    Instant at
) {

    public StatusEvent {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("progressPercent must be between 0 and 100 (current: " + progressPercent + ")");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
    }
}
