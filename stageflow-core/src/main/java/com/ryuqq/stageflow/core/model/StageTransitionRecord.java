package com.ryuqq.stageflow.core.model;

import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Instant;

/**
 * Workflow 전이 로그의 한 항목 (추가 전용).
 *
 * @param stage Stage 이름
 * @param status 전이 후 Workflow 상태
 * @param attempt Stage 시도 번호
 * @param progressPercent 전이 후 진행률
 * @param at 전이 시각
 * @param note 전이 사유 (선택, null 가능)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record StageTransitionRecord(
    String stage,
    WorkflowStatus status,
    int attempt,
    int progressPercent,
    Instant at,
    String note
) {

    public StageTransitionRecord {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
    }
}
