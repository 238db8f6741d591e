package com.ryuqq.stageflow.core.stage;

import com.ryuqq.stageflow.core.model.AccumulatedStageData;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.WorkflowId;

/**
 * Stage 핸들러 실행 컨텍스트.
 *
 * <p>핸들러는 이전 Stage의 결과를 {@link #accumulated()}로 읽고,
 * 오래 걸리는 작업의 진행률을 {@link #reportProgress(int, String)}로 알립니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class StageContext {

    private final WorkflowId workflowId;
    private final EntityId entityId;
    private final Stage stage;
    private final int attempt;
    private final Payload payload;
    private final AccumulatedStageData accumulated;
    private final ProgressReporter progressReporter;

    public StageContext(WorkflowId workflowId, EntityId entityId, Stage stage, int attempt,
                        Payload payload, AccumulatedStageData accumulated, ProgressReporter progressReporter) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        this.workflowId = workflowId;
        this.entityId = entityId;
        this.stage = stage;
        this.attempt = attempt;
        this.payload = payload == null ? Payload.empty() : payload;
        this.accumulated = accumulated == null ? AccumulatedStageData.empty() : accumulated;
        this.progressReporter = progressReporter == null ? ProgressReporter.noop() : progressReporter;
    }

    public WorkflowId workflowId() {
        return workflowId;
    }

    public EntityId entityId() {
        return entityId;
    }

    public Stage stage() {
        return stage;
    }

    public int attempt() {
        return attempt;
    }

    /**
     * 제출 시 전달된 Payload.
     *
     * @return 제출 Payload
     */
    public Payload payload() {
        return payload;
    }

    /**
     * 이전 Stage들의 누적 결과.
     *
     * @return 누적 결과
     */
    public AccumulatedStageData accumulated() {
        return accumulated;
    }

    /**
     * Stage 내부 진행률 보고 (best effort).
     *
     * @param subPercent Stage 내부 진행률 (0~100)
     * @param message 표시 메시지 (선택)
     */
    public void reportProgress(int subPercent, String message) {
        if (subPercent < 0 || subPercent > 100) {
            throw new IllegalArgumentException("subPercent must be between 0 and 100 (current: " + subPercent + ")");
        }
        progressReporter.report(subPercent, message);
    }
}
