package com.ryuqq.stageflow.application.query;

import com.ryuqq.stageflow.core.error.WorkflowNotFoundException;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.spi.WorkflowStore;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Workflow 조회 서비스.
 *
 * <p>운영 화면과 정리 작업(Reaper)이 사용하는 조회 전용 표면입니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class WorkflowQueryService {

    private final WorkflowStore workflowStore;
    private final Clock clock;

    public WorkflowQueryService(WorkflowStore workflowStore, Clock clock) {
        if (workflowStore == null) {
            throw new IllegalArgumentException("workflowStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.workflowStore = workflowStore;
        this.clock = clock;
    }

    /**
     * 아직 첫 Stage가 발행되지 않은 Workflow 목록.
     *
     * @param limit 최대 개수
     * @return PENDING 상태 Workflow (오래된 순)
     */
    public List<WorkflowExecution> findPending(int limit) {
        requirePositive(limit);
        return workflowStore.findByStatus(WorkflowStatus.PENDING, limit);
    }

    /**
     * 일정 시간 이상 갱신되지 않은 비종료 Workflow 목록.
     *
     * @param olderThan 경과 시간 임계값
     * @param limit 최대 개수
     * @return 정체된 Workflow (오래된 순)
     */
    public List<WorkflowExecution> findStuck(Duration olderThan, int limit) {
        if (olderThan == null || olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan must be non-negative (current: " + olderThan + ")");
        }
        requirePositive(limit);
        return workflowStore.findStuck(clock.instant().minus(olderThan), limit);
    }

    /**
     * Workflow 조회.
     *
     * @param workflowId Workflow ID
     * @return Workflow
     * @throws WorkflowNotFoundException 존재하지 않는 경우
     */
    public WorkflowExecution get(WorkflowId workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return workflowStore.findById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
    }
}
