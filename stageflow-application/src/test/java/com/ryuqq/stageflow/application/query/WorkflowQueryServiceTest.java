package com.ryuqq.stageflow.application.query;

import com.ryuqq.stageflow.adapter.inmemory.store.InMemoryWorkflowStore;
import com.ryuqq.stageflow.core.error.WorkflowNotFoundException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.testkit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowQueryService 유닛 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class WorkflowQueryServiceTest {

    private MutableClock clock;
    private InMemoryWorkflowStore store;
    private WorkflowQueryService queries;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
        store = new InMemoryWorkflowStore();
        queries = new WorkflowQueryService(store, clock);
    }

    @Test
    void PENDING_Workflow만_조회() {
        // given
        WorkflowExecution pending = create("wf-1", "entity-1");
        WorkflowExecution processing = create("wf-2", "entity-2");
        store.update(processing.markProcessing(clock.instant()));

        // when / then
        assertThat(queries.findPending(10)).extracting(WorkflowExecution::id).containsExactly(pending.id());
    }

    @Test
    void 임계값보다_오래_갱신되지_않은_Workflow_조회() {
        // given
        WorkflowExecution old = create("wf-1", "entity-1");
        store.update(old.markProcessing(clock.instant()));
        clock.advance(Duration.ofMinutes(20));
        create("wf-2", "entity-2");

        // when / then
        assertThat(queries.findStuck(Duration.ofMinutes(10), 10))
            .extracting(WorkflowExecution::id)
            .containsExactly(WorkflowId.of("wf-1"));
    }

    @Test
    void 없는_Workflow_조회_시_예외() {
        assertThatThrownBy(() -> queries.get(WorkflowId.of("missing")))
            .isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void 잘못된_limit_거부() {
        assertThatThrownBy(() -> queries.findPending(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private WorkflowExecution create(String workflowId, String entityId) {
        WorkflowExecution workflow = WorkflowExecution.create(WorkflowId.of(workflowId), EntityId.of(entityId),
            "AI_PARSING", Payload.empty(), clock.instant());
        store.insert(workflow);
        return workflow;
    }
}
