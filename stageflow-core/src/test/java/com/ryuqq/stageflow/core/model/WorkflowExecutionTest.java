package com.ryuqq.stageflow.core.model;

import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowExecution 상태 변경 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class WorkflowExecutionTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private WorkflowExecution newWorkflow() {
        return WorkflowExecution.create(
            WorkflowId.of("wf-1"), EntityId.of("po-1"), "S1",
            Payload.of(Map.of("ownerId", "merchant-1")), T0);
    }

    @Test
    void create_StartsPendingAtFirstStage() {
        WorkflowExecution workflow = newWorkflow();

        assertEquals(WorkflowStatus.PENDING, workflow.status());
        assertEquals("S1", workflow.currentStage());
        assertEquals(0, workflow.progressPercent());
        assertEquals(1, workflow.stageAttempt());
        assertEquals("merchant-1", workflow.ownerId());
        assertEquals(0L, workflow.version());
        assertEquals(1, workflow.transitions().size());
    }

    @Test
    void advanceTo_IncrementsVersionAndLogsTransition() {
        // Given
        WorkflowExecution processing = newWorkflow().markProcessing(T0.plusSeconds(1));

        // When
        WorkflowExecution advanced = processing.advanceTo("S2", 50, T0.plusSeconds(2), "S1 completed");

        // Then
        assertEquals("S2", advanced.currentStage());
        assertEquals(50, advanced.progressPercent());
        assertEquals(1, advanced.stageAttempt());
        assertEquals(processing.version() + 1, advanced.version());
        assertEquals(3, advanced.transitions().size());
        assertEquals("S2", advanced.transitions().get(2).stage());
    }

    @Test
    void retrying_KeepsProcessingAndIncrementsAttempt() {
        // Given
        WorkflowExecution processing = newWorkflow().markProcessing(T0);
        ErrorDetail error = new ErrorDetail("S1", "connection reset", ErrorType.TRANSIENT_INFRASTRUCTURE, 1, T0);

        // When
        WorkflowExecution retrying = processing.retrying(error, T0.plusSeconds(1));

        // Then
        assertEquals(WorkflowStatus.PROCESSING, retrying.status());
        assertEquals(2, retrying.stageAttempt());
        assertEquals(error, retrying.errorDetail());
    }

    @Test
    void withProgress_NeverDecreases() {
        WorkflowExecution workflow = newWorkflow().markProcessing(T0).withProgress(40, T0);

        assertSame(workflow, workflow.withProgress(30, T0));
        assertEquals(45, workflow.withProgress(45, T0).progressPercent());
    }

    @Test
    void complete_SetsProgress100AndCompletedAt() {
        WorkflowExecution completed = newWorkflow().markProcessing(T0).complete(T0.plusSeconds(5));

        assertEquals(WorkflowStatus.COMPLETED, completed.status());
        assertEquals(100, completed.progressPercent());
        assertEquals(T0.plusSeconds(5), completed.completedAt());
        assertTrue(completed.isTerminal());
    }

    @Test
    void terminalWorkflow_RejectsFurtherTransitions() {
        WorkflowExecution failed = newWorkflow().markProcessing(T0)
            .fail(new ErrorDetail("S1", "bad document", ErrorType.VALIDATION_FAILURE, 1, T0), T0);

        assertThrows(IllegalStateException.class, () -> failed.advanceTo("S2", 50, T0, "late"));
        assertThrows(IllegalStateException.class, () -> failed.complete(T0));
        assertThrows(IllegalStateException.class, () -> failed.withProgress(60, T0));
    }

    @Test
    void transitions_AreUnmodifiable() {
        WorkflowExecution workflow = newWorkflow();

        assertThrows(UnsupportedOperationException.class, () -> workflow.transitions().clear());
    }
}
