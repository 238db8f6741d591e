package com.ryuqq.stageflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.stageflow.core.statemachine.WorkflowStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToProcessing_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, PROCESSING));
    }

    @Test
    void validate_ProcessingToProcessing_Succeeds() {
        // Stage 전진과 재시도는 PROCESSING 유지
        assertDoesNotThrow(() -> StateTransition.validate(PROCESSING, PROCESSING));
    }

    @Test
    void validate_PendingToFailed_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, FAILED));
    }

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        // Given
        WorkflowStatus state = PENDING;

        // When
        state = StateTransition.transition(state, PROCESSING);
        state = StateTransition.transition(state, PROCESSING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_CompletedToProcessing_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(COMPLETED, PROCESSING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_FailedToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(FAILED, COMPLETED));
    }

    @Test
    void validate_ProcessingToPending_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PROCESSING, PENDING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_PendingToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PENDING, COMPLETED));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, PROCESSING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(PENDING, null));
    }

    @Test
    void isAllowed_MirrorsValidateWithoutThrowing() {
        assertTrue(StateTransition.isAllowed(PROCESSING, PROCESSING));
        assertTrue(StateTransition.isAllowed(PENDING, FAILED));
        assertFalse(StateTransition.isAllowed(PENDING, COMPLETED));
        assertFalse(StateTransition.isAllowed(COMPLETED, FAILED));
        assertFalse(StateTransition.isAllowed(null, PENDING));
    }
}
