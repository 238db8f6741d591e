/**
 * Workflow state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.statemachine.WorkflowStatus} - Workflow lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.stageflow.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → PROCESSING (first job enqueued)
 * PENDING → FAILED
 * PROCESSING → PROCESSING (advance or retry)
 * PROCESSING → COMPLETED
 * PROCESSING → FAILED
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - FAILED → * (terminal state)
 * - PROCESSING → PENDING
 * </pre>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.core.statemachine;
