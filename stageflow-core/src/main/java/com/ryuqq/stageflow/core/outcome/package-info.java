/**
 * Stage execution outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.outcome.Outcome} - Sealed interface (permits Ok, Retry, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.outcome.Ok} - Stage completed, carries the stage's partial result</li>
 *   <li>{@link com.ryuqq.stageflow.core.outcome.Retry} - Temporary failure, the same stage is re-enqueued</li>
 *   <li>{@link com.ryuqq.stageflow.core.outcome.Fail} - Permanent failure, the workflow ends FAILED</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof Ok ok) {
 *     resultStore.saveStageResult(workflowId, stage, ok.output());
 * } else if (outcome instanceof Retry retry) {
 *     scheduleRetry(retry.errorType(), retry.reason());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.core.outcome;
