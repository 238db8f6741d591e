/**
 * Error taxonomy.
 *
 * <p>Every domain failure is an unchecked {@link com.ryuqq.stageflow.core.error.StageflowException}
 * tagged with an {@link com.ryuqq.stageflow.core.error.ErrorType}. The retryable flag decides whether
 * the orchestrator re-enqueues the stage or fails the workflow.</p>
 *
 * <h2>Retryable by default</h2>
 * <ul>
 *   <li>TRANSIENT_INFRASTRUCTURE, NATURAL_KEY_CONFLICT, LOCK_TIMEOUT</li>
 * </ul>
 *
 * <h2>Non-retryable</h2>
 * <ul>
 *   <li>PERSISTENT_CONFLICT, VALIDATION_FAILURE, LOCK_LOST</li>
 *   <li>HANDLER_FAILURE unless the handler says otherwise</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.core.error;
