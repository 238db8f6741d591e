/**
 * Connection resilience layer.
 *
 * <p>Shields every store call from transient infrastructure failures (cold starts, dropped
 * connections, pool exhaustion) without masking business errors.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.application.resilience.TransientErrorClassifier} - Signature and type based classification</li>
 *   <li>{@link com.ryuqq.stageflow.application.resilience.StoreOperationRetrier} - Bounded exponential backoff with jitter</li>
 *   <li>{@link com.ryuqq.stageflow.application.resilience.StoreClientHolder} - One shared client per process, invalidated on transport death</li>
 *   <li>{@link com.ryuqq.stageflow.application.resilience.ResilientKeyValueStore} and
 *       {@link com.ryuqq.stageflow.application.resilience.ResilientWorkflowStore} - Per-call resolution plus retry</li>
 * </ul>
 *
 * <h2>Rule</h2>
 * <p>Never check liveness and then use a cached handle: the connection can die between the two.
 * Resolve the handle inside the retried operation instead.</p>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.application.resilience;
