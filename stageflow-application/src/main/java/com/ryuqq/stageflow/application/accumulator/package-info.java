/**
 * Stage result accumulator.
 *
 * <p>Workflow-scoped, stage-namespaced storage of partial results with a passive TTL.
 * Writes to one namespace never touch another, so a redelivered stage cannot erase the
 * output of an earlier stage.</p>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.application.accumulator;
