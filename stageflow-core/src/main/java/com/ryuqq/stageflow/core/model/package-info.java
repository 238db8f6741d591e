/**
 * Domain model package.
 *
 * <p>Immutable value types shared by every module.</p>
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.model.WorkflowId} - One pipeline run</li>
 *   <li>{@link com.ryuqq.stageflow.core.model.EntityId} - The record a workflow builds, unit of locking</li>
 * </ul>
 *
 * <h2>State</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.model.WorkflowExecution} - Persisted workflow state with transition log</li>
 *   <li>{@link com.ryuqq.stageflow.core.model.StageJob} - Ephemeral queue message for one stage run</li>
 *   <li>{@link com.ryuqq.stageflow.core.model.AccumulatedStageData} - Stage results, namespaced and merged</li>
 *   <li>{@link com.ryuqq.stageflow.core.model.EntityLock} - Exclusive per-entity lock with heartbeat</li>
 *   <li>{@link com.ryuqq.stageflow.core.model.TargetEntity} - Final record with owner-scoped natural key</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.core.model;
