/**
 * In-memory persistence adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.adapter.inmemory.store.InMemoryWorkflowStore} - workflow state with one active workflow per entity</li>
 *   <li>{@link com.ryuqq.stageflow.adapter.inmemory.store.InMemoryTargetEntityRepository} - final records with owner-scoped unique natural key</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>No actual transactions (monitor-based simulation only)</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.adapter.inmemory.store;
