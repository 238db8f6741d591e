/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Infrastructure abstractions implemented by adapters. The in-memory adapter module
 * ships reference implementations; the testkit module ships contract tests every
 * implementation must pass.</p>
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.spi.WorkflowStore} - Workflow state, one active workflow per entity</li>
 *   <li>{@link com.ryuqq.stageflow.core.spi.JobQueue} - Per-stage leased queues with dead letter</li>
 *   <li>{@link com.ryuqq.stageflow.core.spi.KeyValueStore} - TTL hashes for results and locks</li>
 *   <li>{@link com.ryuqq.stageflow.core.spi.TargetEntityRepository} - Final records, natural key unique per owner</li>
 *   <li>{@link com.ryuqq.stageflow.core.spi.StatusPublisher} - Best-effort progress events</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>Thread-safe: All implementations must be safe for concurrent access</li>
 *   <li>Transport failures propagate as exceptions so the resilience layer can classify them</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.core.spi;
