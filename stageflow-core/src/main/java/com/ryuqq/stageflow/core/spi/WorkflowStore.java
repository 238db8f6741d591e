package com.ryuqq.stageflow.core.spi;

import com.ryuqq.stageflow.core.error.DuplicateSubmissionException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for workflow execution state.
 *
 * <p>The workflow store is the source of truth for where a workflow is. Queue messages are
 * ephemeral; workers always re-read the stored state before acting on a job.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Atomic "one active workflow per entity" check on insert</li>
 *   <li>Optimistic-concurrency updates using {@link WorkflowExecution#version()}</li>
 *   <li>Status and staleness queries for the pending list and the stuck sweep</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Atomic insert: the active-workflow check and the insert must not be separable
 *       (a unique partial index on {@code target_entity_id WHERE status NOT IN ('COMPLETED','FAILED')}
 *       in a relational store)</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public interface WorkflowStore {

    /**
     * Inserts a new workflow.
     *
     * @param workflow the workflow to insert (version 0)
     * @throws DuplicateSubmissionException if a non-terminal workflow already targets the same entity
     * @throws IllegalStateException if a workflow with the same id already exists
     * @throws IllegalArgumentException if workflow is null
     */
    void insert(WorkflowExecution workflow);

    /**
     * Finds a workflow by id.
     *
     * @param workflowId the workflow id
     * @return the workflow, or empty if unknown
     */
    Optional<WorkflowExecution> findById(WorkflowId workflowId);

    /**
     * Finds the non-terminal workflow targeting an entity.
     *
     * @param entityId the target entity
     * @return the active workflow, or empty if none
     */
    Optional<WorkflowExecution> findActiveByEntity(EntityId entityId);

    /**
     * Replaces the stored workflow with a newer version.
     *
     * <p>The update succeeds only if the stored version equals {@code updated.version() - 1}.</p>
     *
     * @param updated the new state
     * @throws IllegalStateException if the workflow does not exist or the version check fails
     * @throws IllegalArgumentException if updated is null
     */
    void update(WorkflowExecution updated);

    /**
     * Lists workflows in a given status, oldest first.
     *
     * @param status the status to match
     * @param limit maximum number of results
     * @return matching workflows (may be empty)
     */
    List<WorkflowExecution> findByStatus(WorkflowStatus status, int limit);

    /**
     * Lists non-terminal workflows whose last update is before the cutoff, oldest first.
     *
     * @param updatedBefore staleness cutoff
     * @param limit maximum number of results
     * @return stuck workflows (may be empty)
     */
    List<WorkflowExecution> findStuck(Instant updatedBefore, int limit);
}
