package com.ryuqq.stageflow.adapter.inmemory.store;

import com.ryuqq.stageflow.core.error.DuplicateSubmissionException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.spi.WorkflowStore;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link WorkflowStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>workflows:</strong> ConcurrentHashMap&lt;WorkflowId, WorkflowExecution&gt; - latest state per workflow</li>
 *   <li><strong>activeByEntity:</strong> ConcurrentHashMap&lt;EntityId, WorkflowId&gt; - the non-terminal workflow per entity,
 *       playing the role of a unique partial index</li>
 * </ul>
 *
 * <p>insert and update run under one monitor so the active-entity check and the write are atomic.
 * Reads are lock-free.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private final ConcurrentHashMap<WorkflowId, WorkflowExecution> workflows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EntityId, WorkflowId> activeByEntity = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public void insert(WorkflowExecution workflow) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        synchronized (writeLock) {
            if (workflows.containsKey(workflow.id())) {
                throw new IllegalStateException("Workflow already exists: " + workflow.id());
            }
            WorkflowId active = activeByEntity.get(workflow.targetEntityId());
            if (active != null) {
                throw new DuplicateSubmissionException(workflow.targetEntityId(), active);
            }
            workflows.put(workflow.id(), workflow);
            if (!workflow.isTerminal()) {
                activeByEntity.put(workflow.targetEntityId(), workflow.id());
            }
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(WorkflowId workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public Optional<WorkflowExecution> findActiveByEntity(EntityId entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        WorkflowId active = activeByEntity.get(entityId);
        return active == null ? Optional.empty() : Optional.ofNullable(workflows.get(active));
    }

    @Override
    public void update(WorkflowExecution updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        synchronized (writeLock) {
            WorkflowExecution stored = workflows.get(updated.id());
            if (stored == null) {
                throw new IllegalStateException("Workflow not found: " + updated.id());
            }
            if (stored.version() != updated.version() - 1) {
                throw new IllegalStateException(String.format(
                    "Version conflict on %s (stored: %d, updated: %d)",
                    updated.id(), stored.version(), updated.version()));
            }
            workflows.put(updated.id(), updated);
            if (updated.isTerminal()) {
                activeByEntity.remove(updated.targetEntityId(), updated.id());
            }
        }
    }

    @Override
    public List<WorkflowExecution> findByStatus(WorkflowStatus status, int limit) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        requirePositive(limit);
        return workflows.values().stream()
            .filter(workflow -> workflow.status() == status)
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findStuck(Instant updatedBefore, int limit) {
        if (updatedBefore == null) {
            throw new IllegalArgumentException("updatedBefore cannot be null");
        }
        requirePositive(limit);
        return workflows.values().stream()
            .filter(workflow -> !workflow.isTerminal())
            .filter(workflow -> workflow.updatedAt().isBefore(updatedBefore))
            .sorted(Comparator.comparing(WorkflowExecution::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * Returns the number of stored workflows. Used for test assertions.
     *
     * @return workflow count
     */
    public int size() {
        return workflows.size();
    }

    /**
     * Clears all workflows. Used for test cleanup.
     */
    public void clear() {
        synchronized (writeLock) {
            workflows.clear();
            activeByEntity.clear();
        }
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
    }
}
