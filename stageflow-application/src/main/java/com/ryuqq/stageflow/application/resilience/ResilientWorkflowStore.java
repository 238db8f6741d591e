package com.ryuqq.stageflow.application.resilience;

import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.spi.WorkflowStore;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Workflow store decorator that resolves the live client per call and retries transient failures.
 *
 * <p>Domain rejections ({@code DuplicateSubmissionException}, version conflicts) are not transient
 * and propagate on the first attempt.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class ResilientWorkflowStore implements WorkflowStore {

    private final StoreClientHolder<WorkflowStore> holder;
    private final StoreOperationRetrier retrier;

    public ResilientWorkflowStore(StoreClientHolder<WorkflowStore> holder, StoreOperationRetrier retrier) {
        if (holder == null) {
            throw new IllegalArgumentException("holder cannot be null");
        }
        if (retrier == null) {
            throw new IllegalArgumentException("retrier cannot be null");
        }
        this.holder = holder;
        this.retrier = retrier;
    }

    @Override
    public void insert(WorkflowExecution workflow) {
        call("workflow.insert", client -> {
            client.insert(workflow);
            return null;
        });
    }

    @Override
    public Optional<WorkflowExecution> findById(WorkflowId workflowId) {
        return call("workflow.findById", client -> client.findById(workflowId));
    }

    @Override
    public Optional<WorkflowExecution> findActiveByEntity(EntityId entityId) {
        return call("workflow.findActiveByEntity", client -> client.findActiveByEntity(entityId));
    }

    @Override
    public void update(WorkflowExecution updated) {
        call("workflow.update", client -> {
            client.update(updated);
            return null;
        });
    }

    @Override
    public List<WorkflowExecution> findByStatus(WorkflowStatus status, int limit) {
        return call("workflow.findByStatus", client -> client.findByStatus(status, limit));
    }

    @Override
    public List<WorkflowExecution> findStuck(Instant updatedBefore, int limit) {
        return call("workflow.findStuck", client -> client.findStuck(updatedBefore, limit));
    }

    private <R> R call(String operationName, Function<WorkflowStore, R> operation) {
        return retrier.execute(operationName, () -> {
            WorkflowStore client = holder.current();
            try {
                return operation.apply(client);
            } catch (RuntimeException e) {
                if (retrier.isTransient(e)) {
                    holder.invalidate(client);
                }
                throw e;
            }
        });
    }
}
