package com.ryuqq.stageflow.core.spi;

import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;

import java.util.List;
import java.util.Optional;

/**
 * Message queue SPI for stage jobs.
 *
 * <p>Jobs are routed by stage name: each stage has its own logical queue so that
 * per-stage concurrency can be bounded independently.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Leases: a dequeued job is invisible to other consumers until ack/nack or lease expiry</li>
 *   <li>At-least-once delivery: a job whose lease expires is delivered again with the same jobId</li>
 *   <li>Idempotent: ack/nack of an unknown or already settled job is a no-op</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * queue.publish(StageJob.of(workflowId, DocumentStage.AI_PARSING, 1, payload, now), 0L);
 *
 * List&lt;StageJob&gt; batch = queue.dequeue("AI_PARSING", 4);
 * for (StageJob job : batch) {
 *     try {
 *         orchestrator.execute(job);
 *         queue.ack(job);
 *     } catch (Exception e) {
 *         queue.nack(job);
 *     }
 * }
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public interface JobQueue {

    /**
     * Publishes a job to its stage queue.
     *
     * @param job the job to publish
     * @param delayMs delay before the job becomes visible (0 for immediate)
     * @throws IllegalArgumentException if job is null or delayMs is negative
     */
    void publish(StageJob job, long delayMs);

    /**
     * Dequeues visible jobs of one stage and starts their leases.
     *
     * @param stage stage name
     * @param batchSize maximum number of jobs
     * @return leased jobs (may be empty)
     * @throws IllegalArgumentException if stage is blank or batchSize is not positive
     */
    List<StageJob> dequeue(String stage, int batchSize);

    /**
     * Leases the visible job of one workflow at one stage, if there is one.
     *
     * <p>Used by inline execution to take over a workflow's next job before a worker does.
     * Delayed jobs (retry backoff) and jobs already leased by another consumer are not returned.</p>
     *
     * @param workflowId workflow whose job to claim
     * @param stage stage name
     * @return the leased job, or empty
     * @throws IllegalArgumentException if workflowId is null or stage is blank
     */
    Optional<StageJob> claim(WorkflowId workflowId, String stage);

    /**
     * Acknowledges a leased job, removing it permanently.
     *
     * @param job the job to acknowledge
     */
    void ack(StageJob job);

    /**
     * Returns a leased job to its queue for immediate redelivery.
     *
     * @param job the job to return
     */
    void nack(StageJob job);

    /**
     * Moves a job to the dead letter queue with failure details.
     *
     * @param job the failed job
     * @param fail failure details
     * @throws IllegalArgumentException if job or fail is null
     */
    void publishToDeadLetter(StageJob job, Fail fail);

    /**
     * Returns every job whose lease has expired to its queue.
     *
     * @return number of jobs made visible again
     */
    int reclaimExpiredLeases();
}
