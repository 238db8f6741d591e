package com.ryuqq.stageflow.application.runtime;

/**
 * Asynchronous stage job runtime.
 *
 * <p>Defines one polling cycle of the job dispatcher: reclaim expired leases, dequeue
 * per-stage batches within each stage's free concurrency, run the jobs and settle them.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   1. Reclaim expired leases (redelivery)
 *   2. For each stage:
 *      a. Dequeue up to the stage's free permits
 *      b. Run orchestrator.execute(job) on the worker pool
 *      c. Settle:
 *         - returned normally → ack (or dead-letter when the workflow ended FAILED)
 *         - unexpected exception → nack
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle.
     *
     * <p>Returns once the dequeued jobs have been handed to the worker pool; it does not wait
     * for them to finish. Per-job errors are handled internally.</p>
     *
     * @throws IllegalStateException if the runtime has been shut down
     */
    void pump();
}
