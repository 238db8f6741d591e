package com.ryuqq.stageflow.adapter.inmemory.queue;

import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.spi.JobQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link JobQueue} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Stage Queues:</strong> ConcurrentHashMap&lt;String, DelayQueue&lt;DelayedJob&gt;&gt; - one delay queue per stage name</li>
 *   <li><strong>Leases:</strong> ConcurrentHashMap&lt;String, Lease&gt; - in-flight jobs keyed by jobId with lease deadline</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DeadLetterEntry&gt; - permanently failed jobs</li>
 * </ul>
 *
 * <p><strong>Lease Semantics:</strong></p>
 * <ul>
 *   <li>A lease belongs to one delivery of a job. ack/nack carrying an older deliveryCount
 *       than the current lease are ignored, so a worker whose lease already expired cannot
 *       settle the redelivered copy.</li>
 *   <li>{@link #reclaimExpiredLeases()} returns expired jobs to their stage queue with
 *       deliveryCount incremented.</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryJobQueue queue = new InMemoryJobQueue(30_000L);
 * queue.publish(job, 0);
 *
 * List&lt;StageJob&gt; batch = queue.dequeue("AI_PARSING", 5);
 * queue.ack(batch.get(0));
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class InMemoryJobQueue implements JobQueue {

    /**
     * Default lease duration: 30 seconds.
     */
    private static final long DEFAULT_LEASE_MS = 30_000L;

    private final Map<String, DelayQueue<DelayedJob>> queues;
    private final ConcurrentHashMap<String, Lease> inFlight;
    private final List<DeadLetterEntry> deadLetters;
    private final long leaseMs;

    /**
     * Creates a new InMemoryJobQueue with the default lease (30 seconds).
     */
    public InMemoryJobQueue() {
        this(DEFAULT_LEASE_MS);
    }

    /**
     * Creates a new InMemoryJobQueue with a custom lease.
     *
     * @param leaseMs lease duration in milliseconds
     * @throws IllegalArgumentException if leaseMs is not positive
     */
    public InMemoryJobQueue(long leaseMs) {
        if (leaseMs <= 0) {
            throw new IllegalArgumentException("leaseMs must be positive, but was: " + leaseMs);
        }
        this.queues = new ConcurrentHashMap<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.deadLetters = new CopyOnWriteArrayList<>();
        this.leaseMs = leaseMs;
    }

    @Override
    public void publish(StageJob job, long delayMs) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queueFor(job.stage()).put(new DelayedJob(job, delayMs));
    }

    @Override
    public List<StageJob> dequeue(String stage, int batchSize) {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        DelayQueue<DelayedJob> queue = queueFor(stage);
        List<StageJob> result = new ArrayList<>();
        long now = System.currentTimeMillis();

        for (int i = 0; i < batchSize; i++) {
            DelayedJob delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            StageJob job = delayed.job;
            inFlight.put(job.jobId(), new Lease(job, now + leaseMs));
            result.add(job);
        }
        return result;
    }

    @Override
    public Optional<StageJob> claim(WorkflowId workflowId, String stage) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        DelayQueue<DelayedJob> queue = queueFor(stage);
        for (DelayedJob delayed : queue) {
            if (!delayed.job.workflowId().equals(workflowId) || delayed.getDelay(TimeUnit.MILLISECONDS) > 0) {
                continue;
            }
            // remove() fails when a concurrent dequeue took the job first
            if (queue.remove(delayed)) {
                StageJob job = delayed.job;
                inFlight.put(job.jobId(), new Lease(job, System.currentTimeMillis() + leaseMs));
                return Optional.of(job);
            }
        }
        return Optional.empty();
    }

    @Override
    public void ack(StageJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        releaseLease(job);
    }

    @Override
    public void nack(StageJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (releaseLease(job)) {
            publish(job.redelivered(), 0);
        }
    }

    @Override
    public void publishToDeadLetter(StageJob job, Fail fail) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (fail == null) {
            throw new IllegalArgumentException("fail cannot be null");
        }
        releaseLease(job);
        deadLetters.add(new DeadLetterEntry(job, fail, System.currentTimeMillis()));
    }

    @Override
    public int reclaimExpiredLeases() {
        long now = System.currentTimeMillis();
        int count = 0;

        List<String> expired = new ArrayList<>();
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().expiresAt <= now) {
                expired.add(entry.getKey());
            }
        }
        for (String jobId : expired) {
            Lease lease = inFlight.remove(jobId);
            if (lease != null) {
                publish(lease.job.redelivered(), 0);
                count++;
            }
        }
        return count;
    }

    /**
     * Expires the lease of one job immediately. Used for testing.
     *
     * @param job the leased job
     * @return true if the job was in flight and has been returned to its queue
     */
    public boolean expireLease(StageJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        Lease lease = inFlight.remove(job.jobId());
        if (lease == null) {
            return false;
        }
        publish(lease.job.redelivered(), 0);
        return true;
    }

    /**
     * Returns the jobs waiting in a stage queue, including delayed ones. Used for test assertions.
     *
     * @param stage stage name
     * @return snapshot of queued jobs
     */
    public List<StageJob> queuedJobs(String stage) {
        List<StageJob> jobs = new ArrayList<>();
        for (DelayedJob delayed : queueFor(stage)) {
            jobs.add(delayed.job);
        }
        return jobs;
    }

    /**
     * Returns the number of queued jobs across all stages (not in flight).
     *
     * @return queue size
     */
    public int queueSize() {
        int size = 0;
        for (DelayQueue<DelayedJob> queue : queues.values()) {
            size += queue.size();
        }
        return size;
    }

    public int queueSize(String stage) {
        return queueFor(stage).size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public int deadLetterSize() {
        return deadLetters.size();
    }

    public List<DeadLetterEntry> getDeadLetterEntries() {
        return new ArrayList<>(deadLetters);
    }

    /**
     * Clears all queues, leases and dead letters. Used for test cleanup.
     */
    public void clear() {
        queues.clear();
        inFlight.clear();
        deadLetters.clear();
    }

    private DelayQueue<DelayedJob> queueFor(String stage) {
        return queues.computeIfAbsent(stage, key -> new DelayQueue<>());
    }

    private boolean releaseLease(StageJob job) {
        boolean[] released = new boolean[1];
        inFlight.computeIfPresent(job.jobId(), (jobId, lease) -> {
            if (lease.job.deliveryCount() == job.deliveryCount()) {
                released[0] = true;
                return null;
            }
            return lease;
        });
        return released[0];
    }

    private static class DelayedJob implements Delayed {
        private final StageJob job;
        private final long availableAt;

        DelayedJob(StageJob job, long delayMs) {
            this.job = job;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long diff = availableAt - System.currentTimeMillis();
            return unit.convert(diff, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private static class Lease {
        private final StageJob job;
        private final long expiresAt;

        Lease(StageJob job, long expiresAt) {
            this.job = job;
            this.expiresAt = expiresAt;
        }
    }

    /**
     * Dead letter entry with failure metadata.
     */
    public static class DeadLetterEntry {
        private final StageJob job;
        private final Fail fail;
        private final long timestamp;

        DeadLetterEntry(StageJob job, Fail fail, long timestamp) {
            this.job = job;
            this.fail = fail;
            this.timestamp = timestamp;
        }

        public StageJob getJob() {
            return job;
        }

        public Fail getFail() {
            return fail;
        }

        public long getTimestamp() {
            return timestamp;
        }
    }
}
