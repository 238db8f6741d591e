package com.ryuqq.stageflow.testkit.contract;

import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.spi.JobQueue;
import com.ryuqq.stageflow.testkit.support.TestStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link JobQueue} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Per-stage routing</li>
 *   <li>Leases hide dequeued jobs until ack/nack/expiry</li>
 *   <li>Expired leases are redelivered with the same jobId</li>
 *   <li>ack/nack of settled jobs are no-ops</li>
 *   <li>claim takes only the given workflow's visible job</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public abstract class AbstractJobQueueContractTest {

    protected JobQueue queue;

    /**
     * Creates an empty queue under test.
     *
     * @return new queue
     */
    protected abstract JobQueue createQueue();

    /**
     * Makes the lease of a dequeued job expire immediately.
     *
     * @param job the leased job
     */
    protected abstract void expireLease(StageJob job);

    @BeforeEach
    void setUpQueue() {
        queue = createQueue();
    }

    @Test
    void testPublish_RoutedByStage() {
        // Given
        StageJob s1 = newJob(TestStage.S1);
        StageJob s2 = newJob(TestStage.S2);

        // When
        queue.publish(s1, 0);
        queue.publish(s2, 0);

        // Then
        List<StageJob> batch = queue.dequeue("S1", 10);
        assertEquals(List.of(s1), batch);
        assertEquals(List.of(s2), queue.dequeue("S2", 10));
        assertTrue(queue.dequeue("S3", 10).isEmpty());
    }

    @Test
    void testDequeue_RespectsBatchSize() {
        for (int i = 0; i < 5; i++) {
            queue.publish(newJob(TestStage.S1), 0);
        }

        assertEquals(3, queue.dequeue("S1", 3).size());
        assertEquals(2, queue.dequeue("S1", 3).size());
    }

    @Test
    void testLease_DequeuedJobInvisibleUntilNack() {
        // Given
        StageJob job = newJob(TestStage.S1);
        queue.publish(job, 0);
        StageJob leased = queue.dequeue("S1", 1).get(0);

        // Then: hidden while leased
        assertTrue(queue.dequeue("S1", 1).isEmpty(), "Leased job must not be visible");

        // When
        queue.nack(leased);

        // Then: redelivered with same jobId
        List<StageJob> redelivered = queue.dequeue("S1", 1);
        assertEquals(1, redelivered.size());
        assertEquals(job.jobId(), redelivered.get(0).jobId());
        assertEquals(1, redelivered.get(0).deliveryCount());
    }

    @Test
    void testAck_RemovesJobPermanently() {
        // Given
        queue.publish(newJob(TestStage.S1), 0);
        StageJob leased = queue.dequeue("S1", 1).get(0);

        // When
        queue.ack(leased);
        queue.ack(leased);
        queue.nack(leased);

        // Then
        assertEquals(0, queue.reclaimExpiredLeases());
        assertTrue(queue.dequeue("S1", 1).isEmpty(), "Settled job must never come back");
    }

    @Test
    void testExpiredLease_RedeliveredWithSameJobId() {
        // Given
        StageJob job = newJob(TestStage.S1);
        queue.publish(job, 0);
        StageJob leased = queue.dequeue("S1", 1).get(0);

        // When
        expireLease(leased);

        // Then
        StageJob redelivered = queue.dequeue("S1", 1).get(0);
        assertEquals(job.jobId(), redelivered.jobId());
        assertEquals(job.attempt(), redelivered.attempt());
    }

    @Test
    void testAckOfStaleDelivery_DoesNotSettleRedelivery() {
        // Given: first delivery's lease expires and the job is delivered again
        queue.publish(newJob(TestStage.S1), 0);
        StageJob first = queue.dequeue("S1", 1).get(0);
        expireLease(first);
        StageJob second = queue.dequeue("S1", 1).get(0);

        // When: the slow first consumer acks late
        queue.ack(first);
        queue.nack(second);

        // Then: the second delivery is still governed by its own lease
        assertEquals(1, queue.dequeue("S1", 1).size());
    }

    @Test
    void testDelayedPublish_NotVisibleBeforeDelay() {
        queue.publish(newJob(TestStage.S1), 60_000L);

        assertTrue(queue.dequeue("S1", 1).isEmpty());
    }

    @Test
    void testPublishToDeadLetter_JobLeavesQueue() {
        // Given
        queue.publish(newJob(TestStage.S1), 0);
        StageJob leased = queue.dequeue("S1", 1).get(0);

        // When
        queue.publishToDeadLetter(leased, Fail.of(ErrorType.HANDLER_FAILURE, "boom"));

        // Then
        assertEquals(0, queue.reclaimExpiredLeases());
        assertTrue(queue.dequeue("S1", 1).isEmpty());
    }

    @Test
    void testClaim_TakesOnlyThatWorkflowsVisibleJob() {
        // Given
        StageJob other = newJob(TestStage.S2);
        StageJob mine = newJob(TestStage.S2);
        queue.publish(other, 0);
        queue.publish(mine, 0);

        // When
        Optional<StageJob> claimed = queue.claim(mine.workflowId(), "S2");

        // Then
        assertEquals(Optional.of(mine), claimed);
        assertEquals(List.of(other), queue.dequeue("S2", 10));
        assertTrue(queue.claim(mine.workflowId(), "S2").isEmpty(), "Claimed job is leased");
    }

    @Test
    void testClaim_IgnoresDelayedJob() {
        StageJob delayed = newJob(TestStage.S1);
        queue.publish(delayed, 60_000L);

        assertTrue(queue.claim(delayed.workflowId(), "S1").isEmpty());
    }

    @Test
    void testClaim_AckSettlesLease() {
        // Given
        StageJob job = newJob(TestStage.S1);
        queue.publish(job, 0);
        StageJob claimed = queue.claim(job.workflowId(), "S1").orElseThrow();

        // When
        queue.ack(claimed);

        // Then
        assertEquals(0, queue.reclaimExpiredLeases());
        assertTrue(queue.dequeue("S1", 1).isEmpty());
    }

    @Test
    void testInvalidArguments_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> queue.publish(null, 0));
        assertThrows(IllegalArgumentException.class, () -> queue.publish(newJob(TestStage.S1), -1));
        assertThrows(IllegalArgumentException.class, () -> queue.dequeue("S1", 0));
        assertThrows(IllegalArgumentException.class, () -> queue.dequeue(" ", 1));
        assertThrows(IllegalArgumentException.class, () -> queue.claim(null, "S1"));
    }

    protected StageJob newJob(TestStage stage) {
        return StageJob.of(WorkflowId.generate(), stage, 1, Payload.empty(), System.currentTimeMillis());
    }
}
