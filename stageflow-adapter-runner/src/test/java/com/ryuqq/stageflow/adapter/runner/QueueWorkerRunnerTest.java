package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.outcome.Ok;
import com.ryuqq.stageflow.core.outcome.Retry;
import com.ryuqq.stageflow.core.spi.JobQueue;
import com.ryuqq.stageflow.core.stage.StagePipeline;
import com.ryuqq.stageflow.testkit.support.ScriptedStageHandler;
import com.ryuqq.stageflow.testkit.support.TestStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * QueueWorkerRunner 유닛 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class QueueWorkerRunnerTest {

    private static final long WAIT_MS = 2_000;

    @Mock
    private JobQueue jobQueue;

    @Mock
    private WorkflowOrchestrator orchestrator;

    private StagePipeline pipeline;
    private StageJob job;
    private QueueWorkerRunner runner;

    @BeforeEach
    void setUp() {
        pipeline = StagePipeline.builder()
            .stage(TestStage.S1, ScriptedStageHandler.alwaysOk(Map.of()))
            .build();
        job = StageJob.of(WorkflowId.of("wf-1"), TestStage.S1, 1, Payload.empty(), 0L);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (runner != null) {
            runner.shutdown();
        }
    }

    @Test
    void 실행_결과가_Ok이면_ACK() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenReturn(Ok.empty());

        // when
        runner.pump();

        // then
        verify(jobQueue, timeout(WAIT_MS)).ack(job);
        verify(jobQueue, never()).publishToDeadLetter(any(), any());
    }

    @Test
    void 재시도_예약_결과도_현재_Job은_ACK() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenReturn(Retry.of(ErrorType.TRANSIENT_INFRASTRUCTURE, "Connection reset"));

        // when
        runner.pump();

        // then
        verify(jobQueue, timeout(WAIT_MS)).ack(job);
    }

    @Test
    void 실행_결과가_Fail이면_DLQ로_이동() {
        // given
        Fail fail = Fail.of(ErrorType.HANDLER_FAILURE, "Unsupported document layout");
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenReturn(fail);

        // when
        runner.pump();

        // then
        verify(jobQueue, timeout(WAIT_MS)).publishToDeadLetter(job, fail);
        verify(jobQueue, never()).ack(any());
    }

    @Test
    void DLQ가_비활성화되면_Fail도_ACK() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withDlqEnabled(false));
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenReturn(Fail.of(ErrorType.HANDLER_FAILURE, "broken"));

        // when
        runner.pump();

        // then
        verify(jobQueue, timeout(WAIT_MS)).ack(job);
        verify(jobQueue, never()).publishToDeadLetter(any(), any());
    }

    @Test
    void 예상치_못한_예외는_NACK하여_재전달() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenThrow(new IllegalStateException("store unavailable"));

        // when
        runner.pump();

        // then
        verify(jobQueue, timeout(WAIT_MS)).nack(job);
        verify(jobQueue, never()).ack(any());
    }

    @Test
    void 처리_시간_상한을_넘기면_시도를_일시_장애로_실패_처리하고_핸들러를_중단() {
        // given
        AtomicBoolean interrupted = new AtomicBoolean();
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withMaxProcessingTimeMs(50));
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return Ok.empty();
        });
        when(orchestrator.failJob(eq(job), any()))
            .thenReturn(Retry.of(ErrorType.TRANSIENT_INFRASTRUCTURE, "Stage S1 exceeded processing ceiling of 50ms"));

        // when
        runner.pump();

        // then
        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(orchestrator, timeout(WAIT_MS)).failJob(eq(job), error.capture());
        assertThat(error.getValue())
            .isInstanceOf(TransientInfrastructureException.class)
            .hasMessage("Stage S1 exceeded processing ceiling of 50ms");
        verify(jobQueue, timeout(WAIT_MS)).ack(job);
        verify(jobQueue, after(200).never()).nack(any());
        assertThat(interrupted).isTrue();
    }

    @Test
    void 처리_시간_상한_초과로_Workflow가_종료되면_DLQ로_이동() {
        // given
        Fail exhausted = Fail.of(ErrorType.TRANSIENT_INFRASTRUCTURE, "Retries exhausted after 3 attempt(s)");
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withMaxProcessingTimeMs(50));
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Ok.empty();
        });
        when(orchestrator.failJob(eq(job), any())).thenReturn(exhausted);

        // when
        runner.pump();

        // then
        verify(jobQueue, timeout(WAIT_MS)).publishToDeadLetter(job, exhausted);
        verify(jobQueue, after(200).never()).ack(any());
    }

    @Test
    void 재전달_한도에_도달한_Job은_실행하지_않고_시도를_실패_처리() {
        // given
        StageJob worn = job.redelivered().redelivered().redelivered();
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withMaxDeliveries(3));
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(worn));
        when(orchestrator.failJob(eq(worn), any()))
            .thenReturn(Retry.of(ErrorType.TRANSIENT_INFRASTRUCTURE, "redelivered"));

        // when
        runner.pump();

        // then
        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(orchestrator, timeout(WAIT_MS)).failJob(eq(worn), error.capture());
        assertThat(error.getValue())
            .isInstanceOf(TransientInfrastructureException.class)
            .hasMessageContaining("delivered 4 times without settling");
        verify(jobQueue, timeout(WAIT_MS)).ack(worn);
        verify(orchestrator, never()).execute(any());
    }

    @Test
    void 재전달_한도_초과_실패도_기록하지_못하면_DLQ로_이동() {
        // given
        StageJob worn = job.redelivered();
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withMaxDeliveries(1));
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(worn));
        when(orchestrator.failJob(eq(worn), any()))
            .thenThrow(new TransientInfrastructureException("Connection reset"));

        // when
        runner.pump();

        // then
        ArgumentCaptor<Fail> dead = ArgumentCaptor.forClass(Fail.class);
        verify(jobQueue, timeout(WAIT_MS)).publishToDeadLetter(eq(worn), dead.capture());
        assertThat(dead.getValue().errorType()).isEqualTo(ErrorType.TRANSIENT_INFRASTRUCTURE);
        verify(jobQueue, never()).nack(any());
    }

    @Test
    void shutdown은_진행_중인_Job을_기다리는_동안_폴링을_멈춤() throws InterruptedException {
        // given
        CountDownLatch running = new CountDownLatch(1);
        AtomicBoolean shuttingDown = new AtomicBoolean();
        AtomicInteger pumpsWhileShuttingDown = new AtomicInteger();
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withPollingIntervalMs(10));
        when(jobQueue.reclaimExpiredLeases()).thenAnswer(invocation -> {
            if (shuttingDown.get()) {
                pumpsWhileShuttingDown.incrementAndGet();
            }
            return 0;
        });
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job)).thenReturn(List.of());
        when(orchestrator.execute(job)).thenAnswer(invocation -> {
            running.countDown();
            Thread.sleep(300);
            return Ok.empty();
        });
        runner.start();
        assertThat(running.await(WAIT_MS, TimeUnit.MILLISECONDS)).isTrue();

        // when
        shuttingDown.set(true);
        runner.shutdown();

        // then
        verify(jobQueue).ack(job);
        assertThat(pumpsWhileShuttingDown.get()).isLessThanOrEqualTo(1);
    }

    @Test
    void Stage_동시_실행_한도만큼만_dequeue() throws InterruptedException {
        // given
        CountDownLatch release = new CountDownLatch(1);
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withStageConcurrency("S1", 1));
        when(jobQueue.dequeue("S1", 1)).thenReturn(List.of(job));
        when(orchestrator.execute(job)).thenAnswer(invocation -> {
            release.await(WAIT_MS, TimeUnit.MILLISECONDS);
            return Ok.empty();
        });

        // when
        runner.pump();
        int permitsWhileRunning = runner.availablePermits("S1");
        runner.pump();
        release.countDown();

        // then
        assertThat(permitsWhileRunning).isZero();
        verify(jobQueue, times(1)).dequeue("S1", 1);
        verify(jobQueue, timeout(WAIT_MS)).ack(job);
    }

    @Test
    void 매_pump마다_만료된_임대를_먼저_회수() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());
        when(jobQueue.reclaimExpiredLeases()).thenReturn(2);

        // when
        runner.pump();

        // then
        verify(jobQueue).reclaimExpiredLeases();
        verify(jobQueue).dequeue("S1", 5);
        verify(orchestrator, never()).execute(any());
    }

    @Test
    void start하면_폴링_주기마다_Job을_처리() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline,
            new QueueWorkerConfig().withPollingIntervalMs(10));
        when(jobQueue.dequeue("S1", 5)).thenReturn(List.of(job)).thenReturn(List.of());
        when(orchestrator.execute(job)).thenReturn(Ok.empty());

        // when
        runner.start();

        // then
        verify(jobQueue, timeout(WAIT_MS)).ack(job);
        verify(jobQueue, timeout(WAIT_MS).atLeast(2)).reclaimExpiredLeases();
    }

    @Test
    void shutdown_이후_pump는_거부() throws InterruptedException {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());
        runner.shutdown();

        // when / then
        assertThatThrownBy(() -> runner.pump())
            .isInstanceOf(IllegalStateException.class);
        verify(jobQueue, never()).dequeue(any(), anyInt());
    }

    @Test
    void 파이프라인에_없는_Stage의_permit_조회는_거부() {
        // given
        runner = new QueueWorkerRunner(jobQueue, orchestrator, pipeline, new QueueWorkerConfig());

        // when / then
        assertThatThrownBy(() -> runner.availablePermits("S9"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(runner.availablePermits("S1")).isEqualTo(5);
    }
}
