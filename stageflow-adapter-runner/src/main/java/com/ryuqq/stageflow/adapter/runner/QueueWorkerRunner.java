package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.stageflow.application.runtime.Runtime;
import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.outcome.Outcome;
import com.ryuqq.stageflow.core.spi.JobQueue;
import com.ryuqq.stageflow.core.stage.StageDefinition;
import com.ryuqq.stageflow.core.stage.StagePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue Worker Runner 구현체.
 *
 * <p>Stage별 큐에서 Job을 가져와 {@link WorkflowOrchestrator#execute(StageJob)}로 실행하고,
 * 결과에 따라 ACK/NACK/DLQ 처리합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * reclaimExpiredLeases() → 임대 만료 Job 재전달
 *   ↓
 * For each Stage (파이프라인 순서):
 *   free = min(Stage 여유 permit, batchSize)
 *   dequeue(stage, free) → [Job1, Job2, ...]
 *   ↓
 * For each Job (워커 스레드):
 *   0. deliveryCount가 maxDeliveries 이상이면 실행하지 않고 현재 시도 실패 처리
 *   1. orchestrator.execute(job)
 *   2. 결과 처리:
 *      - Fail (Workflow FAILED 또는 무효 Job) → DLQ (dlqEnabled일 때)
 *      - 그 외 → ack
 *   3. 예상치 못한 예외 → nack (재전달)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>Stage마다 Semaphore로 동시 실행 수 제한 (permit이 없으면 dequeue하지 않음)</li>
 *   <li>같은 Workflow의 Stage는 순차 발행되므로 동시에 실행되지 않음</li>
 *   <li>Job마다 maxProcessingTimeMs 감시: 초과 시 현재 시도를 일시 장애로 실패 처리한 뒤 핸들러를 인터럽트
 *       (시도 횟수 차감, 백오프 적용, 오류 기록)</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    private static final int QUEUED = 0;
    private static final int RUNNING = 1;
    private static final int SETTLED = 2;
    private static final int EXPIRED = 3;

    private final JobQueue jobQueue;
    private final WorkflowOrchestrator orchestrator;
    private final StagePipeline pipeline;
    private final QueueWorkerConfig config;
    private final Map<String, Semaphore> stagePermits;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean shutdown;

    /**
     * 생성자.
     *
     * @param jobQueue Stage Job 큐
     * @param orchestrator Workflow 오케스트레이터
     * @param pipeline Stage 파이프라인 (dequeue 대상 Stage 목록)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(JobQueue jobQueue, WorkflowOrchestrator orchestrator, StagePipeline pipeline,
                             QueueWorkerConfig config) {
        if (jobQueue == null) {
            throw new IllegalArgumentException("jobQueue cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.jobQueue = jobQueue;
        this.orchestrator = orchestrator;
        this.pipeline = pipeline;
        this.config = config;
        this.stagePermits = new HashMap<>();
        for (StageDefinition definition : pipeline.definitions()) {
            stagePermits.put(definition.name(), new Semaphore(config.concurrencyFor(definition.name())));
        }
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
        this.scheduler = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable, "stageflow-worker-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void pump() {
        if (shutdown) {
            throw new IllegalStateException("QueueWorkerRunner has been shut down");
        }

        // 1. 임대 만료 Job 재전달
        int reclaimed = jobQueue.reclaimExpiredLeases();
        if (reclaimed > 0) {
            log.info("Reclaimed {} expired job lease(s) for redelivery", reclaimed);
        }

        // 2. Stage별 여유 permit만큼 dequeue
        for (StageDefinition definition : pipeline.definitions()) {
            Semaphore permits = stagePermits.get(definition.name());
            int free = Math.min(permits.availablePermits(), config.batchSize());
            if (free <= 0) {
                continue;
            }
            List<StageJob> jobs = jobQueue.dequeue(definition.name(), free);
            for (StageJob job : jobs) {
                dispatch(job, permits);
            }
        }
    }

    /**
     * pollingIntervalMs 주기로 {@link #pump()} 실행 시작.
     */
    public void start() {
        if (shutdown) {
            throw new IllegalStateException("QueueWorkerRunner has been shut down");
        }
        pollTask = scheduler.scheduleWithFixedDelay(
            this::pumpSafely, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("QueueWorkerRunner started: stages={}, pollingInterval={}ms, concurrency={}",
            stagePermits.keySet(), config.pollingIntervalMs(), config.concurrency());
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>폴링을 먼저 멈추고, 진행 중인 Job이 끝나도록 최대 60초 대기합니다.
     * 대기 중에도 처리 시간 감시는 계속 동작합니다. 끝나지 않은 Job은 임대 만료 후 재전달됩니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        shutdown = true;
        ScheduledFuture<?> polling = pollTask;
        if (polling != null) {
            polling.cancel(false);
        }
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
        scheduler.shutdownNow();
    }

    /**
     * Stage의 현재 여유 permit 수.
     *
     * @param stage Stage 이름
     * @return 여유 permit 수
     * @throws IllegalArgumentException 파이프라인에 없는 Stage인 경우
     */
    public int availablePermits(String stage) {
        Semaphore permits = stagePermits.get(stage);
        if (permits == null) {
            throw new IllegalArgumentException("Unknown stage: " + stage);
        }
        return permits.availablePermits();
    }

    private void pumpSafely() {
        if (shutdown) {
            return;
        }
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Pump cycle failed, retrying on next poll", e);
        }
    }

    private void dispatch(StageJob job, Semaphore permits) {
        if (!permits.tryAcquire()) {
            jobQueue.nack(job);
            return;
        }
        InFlightJob inFlight = new InFlightJob(job, permits);
        try {
            inFlight.worker = workerExecutor.submit(() -> run(inFlight));
            inFlight.watchdog = scheduler.schedule(
                () -> enforceCeiling(inFlight), config.maxProcessingTimeMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            if (inFlight.state.compareAndSet(QUEUED, SETTLED)) {
                permits.release();
                jobQueue.nack(job);
            }
            log.warn("Worker pool rejected job {}, returned to queue", job.jobId());
        }
    }

    /**
     * Job 처리 (실행 → 결과 처리 → ACK/DLQ).
     *
     * <p>예외 발생 시 NACK 처리하여 재전달되도록 합니다. 처리 시간 상한을 넘겨 감시자가
     * 먼저 정산한 Job(EXPIRED)은 여기서 다시 정산하지 않습니다.</p>
     */
    private void run(InFlightJob inFlight) {
        if (!inFlight.state.compareAndSet(QUEUED, RUNNING)) {
            return;
        }
        StageJob job = inFlight.job;
        try {
            Outcome outcome = job.deliveryCount() >= config.maxDeliveries()
                ? abandonRedelivered(job)
                : orchestrator.execute(job);
            if (inFlight.state.compareAndSet(RUNNING, SETTLED)) {
                settle(job, outcome);
            }
        } catch (RuntimeException e) {
            if (inFlight.state.compareAndSet(RUNNING, SETTLED)) {
                log.error("Job {} for workflow {} at stage {} failed unexpectedly, returning it to the queue",
                    job.jobId(), job.workflowId().getValue(), job.stage(), e);
                jobQueue.nack(job);
            }
        } finally {
            inFlight.permits.release();
            ScheduledFuture<?> watchdog = inFlight.watchdog;
            if (watchdog != null) {
                watchdog.cancel(false);
            }
        }
    }

    /**
     * 정산되지 않고 반복 재전달된 Job의 시도를 끝냄.
     *
     * <p>오케스트레이터에 실패를 기록하지 못하면 Job을 더 돌리지 않고 DLQ로 보냅니다.</p>
     */
    private Outcome abandonRedelivered(StageJob job) {
        String message = "Job " + job.jobId() + " was delivered " + (job.deliveryCount() + 1)
            + " times without settling";
        log.warn("{} (workflow {}, stage {}, attempt {})",
            message, job.workflowId().getValue(), job.stage(), job.attempt());
        try {
            return orchestrator.failJob(job, new TransientInfrastructureException(message));
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}, giving up on redelivery", job.jobId(), e);
            return Fail.of(ErrorType.TRANSIENT_INFRASTRUCTURE, message, e.toString());
        }
    }

    /**
     * lease ceiling 초과 처리.
     *
     * <p>시작 전이면 permit을 돌려주고 nack합니다. 실행 중이면 EXPIRED로 표시하고
     * 현재 시도를 일시 장애로 실패 처리(재시도 발행 또는 FAILED)해 정산한 뒤 핸들러를 인터럽트합니다.
     * 인터럽트된 핸들러의 늦은 결과는 지난 시도로 무시됩니다.</p>
     */
    private void enforceCeiling(InFlightJob inFlight) {
        StageJob job = inFlight.job;
        if (inFlight.state.compareAndSet(QUEUED, SETTLED)) {
            inFlight.permits.release();
            jobQueue.nack(job);
            log.warn("Job {} waited longer than {}ms for a worker, returned to queue",
                job.jobId(), config.maxProcessingTimeMs());
            return;
        }
        if (!inFlight.state.compareAndSet(RUNNING, EXPIRED)) {
            return;
        }
        log.warn("Job {} for workflow {} at stage {} exceeded {}ms, failing the attempt and interrupting it",
            job.jobId(), job.workflowId().getValue(), job.stage(), config.maxProcessingTimeMs());
        try {
            settle(job, orchestrator.failJob(job, new TransientInfrastructureException(
                "Stage " + job.stage() + " exceeded processing ceiling of " + config.maxProcessingTimeMs() + "ms")));
        } catch (RuntimeException e) {
            log.error("Could not record ceiling breach of job {}, returning it to the queue", job.jobId(), e);
            jobQueue.nack(job);
        } finally {
            Future<?> worker = inFlight.worker;
            if (worker != null) {
                worker.cancel(true);
            }
        }
    }

    private void settle(StageJob job, Outcome outcome) {
        if (outcome instanceof Fail fail && config.dlqEnabled()) {
            jobQueue.publishToDeadLetter(job, fail);
            log.warn("Job {} for workflow {} moved to DLQ: {} - {}",
                job.jobId(), job.workflowId().getValue(), fail.errorType(), fail.message());
        } else {
            jobQueue.ack(job);
            log.debug("Job {} at stage {} settled: {}", job.jobId(), job.stage(), outcome.summary());
        }
    }

    private static final class InFlightJob {
        private final StageJob job;
        private final Semaphore permits;
        private final AtomicInteger state = new AtomicInteger(QUEUED);
        private volatile Future<?> worker;
        private volatile ScheduledFuture<?> watchdog;

        InFlightJob(StageJob job, Semaphore permits) {
            this.job = job;
            this.permits = permits;
        }
    }
}
