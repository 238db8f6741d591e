package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.stageflow.application.query.WorkflowQueryService;
import com.ryuqq.stageflow.core.error.HandlerFailureException;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.spi.JobQueue;
import com.ryuqq.stageflow.core.stage.StageDefinition;
import com.ryuqq.stageflow.core.stage.StagePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * stuck Workflow 리컨실러.
 *
 * <p>Stage 결과 저장 후 다음 Job 발행 전에 워커가 죽으면 Workflow는 PROCESSING에 멈춥니다.
 * Reaper는 {@link ReaperConfig#stuckThreshold()} 동안 갱신이 없는 Workflow를 찾아
 * {@link ReconcileStrategy}에 따라 처리합니다.</p>
 *
 * <ul>
 *   <li>RETRY: 현재 Stage Job을 같은 시도 번호로 즉시 재발행</li>
 *   <li>FAIL: 재시도 불가 오류로 실패 처리 (락 해제, 누적 결과 정리)</li>
 * </ul>
 *
 * <p>중복 Job과 이미 종료된 Workflow는 오케스트레이터가 걸러내므로 여러 인스턴스가 동시에 돌아도 됩니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    private final WorkflowQueryService queryService;
    private final JobQueue jobQueue;
    private final WorkflowOrchestrator orchestrator;
    private final StagePipeline pipeline;
    private final ReaperConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public Reaper(WorkflowQueryService queryService, JobQueue jobQueue, WorkflowOrchestrator orchestrator,
                  StagePipeline pipeline, ReaperConfig config, Clock clock) {
        if (queryService == null) {
            throw new IllegalArgumentException("queryService cannot be null");
        }
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
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.queryService = queryService;
        this.jobQueue = jobQueue;
        this.orchestrator = orchestrator;
        this.pipeline = pipeline;
        this.config = config;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stageflow-reaper");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * scanInterval 간격으로 {@link #scan()}을 예약합니다. 첫 스캔도 한 간격 뒤에 실행됩니다.
     */
    public void start() {
        long intervalMs = config.scanInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::scanSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Reaper started: interval={}ms, threshold={}ms, strategy={}",
            intervalMs, config.stuckThreshold().toMillis(), config.strategy());
    }

    public void shutdown() {
        scheduler.shutdownNow();
        log.info("Reaper stopped");
    }

    /**
     * stuck Workflow를 한 배치 스캔하고 리컨실합니다.
     *
     * @return 리컨실에 성공한 Workflow 수
     */
    public int scan() {
        List<WorkflowExecution> stuck = queryService.findStuck(config.stuckThreshold(), config.batchSize());
        if (stuck.isEmpty()) {
            log.debug("Reaper scan found no stuck workflows");
            return 0;
        }

        int reconciled = 0;
        for (WorkflowExecution workflow : stuck) {
            try {
                reconcile(workflow);
                reconciled++;
            } catch (Exception e) {
                // 한 건 실패가 나머지 복구를 막지 않음
                log.error("Failed to reconcile workflow {} at stage {}",
                    workflow.id().getValue(), workflow.currentStage(), e);
            }
        }
        log.info("Reaper scan completed: {} of {} stuck workflows reconciled ({})",
            reconciled, stuck.size(), config.strategy());
        return reconciled;
    }

    private void scanSafely() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Reaper scan failed", e);
        }
    }

    private void reconcile(WorkflowExecution workflow) {
        switch (config.strategy()) {
            case RETRY -> republishCurrentStage(workflow);
            case FAIL -> failCurrentStage(workflow);
        }
    }

    private void republishCurrentStage(WorkflowExecution workflow) {
        StageDefinition definition = pipeline.resolve(workflow.currentStage());
        jobQueue.publish(StageJob.of(workflow.id(), definition.stage(), workflow.stageAttempt(),
            workflow.payload(), clock.millis()), 0);
        log.warn("Re-published stuck workflow {} at stage {} (attempt {})",
            workflow.id().getValue(), definition.name(), workflow.stageAttempt());
    }

    private void failCurrentStage(WorkflowExecution workflow) {
        long idleMs = Duration.between(workflow.updatedAt(), clock.instant()).toMillis();
        orchestrator.fail(workflow.id(), workflow.currentStage(), HandlerFailureException.permanent(
            "Workflow stuck at stage " + workflow.currentStage() + " with no progress for " + idleMs + "ms"));
        log.warn("Failed stuck workflow {} at stage {} after {}ms idle",
            workflow.id().getValue(), workflow.currentStage(), idleMs);
    }
}
