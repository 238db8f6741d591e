package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.orchestrator.WorkflowHandle;
import com.ryuqq.stageflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.stageflow.application.query.WorkflowQueryService;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.outcome.Outcome;
import com.ryuqq.stageflow.core.spi.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inline Fast-Path Runner 구현체.
 *
 * <p>큐 워커를 기다리지 않고 호출 스레드에서 Stage를 차례로 실행합니다.
 * 시간 예산이 부족해지면 남은 Stage는 큐에 남겨 워커가 이어서 처리합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Workflow 제출 (첫 Stage Job이 큐에 발행됨)</li>
 *   <li>Workflow가 종료되면 finished 핸들 반환</li>
 *   <li>남은 예산이 stopMargin 이하이면 handedOff 핸들 반환</li>
 *   <li>{@link JobQueue#claim}으로 현재 Stage Job을 직접 임대
 *       (백오프 중이거나 워커가 가져갔으면 pollIntervalMs 후 다시 확인)</li>
 *   <li>{@link WorkflowOrchestrator#execute}로 실행 후 ACK/DLQ, 2로 돌아감</li>
 * </ol>
 *
 * <p>Stage 실행은 큐 워커와 같은 경로(락, 결과 누적, 재시도 규칙)를 거치므로
 * 두 실행 방식이 같은 Workflow를 이어받아도 결과가 같습니다.
 * 실행 중 예상치 못한 예외가 나면 Job을 nack하고 워커에게 넘깁니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class InlineFastPathRunner {

    private static final Logger log = LoggerFactory.getLogger(InlineFastPathRunner.class);

    private final WorkflowOrchestrator orchestrator;
    private final WorkflowQueryService queryService;
    private final JobQueue jobQueue;
    private final InlineRunnerConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param orchestrator Workflow 오케스트레이터
     * @param queryService Workflow 조회 서비스
     * @param jobQueue Stage Job 큐
     * @param config 설정
     * @param clock 예산 측정용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InlineFastPathRunner(WorkflowOrchestrator orchestrator, WorkflowQueryService queryService,
                                JobQueue jobQueue, InlineRunnerConfig config, Clock clock) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (queryService == null) {
            throw new IllegalArgumentException("queryService cannot be null");
        }
        if (jobQueue == null) {
            throw new IllegalArgumentException("jobQueue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.orchestrator = orchestrator;
        this.queryService = queryService;
        this.jobQueue = jobQueue;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 기본 시간 예산으로 제출 후 인라인 실행.
     *
     * @param entityId 대상 엔티티
     * @param payload 제출 Payload
     * @return 실행 핸들
     */
    public WorkflowHandle submit(EntityId entityId, Payload payload) {
        return submit(entityId, payload, config.timeBudget());
    }

    /**
     * 제출 후 주어진 시간 예산 안에서 인라인 실행.
     *
     * <p>같은 엔티티에 진행 중인 Workflow가 있으면 그 Workflow를 이어서 실행합니다.</p>
     *
     * @param entityId 대상 엔티티
     * @param payload 제출 Payload
     * @param timeBudget 시간 예산 (stopMargin보다 커야 함)
     * @return 실행 핸들
     * @throws IllegalArgumentException timeBudget이 유효하지 않은 경우
     */
    public WorkflowHandle submit(EntityId entityId, Payload payload, Duration timeBudget) {
        config.validateBudget(timeBudget);
        Instant startedAt = clock.instant();
        WorkflowId workflowId = orchestrator.submit(entityId, payload);
        return drive(workflowId, startedAt, timeBudget);
    }

    /**
     * 이미 제출된 Workflow를 주어진 시간 예산 안에서 이어서 실행.
     *
     * @param workflowId Workflow ID
     * @param timeBudget 시간 예산 (stopMargin보다 커야 함)
     * @return 실행 핸들
     * @throws IllegalArgumentException workflowId가 null이거나 timeBudget이 유효하지 않은 경우
     * @throws com.ryuqq.stageflow.core.error.WorkflowNotFoundException 존재하지 않는 경우
     */
    public WorkflowHandle resume(WorkflowId workflowId, Duration timeBudget) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        config.validateBudget(timeBudget);
        return drive(workflowId, clock.instant(), timeBudget);
    }

    private WorkflowHandle drive(WorkflowId workflowId, Instant startedAt, Duration timeBudget) {
        Instant deadline = startedAt.plus(timeBudget);
        Map<String, Duration> stageTimings = new LinkedHashMap<>();
        log.info("Running workflow {} inline with a budget of {}ms", workflowId.getValue(), timeBudget.toMillis());

        while (true) {
            WorkflowExecution workflow = queryService.get(workflowId);
            Instant now = clock.instant();
            Duration elapsed = Duration.between(startedAt, now);

            if (workflow.isTerminal()) {
                log.info("Workflow {} finished inline as {} in {}ms, stages run: {}",
                    workflowId.getValue(), workflow.status(), elapsed.toMillis(), stageTimings.keySet());
                return WorkflowHandle.finished(workflow, stageTimings, elapsed);
            }

            Duration remaining = Duration.between(now, deadline);
            if (remaining.compareTo(config.stopMargin()) <= 0) {
                log.info("Handing workflow {} off to queue workers at stage {}: {}ms of budget left",
                    workflowId.getValue(), workflow.currentStage(), Math.max(0, remaining.toMillis()));
                return WorkflowHandle.handedOff(workflow, stageTimings, elapsed);
            }

            Optional<StageJob> claimed = jobQueue.claim(workflowId, workflow.currentStage());
            if (claimed.isEmpty()) {
                sleep(config.pollIntervalMs());
                continue;
            }

            StageJob job = claimed.get();
            if (!runJob(job, stageTimings)) {
                return WorkflowHandle.handedOff(queryService.get(workflowId), stageTimings,
                    Duration.between(startedAt, clock.instant()));
            }
        }
    }

    /**
     * Job 하나 실행 후 정산.
     *
     * @return 계속 인라인으로 진행할 수 있으면 true
     */
    private boolean runJob(StageJob job, Map<String, Duration> stageTimings) {
        Instant stageStartedAt = clock.instant();
        try {
            Outcome outcome = orchestrator.execute(job);
            if (outcome instanceof Fail fail && config.dlqEnabled()) {
                jobQueue.publishToDeadLetter(job, fail);
            } else {
                jobQueue.ack(job);
            }
            log.debug("Inline job {} at stage {} settled: {}", job.jobId(), job.stage(), outcome.summary());
            return true;
        } catch (RuntimeException e) {
            log.error("Inline job {} for workflow {} at stage {} failed unexpectedly, handing it to queue workers",
                job.jobId(), job.workflowId().getValue(), job.stage(), e);
            jobQueue.nack(job);
            return false;
        } finally {
            stageTimings.merge(job.stage(), Duration.between(stageStartedAt, clock.instant()), Duration::plus);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Inline run interrupted", e);
        }
    }
}
