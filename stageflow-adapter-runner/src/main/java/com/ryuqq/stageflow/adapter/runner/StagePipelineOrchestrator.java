package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.accumulator.StageResultStore;
import com.ryuqq.stageflow.application.lock.EntityLockManager;
import com.ryuqq.stageflow.application.lock.LockAcquisition;
import com.ryuqq.stageflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.stageflow.application.resilience.BackoffCalculator;
import com.ryuqq.stageflow.core.error.DuplicateSubmissionException;
import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.error.HandlerFailureException;
import com.ryuqq.stageflow.core.error.ValidationFailureException;
import com.ryuqq.stageflow.core.error.WorkflowNotFoundException;
import com.ryuqq.stageflow.core.model.AccumulatedStageData;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.ErrorDetail;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.StageTransitionRecord;
import com.ryuqq.stageflow.core.model.StatusEvent;
import com.ryuqq.stageflow.core.model.WorkflowExecution;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.outcome.Ok;
import com.ryuqq.stageflow.core.outcome.Outcome;
import com.ryuqq.stageflow.core.outcome.Retry;
import com.ryuqq.stageflow.core.spi.JobQueue;
import com.ryuqq.stageflow.core.spi.StatusPublisher;
import com.ryuqq.stageflow.core.spi.WorkflowStore;
import com.ryuqq.stageflow.core.stage.ProgressReporter;
import com.ryuqq.stageflow.core.stage.StageContext;
import com.ryuqq.stageflow.core.stage.StageDefinition;
import com.ryuqq.stageflow.core.stage.StagePipeline;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 고정 Stage 파이프라인 기반 WorkflowOrchestrator 구현체.
 *
 * <p>Workflow 상태는 WorkflowStore, Stage 간 데이터는 StageResultStore,
 * 엔티티 단위 직렬화는 EntityLockManager가 담당하며, 이 클래스는 상태를 들고 있지 않습니다.
 * 어느 워커 인스턴스가 Job을 받든 같은 결과를 냅니다.</p>
 *
 * <p><strong>Stage 실행 흐름 ({@link #execute(StageJob)}):</strong></p>
 * <pre>
 * 1. Workflow 조회 → Job 유효성 확인
 *    - 종료된 Workflow, 지난 Stage, 지난 시도 → 무시 (Ok.empty)
 *    - 현재보다 앞선 Stage/시도 → Fail(VALIDATION_FAILURE)
 * 2. 엔티티 락 획득 (재진입 시 heartbeat 갱신)
 *    - LockTimeout → 같은 Stage 재발행 (Retry)
 * 3. 누적 결과 조회 → StageContext 생성
 * 4. shouldRun() == false → 빈 결과로 advance
 * 5. handler.handle(context)
 *    - Ok → advance (그 사이 시도가 바뀌었으면 결과 폐기)
 *    - Retry / Fail / 예외 → fail 경로
 * 2~5 단계에서 핸들러 밖 예외 (저장소 장애, 락 상실) → 분류 후 같은 fail 경로
 * </pre>
 *
 * <p>fail 경로는 Job의 시도 번호를 기준으로 동작합니다. Workflow가 이미 다음 시도나
 * 다음 Stage로 넘어갔으면 늦게 도착한 실패는 무시됩니다.</p>
 *
 * <p><strong>순서 보장:</strong> Stage N의 결과 저장이 끝난 뒤에 Stage N+1 Job을 발행합니다.
 * 발행 전에 프로세스가 죽으면 Workflow는 PROCESSING으로 남고 Reaper가 회수합니다.</p>
 *
 * <p><strong>로깅:</strong></p>
 * <ul>
 *   <li>INFO: 모든 상태 전이 (Workflow ID, Stage, 진행률, 시각)</li>
 *   <li>WARN: 재시도 예약, 상태 이벤트/정리 실패</li>
 *   <li>ERROR: Workflow 최종 실패</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class StagePipelineOrchestrator implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StagePipelineOrchestrator.class);

    private static final int ANY_ATTEMPT = 0;

    private final StagePipeline pipeline;
    private final WorkflowStore workflowStore;
    private final JobQueue jobQueue;
    private final StageResultStore resultStore;
    private final EntityLockManager lockManager;
    private final StatusPublisher statusPublisher;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final StageFailureClassifier failureClassifier;
    private final BackoffCalculator backoffCalculator;
    private final ScheduledExecutorService cleanupScheduler;

    /**
     * 생성자 (기본 StageFailureClassifier 사용).
     *
     * @param pipeline Stage 파이프라인
     * @param workflowStore Workflow 저장소
     * @param jobQueue Stage Job 큐
     * @param resultStore Stage 결과 저장소
     * @param lockManager 엔티티 락 관리자
     * @param statusPublisher 상태 이벤트 발행자
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StagePipelineOrchestrator(StagePipeline pipeline, WorkflowStore workflowStore, JobQueue jobQueue,
                                     StageResultStore resultStore, EntityLockManager lockManager,
                                     StatusPublisher statusPublisher, OrchestratorConfig config, Clock clock) {
        this(pipeline, workflowStore, jobQueue, resultStore, lockManager, statusPublisher, config, clock,
            new StageFailureClassifier());
    }

    /**
     * 생성자 (커스텀 StageFailureClassifier 주입).
     *
     * @param pipeline Stage 파이프라인
     * @param workflowStore Workflow 저장소
     * @param jobQueue Stage Job 큐
     * @param resultStore Stage 결과 저장소
     * @param lockManager 엔티티 락 관리자
     * @param statusPublisher 상태 이벤트 발행자
     * @param config 설정
     * @param clock 시계
     * @param failureClassifier 실패 분류기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StagePipelineOrchestrator(StagePipeline pipeline, WorkflowStore workflowStore, JobQueue jobQueue,
                                     StageResultStore resultStore, EntityLockManager lockManager,
                                     StatusPublisher statusPublisher, OrchestratorConfig config, Clock clock,
                                     StageFailureClassifier failureClassifier) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (workflowStore == null) {
            throw new IllegalArgumentException("workflowStore cannot be null");
        }
        if (jobQueue == null) {
            throw new IllegalArgumentException("jobQueue cannot be null");
        }
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        if (lockManager == null) {
            throw new IllegalArgumentException("lockManager cannot be null");
        }
        if (statusPublisher == null) {
            throw new IllegalArgumentException("statusPublisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (failureClassifier == null) {
            throw new IllegalArgumentException("failureClassifier cannot be null");
        }
        this.pipeline = pipeline;
        this.workflowStore = workflowStore;
        this.jobQueue = jobQueue;
        this.resultStore = resultStore;
        this.lockManager = lockManager;
        this.statusPublisher = statusPublisher;
        this.config = config;
        this.clock = clock;
        this.failureClassifier = failureClassifier;
        this.backoffCalculator = config.toBackoff();
        this.cleanupScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stageflow-result-cleanup");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public WorkflowId submit(EntityId entityId, Payload payload) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        StageDefinition first = pipeline.first();
        WorkflowExecution created = WorkflowExecution.create(
            WorkflowId.generate(), entityId, first.name(), payload, clock.instant());

        try {
            workflowStore.insert(created);
        } catch (DuplicateSubmissionException e) {
            log.info("Duplicate submission for entity {}, returning active workflow {}",
                entityId.getValue(), e.getExistingWorkflowId().getValue());
            return e.getExistingWorkflowId();
        }
        logTransition(created);
        publishStatus(created, "Submitted");

        WorkflowExecution processing = created.markProcessing(clock.instant());
        workflowStore.update(processing);
        logTransition(processing);

        jobQueue.publish(StageJob.of(created.id(), first.stage(), 1, created.payload(), clock.millis()), 0);
        publishStatus(processing, first.displayMessage());
        return created.id();
    }

    @Override
    public Outcome execute(StageJob job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        Optional<WorkflowExecution> found = workflowStore.findById(job.workflowId());
        if (found.isEmpty()) {
            log.warn("Rejecting job {} for unknown workflow {}", job.jobId(), job.workflowId().getValue());
            return Fail.of(ErrorType.VALIDATION_FAILURE, "Workflow not found: " + job.workflowId().getValue());
        }
        WorkflowExecution workflow = found.get();

        StageDefinition definition;
        try {
            definition = pipeline.resolve(job.stage());
        } catch (ValidationFailureException e) {
            log.error("Job {} for workflow {} names an invalid stage", job.jobId(), job.workflowId().getValue(), e);
            return failStage(job.workflowId(), workflow.currentStage(), failureClassifier.classify(e, null));
        }

        Optional<Outcome> rejected = checkJob(job, workflow);
        if (rejected.isPresent()) {
            return rejected.get();
        }

        try {
            return runStage(job, workflow, definition);
        } catch (RuntimeException e) {
            // 핸들러 밖 실패 (저장소, 락, 결과 저장)도 같은 시도 예산으로 처리
            log.warn("Stage {} of workflow {} (attempt {}) failed outside the handler: {}",
                definition.name(), workflow.id().getValue(), job.attempt(), e.toString());
            return failAttempt(workflow.id(), definition.name(), job.attempt(), failureClassifier.classify(e, null));
        }
    }

    private Outcome runStage(StageJob job, WorkflowExecution workflow, StageDefinition definition) {
        if (workflow.status() == WorkflowStatus.PENDING) {
            workflow = workflow.markProcessing(clock.instant());
            workflowStore.update(workflow);
            logTransition(workflow);
        }

        LockAcquisition acquisition = lockManager.acquire(workflow.targetEntityId(), workflow.id(), definition.name());
        if (acquisition == LockAcquisition.RECLAIMED) {
            log.warn("Workflow {} reclaimed a stale lock on {} at stage {}",
                workflow.id().getValue(), workflow.targetEntityId().getValue(), definition.name());
        }

        AccumulatedStageData accumulated = resultStore.getAccumulatedData(workflow.id());
        StageContext context = new StageContext(
            workflow.id(), workflow.targetEntityId(), definition.stage(), workflow.stageAttempt(),
            workflow.payload(), accumulated, progressReporter(workflow, definition));

        log.info("Running stage {} for workflow {} (attempt {})",
            definition.name(), workflow.id().getValue(), workflow.stageAttempt());

        if (!definition.handler().shouldRun(context)) {
            log.info("Skipping stage {} for workflow {}: precondition not met",
                definition.name(), workflow.id().getValue());
            return advanceAfterRun(job, definition, Ok.empty());
        }

        Outcome outcome;
        try {
            outcome = definition.handler().handle(context);
        } catch (RuntimeException e) {
            return failAttempt(workflow.id(), definition.name(), job.attempt(),
                failureClassifier.classify(e, definition.handler()));
        }

        if (outcome == null) {
            HandlerFailureException missing = HandlerFailureException.permanent(
                "Handler for stage " + definition.name() + " returned no outcome");
            return failAttempt(workflow.id(), definition.name(), job.attempt(), failureClassifier.classify(missing, null));
        }
        if (outcome instanceof Ok ok) {
            return advanceAfterRun(job, definition, ok);
        }
        return failAttempt(workflow.id(), definition.name(), job.attempt(), outcome);
    }

    @Override
    public void advance(WorkflowId workflowId, String stage, Payload stageOutput) {
        WorkflowExecution workflow = load(workflowId);
        StageDefinition definition = pipeline.resolve(stage);
        requireCurrentStage(workflow, definition.name());

        lockManager.verifyHolder(workflow.targetEntityId(), workflowId);
        resultStore.saveStageResult(workflowId, definition.name(), stageOutput == null ? Payload.empty() : stageOutput);

        Optional<StageDefinition> next = pipeline.next(definition.name());
        Instant now = clock.instant();
        if (next.isPresent()) {
            StageDefinition nextStage = next.get();
            WorkflowExecution advanced = workflow.advanceTo(
                nextStage.name(), pipeline.progressAfter(definition.name()), now, definition.name() + " completed");
            workflowStore.update(advanced);
            logTransition(advanced);

            jobQueue.publish(StageJob.of(workflowId, nextStage.stage(), 1, workflow.payload(), now.toEpochMilli()), 0);
            publishStatus(advanced, nextStage.displayMessage());
            return;
        }

        WorkflowExecution completed = workflow.complete(now);
        workflowStore.update(completed);
        logTransition(completed);
        publishStatus(completed, "Completed");
        releaseLock(completed);
        scheduleCleanup(workflowId);
    }

    @Override
    public Outcome fail(WorkflowId workflowId, String stage, Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        StageDefinition definition = pipeline.resolve(stage);
        return failStage(workflowId, definition.name(), failureClassifier.classify(error, definition.handler()));
    }

    @Override
    public Outcome failJob(StageJob job, Throwable error) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        StageDefinition definition = pipeline.resolve(job.stage());
        return failAttempt(job.workflowId(), definition.name(), job.attempt(),
            failureClassifier.classify(error, definition.handler()));
    }

    /**
     * 지연 정리 스케줄러 종료.
     *
     * <p>예약된 정리 작업은 취소되며, 남은 데이터는 TTL로 만료됩니다.</p>
     */
    public void shutdown() {
        List<Runnable> pending = cleanupScheduler.shutdownNow();
        if (!pending.isEmpty()) {
            log.info("Orchestrator shut down with {} pending result cleanups (left to TTL)", pending.size());
        }
    }

    /**
     * 실패 처리 (재발행 또는 FAILED 종료).
     *
     * @param workflowId Workflow ID
     * @param stage 실패한 Stage 이름
     * @param classification {@code Retry} 또는 {@code Fail}
     * @return 재발행했으면 Retry, 종료했으면 Fail
     */
    private Outcome failStage(WorkflowId workflowId, String stage, Outcome classification) {
        return failAttempt(workflowId, stage, ANY_ATTEMPT, classification);
    }

    /**
     * 특정 시도의 실패 처리. Workflow가 그 시도를 이미 지나갔으면 무시합니다.
     *
     * @param expectedAttempt 실패한 시도 번호 ({@link #ANY_ATTEMPT}이면 현재 시도)
     */
    private Outcome failAttempt(WorkflowId workflowId, String stage, int expectedAttempt, Outcome classification) {
        WorkflowExecution workflow = load(workflowId);
        if (workflow.isTerminal()) {
            log.info("Ignoring failure of stage {} for workflow {}: already {}",
                stage, workflowId.getValue(), workflow.status());
            return toFail(classification, workflow.stageAttempt());
        }
        if (expectedAttempt != ANY_ATTEMPT && isSuperseded(workflow, stage, expectedAttempt)) {
            log.info("Ignoring failure of superseded attempt {} of stage {} for workflow {} (now {} attempt {})",
                expectedAttempt, stage, workflowId.getValue(), workflow.currentStage(), workflow.stageAttempt());
            return Ok.empty();
        }
        requireCurrentStage(workflow, stage);

        StageDefinition definition = pipeline.resolve(stage);
        int attempt = workflow.stageAttempt();
        int maxAttempts = definition.effectiveMaxAttempts(config.defaultMaxAttempts());
        Instant now = clock.instant();

        if (classification instanceof Retry retry && attempt < maxAttempts) {
            ErrorDetail detail = new ErrorDetail(stage, retry.reason(), retry.errorType(), attempt, now);
            WorkflowExecution retrying = workflow.retrying(detail, now);
            workflowStore.update(retrying);
            logTransition(retrying);

            long delayMs = backoffCalculator.calculate(attempt);
            jobQueue.publish(
                StageJob.of(workflowId, definition.stage(), retrying.stageAttempt(), workflow.payload(), now.toEpochMilli()),
                delayMs);
            log.warn("Stage {} of workflow {} failed with {} (attempt {}/{}), retrying in {}ms: {}",
                stage, workflowId.getValue(), retry.errorType(), attempt, maxAttempts, delayMs, retry.reason());
            publishStatus(retrying, definition.displayMessage() + " (retry " + retrying.stageAttempt() + ")");
            return retry;
        }

        Fail fail = toFail(classification, attempt);
        ErrorDetail detail = new ErrorDetail(stage, fail.message(), fail.errorType(), attempt, now);
        WorkflowExecution failed = workflow.fail(detail, now);
        workflowStore.update(failed);
        logTransition(failed);
        log.error("Workflow {} failed at stage {} after {} attempt(s): {} - {}",
            workflowId.getValue(), stage, attempt, fail.errorType(), fail.message());

        publishStatus(failed, fail.message());
        releaseLock(failed);
        scheduleCleanup(workflowId);
        return fail;
    }

    private Outcome advanceAfterRun(StageJob job, StageDefinition definition, Ok ok) {
        WorkflowExecution workflow = load(job.workflowId());
        if (workflow.isTerminal() || isSuperseded(workflow, definition.name(), job.attempt())) {
            log.warn("Discarding output of stage {} for workflow {}: attempt {} was superseded (now {} {} attempt {})",
                definition.name(), job.workflowId().getValue(), job.attempt(),
                workflow.status(), workflow.currentStage(), workflow.stageAttempt());
            return Ok.empty();
        }
        advance(job.workflowId(), definition.name(), ok.output());
        return ok;
    }

    private static boolean isSuperseded(WorkflowExecution workflow, String stage, int attempt) {
        return !workflow.currentStage().equals(stage) || workflow.stageAttempt() != attempt;
    }

    /**
     * Job과 저장된 Workflow 상태 비교.
     *
     * @return 실행하지 않을 Job이면 반환할 Outcome, 실행할 Job이면 empty
     */
    private Optional<Outcome> checkJob(StageJob job, WorkflowExecution workflow) {
        String workflowId = workflow.id().getValue();
        if (workflow.isTerminal()) {
            log.info("Dropping job {} for workflow {}: already {}", job.jobId(), workflowId, workflow.status());
            return Optional.of(Ok.empty());
        }

        int jobIndex = pipeline.indexOf(job.stage());
        int currentIndex = pipeline.indexOf(workflow.currentStage());
        if (jobIndex < currentIndex) {
            log.info("Dropping late job {} for workflow {}: stage {} already passed (current {})",
                job.jobId(), workflowId, job.stage(), workflow.currentStage());
            return Optional.of(Ok.empty());
        }
        if (jobIndex > currentIndex) {
            try {
                pipeline.checkForward(job.stage(), workflow.currentStage());
            } catch (IllegalStateException e) {
                log.error("Rejecting job {} for workflow {}: {}", job.jobId(), workflowId, e.getMessage());
                return Optional.of(Fail.of(ErrorType.VALIDATION_FAILURE, e.getMessage()));
            }
        }

        if (job.attempt() < workflow.stageAttempt()) {
            log.info("Dropping stale job {} for workflow {}: attempt {} superseded by attempt {}",
                job.jobId(), workflowId, job.attempt(), workflow.stageAttempt());
            return Optional.of(Ok.empty());
        }
        if (job.attempt() > workflow.stageAttempt()) {
            log.error("Rejecting job {} for workflow {}: attempt {} is ahead of recorded attempt {}",
                job.jobId(), workflowId, job.attempt(), workflow.stageAttempt());
            return Optional.of(Fail.of(ErrorType.VALIDATION_FAILURE,
                "Attempt " + job.attempt() + " is ahead of recorded attempt " + workflow.stageAttempt()));
        }
        return Optional.empty();
    }

    /**
     * Stage 내부 진행률 보고 콜백.
     *
     * <p>보고할 때마다 락 heartbeat를 갱신합니다. 락을 잃었으면 LockLostException이
     * 핸들러로 전파됩니다. 진행률 저장과 이벤트 발행은 best effort입니다.</p>
     */
    private ProgressReporter progressReporter(WorkflowExecution workflow, StageDefinition definition) {
        return (subPercent, message) -> {
            lockManager.refresh(workflow.targetEntityId(), workflow.id(), definition.name());
            try {
                Optional<WorkflowExecution> current = workflowStore.findById(workflow.id());
                if (current.isEmpty() || current.get().isTerminal()
                        || !current.get().currentStage().equals(definition.name())) {
                    return;
                }
                int progress = pipeline.progressAt(definition.name(), subPercent);
                WorkflowExecution updated = current.get().withProgress(progress, clock.instant());
                if (updated != current.get()) {
                    workflowStore.update(updated);
                }
                publishStatus(updated, message == null ? definition.displayMessage() : message);
            } catch (RuntimeException e) {
                log.warn("Progress update failed for workflow {} at stage {}",
                    workflow.id().getValue(), definition.name(), e);
            }
        };
    }

    private WorkflowExecution load(WorkflowId workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return workflowStore.findById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private void requireCurrentStage(WorkflowExecution workflow, String stage) {
        if (workflow.isTerminal()) {
            throw new IllegalStateException(
                "Workflow " + workflow.id().getValue() + " is already " + workflow.status());
        }
        pipeline.checkForward(stage, workflow.currentStage());
        if (!workflow.currentStage().equals(stage)) {
            throw new IllegalStateException(
                String.format("Stage order violation: %s is not the current stage %s of workflow %s",
                    stage, workflow.currentStage(), workflow.id().getValue()));
        }
    }

    private Fail toFail(Outcome classification, int attempt) {
        if (classification instanceof Fail fail) {
            return fail;
        }
        if (classification instanceof Retry retry) {
            return Fail.of(retry.errorType(),
                "Retries exhausted after " + attempt + " attempt(s): " + retry.reason());
        }
        return Fail.of(ErrorType.HANDLER_FAILURE, "Unexpected outcome: " + classification);
    }

    private void releaseLock(WorkflowExecution workflow) {
        try {
            lockManager.release(workflow.targetEntityId(), workflow.id());
        } catch (RuntimeException e) {
            log.warn("Failed to release lock on {} for workflow {}, it will go stale",
                workflow.targetEntityId().getValue(), workflow.id().getValue(), e);
        }
    }

    private void scheduleCleanup(WorkflowId workflowId) {
        Duration grace = resultStore.getConfig().cleanupGrace();
        if (grace.isZero()) {
            clearResults(workflowId);
            return;
        }
        try {
            cleanupScheduler.schedule(() -> clearResults(workflowId), grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Cleanup scheduler is shut down, clearing results of {} inline", workflowId.getValue());
            clearResults(workflowId);
        }
    }

    private void clearResults(WorkflowId workflowId) {
        try {
            int removed = resultStore.clearWorkflowResults(workflowId);
            log.debug("Cleared {} stage result(s) of workflow {}", removed, workflowId.getValue());
        } catch (RuntimeException e) {
            log.warn("Failed to clear stage results of workflow {}, TTL will expire them", workflowId.getValue(), e);
        }
    }

    private void logTransition(WorkflowExecution workflow) {
        List<StageTransitionRecord> transitions = workflow.transitions();
        StageTransitionRecord last = transitions.get(transitions.size() - 1);
        log.info("Workflow {} transition: stage={}, status={}, attempt={}, progress={}%, at={}, note={}",
            workflow.id().getValue(), last.stage(), last.status(), last.attempt(),
            last.progressPercent(), last.at(), last.note());
    }

    private void publishStatus(WorkflowExecution workflow, String message) {
        try {
            statusPublisher.publish(new StatusEvent(
                workflow.id(), workflow.currentStage(), workflow.progressPercent(),
                message, workflow.status(), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to publish status event for workflow {}", workflow.id().getValue(), e);
        }
    }
}
