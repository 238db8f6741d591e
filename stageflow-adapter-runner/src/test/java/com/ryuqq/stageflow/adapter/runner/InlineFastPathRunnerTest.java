package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.adapter.inmemory.event.InMemoryStatusPublisher;
import com.ryuqq.stageflow.adapter.inmemory.kv.InMemoryKeyValueStore;
import com.ryuqq.stageflow.adapter.inmemory.queue.InMemoryJobQueue;
import com.ryuqq.stageflow.adapter.inmemory.store.InMemoryWorkflowStore;
import com.ryuqq.stageflow.application.accumulator.StageResultStore;
import com.ryuqq.stageflow.application.accumulator.StageResultStoreConfig;
import com.ryuqq.stageflow.application.lock.EntityLockManager;
import com.ryuqq.stageflow.application.lock.LockConfig;
import com.ryuqq.stageflow.application.orchestrator.WorkflowHandle;
import com.ryuqq.stageflow.application.query.WorkflowQueryService;
import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import com.ryuqq.stageflow.core.error.WorkflowNotFoundException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Ok;
import com.ryuqq.stageflow.core.stage.StageHandler;
import com.ryuqq.stageflow.core.stage.StagePipeline;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;
import com.ryuqq.stageflow.testkit.support.MutableClock;
import com.ryuqq.stageflow.testkit.support.ScriptedStageHandler;
import com.ryuqq.stageflow.testkit.support.TestStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InlineFastPathRunner 테스트.
 *
 * <p>인메모리 어댑터 위에서 시간 예산 안의 직접 실행과 큐 워커로의 인계를 검증합니다.
 * 예산은 핸들러 안에서 {@link MutableClock}을 움직여 소모합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class InlineFastPathRunnerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final EntityId E1 = EntityId.of("po-1001");
    private static final Duration BUDGET = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryKeyValueStore kv;
    private InMemoryWorkflowStore workflowStore;
    private InMemoryJobQueue queue;
    private StageResultStore resultStore;
    private EntityLockManager lockManager;
    private StagePipeline pipeline;
    private StagePipelineOrchestrator orchestrator;
    private InlineFastPathRunner runner;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(T0);
        kv = new InMemoryKeyValueStore(clock);
        workflowStore = new InMemoryWorkflowStore();
        queue = new InMemoryJobQueue();
        resultStore = new StageResultStore(() -> kv,
            new StageResultStoreConfig().withCleanupGrace(Duration.ZERO), clock);
        lockManager = new EntityLockManager(() -> kv, new LockConfig()
            .withAcquireTimeout(Duration.ofMillis(50))
            .withPollInterval(Duration.ofMillis(5)), clock);
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    @Test
    void 예산_안에_모든_Stage를_마치면_finished_핸들과_Stage별_소요_시간_반환() {
        // given
        StageHandler s2 = context -> {
            clock.advance(Duration.ofSeconds(5));
            return Ok.of(Map.of("draftId", "d-1"));
        };
        usePipeline(ScriptedStageHandler.alwaysOk(Map.of("ok", true)), s2, ScriptedStageHandler.alwaysOk(Map.of()));

        // when
        WorkflowHandle handle = runner.submit(E1, Payload.empty(), BUDGET);

        // then
        assertThat(handle.isFinished()).isTrue();
        assertThat(handle.getWorkflow().status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(handle.getStageTimings()).containsOnlyKeys("S1", "S2", "S3");
        assertThat(handle.getStageTimings().keySet()).containsExactly("S1", "S2", "S3");
        assertThat(handle.getStageTimings().get("S2")).isEqualTo(Duration.ofSeconds(5));
        assertThat(handle.getElapsed()).isEqualTo(Duration.ofSeconds(5));
        assertThat(queue.queueSize()).isZero();
        assertThat(lockManager.currentHolder(E1)).isEmpty();
    }

    @Test
    void 남은_예산이_정지_여유_이하가_되면_남은_Stage를_큐에_남기고_인계() {
        // given
        StageHandler slowParse = context -> {
            clock.advance(Duration.ofSeconds(40));
            return Ok.of(Map.of("parsedTitle", "Spring Jacket"));
        };
        ScriptedStageHandler s2 = ScriptedStageHandler.alwaysOk(Map.of());
        usePipeline(slowParse, s2, ScriptedStageHandler.alwaysOk(Map.of()));

        // when
        WorkflowHandle handle = runner.submit(E1, Payload.empty(), BUDGET);

        // then
        assertThat(handle.isFinished()).isFalse();
        assertThat(handle.getWorkflow().status()).isEqualTo(WorkflowStatus.PROCESSING);
        assertThat(handle.getWorkflow().currentStage()).isEqualTo("S2");
        assertThat(handle.getStageTimings().keySet()).containsExactly("S1");
        assertThat(s2.invocationCount()).isZero();
        assertThat(queue.queueSize("S2")).isEqualTo(1);
    }

    @Test
    void 인계된_Workflow는_resume으로_이어서_완료() {
        // given
        StageHandler slowParse = context -> {
            clock.advance(Duration.ofSeconds(40));
            return Ok.of(Map.of("parsedTitle", "Spring Jacket"));
        };
        ScriptedStageHandler s3 = ScriptedStageHandler.alwaysOk(Map.of("ok", true));
        usePipeline(slowParse, ScriptedStageHandler.alwaysOk(Map.of()), s3);
        WorkflowId workflowId = runner.submit(E1, Payload.empty(), BUDGET).getWorkflow().id();

        // when
        WorkflowHandle resumed = runner.resume(workflowId, BUDGET);

        // then
        assertThat(resumed.isFinished()).isTrue();
        assertThat(resumed.getWorkflow().status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(resumed.getStageTimings().keySet()).containsExactly("S2", "S3");
        assertThat(s3.invocations().get(0).accumulated().get("parsedTitle")).contains("Spring Jacket");
    }

    @Test
    void 백오프_중인_재시도는_지연이_지난_뒤_인라인으로_다시_실행() {
        // given
        ScriptedStageHandler s2 = ScriptedStageHandler.builder()
            .thenThrow(new TransientInfrastructureException("Connection reset"))
            .thenReturn(Ok.of(Map.of("ok", true)))
            .build();
        usePipeline(ScriptedStageHandler.alwaysOk(Map.of()), s2, ScriptedStageHandler.alwaysOk(Map.of()));

        // when
        WorkflowHandle handle = runner.submit(E1, Payload.empty(), BUDGET);

        // then
        assertThat(handle.isFinished()).isTrue();
        assertThat(handle.getWorkflow().status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(s2.invocationCount()).isEqualTo(2);
        assertThat(s2.invocations().get(1).attempt()).isEqualTo(2);
    }

    @Test
    void 재시도_불가_실패는_FAILED로_끝난_finished_핸들과_DLQ_이동() {
        // given
        ScriptedStageHandler s1 = ScriptedStageHandler.builder()
            .thenThrow(new IllegalArgumentException("Unsupported document layout"))
            .build();
        usePipeline(s1, ScriptedStageHandler.alwaysOk(Map.of()), ScriptedStageHandler.alwaysOk(Map.of()));

        // when
        WorkflowHandle handle = runner.submit(E1, Payload.empty(), BUDGET);

        // then
        assertThat(handle.isFinished()).isTrue();
        assertThat(handle.getWorkflow().status()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(handle.getWorkflow().errorDetail().errorType()).isEqualTo(ErrorType.HANDLER_FAILURE);
        assertThat(queue.deadLetterSize()).isEqualTo(1);
    }

    @Test
    void 정지_여유_이하의_예산은_거부() {
        // given
        usePipeline(ScriptedStageHandler.alwaysOk(Map.of()), ScriptedStageHandler.alwaysOk(Map.of()),
            ScriptedStageHandler.alwaysOk(Map.of()));

        // when / then
        assertThatThrownBy(() -> runner.submit(E1, Payload.empty(), Duration.ofSeconds(30)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("stopMargin");
        assertThat(workflowStore.size()).isZero();
    }

    @Test
    void 없는_Workflow의_resume은_WorkflowNotFoundException() {
        // given
        usePipeline(ScriptedStageHandler.alwaysOk(Map.of()), ScriptedStageHandler.alwaysOk(Map.of()),
            ScriptedStageHandler.alwaysOk(Map.of()));

        // when / then
        assertThatThrownBy(() -> runner.resume(WorkflowId.of("wf-missing"), BUDGET))
            .isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void 설정은_예산이_정지_여유보다_길어야_함() {
        assertThatThrownBy(() -> new InlineRunnerConfig().withStopMargin(Duration.ofSeconds(270)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InlineRunnerConfig().withPollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new InlineRunnerConfig().timeBudget()).isEqualTo(Duration.ofSeconds(270));
    }

    private void usePipeline(StageHandler s1, StageHandler s2, StageHandler s3) {
        pipeline = StagePipeline.builder()
            .stage(TestStage.S1, s1)
            .stage(TestStage.S2, s2)
            .stage(TestStage.S3, s3)
            .build();
        orchestrator = new StagePipelineOrchestrator(pipeline, workflowStore, queue, resultStore, lockManager,
            new InMemoryStatusPublisher(), new OrchestratorConfig().withRetryBaseDelayMs(1).withRetryMaxDelayMs(5),
            clock);
        runner = new InlineFastPathRunner(orchestrator, new WorkflowQueryService(workflowStore, clock), queue,
            new InlineRunnerConfig().withPollIntervalMs(2), clock);
    }
}
