package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.error.HandlerFailureException;
import com.ryuqq.stageflow.core.error.LockTimeoutException;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import com.ryuqq.stageflow.core.error.ValidationFailureException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.outcome.Outcome;
import com.ryuqq.stageflow.core.outcome.Retry;
import com.ryuqq.stageflow.testkit.support.ScriptedStageHandler;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StageFailureClassifier 유닛 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class StageFailureClassifierTest {

    private final StageFailureClassifier classifier = new StageFailureClassifier();

    @Test
    void 재시도_가능한_Stageflow_예외는_Retry로_분류() {
        // when
        Outcome outcome = classifier.classify(new TransientInfrastructureException("Connection reset"), null);

        // then
        assertThat(outcome).isEqualTo(Retry.of(ErrorType.TRANSIENT_INFRASTRUCTURE, "Connection reset"));
    }

    @Test
    void 락_대기_시간_초과는_Retry로_분류() {
        // when
        Outcome outcome = classifier.classify(
            new LockTimeoutException(EntityId.of("po-1"), WorkflowId.of("wf-holder"), 10_000), null);

        // then
        assertThat(outcome).isInstanceOf(Retry.class);
        assertThat(((Retry) outcome).errorType()).isEqualTo(ErrorType.LOCK_TIMEOUT);
    }

    @Test
    void 검증_실패는_핸들러_판단과_무관하게_Fail로_분류() {
        // given
        ScriptedStageHandler handler = ScriptedStageHandler.builder()
            .retryableWhen(error -> true)
            .build();

        // when
        Outcome outcome = classifier.classify(new ValidationFailureException("Unknown stage: S9"), handler);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail fail = (Fail) outcome;
        assertThat(fail.errorType()).isEqualTo(ErrorType.VALIDATION_FAILURE);
        assertThat(fail.message()).isEqualTo("Unknown stage: S9");
    }

    @Test
    void 영구_핸들러_실패는_Fail로_분류() {
        // when
        Outcome outcome = classifier.classify(HandlerFailureException.permanent("Malformed document"), null);

        // then
        assertThat(outcome.isFail()).isTrue();
        assertThat(((Fail) outcome).errorType()).isEqualTo(ErrorType.HANDLER_FAILURE);
    }

    @Test
    void 핸들러가_재시도_가능하다고_판단한_일반_예외는_Retry로_분류() {
        // given
        ScriptedStageHandler handler = ScriptedStageHandler.builder()
            .retryableWhen(error -> error instanceof IllegalStateException)
            .build();

        // when
        Outcome outcome = classifier.classify(new IllegalStateException("rate limited"), handler);

        // then
        assertThat(outcome).isEqualTo(Retry.of(ErrorType.HANDLER_FAILURE, "rate limited"));
    }

    @Test
    void 연결_장애_메시지를_가진_일반_예외는_일시_장애로_분류() {
        // when
        Outcome outcome = classifier.classify(
            new RuntimeException("Can't reach database server at db:5432"), ScriptedStageHandler.alwaysOk(Map.of()));

        // then
        assertThat(outcome).isInstanceOf(Retry.class);
        assertThat(((Retry) outcome).errorType()).isEqualTo(ErrorType.TRANSIENT_INFRASTRUCTURE);
    }

    @Test
    void 그_외_예외는_Fail이고_원인과_클래스명을_남김() {
        // when
        Outcome outcome = classifier.classify(
            new IllegalArgumentException("bad layout", new NumberFormatException("x")), null);

        // then
        Fail fail = (Fail) outcome;
        assertThat(fail.errorType()).isEqualTo(ErrorType.HANDLER_FAILURE);
        assertThat(fail.message()).isEqualTo("bad layout");
        assertThat(fail.cause()).contains("NumberFormatException");
    }

    @Test
    void 메시지가_없는_예외는_클래스_이름을_메시지로_사용() {
        // when
        Outcome outcome = classifier.classify(new NullPointerException(), null);

        // then
        assertThat(((Fail) outcome).message()).isEqualTo("NullPointerException");
        assertThat(((Fail) outcome).cause()).isEqualTo("java.lang.NullPointerException");
    }

    @Test
    void null_오류는_거부() {
        // when / then
        assertThatThrownBy(() -> classifier.classify(null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
