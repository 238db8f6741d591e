package com.ryuqq.stageflow.adapter.runner;

import com.ryuqq.stageflow.application.resilience.TransientErrorClassifier;
import com.ryuqq.stageflow.core.error.ErrorType;
import com.ryuqq.stageflow.core.error.StageflowException;
import com.ryuqq.stageflow.core.outcome.Fail;
import com.ryuqq.stageflow.core.outcome.Outcome;
import com.ryuqq.stageflow.core.outcome.Retry;
import com.ryuqq.stageflow.core.stage.StageHandler;

/**
 * Stage 실패 원인을 {@code Retry} 또는 {@code Fail}로 분류.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>{@link StageflowException}: 예외가 가진 ErrorType과 재시도 플래그</li>
 *   <li>핸들러의 {@link StageHandler#isRetryable(Throwable)}이 true: Retry(HANDLER_FAILURE)</li>
 *   <li>연결 장애 시그니처와 일치: Retry(TRANSIENT_INFRASTRUCTURE)</li>
 *   <li>그 외: Fail(HANDLER_FAILURE)</li>
 * </ol>
 *
 * <p>분류 결과는 "재시도할 가치가 있는지"만 말하며, 남은 시도 횟수는
 * 오케스트레이터가 판단합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class StageFailureClassifier {

    private final TransientErrorClassifier transientErrorClassifier;

    /**
     * 기본 연결 장애 시그니처로 생성.
     */
    public StageFailureClassifier() {
        this(new TransientErrorClassifier());
    }

    /**
     * 생성자.
     *
     * @param transientErrorClassifier 연결 장애 분류기
     * @throws IllegalArgumentException transientErrorClassifier가 null인 경우
     */
    public StageFailureClassifier(TransientErrorClassifier transientErrorClassifier) {
        if (transientErrorClassifier == null) {
            throw new IllegalArgumentException("transientErrorClassifier cannot be null");
        }
        this.transientErrorClassifier = transientErrorClassifier;
    }

    /**
     * 실패 원인 분류.
     *
     * @param error 실패 원인
     * @param handler 실패한 Stage의 핸들러 (없으면 null)
     * @return {@code Retry} 또는 {@code Fail}
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Outcome classify(Throwable error, StageHandler handler) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        String message = describe(error);

        if (error instanceof StageflowException stageflowException) {
            ErrorType type = stageflowException.getErrorType();
            return stageflowException.isRetryable()
                ? Retry.of(type, message)
                : Fail.of(type, message, causeOf(error));
        }
        if (handler != null && handler.isRetryable(error)) {
            return Retry.of(ErrorType.HANDLER_FAILURE, message);
        }
        if (transientErrorClassifier.isTransient(error)) {
            return Retry.of(ErrorType.TRANSIENT_INFRASTRUCTURE, message);
        }
        return Fail.of(ErrorType.HANDLER_FAILURE, message, causeOf(error));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static String causeOf(Throwable error) {
        Throwable cause = error.getCause();
        return cause == null ? error.getClass().getName() : cause.toString();
    }
}
