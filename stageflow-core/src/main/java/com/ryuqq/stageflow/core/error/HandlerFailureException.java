package com.ryuqq.stageflow.core.error;

/**
 * Stage 핸들러 고유 실패.
 *
 * <p>재시도 가능 여부는 핸들러가 결정합니다. 예를 들어 외부 플랫폼의 429 응답은
 * {@code retryable(...)}, 잘못된 문서 형식은 {@code permanent(...)}로 던집니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class HandlerFailureException extends StageflowException {

    private HandlerFailureException(String message, boolean retryable, Throwable cause) {
        super(ErrorType.HANDLER_FAILURE, message, retryable, cause);
    }

    public static HandlerFailureException retryable(String message) {
        return new HandlerFailureException(message, true, null);
    }

    public static HandlerFailureException retryable(String message, Throwable cause) {
        return new HandlerFailureException(message, true, cause);
    }

    public static HandlerFailureException permanent(String message) {
        return new HandlerFailureException(message, false, null);
    }

    public static HandlerFailureException permanent(String message, Throwable cause) {
        return new HandlerFailureException(message, false, cause);
    }
}
