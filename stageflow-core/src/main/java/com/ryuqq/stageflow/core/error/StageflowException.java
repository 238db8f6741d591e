package com.ryuqq.stageflow.core.error;

/**
 * 모든 도메인 예외의 최상위 타입.
 *
 * <p>{@link ErrorType}과 재시도 가능 여부를 함께 전달하여
 * 오케스트레이터가 예외를 Retry/Fail로 분류할 수 있게 합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class StageflowException extends RuntimeException {

    private final ErrorType errorType;
    private final boolean retryable;

    public StageflowException(ErrorType errorType, String message) {
        this(errorType, message, errorType == null || errorType.isRetryableByDefault(), null);
    }

    public StageflowException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, errorType == null || errorType.isRetryableByDefault(), cause);
    }

    protected StageflowException(ErrorType errorType, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        this.errorType = errorType;
        this.retryable = retryable;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
