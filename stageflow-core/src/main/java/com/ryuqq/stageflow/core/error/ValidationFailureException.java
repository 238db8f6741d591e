package com.ryuqq.stageflow.core.error;

/**
 * 입력 또는 Stage Job 유효성 위반 (재시도 불가).
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class ValidationFailureException extends StageflowException {

    public ValidationFailureException(String message) {
        super(ErrorType.VALIDATION_FAILURE, message);
    }
}
