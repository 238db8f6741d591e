package com.ryuqq.stageflow.core.error;

/**
 * 재시도 한도 내에 해소되지 않은 자연 키 충돌 (재시도 불가).
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class PersistentConflictException extends StageflowException {

    public PersistentConflictException(String message, Throwable cause) {
        super(ErrorType.PERSISTENT_CONFLICT, message, cause);
    }
}
