package com.ryuqq.stageflow.core.error;

/**
 * 인프라 일시 장애 (저장소 연결 끊김, 풀 타임아웃 등).
 *
 * <p>재시도 래퍼가 재시도를 모두 소진한 경우에도 이 예외로 감싸서 던지며,
 * 비즈니스 실패와 구분됩니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class TransientInfrastructureException extends StageflowException {

    public TransientInfrastructureException(String message) {
        super(ErrorType.TRANSIENT_INFRASTRUCTURE, message);
    }

    public TransientInfrastructureException(String message, Throwable cause) {
        super(ErrorType.TRANSIENT_INFRASTRUCTURE, message, cause);
    }
}
