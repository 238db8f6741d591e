package com.ryuqq.stageflow.core.error;

/**
 * Stage 실패 분류.
 *
 * <p>각 유형은 기본 재시도 가능 여부를 가지며, 오케스트레이터는 이 값으로
 * 같은 Stage를 재발행할지 Workflow를 FAILED로 종료할지 결정합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public enum ErrorType {

    /**
     * 연결 끊김, 타임아웃 등 인프라 일시 장애.
     */
    TRANSIENT_INFRASTRUCTURE(true),

    /**
     * 자연 키 유일성 위반 (해소 가능).
     */
    NATURAL_KEY_CONFLICT(true),

    /**
     * 재시도 한도 내에 해소되지 않은 충돌.
     */
    PERSISTENT_CONFLICT(false),

    /**
     * 입력 또는 Job 유효성 위반.
     */
    VALIDATION_FAILURE(false),

    /**
     * Stage 핸들러 고유 실패. 재시도 여부는 핸들러가 결정합니다.
     */
    HANDLER_FAILURE(false),

    /**
     * 엔티티 락 획득 시간 초과.
     */
    LOCK_TIMEOUT(true),

    /**
     * 보유하던 엔티티 락을 다른 Workflow가 회수함.
     */
    LOCK_LOST(false);

    private final boolean retryableByDefault;

    ErrorType(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    /**
     * 기본 재시도 가능 여부.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
