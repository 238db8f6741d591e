package com.ryuqq.stageflow.application.lock;

/**
 * 락 획득 결과.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public enum LockAcquisition {

    /**
     * 보유자 없는 락을 새로 획득.
     */
    GRANTED,

    /**
     * 이미 같은 Workflow가 보유 중 (heartbeat 갱신).
     */
    REENTERED,

    /**
     * stale 락을 다른 Workflow로부터 회수.
     */
    RECLAIMED
}
