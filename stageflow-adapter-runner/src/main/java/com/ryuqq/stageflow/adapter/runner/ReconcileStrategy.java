package com.ryuqq.stageflow.adapter.runner;

/**
 * stuck Workflow 처리 방식.
 *
 * <p>핸들러가 멱등하면 RETRY, 외부 시스템에 부분 반영이 남을 수 있으면 FAIL을 고릅니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 현재 Stage Job을 같은 시도 번호로 재발행. 누적 결과와 락은 그대로 유지됩니다.
     * 큐에 원래 Job이 남아 있었다면 둘 중 먼저 처리된 쪽만 반영되고 나머지는 지난 Job으로 무시됩니다.
     */
    RETRY,

    /**
     * 재시도 불가 오류로 Workflow를 FAILED 처리. 락 해제와 누적 결과 정리가 함께 일어나며
     * 복구하려면 같은 엔티티로 다시 제출해야 합니다.
     */
    FAIL
}
