package com.ryuqq.stageflow.core.statemachine;

/**
 * Workflow 실행의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → PROCESSING (첫 Stage Job 발행)</li>
 *   <li>PENDING → FAILED (발행 전 정리)</li>
 *   <li>PROCESSING → PROCESSING (Stage 전진 또는 재시도)</li>
 *   <li>PROCESSING → COMPLETED (마지막 Stage 성공)</li>
 *   <li>PROCESSING → FAILED (재시도 불가 또는 재시도 소진)</li>
 *   <li><strong>종료 상태에서의 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ▼ (발행)
 * PROCESSING ──┐ (다음 Stage / 재시도)
 *    │    ▲────┘
 *    ├─► COMPLETED
 *    │
 *    └─► FAILED
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public enum WorkflowStatus {

    /**
     * 생성됨, 첫 Stage Job 발행 전.
     */
    PENDING,

    /**
     * Stage 실행 중 (재시도 대기 포함).
     */
    PROCESSING,

    /**
     * 모든 Stage 완료.
     */
    COMPLETED,

    /**
     * 실패 (영구).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
