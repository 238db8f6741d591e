package com.ryuqq.stageflow.core.statemachine;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Workflow 상태 전이 규칙.
 *
 * <pre>
 * PENDING    → PROCESSING, FAILED
 * PROCESSING → PROCESSING (Stage 전진, 재시도), COMPLETED, FAILED
 * COMPLETED, FAILED → (없음)
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class StateTransition {

    private static final Map<WorkflowStatus, Set<WorkflowStatus>> ALLOWED = new EnumMap<>(WorkflowStatus.class);

    static {
        ALLOWED.put(WorkflowStatus.PENDING, EnumSet.of(WorkflowStatus.PROCESSING, WorkflowStatus.FAILED));
        ALLOWED.put(WorkflowStatus.PROCESSING,
            EnumSet.of(WorkflowStatus.PROCESSING, WorkflowStatus.COMPLETED, WorkflowStatus.FAILED));
        ALLOWED.put(WorkflowStatus.COMPLETED, EnumSet.noneOf(WorkflowStatus.class));
        ALLOWED.put(WorkflowStatus.FAILED, EnumSet.noneOf(WorkflowStatus.class));
    }

    private StateTransition() {
    }

    /**
     * @param from 현재 상태
     * @param to 다음 상태
     * @return 전이 허용 여부 (null이면 false)
     */
    public static boolean isAllowed(WorkflowStatus from, WorkflowStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    /**
     * 전이 검증.
     *
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 종료 상태에서 나가거나 허용되지 않은 전이인 경우
     */
    public static void validate(WorkflowStatus from, WorkflowStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException("Workflow is in terminal state " + from + ", cannot move to " + to);
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("Invalid state transition: " + from + " -> " + to);
        }
    }

    /**
     * 검증 후 다음 상태를 반환합니다.
     */
    public static WorkflowStatus transition(WorkflowStatus current, WorkflowStatus next) {
        validate(current, next);
        return next;
    }
}
