package com.ryuqq.stageflow.core.model;

import com.ryuqq.stageflow.core.statemachine.StateTransition;
import com.ryuqq.stageflow.core.statemachine.WorkflowStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 하나의 대상 엔티티에 대한 파이프라인 실행 상태.
 *
 * <p>WorkflowExecution은 불변 값이며, 모든 변경 메서드는 {@code version}이 1 증가한
 * 새 인스턴스를 반환합니다. WorkflowStore는 이 version으로 낙관적 동시성을 검사합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>상태 전이는 {@link StateTransition} 규칙을 따름</li>
 *   <li>진행률은 0~100이며 감소하지 않음</li>
 *   <li>모든 전이는 {@code transitions}에 추가 기록됨 (삭제 없음)</li>
 * </ul>
 *
 * @param id Workflow ID
 * @param targetEntityId 대상 엔티티 ID
 * @param ownerId 대상 엔티티 소유자 (선택, null 가능)
 * @param currentStage 현재 Stage 이름
 * @param status 상태
 * @param progressPercent 진행률 (0~100)
 * @param stageAttempt 현재 Stage 시도 번호
 * @param payload 제출 Payload
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 * @param completedAt 종료 시각 (종료 전 null)
 * @param errorDetail 마지막 실패 상세 (없으면 null)
 * @param transitions 전이 로그
 * @param version 낙관적 동시성 버전
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record WorkflowExecution(
    WorkflowId id,
    EntityId targetEntityId,
    String ownerId,
    String currentStage,
    WorkflowStatus status,
    int progressPercent,
    int stageAttempt,
    Payload payload,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    ErrorDetail errorDetail,
    List<StageTransitionRecord> transitions,
    long version
) {

    /**
     * 제출 Payload에서 소유자를 읽는 키.
     */
    public static final String OWNER_ID_KEY = "ownerId";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 범위를 벗어난 경우
     */
    public WorkflowExecution {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (targetEntityId == null) {
            throw new IllegalArgumentException("targetEntityId cannot be null");
        }
        if (currentStage == null || currentStage.isBlank()) {
            throw new IllegalArgumentException("currentStage cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("progressPercent must be between 0 and 100 (current: " + progressPercent + ")");
        }
        if (stageAttempt < 1) {
            throw new IllegalArgumentException("stageAttempt must be positive (current: " + stageAttempt + ")");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        payload = payload == null ? Payload.empty() : payload;
        transitions = transitions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    /**
     * 새 Workflow 생성 (PENDING, 첫 Stage, 진행률 0).
     *
     * @param id Workflow ID
     * @param targetEntityId 대상 엔티티 ID
     * @param firstStage 첫 Stage 이름
     * @param payload 제출 Payload
     * @param now 현재 시각
     * @return 생성된 WorkflowExecution
     */
    public static WorkflowExecution create(WorkflowId id, EntityId targetEntityId, String firstStage,
                                           Payload payload, Instant now) {
        Payload safePayload = payload == null ? Payload.empty() : payload;
        StageTransitionRecord created = new StageTransitionRecord(
            firstStage, WorkflowStatus.PENDING, 1, 0, now, "submitted");
        return new WorkflowExecution(
            id, targetEntityId, safePayload.getString(OWNER_ID_KEY), firstStage,
            WorkflowStatus.PENDING, 0, 1, safePayload,
            now, now, null, null, List.of(created), 0L
        );
    }

    /**
     * 첫 Stage Job 발행 후 PROCESSING으로 전이.
     *
     * @param now 현재 시각
     * @return 전이된 WorkflowExecution
     */
    public WorkflowExecution markProcessing(Instant now) {
        WorkflowStatus next = StateTransition.transition(status, WorkflowStatus.PROCESSING);
        return copy(currentStage, next, progressPercent, stageAttempt, now, null, errorDetail,
            new StageTransitionRecord(currentStage, next, stageAttempt, progressPercent, now, "enqueued"));
    }

    /**
     * 다음 Stage로 전진.
     *
     * @param nextStage 다음 Stage 이름
     * @param newProgress 전진 후 진행률
     * @param now 현재 시각
     * @param note 전이 사유
     * @return 전이된 WorkflowExecution
     */
    public WorkflowExecution advanceTo(String nextStage, int newProgress, Instant now, String note) {
        WorkflowStatus next = StateTransition.transition(status, WorkflowStatus.PROCESSING);
        int progress = Math.max(progressPercent, newProgress);
        return copy(nextStage, next, progress, 1, now, null, null,
            new StageTransitionRecord(nextStage, next, 1, progress, now, note));
    }

    /**
     * 같은 Stage 재시도 기록 (PROCESSING 유지).
     *
     * @param error 실패 상세
     * @param now 현재 시각
     * @return 시도 번호가 증가한 WorkflowExecution
     */
    public WorkflowExecution retrying(ErrorDetail error, Instant now) {
        WorkflowStatus next = StateTransition.transition(status, WorkflowStatus.PROCESSING);
        int nextAttempt = stageAttempt + 1;
        return copy(currentStage, next, progressPercent, nextAttempt, now, null, error,
            new StageTransitionRecord(currentStage, next, nextAttempt, progressPercent, now,
                "retry: " + error.message()));
    }

    /**
     * Stage 내부 진행률 갱신 (전이 로그에는 기록하지 않음).
     *
     * @param newProgress 새 진행률 (현재보다 작으면 무시)
     * @param now 현재 시각
     * @return 갱신된 WorkflowExecution
     */
    public WorkflowExecution withProgress(int newProgress, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot update progress of terminal workflow: " + id);
        }
        if (newProgress <= progressPercent) {
            return this;
        }
        return new WorkflowExecution(id, targetEntityId, ownerId, currentStage, status, newProgress, stageAttempt,
            payload, createdAt, now, completedAt, errorDetail, transitions, version + 1);
    }

    /**
     * 완료 처리 (진행률 100).
     *
     * @param now 현재 시각
     * @return COMPLETED 상태의 WorkflowExecution
     */
    public WorkflowExecution complete(Instant now) {
        WorkflowStatus next = StateTransition.transition(status, WorkflowStatus.COMPLETED);
        return copy(currentStage, next, 100, stageAttempt, now, now, null,
            new StageTransitionRecord(currentStage, next, stageAttempt, 100, now, "completed"));
    }

    /**
     * 실패 처리.
     *
     * @param error 실패 상세
     * @param now 현재 시각
     * @return FAILED 상태의 WorkflowExecution
     */
    public WorkflowExecution fail(ErrorDetail error, Instant now) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        WorkflowStatus next = StateTransition.transition(status, WorkflowStatus.FAILED);
        return copy(currentStage, next, progressPercent, stageAttempt, now, now, error,
            new StageTransitionRecord(currentStage, next, stageAttempt, progressPercent, now,
                "failed: " + error.message()));
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    private WorkflowExecution copy(String stage, WorkflowStatus newStatus, int progress, int attempt,
                                   Instant now, Instant completed, ErrorDetail error,
                                   StageTransitionRecord record) {
        List<StageTransitionRecord> log = new ArrayList<>(transitions);
        log.add(record);
        return new WorkflowExecution(id, targetEntityId, ownerId, stage, newStatus, progress, attempt,
            payload, createdAt, now, completed, error, log, version + 1);
    }
}
