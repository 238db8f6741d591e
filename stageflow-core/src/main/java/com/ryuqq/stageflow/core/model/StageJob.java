package com.ryuqq.stageflow.core.model;

import com.ryuqq.stageflow.core.stage.Stage;

import java.util.UUID;

/**
 * 단일 Stage 실행을 요청하는 큐 메시지.
 *
 * <p>StageJob은 일시적이며, Workflow 상태의 원본은 WorkflowStore에 있습니다.
 * 워커는 Job을 받으면 항상 저장된 Workflow 상태를 다시 읽어 유효성을 확인합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>jobId:</strong> 큐 임대(lease) 식별자. 재전달 시 유지, 재시도 발행 시 새로 생성</li>
 *   <li><strong>stage:</strong> 실행할 Stage 이름 (null/빈 값 불가, 큐 라우팅 키)</li>
 *   <li><strong>attempt:</strong> 해당 Stage의 시도 번호 (1부터)</li>
 *   <li><strong>deliveryCount:</strong> 같은 jobId의 전달 횟수 (임대 만료 후 재전달 시 증가)</li>
 *   <li><strong>enqueuedAt:</strong> 발행 시각 (epoch milliseconds)</li>
 * </ul>
 *
 * @param jobId Job 고유 식별자
 * @param workflowId 대상 Workflow ID
 * @param stage Stage 이름
 * @param attempt Stage 시도 번호
 * @param payload 제출 Payload
 * @param deliveryCount 전달 횟수
 * @param enqueuedAt 발행 시각 (epoch millis)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record StageJob(
    String jobId,
    WorkflowId workflowId,
    String stage,
    int attempt,
    Payload payload,
    int deliveryCount,
    long enqueuedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 범위를 벗어난 경우
     */
    public StageJob {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (deliveryCount < 0) {
            throw new IllegalArgumentException("deliveryCount must be non-negative (current: " + deliveryCount + ")");
        }
        if (enqueuedAt < 0) {
            throw new IllegalArgumentException("enqueuedAt must be non-negative (current: " + enqueuedAt + ")");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * 새 Stage Job 생성.
     *
     * @param workflowId Workflow ID
     * @param stage 실행할 Stage
     * @param attempt 시도 번호
     * @param payload 제출 Payload
     * @param enqueuedAt 발행 시각 (epoch millis)
     * @return 생성된 StageJob
     */
    public static StageJob of(WorkflowId workflowId, Stage stage, int attempt, Payload payload, long enqueuedAt) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return new StageJob(newJobId(), workflowId, stage.name(), attempt, payload, 0, enqueuedAt);
    }

    /**
     * 같은 Stage의 다음 시도 Job 생성 (새 jobId).
     *
     * @param enqueuedAt 발행 시각 (epoch millis)
     * @return 재시도 Job
     */
    public StageJob nextAttempt(long enqueuedAt) {
        return new StageJob(newJobId(), workflowId, stage, attempt + 1, payload, 0, enqueuedAt);
    }

    /**
     * 같은 Job의 재전달본 생성 (jobId 유지, deliveryCount 증가).
     *
     * @return 재전달 Job
     */
    public StageJob redelivered() {
        return new StageJob(jobId, workflowId, stage, attempt, payload, deliveryCount + 1, enqueuedAt);
    }

    private static String newJobId() {
        return "job_" + UUID.randomUUID().toString().replace("-", "");
    }
}
