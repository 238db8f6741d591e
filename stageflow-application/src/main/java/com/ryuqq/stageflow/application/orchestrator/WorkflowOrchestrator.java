package com.ryuqq.stageflow.application.orchestrator;

import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.StageJob;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.outcome.Outcome;

/**
 * 다단계 Workflow 실행 조정자.
 *
 * <p>소스 문서 하나를 고정된 Stage 순서로 처리하여 동기화된 대상 레코드로 만드는 과정을
 * 조정합니다. 각 Stage는 독립적으로 재시도될 수 있으며, 결과는 Stage별로 누적됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowId workflowId = orchestrator.submit(EntityId.of("po-1001"), payload);
 *
 * // 워커 측 (QueueWorkerRunner)
 * Outcome outcome = orchestrator.execute(job);
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public interface WorkflowOrchestrator {

    /**
     * Workflow 제출.
     *
     * <p>같은 엔티티에 종료되지 않은 Workflow가 있으면 새로 만들지 않고
     * 기존 Workflow ID를 반환합니다 (멱등).</p>
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>PENDING 상태로 Workflow 저장 (엔티티당 활성 Workflow 1개를 저장소가 원자적으로 보장)</li>
     *   <li>전이 로그 기록, 상태 이벤트 발행</li>
     *   <li>첫 Stage Job 발행</li>
     *   <li>PROCESSING으로 전이</li>
     * </ol>
     *
     * @param entityId 대상 엔티티
     * @param payload 제출 Payload
     * @return Workflow ID (신규 또는 기존)
     * @throws IllegalArgumentException entityId가 null인 경우
     */
    WorkflowId submit(EntityId entityId, Payload payload);

    /**
     * Stage Job 실행 (워커 진입점).
     *
     * <p>저장된 Workflow 상태로 Job의 유효성을 확인하고, 엔티티 락을 획득한 뒤
     * 핸들러를 실행하여 결과에 따라 {@link #advance}나 {@link #fail}로 진행합니다.</p>
     *
     * @param job Stage Job
     * @return 처리 결과 ({@code Fail}이면 Workflow가 FAILED로 종료됨)
     */
    Outcome execute(StageJob job);

    /**
     * Stage 완료 처리.
     *
     * <p>락 보유를 검증하고, Stage 결과를 해당 네임스페이스에 기록한 뒤
     * 다음 Stage를 발행합니다. 마지막 Stage이면 COMPLETED로 전이하고 락을 해제합니다.</p>
     *
     * @param workflowId Workflow ID
     * @param stage 완료된 Stage 이름
     * @param stageOutput Stage 부분 결과
     * @throws com.ryuqq.stageflow.core.error.LockLostException 다른 Workflow가 락을 회수한 경우
     */
    void advance(WorkflowId workflowId, String stage, Payload stageOutput);

    /**
     * Stage 실패 처리.
     *
     * <p>재시도 가능하고 시도 횟수가 남아 있으면 백오프 후 같은 Stage를 재발행하고
     * PROCESSING을 유지합니다. 그 외에는 FAILED로 전이하고 락을 해제합니다.</p>
     *
     * @param workflowId Workflow ID
     * @param stage 실패한 Stage 이름
     * @param error 실패 원인
     * @return 재발행했으면 {@code Retry}, Workflow를 종료했으면 {@code Fail}
     */
    Outcome fail(WorkflowId workflowId, String stage, Throwable error);

    /**
     * Job이 가리키는 시도 하나를 실패 처리.
     *
     * <p>{@link #fail}과 같은 규칙으로 재시도/종료하지만, Workflow가 이미 그 Stage나 시도를
     * 지나갔으면 아무것도 하지 않습니다. 처리 시간 상한 초과나 재전달 한도 초과처럼
     * 워커 밖에서 시도를 끝내야 할 때 사용합니다.</p>
     *
     * @param job 실패한 시도의 Job
     * @param error 실패 원인
     * @return 재발행했으면 {@code Retry}, 종료했으면 {@code Fail}, 지난 시도였으면 {@code Ok.empty()}
     */
    Outcome failJob(StageJob job, Throwable error);
}
