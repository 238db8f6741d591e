package com.ryuqq.stageflow.application.orchestrator;

import com.ryuqq.stageflow.core.model.WorkflowExecution;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 인라인 실행 결과 핸들.
 *
 * <p>시간 예산 안에서 Stage를 직접 실행한 결과를 표현합니다.</p>
 *
 * <ul>
 *   <li><strong>finished:</strong> 예산 안에 Workflow가 COMPLETED 또는 FAILED로 끝남.
 *       {@link #getWorkflow()}가 최종 상태입니다.</li>
 *   <li><strong>handedOff:</strong> 예산이 부족하거나 실행할 Job을 가져올 수 없어 남은 Stage를
 *       큐 워커에게 넘김. 호출자는 Workflow ID로 진행 상황을 조회합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowHandle handle = inlineRunner.submit(entityId, payload);
 * if (handle.isFinished()) {
 *     // 200 OK + 최종 상태
 * } else {
 *     // 202 Accepted + /workflows/{id}
 * }
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class WorkflowHandle {

    private final WorkflowExecution workflow;
    private final boolean finished;
    private final Map<String, Duration> stageTimings;
    private final Duration elapsed;

    private WorkflowHandle(WorkflowExecution workflow, boolean finished, Map<String, Duration> stageTimings,
                           Duration elapsed) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (stageTimings == null) {
            throw new IllegalArgumentException("stageTimings cannot be null");
        }
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed cannot be null or negative (current: " + elapsed + ")");
        }
        this.workflow = workflow;
        this.finished = finished;
        this.stageTimings = Collections.unmodifiableMap(new LinkedHashMap<>(stageTimings));
        this.elapsed = elapsed;
    }

    /**
     * 종료된 Workflow의 핸들 생성.
     *
     * @param workflow 종료 상태의 Workflow
     * @param stageTimings 이번 호출에서 실행한 Stage별 소요 시간 (실행 순서)
     * @param elapsed 전체 소요 시간
     * @return 핸들 (finished=true)
     * @throws IllegalArgumentException workflow가 종료 상태가 아닌 경우
     */
    public static WorkflowHandle finished(WorkflowExecution workflow, Map<String, Duration> stageTimings,
                                          Duration elapsed) {
        if (workflow != null && !workflow.isTerminal()) {
            throw new IllegalArgumentException(
                "workflow must be terminal for a finished handle (current: " + workflow.status() + ")");
        }
        return new WorkflowHandle(workflow, true, stageTimings, elapsed);
    }

    /**
     * 큐 워커에게 넘긴 Workflow의 핸들 생성.
     *
     * @param workflow 넘긴 시점의 Workflow
     * @param stageTimings 이번 호출에서 실행한 Stage별 소요 시간 (실행 순서)
     * @param elapsed 전체 소요 시간
     * @return 핸들 (finished=false)
     */
    public static WorkflowHandle handedOff(WorkflowExecution workflow, Map<String, Duration> stageTimings,
                                           Duration elapsed) {
        return new WorkflowHandle(workflow, false, stageTimings, elapsed);
    }

    public WorkflowExecution getWorkflow() {
        return workflow;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * @return 이번 호출에서 실행한 Stage별 누적 소요 시간 (실행 순서, 재시도 포함)
     */
    public Map<String, Duration> getStageTimings() {
        return stageTimings;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "WorkflowHandle{workflowId=" + workflow.id().getValue()
            + ", finished=" + finished
            + ", status=" + workflow.status()
            + ", stage=" + workflow.currentStage()
            + ", stagesRun=" + stageTimings.keySet()
            + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
