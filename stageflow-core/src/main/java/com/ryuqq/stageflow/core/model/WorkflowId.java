package com.ryuqq.stageflow.core.model;

import java.util.UUID;

/**
 * Workflow 실행의 전역 고유 식별자.
 *
 * <p>WorkflowId는 하나의 대상 엔티티에 대한 파이프라인 실행 전체(모든 Stage)를 추적하며,
 * Stage 결과 저장소의 네임스페이스 키와 엔티티 락의 소유자 식별자로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class WorkflowId {

    private final String value;

    private WorkflowId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkflowId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("WorkflowId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("WorkflowId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * WorkflowId 생성.
     *
     * @param value WorkflowId 값
     * @return WorkflowId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkflowId of(String value) {
        return new WorkflowId(value);
    }

    /**
     * 새 WorkflowId 생성 (wf_ 접두어 + UUID).
     *
     * @return 새 WorkflowId
     */
    public static WorkflowId generate() {
        return new WorkflowId("wf_" + UUID.randomUUID().toString().replace("-", ""));
    }

    /**
     * WorkflowId 값 조회.
     *
     * @return WorkflowId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowId that = (WorkflowId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowId{" + value + '}';
    }
}
