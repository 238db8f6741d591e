package com.ryuqq.stageflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowId / EntityId Value Object 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class WorkflowIdTest {

    @Test
    void of_ValidValue_CreatesWorkflowId() {
        WorkflowId workflowId = WorkflowId.of("wf-123_abc");

        assertEquals("wf-123_abc", workflowId.getValue());
        assertEquals(WorkflowId.of("wf-123_abc"), workflowId);
        assertEquals("WorkflowId{wf-123_abc}", workflowId.toString());
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // ':'는 저장소 키 구분자이므로 허용하지 않음
        assertThrows(IllegalArgumentException.class, () -> WorkflowId.of("wf:1"));
        assertThrows(IllegalArgumentException.class, () -> WorkflowId.of(" "));
        assertThrows(IllegalArgumentException.class, () -> WorkflowId.of(null));
    }

    @Test
    void generate_CreatesUniqueIds() {
        assertNotEquals(WorkflowId.generate(), WorkflowId.generate());
        assertTrue(WorkflowId.generate().getValue().startsWith("wf_"));
    }

    @Test
    void entityId_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityId.of(""));
        assertEquals(EntityId.of("po-1"), EntityId.of("po-1"));
    }
}
