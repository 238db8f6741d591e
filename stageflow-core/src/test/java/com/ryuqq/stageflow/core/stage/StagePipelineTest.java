package com.ryuqq.stageflow.core.stage;

import com.ryuqq.stageflow.core.error.ValidationFailureException;
import com.ryuqq.stageflow.core.outcome.Ok;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StagePipeline 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class StagePipelineTest {

    private final StageHandler noop = context -> Ok.empty();

    private StagePipeline documentPipeline() {
        StagePipeline.Builder builder = StagePipeline.builder();
        for (DocumentStage stage : DocumentStage.values()) {
            builder.stage(stage, noop);
        }
        return builder.build();
    }

    // ========== 순서 ==========

    @Test
    void next_FollowsDeclarationOrder() {
        StagePipeline pipeline = documentPipeline();

        assertEquals(DocumentStage.AI_PARSING, pipeline.first().stage());
        assertEquals(DocumentStage.DATABASE_SAVE, pipeline.next("AI_PARSING").orElseThrow().stage());
        assertTrue(pipeline.next("STATUS_UPDATE").isEmpty());
        assertTrue(pipeline.isLast("STATUS_UPDATE"));
    }

    @Test
    void checkForward_SameOrLaterStage_Succeeds() {
        StagePipeline pipeline = documentPipeline();

        assertDoesNotThrow(() -> pipeline.checkForward("DATABASE_SAVE", "DATABASE_SAVE"));
        assertDoesNotThrow(() -> pipeline.checkForward("DATABASE_SAVE", "IMAGE_ATTACHMENT"));
    }

    @Test
    void checkForward_EarlierStage_ThrowsException() {
        StagePipeline pipeline = documentPipeline();

        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> pipeline.checkForward("IMAGE_ATTACHMENT", "AI_PARSING")
        );
        assertTrue(exception.getMessage().contains("Stage order violation"));
    }

    @Test
    void resolve_UnknownOrMissingStage_ThrowsValidationFailure() {
        StagePipeline pipeline = documentPipeline();

        assertThrows(ValidationFailureException.class, () -> pipeline.resolve("PAYMENT"));
        assertThrows(ValidationFailureException.class, () -> pipeline.resolve(null));
        assertThrows(ValidationFailureException.class, () -> pipeline.resolve(""));
    }

    @Test
    void build_DuplicateStage_ThrowsException() {
        StagePipeline.Builder builder = StagePipeline.builder().stage(DocumentStage.AI_PARSING, noop);

        assertThrows(IllegalArgumentException.class, () -> builder.stage(DocumentStage.AI_PARSING, noop));
        assertThrows(IllegalArgumentException.class, () -> StagePipeline.builder().build());
    }

    // ========== 진행률 ==========

    @Test
    void progressAfter_EqualWeights_SplitsEvenly() {
        StagePipeline pipeline = StagePipeline.builder()
            .stage(DocumentStage.AI_PARSING, noop)
            .stage(DocumentStage.DATABASE_SAVE, noop)
            .stage(DocumentStage.STATUS_UPDATE, noop)
            .stage(DocumentStage.TARGET_SYNC, noop)
            .build();

        assertEquals(25, pipeline.progressAfter("AI_PARSING"));
        assertEquals(50, pipeline.progressAfter("DATABASE_SAVE"));
        assertEquals(100, pipeline.progressAfter("TARGET_SYNC"));
    }

    @Test
    void progressAt_WeightedStageWithSubProgress_Interpolates() {
        // 가중치: AI_PARSING 3, DATABASE_SAVE 1 → 총 4
        StagePipeline pipeline = StagePipeline.builder()
            .stage(StageDefinition.of(DocumentStage.AI_PARSING, noop).withWeight(3))
            .stage(DocumentStage.DATABASE_SAVE, noop)
            .build();

        assertEquals(0, pipeline.progressAt("AI_PARSING", 0));
        assertEquals(37, pipeline.progressAt("AI_PARSING", 50));
        assertEquals(75, pipeline.progressAfter("AI_PARSING"));
        assertEquals(87, pipeline.progressAt("DATABASE_SAVE", 50));
    }

    @Test
    void definition_DefaultsFromDocumentStage() {
        StageDefinition definition = StageDefinition.of(DocumentStage.IMAGE_ATTACHMENT, noop);

        assertEquals("Processing images", definition.displayMessage());
        assertEquals(3, definition.effectiveMaxAttempts(3));
        assertEquals(5, definition.withMaxAttempts(5).effectiveMaxAttempts(3));
    }
}
