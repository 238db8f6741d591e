/**
 * Stage contract package.
 *
 * <p>Defines what a pipeline is made of. Stages are a closed set (an enum implementing
 * {@link com.ryuqq.stageflow.core.stage.Stage}); the handler table is assembled once into a
 * {@link com.ryuqq.stageflow.core.stage.StagePipeline} and resolved by name when a job arrives.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageflow.core.stage.StageHandler} - Business logic of one stage</li>
 *   <li>{@link com.ryuqq.stageflow.core.stage.StageContext} - Submission payload, accumulated results, progress callback</li>
 *   <li>{@link com.ryuqq.stageflow.core.stage.StageDefinition} - Handler plus weight, attempt budget and display message</li>
 *   <li>{@link com.ryuqq.stageflow.core.stage.DocumentStage} - Standard document-to-record stage order</li>
 * </ul>
 *
 * <h2>Stage Order</h2>
 * <pre>
 * s1 → s2 → ... → sN
 *
 * Allowed: same stage (retry), next stage (advance)
 * Forbidden: any earlier stage
 * </pre>
 *
 * @since 1.0.0
 * @author Stageflow Team
 */
package com.ryuqq.stageflow.core.stage;
