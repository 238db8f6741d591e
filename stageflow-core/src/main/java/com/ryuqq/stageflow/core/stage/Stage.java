package com.ryuqq.stageflow.core.stage;

/**
 * 파이프라인을 구성하는 단일 Stage의 식별 계약.
 *
 * <p>Stage는 닫힌 집합(enum)으로 구현되는 것을 전제로 합니다.
 * {@link #name()}은 Stage 결과 저장소의 네임스페이스와 큐 라우팅 키로 사용되므로
 * 파이프라인 내에서 고유해야 합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>{@code
 * public enum InvoiceStage implements Stage {
 *     EXTRACT, PERSIST, PUBLISH
 * }
 * }</pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 * @see DocumentStage
 * @see StagePipeline
 */
public interface Stage {

    /**
     * Stage 이름.
     *
     * @return 파이프라인 내 고유한 Stage 이름
     */
    String name();
}
