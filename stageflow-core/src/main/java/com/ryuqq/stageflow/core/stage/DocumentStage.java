package com.ryuqq.stageflow.core.stage;

/**
 * 문서 → 동기화된 대상 레코드 변환 파이프라인의 표준 Stage 순서.
 *
 * <p>선언 순서가 곧 실행 순서입니다.</p>
 * <ol>
 *   <li>AI_PARSING: 업로드 문서에서 구조화된 데이터 추출</li>
 *   <li>DATABASE_SAVE: 대상 엔티티 생성/갱신 (자연 키 충돌 처리)</li>
 *   <li>PRODUCT_DRAFT_CREATION: 라인 아이템 기반 상품 초안 생성</li>
 *   <li>IMAGE_ATTACHMENT: 상품 이미지 연결</li>
 *   <li>TARGET_SYNC: 외부 플랫폼 동기화</li>
 *   <li>STATUS_UPDATE: 최종 상태 확정</li>
 * </ol>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public enum DocumentStage implements Stage {

    AI_PARSING("Parsing document with AI"),
    DATABASE_SAVE("Saving to database"),
    PRODUCT_DRAFT_CREATION("Creating product drafts"),
    IMAGE_ATTACHMENT("Processing images"),
    TARGET_SYNC("Syncing to target platform"),
    STATUS_UPDATE("Finalizing");

    private final String displayMessage;

    DocumentStage(String displayMessage) {
        this.displayMessage = displayMessage;
    }

    /**
     * 상태 이벤트에 표시할 기본 메시지.
     *
     * @return 표시 메시지
     */
    public String displayMessage() {
        return displayMessage;
    }
}
