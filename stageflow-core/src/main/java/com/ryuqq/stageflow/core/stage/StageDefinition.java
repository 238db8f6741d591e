package com.ryuqq.stageflow.core.stage;

/**
 * 파이프라인 내 Stage 하나의 정의.
 *
 * @param stage Stage
 * @param handler 핸들러
 * @param weight 진행률 가중치 (1 이상)
 * @param maxAttempts Stage 전용 최대 시도 횟수 (0이면 오케스트레이터 기본값)
 * @param displayMessage 상태 이벤트 표시 메시지
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record StageDefinition(
    Stage stage,
    StageHandler handler,
    int weight,
    int maxAttempts,
    String displayMessage
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public StageDefinition {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (weight < 1) {
            throw new IllegalArgumentException("weight must be positive (current: " + weight + ")");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative (current: " + maxAttempts + ")");
        }
        if (displayMessage == null || displayMessage.isBlank()) {
            displayMessage = defaultMessage(stage);
        }
    }

    /**
     * 기본값으로 정의 생성 (가중치 1, 기본 시도 횟수).
     *
     * @param stage Stage
     * @param handler 핸들러
     * @return StageDefinition
     */
    public static StageDefinition of(Stage stage, StageHandler handler) {
        return new StageDefinition(stage, handler, 1, 0, null);
    }

    public StageDefinition withWeight(int newWeight) {
        return new StageDefinition(stage, handler, newWeight, maxAttempts, displayMessage);
    }

    public StageDefinition withMaxAttempts(int newMaxAttempts) {
        return new StageDefinition(stage, handler, weight, newMaxAttempts, displayMessage);
    }

    public StageDefinition withDisplayMessage(String newDisplayMessage) {
        return new StageDefinition(stage, handler, weight, maxAttempts, newDisplayMessage);
    }

    /**
     * 유효 최대 시도 횟수.
     *
     * @param defaultMaxAttempts 오케스트레이터 기본값
     * @return Stage 전용 값이 있으면 그 값, 없으면 기본값
     */
    public int effectiveMaxAttempts(int defaultMaxAttempts) {
        return maxAttempts > 0 ? maxAttempts : defaultMaxAttempts;
    }

    public String name() {
        return stage.name();
    }

    private static String defaultMessage(Stage stage) {
        if (stage instanceof DocumentStage documentStage) {
            return documentStage.displayMessage();
        }
        return "Processing " + stage.name();
    }
}
