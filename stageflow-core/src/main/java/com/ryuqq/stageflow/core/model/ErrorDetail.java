package com.ryuqq.stageflow.core.model;

import com.ryuqq.stageflow.core.error.ErrorType;

import java.time.Instant;

/**
 * Stage 실패 상세.
 *
 * @param stage 실패한 Stage 이름
 * @param message 오류 메시지
 * @param errorType 실패 분류
 * @param attemptCount 실패 시점까지의 시도 횟수
 * @param occurredAt 발생 시각
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record ErrorDetail(
    String stage,
    String message,
    ErrorType errorType,
    int attemptCount,
    Instant occurredAt
) {

    public ErrorDetail {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = errorType.name();
        }
    }
}
