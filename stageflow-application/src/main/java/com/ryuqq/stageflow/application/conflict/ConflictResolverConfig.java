package com.ryuqq.stageflow.application.conflict;

/**
 * 자연 키 충돌 해소 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxAttempts: 3 (해소 재시도 횟수, 초과 시 PersistentConflict)</li>
 *   <li>baseDelayMs: 50, maxDelayMs: 500 (짧은 지수 백오프)</li>
 *   <li>suggestionLimit: 100 (사전 제안 시 탐색할 최대 접미어)</li>
 * </ul>
 *
 * @param maxAttempts 해소 재시도 횟수
 * @param baseDelayMs 첫 재시도 대기 시간 (밀리초)
 * @param maxDelayMs 대기 시간 상한 (밀리초)
 * @param suggestionLimit 사전 제안 접미어 상한
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record ConflictResolverConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    int suggestionLimit
) {

    /**
     * 기본 설정으로 생성.
     */
    public ConflictResolverConfig() {
        this(3, 50, 500, 100);
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 설정값이 유효하지 않은 경우
     */
    public ConflictResolverConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (suggestionLimit <= 0) {
            throw new IllegalArgumentException("suggestionLimit must be positive (current: " + suggestionLimit + ")");
        }
    }

    public ConflictResolverConfig withMaxAttempts(int maxAttempts) {
        return new ConflictResolverConfig(maxAttempts, baseDelayMs, maxDelayMs, suggestionLimit);
    }

    public ConflictResolverConfig withBaseDelayMs(long baseDelayMs) {
        return new ConflictResolverConfig(maxAttempts, baseDelayMs, Math.max(maxDelayMs, baseDelayMs), suggestionLimit);
    }

    public ConflictResolverConfig withSuggestionLimit(int suggestionLimit) {
        return new ConflictResolverConfig(maxAttempts, baseDelayMs, maxDelayMs, suggestionLimit);
    }
}
