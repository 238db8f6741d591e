package com.ryuqq.stageflow.application.conflict;

/**
 * 자연 키 충돌 해소 규칙 (순수 함수).
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li><strong>UPDATE:</strong> 엔티티가 이미 보유한 값을 유지합니다. 기존 값이 없으면
 *       충돌 값에 접미어를 붙인 값을 사용하며, null을 반환하지 않습니다.</li>
 *   <li><strong>CREATE:</strong> 충돌 값에 시도 번호 접미어를 붙입니다 ({@code K-1}, {@code K-2}, ...).</li>
 * </ul>
 *
 * <p>같은 입력에 대해 항상 같은 값을 반환합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class NaturalKeyResolution {

    static final String SUFFIX_SEPARATOR = "-";

    private NaturalKeyResolution() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 충돌 해소 후 사용할 자연 키 계산.
     *
     * @param currentValue 엔티티가 현재 저장소에 가진 값 (CREATE이거나 값이 없으면 null)
     * @param conflictingValue 충돌을 일으킨 값
     * @param isUpdate UPDATE 여부
     * @param attempt 해소 시도 번호 (1부터)
     * @return 새 자연 키 (null 아님)
     * @throws IllegalArgumentException conflictingValue가 비어있거나 attempt가 양수가 아닌 경우
     */
    public static String resolve(String currentValue, String conflictingValue, boolean isUpdate, int attempt) {
        if (conflictingValue == null || conflictingValue.isBlank()) {
            throw new IllegalArgumentException("conflictingValue cannot be null or blank");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (isUpdate && currentValue != null && !currentValue.isBlank()) {
            return currentValue;
        }
        return suffixed(conflictingValue, attempt);
    }

    static String suffixed(String base, int suffix) {
        return base + SUFFIX_SEPARATOR + suffix;
    }
}
