package com.ryuqq.stageflow.core.outcome;

import com.ryuqq.stageflow.core.model.Payload;

import java.util.Map;

/**
 * Stage 성공 결과.
 *
 * <p>{@code output}은 해당 Stage의 네임스페이스에만 기록되며,
 * 이전 Stage의 결과를 덮어쓰지 않습니다.</p>
 *
 * @param output Stage 부분 결과 (빈 Payload 가능)
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public record Ok(
    Payload output,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException output이 null인 경우
     */
    public Ok {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }

    /**
     * 부분 결과로 성공 생성.
     *
     * @param output Stage 부분 결과
     * @return Ok 인스턴스
     */
    public static Ok of(Map<String, ?> output) {
        return new Ok(Payload.of(output), null);
    }

    /**
     * 결과 없는 성공 생성 (Skip된 Stage 등).
     *
     * @return Ok 인스턴스
     */
    public static Ok empty() {
        return new Ok(Payload.empty(), null);
    }
}
