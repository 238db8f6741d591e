package com.ryuqq.stageflow.core.stage;

import com.ryuqq.stageflow.core.error.ValidationFailureException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 고정된 순서의 Stage 정의 목록.
 *
 * <p>StagePipeline은 오케스트레이터 생성 시 한 번 구성되며 이후 변경되지 않습니다.
 * Stage 이름 → 핸들러 조회, 다음 Stage 계산, 가중치 기반 진행률 계산,
 * 전진 전용(forward-only) 순서 검증을 담당합니다.</p>
 *
 * <p><strong>진행률 계산:</strong></p>
 * <pre>
 * progressAt(stage, sub) = (앞선 Stage 가중치 합 + 현재 가중치 × sub / 100) × 100 / 전체 가중치
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * StagePipeline pipeline = StagePipeline.builder()
 *     .stage(DocumentStage.AI_PARSING, parsingHandler)
 *     .stage(StageDefinition.of(DocumentStage.DATABASE_SAVE, saveHandler).withMaxAttempts(5))
 *     .build();
 * }</pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class StagePipeline {

    private final List<StageDefinition> definitions;
    private final Map<String, Integer> indexByName;
    private final int[] weightBefore;
    private final int totalWeight;

    private StagePipeline(List<StageDefinition> definitions) {
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
        this.indexByName = new HashMap<>();
        this.weightBefore = new int[definitions.size()];
        int sum = 0;
        for (int i = 0; i < definitions.size(); i++) {
            indexByName.put(definitions.get(i).name(), i);
            weightBefore[i] = sum;
            sum += definitions.get(i).weight();
        }
        this.totalWeight = sum;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 첫 Stage 정의.
     *
     * @return 첫 Stage
     */
    public StageDefinition first() {
        return definitions.get(0);
    }

    /**
     * Stage 이름으로 정의 조회.
     *
     * @param stageName Stage 이름
     * @return Stage 정의
     * @throws ValidationFailureException 이름이 없거나 파이프라인에 없는 Stage인 경우
     */
    public StageDefinition resolve(String stageName) {
        if (stageName == null || stageName.isBlank()) {
            throw new ValidationFailureException("Stage name is missing");
        }
        Integer index = indexByName.get(stageName);
        if (index == null) {
            throw new ValidationFailureException("Unknown stage: " + stageName);
        }
        return definitions.get(index);
    }

    /**
     * 다음 Stage 정의 조회.
     *
     * @param stageName 현재 Stage 이름
     * @return 다음 Stage (마지막 Stage이면 empty)
     */
    public Optional<StageDefinition> next(String stageName) {
        int index = indexOf(stageName);
        if (index + 1 >= definitions.size()) {
            return Optional.empty();
        }
        return Optional.of(definitions.get(index + 1));
    }

    /**
     * Stage 순서 조회 (0부터).
     *
     * @param stageName Stage 이름
     * @return 순서
     * @throws ValidationFailureException 파이프라인에 없는 Stage인 경우
     */
    public int indexOf(String stageName) {
        resolve(stageName);
        return indexByName.get(stageName);
    }

    public boolean isLast(String stageName) {
        return indexOf(stageName) == definitions.size() - 1;
    }

    /**
     * Stage 진행 중 진행률.
     *
     * @param stageName 현재 Stage 이름
     * @param subPercent Stage 내부 진행률 (0~100)
     * @return 전체 진행률 (0~100)
     */
    public int progressAt(String stageName, int subPercent) {
        if (subPercent < 0 || subPercent > 100) {
            throw new IllegalArgumentException("subPercent must be between 0 and 100 (current: " + subPercent + ")");
        }
        int index = indexOf(stageName);
        long numerator = (long) weightBefore[index] * 100 + (long) definitions.get(index).weight() * subPercent;
        return (int) (numerator / totalWeight);
    }

    /**
     * Stage 완료 후 진행률.
     *
     * @param stageName 완료된 Stage 이름
     * @return 전체 진행률 (0~100)
     */
    public int progressAfter(String stageName) {
        return progressAt(stageName, 100);
    }

    /**
     * 전진 전용 순서 검증.
     *
     * <p>같은 Stage(재시도) 또는 뒤의 Stage로의 이동만 허용합니다.</p>
     *
     * @param from 현재 Stage 이름
     * @param to 이동할 Stage 이름
     * @throws IllegalStateException 앞 Stage로 되돌아가는 경우
     */
    public void checkForward(String from, String to) {
        if (indexOf(to) < indexOf(from)) {
            throw new IllegalStateException(
                String.format("Stage order violation: %s → %s", from, to)
            );
        }
    }

    public List<StageDefinition> definitions() {
        return definitions;
    }

    public int size() {
        return definitions.size();
    }

    /**
     * StagePipeline 빌더.
     */
    public static final class Builder {

        private final List<StageDefinition> definitions = new ArrayList<>();

        private Builder() {
        }

        public Builder stage(Stage stage, StageHandler handler) {
            return stage(StageDefinition.of(stage, handler));
        }

        public Builder stage(StageDefinition definition) {
            if (definition == null) {
                throw new IllegalArgumentException("definition cannot be null");
            }
            for (StageDefinition existing : definitions) {
                if (existing.name().equals(definition.name())) {
                    throw new IllegalArgumentException("Duplicate stage: " + definition.name());
                }
            }
            definitions.add(definition);
            return this;
        }

        public StagePipeline build() {
            if (definitions.isEmpty()) {
                throw new IllegalArgumentException("pipeline must have at least one stage");
            }
            return new StagePipeline(definitions);
        }
    }
}
