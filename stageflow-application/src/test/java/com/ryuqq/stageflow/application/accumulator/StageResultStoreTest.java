package com.ryuqq.stageflow.application.accumulator;

import com.ryuqq.stageflow.adapter.inmemory.kv.InMemoryKeyValueStore;
import com.ryuqq.stageflow.core.model.AccumulatedStageData;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.testkit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StageResultStore 유닛 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class StageResultStoreTest {

    private static final WorkflowId WF = WorkflowId.of("wf-1");

    private MutableClock clock;
    private InMemoryKeyValueStore kv;
    private StageResultStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
        kv = new InMemoryKeyValueStore(clock);
        store = new StageResultStore(() -> kv, new StageResultStoreConfig(), clock);
    }

    @Test
    void Stage별_네임스페이스에_누적() {
        // given
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("title", "Shoes", "price", 100)));
        clock.advance(Duration.ofSeconds(1));
        store.saveStageResult(WF, "DATABASE_SAVE", Payload.of(Map.of("productId", "p-1")));

        // when
        AccumulatedStageData data = store.getAccumulatedData(WF);

        // then
        assertThat(data.stages()).containsExactly("AI_PARSING", "DATABASE_SAVE");
        assertThat(data.forStage("AI_PARSING").orElseThrow().get("title")).contains("Shoes");
        assertThat(data.merged().asMap()).containsKeys("title", "price", "productId");
    }

    @Test
    void 같은_Stage_재저장은_자기_네임스페이스만_덮어씀() {
        // given
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("title", "v1")));
        clock.advance(Duration.ofSeconds(1));
        store.saveStageResult(WF, "DATABASE_SAVE", Payload.of(Map.of("productId", "p-1")));
        clock.advance(Duration.ofSeconds(1));

        // when
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("title", "v2")));

        // then
        AccumulatedStageData data = store.getAccumulatedData(WF);
        assertThat(data.forStage("AI_PARSING").orElseThrow().get("title")).contains("v2");
        assertThat(data.forStage("DATABASE_SAVE").orElseThrow().get("productId")).contains("p-1");
    }

    @Test
    void 나중에_저장된_Stage가_병합_뷰에서_같은_키를_가림() {
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("status", "parsed")));
        clock.advance(Duration.ofMillis(5));
        store.saveStageResult(WF, "TARGET_SYNC", Payload.of(Map.of("status", "synced")));

        assertThat(store.getAccumulatedData(WF).get("status")).contains("synced");
    }

    @Test
    void 중첩_구조_보존() {
        Map<String, Object> nested = Map.of("images", List.of(Map.of("url", "a.png")), "meta", Map.of("w", 10));

        store.saveStageResult(WF, "IMAGE_ATTACHMENT", Payload.of(nested));

        assertThat(store.getStageResult(WF, "IMAGE_ATTACHMENT").orElseThrow().asMap()).isEqualTo(nested);
    }

    @Test
    void 다른_Workflow_결과와_격리() {
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("a", 1)));
        store.saveStageResult(WorkflowId.of("wf-10"), "AI_PARSING", Payload.of(Map.of("a", 2)));

        assertThat(store.getAccumulatedData(WF).stages()).containsExactly("AI_PARSING");
        assertThat(store.getAccumulatedData(WF).get("a")).contains(1);
    }

    @Test
    void 결과가_없으면_빈_누적본() {
        assertThat(store.getAccumulatedData(WF).isEmpty()).isTrue();
        assertThat(store.getStageResult(WF, "AI_PARSING")).isEmpty();
    }

    @Test
    void TTL_만료_후_조회되지_않음() {
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("a", 1)));

        clock.advance(Duration.ofHours(2).plusSeconds(1));

        assertThat(store.getAccumulatedData(WF).isEmpty()).isTrue();
    }

    @Test
    void TTL_연장() {
        // given
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("a", 1)));
        store.saveStageResult(WF, "DATABASE_SAVE", Payload.of(Map.of("b", 2)));
        clock.advance(Duration.ofMinutes(110));

        // when
        int extended = store.extendTtl(WF, Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(30));

        // then
        assertThat(extended).isEqualTo(2);
        assertThat(store.getAccumulatedData(WF).stages()).hasSize(2);
    }

    @Test
    void Workflow_결과_전체_삭제() {
        store.saveStageResult(WF, "AI_PARSING", Payload.of(Map.of("a", 1)));
        store.saveStageResult(WF, "DATABASE_SAVE", Payload.of(Map.of("b", 2)));

        assertThat(store.clearWorkflowResults(WF)).isEqualTo(2);
        assertThat(kv.size()).isZero();
    }

    @Test
    void 키_형식() {
        StageResultStore custom = new StageResultStore(() -> kv,
            new StageResultStoreConfig().withKeyPrefix("pipeline"), clock);

        assertThat(custom.resultKey(WF, "AI_PARSING")).isEqualTo("pipeline:wf-1:stage:AI_PARSING:result");
        assertThatThrownBy(() -> new StageResultStoreConfig().withKeyPrefix("a:b"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
