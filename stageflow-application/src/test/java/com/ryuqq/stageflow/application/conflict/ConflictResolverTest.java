package com.ryuqq.stageflow.application.conflict;

import com.ryuqq.stageflow.adapter.inmemory.store.InMemoryTargetEntityRepository;
import com.ryuqq.stageflow.core.error.NaturalKeyConflictException;
import com.ryuqq.stageflow.core.error.PersistentConflictException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.Payload;
import com.ryuqq.stageflow.core.model.TargetEntity;
import com.ryuqq.stageflow.core.spi.TargetEntityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ConflictResolver 유닛 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class ConflictResolverTest {

    private static final String OWNER = "owner-1";
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    private InMemoryTargetEntityRepository repository;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTargetEntityRepository();
        resolver = new ConflictResolver(repository, fastConfig(), CLOCK);
    }

    @Test
    void CREATE_충돌_시_접미어로_저장() {
        // given
        repository.create(entity("e-1", "K"));

        // when
        TargetEntity saved = resolver.create(entity("e-2", "K"));

        // then
        assertThat(saved.naturalKey()).isEqualTo("K-1");
        assertThat(repository.findByNaturalKey(OWNER, "K-1")).isPresent();
    }

    @Test
    void CREATE_연속_충돌_시_다음_번호() {
        repository.create(entity("e-1", "K"));
        repository.create(entity("e-2", "K-1"));

        TargetEntity saved = resolver.create(entity("e-3", "K"));

        assertThat(saved.naturalKey()).isEqualTo("K-2");
    }

    @Test
    void CREATE_충돌_없으면_그대로() {
        assertThat(resolver.create(entity("e-1", "K")).naturalKey()).isEqualTo("K");
    }

    @Test
    void UPDATE_충돌_시_기존_자연_키_유지() {
        // given
        repository.create(entity("e-1", "K-OLD"));
        repository.create(entity("e-2", "K-NEW"));

        // when
        TargetEntity saved = resolver.update(entity("e-1", "K-NEW"));

        // then
        assertThat(saved.naturalKey()).isEqualTo("K-OLD");
        assertThat(repository.findByNaturalKey(OWNER, "K-NEW").orElseThrow().id()).isEqualTo(EntityId.of("e-2"));
    }

    @Test
    void 재시도_소진_시_PersistentConflictException() {
        // given
        TargetEntityRepository alwaysConflicting = mock(TargetEntityRepository.class);
        when(alwaysConflicting.create(any())).thenThrow(new NaturalKeyConflictException(OWNER, "K"));
        ConflictResolver exhausted = new ConflictResolver(alwaysConflicting, fastConfig(), CLOCK);

        // when / then
        assertThatThrownBy(() -> exhausted.create(entity("e-1", "K")))
            .isInstanceOf(PersistentConflictException.class)
            .hasCauseInstanceOf(NaturalKeyConflictException.class);
        verify(alwaysConflicting, times(4)).create(any());
    }

    @Test
    void UPDATE_재시도_소진() {
        TargetEntityRepository alwaysConflicting = mock(TargetEntityRepository.class);
        when(alwaysConflicting.update(any())).thenThrow(new NaturalKeyConflictException(OWNER, "K"));
        when(alwaysConflicting.findById(EntityId.of("e-1"))).thenReturn(Optional.of(entity("e-1", "K-OLD")));
        ConflictResolver exhausted = new ConflictResolver(alwaysConflicting, fastConfig(), CLOCK);

        assertThatThrownBy(() -> exhausted.update(entity("e-1", "K")))
            .isInstanceOf(PersistentConflictException.class);
    }

    @Test
    void 사용_가능한_키_제안() {
        // given
        repository.create(entity("e-1", "K"));
        repository.create(entity("e-2", "K-1"));
        repository.create(entity("e-3", "K-3"));
        repository.create(entity("e-4", "K-draft"));

        // when / then
        assertThat(resolver.suggestAvailableKey(OWNER, "FREE")).isEqualTo("FREE");
        assertThat(resolver.suggestAvailableKey(OWNER, "K")).isEqualTo("K-2");
    }

    @Test
    void 제안_한도_초과_시_시각_접미어() {
        // given
        ConflictResolver limited = new ConflictResolver(repository, fastConfig().withSuggestionLimit(2), CLOCK);
        repository.create(entity("e-1", "K"));
        repository.create(entity("e-2", "K-1"));
        repository.create(entity("e-3", "K-2"));

        // when
        String suggestion = limited.suggestAvailableKey(OWNER, "K");

        // then
        assertThat(suggestion).isEqualTo("K-1700000000000");
    }

    private static ConflictResolverConfig fastConfig() {
        return new ConflictResolverConfig().withBaseDelayMs(1);
    }

    private static TargetEntity entity(String id, String naturalKey) {
        return new TargetEntity(EntityId.of(id), OWNER, naturalKey, Payload.empty(), null);
    }
}
