package com.ryuqq.stageflow.application.conflict;

import com.ryuqq.stageflow.application.resilience.BackoffCalculator;
import com.ryuqq.stageflow.core.error.NaturalKeyConflictException;
import com.ryuqq.stageflow.core.error.PersistentConflictException;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import com.ryuqq.stageflow.core.model.TargetEntity;
import com.ryuqq.stageflow.core.spi.TargetEntityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.Set;

/**
 * 자연 키 충돌을 해소하며 대상 엔티티를 저장합니다.
 *
 * <p><strong>UPDATE 충돌:</strong> 엔티티가 이미 가진 자연 키를 저장소에서 다시 읽어 유지합니다.
 * 충돌 처리의 부작용으로 자연 키를 비우거나 null로 저장하지 않습니다.</p>
 *
 * <p><strong>CREATE 충돌:</strong> 원래 키에 {@code -1}, {@code -2}, ... 접미어를 붙여 재시도합니다.</p>
 *
 * <p>해소 재시도는 {@link ConflictResolverConfig#maxAttempts()}회로 제한되며,
 * 소진 시 재시도 불가한 {@link PersistentConflictException}을 던집니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final TargetEntityRepository repository;
    private final ConflictResolverConfig config;
    private final BackoffCalculator backoff;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param repository 대상 엔티티 저장소
     * @param config 충돌 해소 설정
     * @param clock 시계 (제안 키 fallback용)
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ConflictResolver(TargetEntityRepository repository, ConflictResolverConfig config, Clock clock) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.repository = repository;
        this.config = config;
        this.backoff = new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), 0.1);
        this.clock = clock;
    }

    /**
     * 새 엔티티 생성 (충돌 시 접미어 부여).
     *
     * @param draft 생성할 엔티티
     * @return 저장된 엔티티 (자연 키가 바뀌었을 수 있음)
     * @throws PersistentConflictException 해소 재시도를 모두 소진한 경우
     */
    public TargetEntity create(TargetEntity draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        String baseKey = draft.naturalKey();
        TargetEntity candidate = draft;
        int attempt = 0;
        while (true) {
            try {
                TargetEntity saved = repository.create(candidate);
                if (attempt > 0) {
                    log.info("Natural key conflict resolved on create: owner={}, requested={}, stored={}",
                        draft.ownerId(), baseKey, saved.naturalKey());
                }
                return saved;
            } catch (NaturalKeyConflictException e) {
                attempt++;
                if (attempt > config.maxAttempts()) {
                    throw exhausted("create", draft, e);
                }
                String next = NaturalKeyResolution.resolve(null, baseKey, false, attempt);
                log.warn("Natural key conflict on create: owner={}, key={}, retrying with {} (attempt {}/{})",
                    draft.ownerId(), candidate.naturalKey(), next, attempt, config.maxAttempts());
                candidate = candidate.withNaturalKey(next);
                sleep(backoff.calculate(attempt));
            }
        }
    }

    /**
     * 기존 엔티티 갱신 (충돌 시 기존 자연 키 유지).
     *
     * @param entity 갱신할 엔티티 (새 자연 키를 담고 있을 수 있음)
     * @return 저장된 엔티티
     * @throws PersistentConflictException 해소 재시도를 모두 소진한 경우
     */
    public TargetEntity update(TargetEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        TargetEntity candidate = entity;
        int attempt = 0;
        while (true) {
            try {
                return repository.update(candidate);
            } catch (NaturalKeyConflictException e) {
                attempt++;
                if (attempt > config.maxAttempts()) {
                    throw exhausted("update", entity, e);
                }
                String current = repository.findById(entity.id())
                    .map(TargetEntity::naturalKey)
                    .orElse(null);
                String next = NaturalKeyResolution.resolve(current, entity.naturalKey(), true, attempt);
                log.warn("Natural key conflict on update: entityId={}, key={}, keeping {} (attempt {}/{})",
                    entity.id().getValue(), candidate.naturalKey(), next, attempt, config.maxAttempts());
                candidate = candidate.withNaturalKey(next);
                sleep(backoff.calculate(attempt));
            }
        }
    }

    /**
     * 트랜잭션 전 사용 가능한 자연 키 제안.
     *
     * <p>키가 비어있으면 그대로, 사용 중이면 {@code key-n} 중 가장 작은 빈 번호를 제안합니다.
     * {@code suggestionLimit}까지 모두 사용 중이면 시각 기반 접미어를 붙입니다.</p>
     *
     * @param ownerId 소유자
     * @param key 원하는 자연 키
     * @return 제안 키
     */
    public String suggestAvailableKey(String ownerId, String key) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (repository.findByNaturalKey(ownerId, key).isEmpty()) {
            return key;
        }
        String prefix = key + NaturalKeyResolution.SUFFIX_SEPARATOR;
        Set<Integer> used = new HashSet<>();
        for (String existing : repository.findNaturalKeysStartingWith(ownerId, prefix)) {
            String suffix = existing.substring(prefix.length());
            if (!suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit) && suffix.length() < 10) {
                used.add(Integer.parseInt(suffix));
            }
        }
        for (int n = 1; n <= config.suggestionLimit(); n++) {
            if (!used.contains(n)) {
                return NaturalKeyResolution.suffixed(key, n);
            }
        }
        return key + NaturalKeyResolution.SUFFIX_SEPARATOR + clock.millis();
    }

    private PersistentConflictException exhausted(String operation, TargetEntity entity, NaturalKeyConflictException cause) {
        log.error("Natural key conflict not resolved on {} after {} attempts: owner={}, key={}",
            operation, config.maxAttempts(), entity.ownerId(), entity.naturalKey());
        return new PersistentConflictException(
            "Natural key conflict not resolved after " + config.maxAttempts() + " attempts: " + entity.naturalKey(),
            cause);
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted while resolving natural key conflict", e);
        }
    }
}
