package com.ryuqq.stageflow.application.lock;

import com.ryuqq.stageflow.core.error.LockLostException;
import com.ryuqq.stageflow.core.error.LockTimeoutException;
import com.ryuqq.stageflow.core.error.TransientInfrastructureException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.EntityLock;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 엔티티 단위 배타 락 관리자.
 *
 * <p>같은 엔티티를 대상으로 하는 Workflow는 동시에 하나만 Stage를 실행할 수 있습니다.
 * 락은 Key-Value 저장소에 보관되며, 모든 상태 변경은 compare-and-set으로 수행되어
 * 두 Workflow가 동시에 보유하는 구간이 생기지 않습니다.</p>
 *
 * <p><strong>획득 규칙:</strong></p>
 * <ol>
 *   <li>보유자 없음 → 즉시 획득 (GRANTED)</li>
 *   <li>같은 Workflow가 보유 → heartbeat 갱신 (REENTERED)</li>
 *   <li>다른 Workflow가 보유, 마지막 갱신이 staleThreshold보다 오래됨 → CAS로 회수 (RECLAIMED)</li>
 *   <li>그 외 → pollInterval 간격으로 재확인, acquireTimeout 초과 시 {@link LockTimeoutException}</li>
 * </ol>
 *
 * <p>staleness 판단은 주입된 {@link Clock} 기준이며, 대기 시간 측정은 단조 시계를 사용합니다.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class EntityLockManager {

    private static final Logger log = LoggerFactory.getLogger(EntityLockManager.class);

    private static final String KEY_PREFIX = "lock:entity:";
    private static final String FIELD_ENTITY = "entityId";
    private static final String FIELD_WORKFLOW = "workflowId";
    private static final String FIELD_STAGE = "stage";
    private static final String FIELD_ACQUIRED_AT = "acquiredAt";
    private static final String FIELD_REFRESHED_AT = "refreshedAt";

    private final Supplier<? extends KeyValueStore> storeProvider;
    private final LockConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param storeProvider 저장소 클라이언트 provider
     * @param config 락 설정
     * @param clock 시계 (staleness 판단용)
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public EntityLockManager(Supplier<? extends KeyValueStore> storeProvider, LockConfig config, Clock clock) {
        if (storeProvider == null) {
            throw new IllegalArgumentException("storeProvider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.storeProvider = storeProvider;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 락 획득 (재진입 가능).
     *
     * @param entityId 대상 엔티티
     * @param workflowId 획득할 Workflow
     * @param stage 현재 Stage 이름
     * @return 획득 방식
     * @throws LockTimeoutException acquireTimeout 내에 획득하지 못한 경우
     */
    public LockAcquisition acquire(EntityId entityId, WorkflowId workflowId, String stage) {
        requireIds(entityId, workflowId);
        String key = lockKey(entityId);
        long startedNanos = System.nanoTime();
        long deadline = startedNanos + config.acquireTimeout().toNanos();
        WorkflowId lastHolder = null;

        while (true) {
            KeyValueStore store = storeProvider.get();
            Instant now = clock.instant();
            Optional<Map<String, Object>> raw = store.get(key);

            if (raw.isEmpty()) {
                EntityLock granted = new EntityLock(entityId, workflowId, stage, now, now);
                if (store.putIfAbsent(key, encode(granted), config.lockTtl())) {
                    log.debug("Lock granted: entityId={}, workflowId={}, stage={}",
                        entityId.getValue(), workflowId.getValue(), stage);
                    return LockAcquisition.GRANTED;
                }
            } else {
                EntityLock existing = decode(raw.get());
                if (existing.isHeldBy(workflowId)) {
                    if (store.replaceIfEquals(key, raw.get(), encode(existing.refreshed(stage, now)), config.lockTtl())) {
                        return LockAcquisition.REENTERED;
                    }
                } else if (existing.isStale(now, config.staleThreshold())) {
                    EntityLock reclaimed = new EntityLock(entityId, workflowId, stage, now, now);
                    if (store.replaceIfEquals(key, raw.get(), encode(reclaimed), config.lockTtl())) {
                        log.warn("Reclaimed stale lock: entityId={}, from={}, to={}, lastRefreshedAt={}",
                            entityId.getValue(), existing.workflowId().getValue(), workflowId.getValue(),
                            existing.refreshedAt());
                        return LockAcquisition.RECLAIMED;
                    }
                } else {
                    lastHolder = existing.workflowId();
                }
            }

            if (System.nanoTime() >= deadline) {
                long waitedMs = (System.nanoTime() - startedNanos) / 1_000_000;
                log.warn("Lock acquisition timed out: entityId={}, workflowId={}, holder={}, waited={}ms",
                    entityId.getValue(), workflowId.getValue(), lastHolder, waitedMs);
                throw new LockTimeoutException(entityId, lastHolder, waitedMs);
            }
            log.debug("Lock on {} held by {}, polling", entityId.getValue(), lastHolder);
            sleep(config.pollInterval().toMillis());
        }
    }

    /**
     * heartbeat 갱신.
     *
     * @param entityId 대상 엔티티
     * @param workflowId 보유 Workflow
     * @param stage 현재 Stage 이름
     * @throws LockLostException 락이 없거나 다른 Workflow가 보유 중인 경우
     */
    public void refresh(EntityId entityId, WorkflowId workflowId, String stage) {
        requireIds(entityId, workflowId);
        String key = lockKey(entityId);
        KeyValueStore store = storeProvider.get();
        Map<String, Object> raw = store.get(key)
            .orElseThrow(() -> new LockLostException(entityId, workflowId, null));
        EntityLock existing = decode(raw);
        if (!existing.isHeldBy(workflowId)) {
            throw new LockLostException(entityId, workflowId, existing.workflowId());
        }
        if (!store.replaceIfEquals(key, raw, encode(existing.refreshed(stage, clock.instant())), config.lockTtl())) {
            // 값이 바뀌었으면 보유자를 다시 확인
            verifyHolder(entityId, workflowId);
        }
    }

    /**
     * 보유 여부 검증.
     *
     * @param entityId 대상 엔티티
     * @param workflowId 보유해야 하는 Workflow
     * @throws LockLostException 락이 없거나 다른 Workflow가 보유 중인 경우
     */
    public void verifyHolder(EntityId entityId, WorkflowId workflowId) {
        requireIds(entityId, workflowId);
        Optional<EntityLock> holder = currentHolder(entityId);
        if (holder.isEmpty() || !holder.get().isHeldBy(workflowId)) {
            WorkflowId current = holder.map(EntityLock::workflowId).orElse(null);
            log.warn("Lock lost: entityId={}, expected={}, current={}",
                entityId.getValue(), workflowId.getValue(), current);
            throw new LockLostException(entityId, workflowId, current);
        }
    }

    /**
     * 락 해제 (멱등).
     *
     * <p>다른 Workflow가 보유한 락은 해제하지 않습니다.</p>
     *
     * @param entityId 대상 엔티티
     * @param workflowId 보유 Workflow
     * @return 해제했으면 true
     */
    public boolean release(EntityId entityId, WorkflowId workflowId) {
        requireIds(entityId, workflowId);
        String key = lockKey(entityId);
        KeyValueStore store = storeProvider.get();
        Optional<Map<String, Object>> raw = store.get(key);
        if (raw.isEmpty()) {
            return false;
        }
        EntityLock existing = decode(raw.get());
        if (!existing.isHeldBy(workflowId)) {
            log.debug("Skip release: entityId={} is held by {}, not {}",
                entityId.getValue(), existing.workflowId().getValue(), workflowId.getValue());
            return false;
        }
        boolean released = store.deleteIfEquals(key, raw.get());
        if (released) {
            log.debug("Lock released: entityId={}, workflowId={}", entityId.getValue(), workflowId.getValue());
        }
        return released;
    }

    /**
     * 현재 락 보유 정보 조회.
     *
     * @param entityId 대상 엔티티
     * @return 락 정보 (없으면 empty)
     */
    public Optional<EntityLock> currentHolder(EntityId entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        return storeProvider.get().get(lockKey(entityId)).map(EntityLockManager::decode);
    }

    public LockConfig getConfig() {
        return config;
    }

    static String lockKey(EntityId entityId) {
        return KEY_PREFIX + entityId.getValue();
    }

    private static Map<String, Object> encode(EntityLock lock) {
        Map<String, Object> value = new HashMap<>();
        value.put(FIELD_ENTITY, lock.entityId().getValue());
        value.put(FIELD_WORKFLOW, lock.workflowId().getValue());
        value.put(FIELD_STAGE, lock.stage());
        value.put(FIELD_ACQUIRED_AT, lock.acquiredAt().toEpochMilli());
        value.put(FIELD_REFRESHED_AT, lock.refreshedAt().toEpochMilli());
        return value;
    }

    private static EntityLock decode(Map<String, Object> value) {
        return new EntityLock(
            EntityId.of(String.valueOf(value.get(FIELD_ENTITY))),
            WorkflowId.of(String.valueOf(value.get(FIELD_WORKFLOW))),
            value.get(FIELD_STAGE) == null ? null : String.valueOf(value.get(FIELD_STAGE)),
            Instant.ofEpochMilli(((Number) value.get(FIELD_ACQUIRED_AT)).longValue()),
            Instant.ofEpochMilli(((Number) value.get(FIELD_REFRESHED_AT)).longValue())
        );
    }

    private static void requireIds(EntityId entityId, WorkflowId workflowId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted while waiting for entity lock", e);
        }
    }
}
