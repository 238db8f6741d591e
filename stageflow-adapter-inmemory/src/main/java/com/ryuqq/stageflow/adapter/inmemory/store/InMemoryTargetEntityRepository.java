package com.ryuqq.stageflow.adapter.inmemory.store;

import com.ryuqq.stageflow.core.error.NaturalKeyConflictException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.TargetEntity;
import com.ryuqq.stageflow.core.spi.TargetEntityRepository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link TargetEntityRepository} SPI for testing and reference purposes.
 *
 * <p>Enforces the unique (ownerId, naturalKey) constraint the way a relational unique index would:
 * a violating write throws {@link NaturalKeyConflictException} and changes nothing.</p>
 *
 * <p>All operations are synchronized on the instance.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class InMemoryTargetEntityRepository implements TargetEntityRepository {

    private final Map<EntityId, TargetEntity> entities = new HashMap<>();
    private final Map<String, EntityId> naturalKeyIndex = new HashMap<>();

    @Override
    public synchronized Optional<TargetEntity> findById(EntityId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(entities.get(id));
    }

    @Override
    public synchronized Optional<TargetEntity> findByNaturalKey(String ownerId, String naturalKey) {
        EntityId id = naturalKeyIndex.get(indexKey(ownerId, naturalKey));
        return id == null ? Optional.empty() : Optional.ofNullable(entities.get(id));
    }

    @Override
    public synchronized List<String> findNaturalKeysStartingWith(String ownerId, String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        List<String> keys = new ArrayList<>();
        for (TargetEntity entity : entities.values()) {
            if (entity.ownerId().equals(ownerId) && entity.naturalKey().startsWith(prefix)) {
                keys.add(entity.naturalKey());
            }
        }
        return keys;
    }

    @Override
    public synchronized TargetEntity create(TargetEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (entities.containsKey(entity.id())) {
            throw new IllegalStateException("Entity already exists: " + entity.id());
        }
        String key = indexKey(entity.ownerId(), entity.naturalKey());
        if (naturalKeyIndex.containsKey(key)) {
            throw new NaturalKeyConflictException(entity.ownerId(), entity.naturalKey());
        }
        entities.put(entity.id(), entity);
        naturalKeyIndex.put(key, entity.id());
        return entity;
    }

    @Override
    public synchronized TargetEntity update(TargetEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        TargetEntity stored = entities.get(entity.id());
        if (stored == null) {
            throw new IllegalStateException("Entity not found: " + entity.id());
        }
        String newKey = indexKey(entity.ownerId(), entity.naturalKey());
        EntityId holder = naturalKeyIndex.get(newKey);
        if (holder != null && !holder.equals(entity.id())) {
            throw new NaturalKeyConflictException(entity.ownerId(), entity.naturalKey());
        }
        naturalKeyIndex.remove(indexKey(stored.ownerId(), stored.naturalKey()));
        naturalKeyIndex.put(newKey, entity.id());
        entities.put(entity.id(), entity);
        return entity;
    }

    /**
     * Returns the number of stored entities. Used for test assertions.
     *
     * @return entity count
     */
    public synchronized int size() {
        return entities.size();
    }

    public synchronized void clear() {
        entities.clear();
        naturalKeyIndex.clear();
    }

    private static String indexKey(String ownerId, String naturalKey) {
        return ownerId + '\u0000' + naturalKey;
    }
}
