package com.ryuqq.stageflow.core.spi;

import com.ryuqq.stageflow.core.error.NaturalKeyConflictException;
import com.ryuqq.stageflow.core.model.EntityId;
import com.ryuqq.stageflow.core.model.TargetEntity;

import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for the records the pipeline produces.
 *
 * <p>The natural key is unique per owner. Writes that would violate uniqueness fail with
 * {@link NaturalKeyConflictException} and leave the stored state untouched.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public interface TargetEntityRepository {

    /**
     * Finds an entity by id.
     *
     * @param id the entity id
     * @return the entity, or empty if absent
     */
    Optional<TargetEntity> findById(EntityId id);

    /**
     * Finds an entity by natural key within an owner.
     *
     * @param ownerId the owner
     * @param naturalKey the natural key
     * @return the entity, or empty if the key is free
     */
    Optional<TargetEntity> findByNaturalKey(String ownerId, String naturalKey);

    /**
     * Lists natural keys of one owner that start with a prefix.
     *
     * @param ownerId the owner
     * @param prefix the key prefix
     * @return matching keys
     */
    List<String> findNaturalKeysStartingWith(String ownerId, String prefix);

    /**
     * Inserts a new entity.
     *
     * @param entity the entity
     * @return the stored entity
     * @throws NaturalKeyConflictException if the natural key is taken
     * @throws IllegalStateException if an entity with the same id exists
     */
    TargetEntity create(TargetEntity entity);

    /**
     * Updates an existing entity.
     *
     * @param entity the entity
     * @return the stored entity
     * @throws NaturalKeyConflictException if the natural key is taken by another entity
     * @throws IllegalStateException if the entity does not exist
     */
    TargetEntity update(TargetEntity entity);
}
