package com.ryuqq.stageflow.core.spi;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value store client SPI (map values with per-key TTL).
 *
 * <p>Backs both the stage result accumulator and the entity lock table. Values are
 * string-keyed maps, possibly nested; two values are equal when their maps are equal,
 * which is what the compare-and-set operations compare.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe; conditional operations must be atomic</li>
 *   <li>Expired keys behave exactly like absent keys</li>
 *   <li>Transport failures surface as exceptions, never as empty results</li>
 * </ul>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * Reads a value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Optional<Map<String, Object>> get(String key);

    /**
     * Writes a value unconditionally.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live (positive)
     */
    void put(String key, Map<String, Object> value, Duration ttl);

    /**
     * Writes a value only if the key is absent.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live (positive)
     * @return true if written
     */
    boolean putIfAbsent(String key, Map<String, Object> value, Duration ttl);

    /**
     * Replaces a value only if the current value equals {@code expected}.
     *
     * @param key the key
     * @param expected the value the caller last observed
     * @param value the new value
     * @param ttl time to live (positive)
     * @return true if replaced
     */
    boolean replaceIfEquals(String key, Map<String, Object> expected, Map<String, Object> value, Duration ttl);

    /**
     * Deletes a key only if the current value equals {@code expected}.
     *
     * @param key the key
     * @param expected the value the caller last observed
     * @return true if deleted
     */
    boolean deleteIfEquals(String key, Map<String, Object> expected);

    /**
     * Deletes a key.
     *
     * @param key the key
     * @return true if a live key was deleted
     */
    boolean delete(String key);

    /**
     * Lists live keys starting with a prefix.
     *
     * @param prefix the key prefix
     * @return matching keys
     */
    Set<String> keys(String prefix);

    /**
     * Resets the TTL of a live key.
     *
     * @param key the key
     * @param ttl new time to live (positive)
     * @return true if the key exists
     */
    boolean expire(String key, Duration ttl);

    /**
     * Round-trips the connection.
     *
     * @throws RuntimeException if the store is unreachable
     */
    void ping();
}
