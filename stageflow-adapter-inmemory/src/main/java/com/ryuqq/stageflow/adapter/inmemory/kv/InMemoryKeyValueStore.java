package com.ryuqq.stageflow.adapter.inmemory.kv;

import com.ryuqq.stageflow.core.spi.KeyValueStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link KeyValueStore} SPI with per-key TTL.
 *
 * <p>Expiry is passive: an expired entry is treated as absent on access and removed lazily,
 * matching how a TTL-based cache behaves. Expiry is measured with the injected {@link Clock},
 * so tests can move time forward without sleeping.</p>
 *
 * <p>Conditional operations run inside {@link ConcurrentHashMap#compute} and are atomic per key.
 * Stored values are unmodifiable copies.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Creates a store on the system clock.
     */
    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store on a custom clock.
     *
     * @param clock clock used for TTL
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryKeyValueStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        requireKey(key);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void put(String key, Map<String, Object> value, Duration ttl) {
        requireKey(key);
        Entry entry = newEntry(value, ttl);
        entries.put(key, entry);
    }

    @Override
    public boolean putIfAbsent(String key, Map<String, Object> value, Duration ttl) {
        requireKey(key);
        Entry fresh = newEntry(value, ttl);
        boolean[] written = new boolean[1];
        entries.compute(key, (k, current) -> {
            if (current == null || current.isExpired(clock.millis())) {
                written[0] = true;
                return fresh;
            }
            return current;
        });
        return written[0];
    }

    @Override
    public boolean replaceIfEquals(String key, Map<String, Object> expected, Map<String, Object> value, Duration ttl) {
        requireKey(key);
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        Entry fresh = newEntry(value, ttl);
        boolean[] replaced = new boolean[1];
        entries.computeIfPresent(key, (k, current) -> {
            long now = clock.millis();
            if (current.isExpired(now)) {
                return null;
            }
            if (current.value.equals(expected)) {
                replaced[0] = true;
                return fresh;
            }
            return current;
        });
        return replaced[0];
    }

    @Override
    public boolean deleteIfEquals(String key, Map<String, Object> expected) {
        requireKey(key);
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        boolean[] deleted = new boolean[1];
        entries.computeIfPresent(key, (k, current) -> {
            if (current.isExpired(clock.millis())) {
                return null;
            }
            if (current.value.equals(expected)) {
                deleted[0] = true;
                return null;
            }
            return current;
        });
        return deleted[0];
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.millis());
    }

    @Override
    public Set<String> keys(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        long now = clock.millis();
        Set<String> keys = new TreeSet<>();
        for (Map.Entry<String, Entry> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(prefix) && !entry.getValue().isExpired(now)) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requireKey(key);
        requireTtl(ttl);
        boolean[] extended = new boolean[1];
        entries.computeIfPresent(key, (k, current) -> {
            long now = clock.millis();
            if (current.isExpired(now)) {
                return null;
            }
            extended[0] = true;
            return new Entry(current.value, now + ttl.toMillis());
        });
        return extended[0];
    }

    @Override
    public void ping() {
        // always reachable
    }

    /**
     * Returns the remaining TTL of a live key. Used for test assertions.
     *
     * @param key the key
     * @return remaining TTL, or empty if absent or expired
     */
    public Optional<Duration> ttl(String key) {
        Entry entry = entries.get(key);
        long now = clock.millis();
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(entry.expiresAt - now));
    }

    /**
     * Returns the number of live keys. Used for test assertions.
     *
     * @return live key count
     */
    public int size() {
        return keys("").size();
    }

    public void clear() {
        entries.clear();
    }

    private Entry newEntry(Map<String, Object> value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        requireTtl(ttl);
        return new Entry(Collections.unmodifiableMap(new HashMap<>(value)), clock.millis() + ttl.toMillis());
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, but was: " + ttl);
        }
    }

    private static final class Entry {
        private final Map<String, Object> value;
        private final long expiresAt;

        Entry(Map<String, Object> value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return expiresAt <= now;
        }
    }
}
