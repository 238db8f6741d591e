package com.ryuqq.stageflow.application.resilience;

import com.ryuqq.stageflow.core.spi.KeyValueStore;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Key-value store decorator that resolves the live client per call and retries transient failures.
 *
 * <p>The client is never cached: each attempt reads {@link StoreClientHolder#current()}, and a
 * transient failure invalidates the client that produced it so the next attempt reconnects.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class ResilientKeyValueStore implements KeyValueStore {

    private final StoreClientHolder<KeyValueStore> holder;
    private final StoreOperationRetrier retrier;

    public ResilientKeyValueStore(StoreClientHolder<KeyValueStore> holder, StoreOperationRetrier retrier) {
        if (holder == null) {
            throw new IllegalArgumentException("holder cannot be null");
        }
        if (retrier == null) {
            throw new IllegalArgumentException("retrier cannot be null");
        }
        this.holder = holder;
        this.retrier = retrier;
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        return call("kv.get", client -> client.get(key));
    }

    @Override
    public void put(String key, Map<String, Object> value, Duration ttl) {
        call("kv.put", client -> {
            client.put(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean putIfAbsent(String key, Map<String, Object> value, Duration ttl) {
        return call("kv.putIfAbsent", client -> client.putIfAbsent(key, value, ttl));
    }

    @Override
    public boolean replaceIfEquals(String key, Map<String, Object> expected, Map<String, Object> value, Duration ttl) {
        return call("kv.replaceIfEquals", client -> client.replaceIfEquals(key, expected, value, ttl));
    }

    @Override
    public boolean deleteIfEquals(String key, Map<String, Object> expected) {
        return call("kv.deleteIfEquals", client -> client.deleteIfEquals(key, expected));
    }

    @Override
    public boolean delete(String key) {
        return call("kv.delete", client -> client.delete(key));
    }

    @Override
    public Set<String> keys(String prefix) {
        return call("kv.keys", client -> client.keys(prefix));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return call("kv.expire", client -> client.expire(key, ttl));
    }

    @Override
    public void ping() {
        call("kv.ping", client -> {
            client.ping();
            return null;
        });
    }

    private <R> R call(String operationName, Function<KeyValueStore, R> operation) {
        return retrier.execute(operationName, () -> {
            KeyValueStore client = holder.current();
            try {
                return operation.apply(client);
            } catch (RuntimeException e) {
                if (retrier.isTransient(e)) {
                    holder.invalidate(client);
                }
                throw e;
            }
        });
    }
}
