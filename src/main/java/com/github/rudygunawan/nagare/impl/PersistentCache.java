package com.github.rudygunawan.nagare.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rudygunawan.nagare.api.Cache;
import com.github.rudygunawan.nagare.storage.KeyValueStorage;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort cache that survives restarts by writing JSON documents to a
 * {@link KeyValueStorage}.
 *
 * <p>Each value is stored under {@code namespace + ":" + key} as
 * {@code {"value": ..., "expiresAt": <epoch millis>}}. This cache is an optimization, not a store
 * of record: every storage, encoding or decoding failure is logged at FINE and degrades to a miss
 * (reads) or a no-op (writes).
 *
 * @param <V> the type of values, which must be serializable by Jackson
 */
public class PersistentCache<V> implements Cache<String, V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.nagare.Cache");
    private static final String VALUE = "value";
    private static final String EXPIRES_AT = "expiresAt";

    private final ObjectMapper mapper = new ObjectMapper();
    private final String prefix;
    private final KeyValueStorage storage;
    private final Class<V> valueType;
    private final long ttlMillis;
    private final Clock clock;

    public PersistentCache(String namespace, KeyValueStorage storage, Class<V> valueType, long ttlMillis, Clock clock) {
        this.prefix = Objects.requireNonNull(namespace, "namespace cannot be null") + ":";
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType cannot be null");
        this.ttlMillis = ttlMillis;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public V getIfPresent(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        String storageKey = prefix + key;
        try {
            String raw = storage.getItem(storageKey);
            if (raw == null) {
                return null;
            }
            JsonNode document = mapper.readTree(raw);
            if (clock.millis() > document.path(EXPIRES_AT).asLong(0)) {
                storage.removeItem(storageKey);
                return null;
            }
            JsonNode value = document.get(VALUE);
            if (value == null || value.isNull()) {
                return null;
            }
            return mapper.treeToValue(value, valueType);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "Persistent cache read failed, treating as miss: key=" + storageKey, e);
            return null;
        }
    }

    @Override
    public void put(String key, V value) {
        write(key, value, ttlMillis);
    }

    @Override
    public void put(String key, V value, long ttl, TimeUnit unit) {
        if (ttl <= 0) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl + " " + unit);
        }
        write(key, value, unit.toMillis(ttl));
    }

    private void write(String key, V value, long entryTtlMillis) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        String storageKey = prefix + key;
        try {
            ObjectNode document = mapper.createObjectNode();
            document.set(VALUE, mapper.valueToTree(value));
            document.put(EXPIRES_AT, clock.millis() + entryTtlMillis);
            storage.setItem(storageKey, mapper.writeValueAsString(document));
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "Persistent cache write failed, skipping: key=" + storageKey, e);
        }
    }

    @Override
    public boolean containsKey(String key) {
        return getIfPresent(key) != null;
    }

    @Override
    public boolean invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        try {
            return storage.removeItem(prefix + key);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "Persistent cache delete failed: key=" + prefix + key, e);
            return false;
        }
    }

    /**
     * Removes every item of this namespace. Items of other namespaces are left alone.
     */
    @Override
    public void invalidateAll() {
        try {
            for (String storageKey : storage.keys()) {
                if (storageKey.startsWith(prefix)) {
                    storage.removeItem(storageKey);
                }
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "Persistent cache clear failed: namespace=" + prefix, e);
        }
    }

    /**
     * Returns the number of live items in this namespace, purging expired ones.
     */
    @Override
    public long size() {
        Set<String> keys;
        try {
            keys = storage.keys();
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "Persistent cache listing failed: namespace=" + prefix, e);
            return 0;
        }
        long live = 0;
        for (String storageKey : keys) {
            if (storageKey.startsWith(prefix) && containsKey(storageKey.substring(prefix.length()))) {
                live++;
            }
        }
        return live;
    }
}
