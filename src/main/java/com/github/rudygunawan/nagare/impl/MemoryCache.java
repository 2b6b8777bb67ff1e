package com.github.rudygunawan.nagare.impl;

import com.github.rudygunawan.nagare.api.Cache;
import com.github.rudygunawan.nagare.builder.CacheBuilder;
import com.github.rudygunawan.nagare.listener.RemovalListener;
import com.github.rudygunawan.nagare.metrics.CacheMetrics;
import com.github.rudygunawan.nagare.model.CacheEntry;
import com.github.rudygunawan.nagare.model.CacheStats;
import com.github.rudygunawan.nagare.policy.RemovalCause;
import com.github.rudygunawan.nagare.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-memory cache with per-entry time-to-live and least-recently-used eviction.
 *
 * <p>Entries are kept in an insertion-ordered map. Every read that hits, and every write, moves
 * the entry to the tail, so the head is always the entry with the oldest access time and eviction
 * is O(1). Every write into a full cache first evicts exactly one entry, the least recently used,
 * even when the written key is already present.
 *
 * <p>Expired entries are purged lazily: by the read that encounters them and by the sweep that
 * {@link #size()} and {@link #cleanUp()} perform. There is no background timer.
 *
 * <p>Logging: uses java.util.logging under the logger name
 * {@code com.github.rudygunawan.nagare.Cache}. Listener failures are logged at WARNING, evictions
 * at FINE and entry writes at FINER.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class MemoryCache<K, V> implements Cache<K, V>, CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.nagare.Cache");

    private final LinkedHashMap<K, CacheEntry<V>> storage = new LinkedHashMap<>();
    private final long maximumSize;
    private final long ttlNanos;
    private final Ticker ticker;
    private final RemovalListener<? super K, ? super V> removalListener;

    // Statistics, guarded by this
    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long expirationCount;

    @SuppressWarnings("unchecked")
    public MemoryCache(CacheBuilder<? super K, ? super V> builder) {
        this.maximumSize = builder.getMaximumSize();
        this.ttlNanos = builder.getExpireAfterWriteNanos();
        this.ticker = builder.getTicker();
        this.removalListener = (RemovalListener<? super K, ? super V>) builder.getRemovalListener();
    }

    @Override
    public V getIfPresent(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        CacheEntry<V> expired;
        synchronized (this) {
            CacheEntry<V> entry = storage.get(key);
            if (entry == null) {
                missCount++;
                return null;
            }
            if (!entry.isExpiredAt(ticker.read())) {
                moveToTail(key, entry);
                hitCount++;
                return entry.getValue();
            }
            storage.remove(key);
            missCount++;
            expirationCount++;
            expired = entry;
        }
        fireRemovalEvent(key, expired.getValue(), RemovalCause.EXPIRED);
        return null;
    }

    @Override
    public void put(K key, V value) {
        putInternal(key, value, ttlNanos);
    }

    @Override
    public void put(K key, V value, long ttl, TimeUnit unit) {
        if (ttl <= 0) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl + " " + unit);
        }
        putInternal(key, value, unit.toNanos(ttl));
    }

    private void putInternal(K key, V value, long entryTtlNanos) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        List<Removal<K, V>> removals = new ArrayList<>(2);
        synchronized (this) {
            long now = ticker.read();
            if (storage.size() >= maximumSize) {
                Removal<K, V> evicted = evictLeastRecentlyUsed();
                if (evicted != null) {
                    removals.add(evicted);
                }
            }
            CacheEntry<V> old = storage.remove(key);
            if (old != null) {
                removals.add(new Removal<>(key, old.getValue(),
                        old.isExpiredAt(now) ? RemovalCause.EXPIRED : RemovalCause.REPLACED));
            }
            storage.put(key, new CacheEntry<>(value, now, entryTtlNanos));
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Stored entry: key=" + key + ", ttlNanos=" + entryTtlNanos);
        }
        fireRemovalEvents(removals);
    }

    /**
     * Removes the head of the storage. Must be called while holding the lock.
     */
    private Removal<K, V> evictLeastRecentlyUsed() {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = storage.entrySet().iterator();
        if (!it.hasNext()) {
            return null;
        }
        Map.Entry<K, CacheEntry<V>> eldest = it.next();
        it.remove();
        evictionCount++;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted entry due to size limit: key=" + eldest.getKey() + ", size=" + storage.size());
        }
        return new Removal<>(eldest.getKey(), eldest.getValue().getValue(), RemovalCause.SIZE);
    }

    private void moveToTail(K key, CacheEntry<V> entry) {
        storage.remove(key);
        storage.put(key, entry);
    }

    @Override
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        CacheEntry<V> expired;
        synchronized (this) {
            CacheEntry<V> entry = storage.get(key);
            if (entry == null) {
                return false;
            }
            if (!entry.isExpiredAt(ticker.read())) {
                return true;
            }
            storage.remove(key);
            expirationCount++;
            expired = entry;
        }
        fireRemovalEvent(key, expired.getValue(), RemovalCause.EXPIRED);
        return false;
    }

    @Override
    public boolean invalidate(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        CacheEntry<V> removed;
        synchronized (this) {
            removed = storage.remove(key);
        }
        if (removed == null) {
            return false;
        }
        fireRemovalEvent(key, removed.getValue(), RemovalCause.EXPLICIT);
        return true;
    }

    @Override
    public void invalidateAll() {
        List<Removal<K, V>> removals = new ArrayList<>();
        synchronized (this) {
            for (Map.Entry<K, CacheEntry<V>> entry : storage.entrySet()) {
                removals.add(new Removal<>(entry.getKey(), entry.getValue().getValue(), RemovalCause.EXPLICIT));
            }
            storage.clear();
        }
        fireRemovalEvents(removals);
    }

    /**
     * Returns the number of live entries, purging expired ones first.
     */
    @Override
    public long size() {
        cleanUp();
        synchronized (this) {
            return storage.size();
        }
    }

    /**
     * Purges every expired entry.
     */
    public void cleanUp() {
        List<Removal<K, V>> removals = new ArrayList<>();
        synchronized (this) {
            long now = ticker.read();
            Iterator<Map.Entry<K, CacheEntry<V>>> it = storage.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, CacheEntry<V>> entry = it.next();
                if (entry.getValue().isExpiredAt(now)) {
                    it.remove();
                    expirationCount++;
                    removals.add(new Removal<>(entry.getKey(), entry.getValue().getValue(), RemovalCause.EXPIRED));
                }
            }
        }
        if (!removals.isEmpty() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Purged " + removals.size() + " expired entries");
        }
        fireRemovalEvents(removals);
    }

    /**
     * Returns a snapshot of the keys from least to most recently used, including entries that have
     * expired but were not purged yet.
     */
    public synchronized List<K> keysInAccessOrder() {
        return Collections.unmodifiableList(new ArrayList<>(storage.keySet()));
    }

    public synchronized CacheStats stats() {
        return new CacheStats(hitCount, missCount, 0, 0, evictionCount, expirationCount);
    }

    @Override
    public synchronized long hitCount() {
        return hitCount;
    }

    @Override
    public synchronized long missCount() {
        return missCount;
    }

    @Override
    public synchronized long evictionCount() {
        return evictionCount + expirationCount;
    }

    @Override
    public long loadSuccessCount() {
        return 0;
    }

    @Override
    public long loadFailureCount() {
        return 0;
    }

    private void fireRemovalEvents(List<Removal<K, V>> removals) {
        for (Removal<K, V> removal : removals) {
            fireRemovalEvent(removal.key, removal.value, removal.cause);
        }
    }

    private void fireRemovalEvent(K key, V value, RemovalCause cause) {
        if (removalListener == null) {
            return;
        }
        try {
            removalListener.onRemoval(key, value, cause);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key + ", cause: " + cause, e);
        }
    }

    private static final class Removal<K, V> {
        final K key;
        final V value;
        final RemovalCause cause;

        Removal(K key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }
}
