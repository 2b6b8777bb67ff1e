package com.github.rudygunawan.nagare.impl;

import com.github.rudygunawan.nagare.api.AsyncFunction;
import com.github.rudygunawan.nagare.builder.CacheBuilder;
import com.github.rudygunawan.nagare.metrics.CacheMetrics;
import com.github.rudygunawan.nagare.model.CacheEntry;
import com.github.rudygunawan.nagare.model.CacheStats;
import com.github.rudygunawan.nagare.model.SwrEntry;
import com.github.rudygunawan.nagare.time.Ticker;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stale-while-revalidate cache: serves cached values immediately and refreshes them in the
 * background once they are older than the stale time.
 *
 * <ul>
 *   <li>Fresh entry: returned, no fetch.
 *   <li>Stale but unexpired entry: returned immediately, and a background revalidation is
 *       started unless one is already in flight for the key.
 *   <li>Expired or missing entry: the caller waits for a fetch, sharing the in-flight one if
 *       there is one.
 * </ul>
 *
 * <p>Entries are stamped when their fetch completes. Invalidation removes cached entries only;
 * an in-flight fetch still completes and repopulates the cache.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SwrCache<K, V> implements CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.nagare.Cache");

    private final AsyncFunction<? super K, V> fetcher;
    private final long staleNanos;
    private final long cacheNanos;
    private final Ticker ticker;

    // Guarded by this
    private final Map<K, SwrEntry<V>> entries = new HashMap<>();
    private final Map<K, CompletableFuture<V>> pending = new HashMap<>();
    private long hitCount;
    private long missCount;
    private long loadSuccessCount;
    private long loadFailureCount;

    public SwrCache(CacheBuilder<? super K, ? super V> builder, AsyncFunction<? super K, V> fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.staleNanos = builder.getStaleNanos();
        this.cacheNanos = builder.getExpireAfterWriteNanos();
        this.ticker = builder.getTicker();
    }

    /**
     * Returns the value for {@code key}, immediately when a valid entry exists.
     *
     * @param key the key to look up
     * @return a future completing with the cached or freshly fetched value
     */
    public CompletableFuture<V> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        V cached;
        boolean revalidate;
        synchronized (this) {
            SwrEntry<V> entry = entries.get(key);
            long now = ticker.read();
            if (entry != null && entry.isValidAt(now)) {
                hitCount++;
                cached = entry.getValue();
                revalidate = entry.isStaleAt(now) && !pending.containsKey(key);
            } else {
                if (entry != null) {
                    entries.remove(key);
                }
                missCount++;
                CompletableFuture<V> inFlight = pending.get(key);
                if (inFlight != null) {
                    return inFlight.copy();
                }
                cached = null;
                revalidate = false;
            }
        }
        if (cached != null) {
            if (revalidate) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Revalidating stale entry in background: key=" + key);
                }
                revalidate(key);
            }
            return CompletableFuture.completedFuture(cached);
        }
        return revalidate(key).copy();
    }

    /**
     * Starts a fetch for {@code key}, or returns the one in flight.
     */
    private CompletableFuture<V> revalidate(K key) {
        CompletableFuture<V> created = new CompletableFuture<>();
        synchronized (this) {
            CompletableFuture<V> inFlight = pending.get(key);
            if (inFlight != null) {
                return inFlight;
            }
            pending.put(key, created);
        }

        CompletableFuture<V> fetch;
        try {
            fetch = fetcher.apply(key);
            if (fetch == null) {
                fetch = CompletableFuture.failedFuture(new NullPointerException("fetcher returned a null future"));
            }
        } catch (Exception e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        fetch.whenComplete((value, error) -> {
            Throwable failure = error;
            if (failure == null && value == null) {
                failure = new NullPointerException("fetcher returned null value for key: " + key);
            }
            synchronized (this) {
                pending.remove(key, created);
                if (failure == null) {
                    long now = ticker.read();
                    entries.put(key, new SwrEntry<>(value,
                            CacheEntry.deadline(now, staleNanos), CacheEntry.deadline(now, cacheNanos)));
                    loadSuccessCount++;
                } else {
                    loadFailureCount++;
                }
            }
            if (failure == null) {
                created.complete(value);
            } else {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.log(Level.FINE, "Fetch failed: key=" + key + ", keeping previous entry if any", failure);
                }
                created.completeExceptionally(failure);
            }
        });
        return created;
    }

    /**
     * Removes the cached entry for {@code key}. An in-flight fetch is not cancelled.
     */
    public synchronized void invalidate(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        entries.remove(key);
    }

    /**
     * Removes all cached entries. In-flight fetches are not cancelled.
     */
    public synchronized void invalidateAll() {
        entries.clear();
    }

    /**
     * Returns {@code true} if a fetch for {@code key} is in flight.
     */
    public synchronized boolean isRevalidating(K key) {
        return pending.containsKey(key);
    }

    public synchronized CacheStats stats() {
        return new CacheStats(hitCount, missCount, loadSuccessCount, loadFailureCount, 0, 0);
    }

    @Override
    public synchronized long size() {
        return entries.size();
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
    public long evictionCount() {
        return 0;
    }

    @Override
    public synchronized long loadSuccessCount() {
        return loadSuccessCount;
    }

    @Override
    public synchronized long loadFailureCount() {
        return loadFailureCount;
    }
}
