package com.github.rudygunawan.nagare.api;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A semi-persistent mapping from keys to values. Entries are manually added using
 * {@link #put(Object, Object)} and stay in the cache until they expire, are evicted or are
 * manually invalidated.
 *
 * <p>Null values are not permitted, so an empty {@link Optional} from {@link #get(Object)} or a
 * {@code null} from {@link #getIfPresent(Object)} always means "not found".
 *
 * <p>Implementations of this interface are thread-safe.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

    /**
     * Returns the value associated with {@code key}, or {@code null} if there is no live value.
     * An expired entry encountered by this call is purged.
     *
     * @param key the key whose associated value is to be returned
     * @return the cached value, or {@code null} on a miss
     */
    V getIfPresent(K key);

    /**
     * Returns the value associated with {@code key}, or an empty optional on a miss.
     *
     * @param key the key whose associated value is to be returned
     * @return the cached value, if present
     */
    default Optional<V> get(K key) {
        return Optional.ofNullable(getIfPresent(key));
    }

    /**
     * Associates {@code value} with {@code key} using the cache's default time-to-live.
     *
     * @param key the key with which the specified value is to be associated
     * @param value the value to be associated with the specified key
     */
    void put(K key, V value);

    /**
     * Associates {@code value} with {@code key}, expiring after the given duration instead of the
     * cache's default time-to-live.
     *
     * @param key the key with which the specified value is to be associated
     * @param value the value to be associated with the specified key
     * @param ttl the time-to-live of this entry
     * @param unit the unit of {@code ttl}
     */
    void put(K key, V value, long ttl, TimeUnit unit);

    /**
     * Returns {@code true} if a live value is associated with {@code key}. This does not count as
     * an access for eviction purposes.
     */
    boolean containsKey(K key);

    /**
     * Discards any cached value for {@code key}. Invalidating a missing key is a no-op.
     *
     * @param key the key whose mapping is to be removed from the cache
     * @return {@code true} if an entry was removed
     */
    boolean invalidate(K key);

    /**
     * Discards all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns the number of live entries in this cache.
     */
    long size();
}
