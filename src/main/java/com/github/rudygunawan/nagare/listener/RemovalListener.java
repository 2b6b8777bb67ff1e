package com.github.rudygunawan.nagare.listener;

import com.github.rudygunawan.nagare.policy.RemovalCause;

/**
 * A listener that receives notification when an entry is removed from a cache.
 *
 * <p>The listener is called synchronously by the thread that caused the removal, after the cache
 * released its lock. Implementations should be fast; exceptions are logged and ignored.
 *
 * <pre>{@code
 * MemoryCache<String, Quote> cache = CacheBuilder.newBuilder()
 *     .maximumSize(100)
 *     .removalListener((key, value, cause) -> log.fine(key + " removed: " + cause))
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * Notifies the listener that a removal occurred.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(K key, V value, RemovalCause cause);
}
