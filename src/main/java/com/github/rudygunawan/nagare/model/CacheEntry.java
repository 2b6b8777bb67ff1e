package com.github.rudygunawan.nagare.model;

/**
 * A cache entry that wraps a value with its expiration time.
 *
 * <p>Times are {@link com.github.rudygunawan.nagare.time.Ticker} readings in nanoseconds. Recency
 * is tracked by the owning cache's ordering, not by the entry.
 *
 * @param <V> the type of the cached value
 */
public class CacheEntry<V> {
    private final V value;
    private final long expirationTime;

    /**
     * Creates a new cache entry.
     *
     * @param value the value to cache
     * @param now the current ticker reading
     * @param ttlNanos the time-to-live in nanoseconds, or 0 or less for no expiration
     */
    public CacheEntry(V value, long now, long ttlNanos) {
        this.value = value;
        this.expirationTime = ttlNanos > 0 ? deadline(now, ttlNanos) : Long.MAX_VALUE;
    }

    /**
     * Returns {@code now + durationNanos}, saturated at {@link Long#MAX_VALUE}.
     */
    public static long deadline(long now, long durationNanos) {
        long deadline = now + durationNanos;
        return durationNanos > 0 && deadline < now ? Long.MAX_VALUE : deadline;
    }

    public V getValue() {
        return value;
    }

    public long getExpirationTime() {
        return expirationTime;
    }

    /**
     * Returns true if this entry has expired at {@code now}. An entry is still live at exactly its
     * expiration time.
     */
    public boolean isExpiredAt(long now) {
        return now > expirationTime;
    }
}
