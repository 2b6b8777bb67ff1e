package com.github.rudygunawan.nagare.model;

import java.util.Objects;

/**
 * Statistics about the performance of a cache. Instances of this class are immutable.
 *
 * <p>Cache statistics are incremented according to the following rules:
 *
 * <ul>
 *   <li>When a lookup encounters a live entry, {@code hitCount} is incremented.
 *   <li>When a lookup encounters a missing or expired entry, {@code missCount} is incremented.
 *   <li>When a fetcher backing the cache completes, {@code loadSuccessCount} or
 *       {@code loadFailureCount} is incremented.
 *   <li>When an entry is removed to make room, {@code evictionCount} is incremented; when it is
 *       purged because its time-to-live passed, {@code expirationCount} is incremented.
 * </ul>
 */
public class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long evictionCount;
    private final long expirationCount;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(
            long hitCount,
            long missCount,
            long loadSuccessCount,
            long loadFailureCount,
            long evictionCount,
            long expirationCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.evictionCount = evictionCount;
        this.expirationCount = expirationCount;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns {@code hitCount / requestCount}, or {@code 1.0} when there were no requests.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns {@code missCount / requestCount}, or {@code 0.0} when there were no requests.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    public long loadFailureCount() {
        return loadFailureCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    public long expirationCount() {
        return expirationCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheStats)) return false;
        CacheStats that = (CacheStats) o;
        return hitCount == that.hitCount
                && missCount == that.missCount
                && loadSuccessCount == that.loadSuccessCount
                && loadFailureCount == that.loadFailureCount
                && evictionCount == that.evictionCount
                && expirationCount == that.expirationCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, loadSuccessCount, loadFailureCount, evictionCount, expirationCount);
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", loadSuccessCount=" + loadSuccessCount
                + ", loadFailureCount=" + loadFailureCount
                + ", evictionCount=" + evictionCount
                + ", expirationCount=" + expirationCount
                + '}';
    }
}
