package com.github.rudygunawan.nagare.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by {@link MicrometerCacheMetrics} to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    long hitCount();

    long missCount();

    /**
     * Returns the number of entries removed by size or expiry.
     */
    long evictionCount();

    /**
     * Returns the number of successful fetches, for caches backed by a fetcher.
     */
    long loadSuccessCount();

    long loadFailureCount();
}
