package com.github.rudygunawan.nagare.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for cache metrics.
 * Binds the counters of a {@link CacheMetrics} source to a MeterRegistry.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions by size or expiry
 *   <li>cache.loads - Fetches, tagged {@code result=success|failure}
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MemoryCache<String, Balance> balances = CacheBuilder.newBuilder()
 *     .maximumSize(500)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, balances, "balances");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName,
                                                     Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of successful fetches")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of failed fetches")
                .register(registry);

        // Hit ratio (derived metric)
        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);
    }
}
