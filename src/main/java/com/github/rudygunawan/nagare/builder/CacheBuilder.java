package com.github.rudygunawan.nagare.builder;

import com.github.rudygunawan.nagare.api.AsyncFunction;
import com.github.rudygunawan.nagare.impl.MemoryCache;
import com.github.rudygunawan.nagare.impl.PersistentCache;
import com.github.rudygunawan.nagare.impl.SwrCache;
import com.github.rudygunawan.nagare.listener.RemovalListener;
import com.github.rudygunawan.nagare.storage.KeyValueStorage;
import com.github.rudygunawan.nagare.time.Ticker;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link MemoryCache}, {@link SwrCache} and {@link PersistentCache} instances.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoryCache<String, Balance> balances = CacheBuilder.newBuilder()
 *     .maximumSize(500)
 *     .expireAfterWrite(30, TimeUnit.SECONDS)
 *     .build();
 *
 * SwrCache<String, Price> prices = CacheBuilder.newBuilder()
 *     .staleTime(10, TimeUnit.SECONDS)
 *     .expireAfterWrite(2, TimeUnit.MINUTES)
 *     .buildSwr(symbol -> priceClient.fetch(symbol));
 * }</pre>
 *
 * <p>For an SWR cache, {@link #expireAfterWrite} is the cache time: how long a fetched value may
 * be served at all. {@link #staleTime} must be shorter.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class CacheBuilder<K, V> {
    static final long DEFAULT_TTL_NANOS = TimeUnit.MINUTES.toNanos(5);
    static final long DEFAULT_MAXIMUM_SIZE = 1000;
    static final long DEFAULT_STALE_NANOS = TimeUnit.SECONDS.toNanos(30);
    static final long DEFAULT_PERSISTENT_TTL_NANOS = TimeUnit.HOURS.toNanos(24);
    private static final long UNSET = -1;

    private long maximumSize = DEFAULT_MAXIMUM_SIZE;
    private long expireAfterWriteNanos = UNSET;
    private long staleNanos = DEFAULT_STALE_NANOS;
    private Ticker ticker = Ticker.systemTicker();
    private Clock clock = Clock.systemUTC();
    private RemovalListener<? super K, ? super V> removalListener;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings: a maximum size of
     * 1000 entries and a time-to-live of five minutes.
     */
    public static CacheBuilder<Object, Object> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Specifies the maximum number of entries a {@link MemoryCache} may contain. When a new key is
     * written into a full cache, the least recently used entry is evicted.
     *
     * @param size the maximum size of the cache
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public CacheBuilder<K, V> maximumSize(long size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maximum size must be positive");
        }
        this.maximumSize = size;
        return this;
    }

    /**
     * Specifies that each entry should be removed once the given duration has elapsed after the
     * entry was written. Individual writes may override it.
     *
     * @param duration the length of time after an entry is written that it should be removed
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public CacheBuilder<K, V> expireAfterWrite(long duration, TimeUnit unit) {
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive: " + duration + " " + unit);
        }
        this.expireAfterWriteNanos = unit.toNanos(duration);
        return this;
    }

    /**
     * Specifies how long a value fetched by an SWR cache is served without triggering a
     * background revalidation.
     *
     * @param duration the staleness threshold
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if {@code duration} is negative
     */
    public CacheBuilder<K, V> staleTime(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new IllegalArgumentException("stale time must not be negative");
        }
        this.staleNanos = unit.toNanos(duration);
        return this;
    }

    /**
     * Specifies the time source used for expiration and staleness. Useful for testing.
     */
    public CacheBuilder<K, V> ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    /**
     * Specifies the wall clock used by persistent caches, whose expiry timestamps must survive a
     * restart.
     */
    public CacheBuilder<K, V> clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        return this;
    }

    /**
     * Specifies a listener notified each time an entry is removed from a {@link MemoryCache}.
     *
     * @param listener the listener
     * @return this builder instance, with narrowed types
     */
    @SuppressWarnings("unchecked")
    public <K1 extends K, V1 extends V> CacheBuilder<K1, V1> removalListener(
            RemovalListener<? super K1, ? super V1> listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        CacheBuilder<K1, V1> self = (CacheBuilder<K1, V1>) this;
        self.removalListener = listener;
        return self;
    }

    /**
     * Builds an in-memory TTL/LRU cache.
     */
    public <K1 extends K, V1 extends V> MemoryCache<K1, V1> build() {
        return new MemoryCache<>(this);
    }

    /**
     * Builds a stale-while-revalidate cache backed by {@code fetcher}.
     *
     * @throws IllegalStateException if the stale time is not shorter than the cache time
     */
    public <K1 extends K, V1 extends V> SwrCache<K1, V1> buildSwr(AsyncFunction<? super K1, V1> fetcher) {
        Objects.requireNonNull(fetcher, "fetcher cannot be null");
        if (staleNanos >= getExpireAfterWriteNanos()) {
            throw new IllegalStateException("stale time must be shorter than cache time");
        }
        return new SwrCache<>(this, fetcher);
    }

    /**
     * Builds a best-effort persistent cache storing JSON-encoded values of {@code valueType} in
     * {@code storage} under keys prefixed with {@code namespace + ":"}. The default time-to-live
     * is 24 hours.
     */
    public <V1 extends V> PersistentCache<V1> buildPersistent(
            String namespace, KeyValueStorage storage, Class<V1> valueType) {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(storage, "storage cannot be null");
        Objects.requireNonNull(valueType, "valueType cannot be null");
        long ttl = expireAfterWriteNanos == UNSET ? DEFAULT_PERSISTENT_TTL_NANOS : expireAfterWriteNanos;
        return new PersistentCache<>(namespace, storage, valueType, TimeUnit.NANOSECONDS.toMillis(ttl), clock);
    }

    // Getters for the cache implementations

    public long getMaximumSize() {
        return maximumSize;
    }

    public long getExpireAfterWriteNanos() {
        return expireAfterWriteNanos == UNSET ? DEFAULT_TTL_NANOS : expireAfterWriteNanos;
    }

    public long getStaleNanos() {
        return staleNanos;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public RemovalListener<? super K, ? super V> getRemovalListener() {
        return removalListener;
    }
}
