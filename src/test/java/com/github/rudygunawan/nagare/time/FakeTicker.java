package com.github.rudygunawan.nagare.time;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Ticker} whose time only moves when a test advances it.
 *
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * MemoryCache<String, Balance> cache = CacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .expireAfterWrite(10, TimeUnit.SECONDS)
 *     .build();
 *
 * cache.put("alice", balance);
 * ticker.advance(11, TimeUnit.SECONDS);
 * assertNull(cache.getIfPresent("alice"));
 * }</pre>
 *
 * <p>Thread-safe.
 */
public class FakeTicker implements Ticker {

    private final AtomicLong nanos = new AtomicLong();

    /**
     * Advances the ticker. Negative durations are ignored.
     */
    public FakeTicker advance(long duration, TimeUnit unit) {
        return advance(unit.toNanos(duration));
    }

    public FakeTicker advance(long nanoseconds) {
        if (nanoseconds > 0) {
            nanos.addAndGet(nanoseconds);
        }
        return this;
    }

    @Override
    public long read() {
        return nanos.get();
    }

    @Override
    public String toString() {
        return "FakeTicker(" + nanos.get() + " ns)";
    }
}
