package com.github.rudygunawan.nagare.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Caches and queues read time exclusively through a Ticker, so expiration, staleness and
 * rate limiting can be tested without relying on the system clock. During testing, provide a
 * fake Ticker implementation that you control.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * MemoryCache<String, User> cache = CacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .expireAfterWrite(10, TimeUnit.MINUTES)
 *     .build();
 *
 * cache.put("user1", user);
 * ticker.advance(11, TimeUnit.MINUTES);
 * assertNull(cache.getIfPresent("user1"));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>This method should have the same properties as {@link System#nanoTime()}: monotonic and
     * not related to wall-clock time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
