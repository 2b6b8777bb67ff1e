package com.github.rudygunawan.nagare.policy;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * How many times a failed operation is retried and how long to wait in between.
 *
 * <p>With linear backoff every wait is {@code delay}; with exponential backoff the wait after
 * failed attempt {@code i} (zero-based) is {@code delay * 2^i}. No jitter is added.
 */
public final class RetryPolicy {
    private static final RetryPolicy NONE = new RetryPolicy(0, 0, false);

    private final int retries;
    private final long delayMillis;
    private final boolean exponential;

    private RetryPolicy(int retries, long delayMillis, boolean exponential) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative");
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        this.retries = retries;
        this.delayMillis = delayMillis;
        this.exponential = exponential;
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy none() {
        return NONE;
    }

    /**
     * Retries up to {@code retries} times, waiting {@code delay} before each retry.
     */
    public static RetryPolicy linear(int retries, long delay, TimeUnit unit) {
        return new RetryPolicy(retries, unit.toMillis(delay), false);
    }

    /**
     * Retries up to {@code retries} times, doubling the wait after each failure.
     */
    public static RetryPolicy exponential(int retries, long delay, TimeUnit unit) {
        return new RetryPolicy(retries, unit.toMillis(delay), true);
    }

    public static RetryPolicy of(int retries, long delay, TimeUnit unit, boolean exponential) {
        return new RetryPolicy(retries, unit.toMillis(delay), exponential);
    }

    public int retries() {
        return retries;
    }

    public int maxAttempts() {
        return retries + 1;
    }

    public long delayMillis() {
        return delayMillis;
    }

    public boolean isExponential() {
        return exponential;
    }

    /**
     * Returns the wait in milliseconds after failed attempt {@code attempt} (zero-based).
     */
    public long delayAfterAttempt(int attempt) {
        if (!exponential) {
            return delayMillis;
        }
        int shift = Math.min(attempt, 62);
        long factor = 1L << shift;
        return delayMillis > Long.MAX_VALUE / factor ? Long.MAX_VALUE : delayMillis * factor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryPolicy)) return false;
        RetryPolicy that = (RetryPolicy) o;
        return retries == that.retries && delayMillis == that.delayMillis && exponential == that.exponential;
    }

    @Override
    public int hashCode() {
        return Objects.hash(retries, delayMillis, exponential);
    }

    @Override
    public String toString() {
        return "RetryPolicy{retries=" + retries + ", delayMillis=" + delayMillis + ", exponential=" + exponential + '}';
    }
}
