package com.github.rudygunawan.nagare.model;

/**
 * An entry of a stale-while-revalidate cache. Immutable; a revalidation replaces the entry.
 *
 * <p>Before {@code staleAt} the value is fresh. Between {@code staleAt} and {@code expiresAt} it
 * is served but triggers a background refresh. After {@code expiresAt} it is unusable.
 *
 * @param <V> the type of the cached value
 */
public final class SwrEntry<V> {
    private final V value;
    private final long staleAt;
    private final long expiresAt;

    public SwrEntry(V value, long staleAt, long expiresAt) {
        if (staleAt >= expiresAt) {
            throw new IllegalArgumentException("staleAt must be before expiresAt");
        }
        this.value = value;
        this.staleAt = staleAt;
        this.expiresAt = expiresAt;
    }

    public V getValue() {
        return value;
    }

    public long getStaleAt() {
        return staleAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isValidAt(long now) {
        return now < expiresAt;
    }

    public boolean isStaleAt(long now) {
        return now > staleAt;
    }
}
