package com.github.rudygunawan.nagare.policy;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was manually removed using {@code invalidate} or {@code invalidateAll}.
     */
    EXPLICIT,

    /**
     * The entry was removed automatically because its value was replaced by a new value.
     */
    REPLACED,

    /**
     * The entry was the least recently used one when a new key was inserted into a full cache.
     */
    SIZE,

    /**
     * The entry's time-to-live had passed when it was encountered.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than manual removal or replacement.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
