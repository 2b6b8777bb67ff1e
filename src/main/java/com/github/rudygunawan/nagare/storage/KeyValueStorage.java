package com.github.rudygunawan.nagare.storage;

import java.io.IOException;
import java.util.Set;

/**
 * A flat string key-value store used by {@link com.github.rudygunawan.nagare.impl.PersistentCache}.
 *
 * <p>Any method may fail with an {@link IOException}; callers treat storage as an optimization and
 * degrade to a miss.
 */
public interface KeyValueStorage {

    /**
     * Returns the stored item, or {@code null} if there is none.
     */
    String getItem(String key) throws IOException;

    void setItem(String key, String value) throws IOException;

    /**
     * Removes the item if present.
     *
     * @return {@code true} if an item was removed
     */
    boolean removeItem(String key) throws IOException;

    /**
     * Returns a snapshot of all stored keys.
     */
    Set<String> keys() throws IOException;
}
