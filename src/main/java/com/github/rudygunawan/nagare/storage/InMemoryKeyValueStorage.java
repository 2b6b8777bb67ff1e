package com.github.rudygunawan.nagare.storage;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local storage. Useful for tests and for hosts without a writable disk.
 */
public class InMemoryKeyValueStorage implements KeyValueStorage {

    private final ConcurrentHashMap<String, String> items = new ConcurrentHashMap<>();

    @Override
    public String getItem(String key) {
        return items.get(key);
    }

    @Override
    public void setItem(String key, String value) {
        items.put(key, value);
    }

    @Override
    public boolean removeItem(String key) {
        return items.remove(key) != null;
    }

    @Override
    public Set<String> keys() {
        return new HashSet<>(items.keySet());
    }
}
