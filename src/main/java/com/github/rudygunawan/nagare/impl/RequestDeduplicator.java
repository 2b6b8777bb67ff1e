package com.github.rudygunawan.nagare.impl;

import com.github.rudygunawan.nagare.api.AsyncTask;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collapses concurrent identical requests into one underlying call.
 *
 * <p>While a call for a key is in flight, further calls for that key receive the same outcome
 * without invoking their task. The pending entry is removed before callers are notified, so any
 * call made after completion (success or failure) starts a fresh attempt.
 *
 * <pre>{@code
 * RequestDeduplicator<String, Account> dedup = new RequestDeduplicator<>();
 * CompletableFuture<Account> a = dedup.execute(address, () -> client.account(address));
 * CompletableFuture<Account> b = dedup.execute(address, () -> client.account(address));
 * // client.account was called once; a and b complete with the same Account instance
 * }</pre>
 *
 * @param <K> the type of request keys
 * @param <T> the type of results
 */
public class RequestDeduplicator<K, T> {

    private final ConcurrentHashMap<K, CompletableFuture<T>> pending = new ConcurrentHashMap<>();

    /**
     * Runs {@code task} unless a call for {@code key} is already in flight, in which case the
     * in-flight outcome is shared.
     *
     * <p>Each caller gets its own dependent future, so cancelling one does not affect the others.
     *
     * @param key the request key
     * @param task the work to run if nothing is in flight for {@code key}
     * @return a future completing with the shared outcome
     */
    public CompletableFuture<T> execute(K key, AsyncTask<T> task) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(task, "task cannot be null");

        CompletableFuture<T> created = new CompletableFuture<>();
        CompletableFuture<T> existing = pending.putIfAbsent(key, created);
        if (existing != null) {
            return existing.copy();
        }

        AsyncTask.start(task).whenComplete((value, error) -> {
            pending.remove(key, created);
            if (error != null) {
                created.completeExceptionally(error);
            } else {
                created.complete(value);
            }
        });
        return created.copy();
    }

    /**
     * Returns the number of keys with a call in flight.
     */
    public int inFlight() {
        return pending.size();
    }

    /**
     * Returns {@code true} if a call for {@code key} is in flight.
     */
    public boolean isInFlight(K key) {
        return pending.containsKey(key);
    }
}
