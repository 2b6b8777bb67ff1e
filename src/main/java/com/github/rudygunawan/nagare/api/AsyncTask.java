package com.github.rudygunawan.nagare.api;

import java.util.concurrent.CompletableFuture;

/**
 * A zero-argument asynchronous unit of work producing a {@code T} or failing.
 *
 * <p>A task that throws from {@link #call()} is treated exactly like a task that returns a failed
 * future. Use {@link #start(AsyncTask)} to invoke a task with that conversion applied.
 *
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface AsyncTask<T> {

    /**
     * Starts the work and returns its pending result.
     *
     * @return a future completing with the result of the work
     * @throws Exception if the work fails before it could be started asynchronously
     */
    CompletableFuture<T> call() throws Exception;

    /**
     * Invokes {@code task}, converting a synchronous throw or a {@code null} future into a failed
     * future.
     *
     * @param task the task to start
     * @param <T> the type of the produced value
     * @return the task's future, never {@code null}
     */
    static <T> CompletableFuture<T> start(AsyncTask<T> task) {
        try {
            CompletableFuture<T> future = task.call();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("task returned a null future"));
            }
            return future;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
