package com.github.rudygunawan.nagare.api;

import java.util.concurrent.CompletableFuture;

/**
 * An asynchronous function of one argument, such as a fetcher keyed by a cache key or an
 * operation driven by an {@code AsyncStateMachine}.
 *
 * @param <A> the type of the argument
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface AsyncFunction<A, T> {

    /**
     * Starts the work for {@code argument}.
     *
     * @param argument the argument, may be {@code null} when the operation takes none
     * @return a future completing with the result of the work
     * @throws Exception if the work fails before it could be started asynchronously
     */
    CompletableFuture<T> apply(A argument) throws Exception;

    /**
     * Binds {@code argument} to this function, yielding a task.
     */
    default AsyncTask<T> bind(A argument) {
        return () -> apply(argument);
    }
}
