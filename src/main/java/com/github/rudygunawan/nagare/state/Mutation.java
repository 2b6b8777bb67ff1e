package com.github.rudygunawan.nagare.state;

import com.github.rudygunawan.nagare.api.AsyncFunction;
import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.util.Futures;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.logging.Level;

/**
 * Tracks the state of a write operation. Unlike {@link AsyncStateMachine} a failure is handed back
 * to the caller of {@link #mutate(Object)} and there is no retry or supersession: the last
 * settled mutation wins.
 *
 * @param <V> the type of the variables passed to the operation
 * @param <T> the type of the result
 */
public class Mutation<V, T> {
    private final AsyncFunction<? super V, T> function;
    private final BiConsumer<? super T, ? super V> onSuccess;
    private final BiConsumer<? super Throwable, ? super V> onError;
    private final SettledCallback<? super T, ? super V> onSettled;

    // Guarded by this
    private AsyncState<T> state = AsyncState.idle(null);

    private Mutation(Builder<V, T> builder) {
        this.function = builder.function;
        this.onSuccess = builder.onSuccess;
        this.onError = builder.onError;
        this.onSettled = builder.onSettled;
    }

    public static <V, T> Builder<V, T> newBuilder(AsyncFunction<? super V, T> function) {
        return new Builder<>(function);
    }

    /**
     * Runs the operation with {@code variables}.
     *
     * @return a future completing with the result or failing with the operation's error
     */
    public CompletableFuture<T> mutate(V variables) {
        synchronized (this) {
            state = state.toLoading();
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        AsyncTask.start(function.bind(variables)).whenComplete((data, error) -> {
            if (error == null) {
                synchronized (this) {
                    state = AsyncState.success(data);
                }
                invoke("onSuccess", () -> onSuccess.accept(data, variables));
                invoke("onSettled", () -> onSettled.onSettled(data, null, variables));
                result.complete(data);
            } else {
                Throwable failure = Futures.unwrap(error);
                synchronized (this) {
                    state = AsyncState.failure(failure);
                }
                invoke("onError", () -> onError.accept(failure, variables));
                invoke("onSettled", () -> onSettled.onSettled(null, failure, variables));
                result.completeExceptionally(failure);
            }
        });
        return result;
    }

    public synchronized void reset() {
        state = AsyncState.idle(null);
    }

    public synchronized AsyncState<T> getState() {
        return state;
    }

    private static void invoke(String callback, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            AsyncStateMachine.LOGGER.log(Level.WARNING, callback + " callback threw exception", e);
        }
    }

    /**
     * Called after a mutation settled either way. Exactly one of {@code data} and {@code error} is
     * meaningful.
     */
    @FunctionalInterface
    public interface SettledCallback<T, V> {
        void onSettled(T data, Throwable error, V variables);
    }

    public static final class Builder<V, T> {
        private final AsyncFunction<? super V, T> function;
        private BiConsumer<? super T, ? super V> onSuccess = (data, variables) -> { };
        private BiConsumer<? super Throwable, ? super V> onError = (error, variables) -> { };
        private SettledCallback<? super T, ? super V> onSettled = (data, error, variables) -> { };

        private Builder(AsyncFunction<? super V, T> function) {
            this.function = Objects.requireNonNull(function, "function cannot be null");
        }

        public Builder<V, T> onSuccess(BiConsumer<? super T, ? super V> onSuccess) {
            this.onSuccess = Objects.requireNonNull(onSuccess, "onSuccess cannot be null");
            return this;
        }

        public Builder<V, T> onError(BiConsumer<? super Throwable, ? super V> onError) {
            this.onError = Objects.requireNonNull(onError, "onError cannot be null");
            return this;
        }

        public Builder<V, T> onSettled(SettledCallback<? super T, ? super V> onSettled) {
            this.onSettled = Objects.requireNonNull(onSettled, "onSettled cannot be null");
            return this;
        }

        public Mutation<V, T> build() {
            return new Mutation<>(this);
        }
    }
}
