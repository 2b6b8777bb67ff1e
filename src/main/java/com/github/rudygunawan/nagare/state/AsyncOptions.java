package com.github.rudygunawan.nagare.state;

import com.github.rudygunawan.nagare.policy.RetryPolicy;
import com.github.rudygunawan.nagare.time.Scheduler;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Configuration of an {@link AsyncStateMachine}.
 *
 * <pre>{@code
 * AsyncOptions<Vault> options = AsyncOptions.<Vault>builder()
 *     .immediate(true)
 *     .retry(RetryPolicy.exponential(2, 500, TimeUnit.MILLISECONDS))
 *     .onError(e -> toaster.show(e.getMessage()))
 *     .build();
 * }</pre>
 *
 * @param <T> the type of the data
 */
public final class AsyncOptions<T> {
    private static final Runnable NO_OP = () -> { };

    private final T initialData;
    private final boolean immediate;
    private final Consumer<? super T> onSuccess;
    private final Consumer<? super Throwable> onError;
    private final Runnable onLoading;
    private final Runnable onReset;
    private final RetryPolicy retry;
    private final boolean abortPrevious;
    private final Scheduler scheduler;

    private AsyncOptions(Builder<T> builder) {
        this.initialData = builder.initialData;
        this.immediate = builder.immediate;
        this.onSuccess = builder.onSuccess;
        this.onError = builder.onError;
        this.onLoading = builder.onLoading;
        this.onReset = builder.onReset;
        this.retry = builder.retry;
        this.abortPrevious = builder.abortPrevious;
        this.scheduler = builder.scheduler;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Options with every default: no seeded data, deferred execution, no callbacks, no retry,
     * aborting previous runs.
     */
    public static <T> AsyncOptions<T> defaults() {
        return new Builder<T>().build();
    }

    public T initialData() {
        return initialData;
    }

    public boolean immediate() {
        return immediate;
    }

    public Consumer<? super T> onSuccess() {
        return onSuccess;
    }

    public Consumer<? super Throwable> onError() {
        return onError;
    }

    public Runnable onLoading() {
        return onLoading;
    }

    public Runnable onReset() {
        return onReset;
    }

    public RetryPolicy retry() {
        return retry;
    }

    public boolean abortPrevious() {
        return abortPrevious;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public static final class Builder<T> {
        private T initialData;
        private boolean immediate;
        private Consumer<? super T> onSuccess = data -> { };
        private Consumer<? super Throwable> onError = error -> { };
        private Runnable onLoading = NO_OP;
        private Runnable onReset = NO_OP;
        private RetryPolicy retry = RetryPolicy.none();
        private boolean abortPrevious = true;
        private Scheduler scheduler = Scheduler.systemScheduler();

        private Builder() {
        }

        /**
         * Data held while idle, and restored by a reset.
         */
        public Builder<T> initialData(T initialData) {
            this.initialData = initialData;
            return this;
        }

        /**
         * Whether to execute once, with a {@code null} argument, as soon as the machine is created.
         */
        public Builder<T> immediate(boolean immediate) {
            this.immediate = immediate;
            return this;
        }

        public Builder<T> onSuccess(Consumer<? super T> onSuccess) {
            this.onSuccess = Objects.requireNonNull(onSuccess, "onSuccess cannot be null");
            return this;
        }

        public Builder<T> onError(Consumer<? super Throwable> onError) {
            this.onError = Objects.requireNonNull(onError, "onError cannot be null");
            return this;
        }

        public Builder<T> onLoading(Runnable onLoading) {
            this.onLoading = Objects.requireNonNull(onLoading, "onLoading cannot be null");
            return this;
        }

        public Builder<T> onReset(Runnable onReset) {
            this.onReset = Objects.requireNonNull(onReset, "onReset cannot be null");
            return this;
        }

        public Builder<T> retry(RetryPolicy retry) {
            this.retry = Objects.requireNonNull(retry, "retry cannot be null");
            return this;
        }

        /**
         * Whether a new run aborts the previous one: its retries stop and its caller receives an
         * {@link ExecutionCancelledException}. Defaults to {@code true}. Either way only the latest
         * run commits state.
         */
        public Builder<T> abortPrevious(boolean abortPrevious) {
            this.abortPrevious = abortPrevious;
            return this;
        }

        /**
         * Scheduler for retry delays and polling.
         */
        public Builder<T> scheduler(Scheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
            return this;
        }

        public AsyncOptions<T> build() {
            return new AsyncOptions<>(this);
        }
    }
}
