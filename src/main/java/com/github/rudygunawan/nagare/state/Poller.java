package com.github.rudygunawan.nagare.state;

import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.listener.StateListener;

import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Re-executes an operation at a fixed interval and exposes its latest state.
 *
 * <p>A tick is skipped while the previous run is still loading, and after a failed run unless
 * {@code retryOnError} is set. Ticks are scheduled on the options' scheduler.
 *
 * <pre>{@code
 * Poller<Price> price = Poller.newBuilder(() -> oracle.price("ETH"))
 *     .interval(15, TimeUnit.SECONDS)
 *     .retryOnError(true)
 *     .build();
 * ...
 * price.close();
 * }</pre>
 *
 * @param <T> the type of the data
 */
public class Poller<T> implements AutoCloseable {
    private final AsyncStateMachine<Void, T> machine;
    private final AsyncOptions<T> options;
    private final long intervalNanos;
    private final boolean retryOnError;

    // Guarded by this
    private ScheduledFuture<?> schedule;

    private Poller(Builder<T> builder) {
        this.options = builder.options;
        // start() executes right away, so the immediate flag is not honoured here
        AsyncTask<T> task = builder.task;
        this.machine = new AsyncStateMachine<>(ignored -> task.call(), options);
        this.intervalNanos = builder.intervalNanos;
        this.retryOnError = builder.retryOnError;
    }

    public static <T> Builder<T> newBuilder(AsyncTask<T> task) {
        return new Builder<>(task);
    }

    /**
     * Executes once immediately, then schedules a tick every interval. Does nothing if already
     * polling.
     */
    public void start() {
        synchronized (this) {
            if (schedule != null || machine.isClosed()) {
                return;
            }
            schedule = options.scheduler().scheduleAtFixedRate(this::tick, intervalNanos, intervalNanos,
                    TimeUnit.NANOSECONDS);
        }
        machine.execute();
    }

    /**
     * Cancels the schedule. A run in progress completes and still commits its state.
     */
    public void stop() {
        ScheduledFuture<?> cancelled;
        synchronized (this) {
            cancelled = schedule;
            schedule = null;
        }
        if (cancelled != null) {
            cancelled.cancel(false);
        }
    }

    public synchronized boolean isPolling() {
        return schedule != null;
    }

    void tick() {
        AsyncState<T> state = machine.getState();
        if (state.isLoading() || (state.isError() && !retryOnError)) {
            if (AsyncStateMachine.LOGGER.isLoggable(Level.FINER)) {
                AsyncStateMachine.LOGGER.finer("Skipping poll tick in state " + state.getStatus());
            }
            return;
        }
        machine.execute();
    }

    public AsyncState<T> getState() {
        return machine.getState();
    }

    public void addListener(StateListener<T> listener) {
        machine.addListener(listener);
    }

    public void removeListener(StateListener<T> listener) {
        machine.removeListener(listener);
    }

    /**
     * Stops polling and closes the underlying state machine.
     */
    @Override
    public void close() {
        stop();
        machine.close();
    }

    public static final class Builder<T> {
        private final AsyncTask<T> task;
        private long intervalNanos = TimeUnit.SECONDS.toNanos(10);
        private boolean retryOnError;
        private boolean enabled = true;
        private AsyncOptions<T> options = AsyncOptions.defaults();

        private Builder(AsyncTask<T> task) {
            this.task = Objects.requireNonNull(task, "task cannot be null");
        }

        /**
         * Time between two ticks. Defaults to 10 seconds.
         */
        public Builder<T> interval(long duration, TimeUnit unit) {
            if (duration <= 0) {
                throw new IllegalArgumentException("interval must be positive");
            }
            this.intervalNanos = unit.toNanos(duration);
            return this;
        }

        /**
         * Whether ticks keep executing after a failed run. Defaults to {@code false}.
         */
        public Builder<T> retryOnError(boolean retryOnError) {
            this.retryOnError = retryOnError;
            return this;
        }

        /**
         * Whether {@link #build()} starts polling. Defaults to {@code true}.
         */
        public Builder<T> enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder<T> options(AsyncOptions<T> options) {
            this.options = Objects.requireNonNull(options, "options cannot be null");
            return this;
        }

        public Poller<T> build() {
            Poller<T> poller = new Poller<>(this);
            if (enabled) {
                poller.start();
            }
            return poller;
        }
    }
}
