package com.github.rudygunawan.nagare.time;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Source of delayed and periodic execution for retry backoff, batch flushing, rate limiting and
 * polling.
 *
 * <p>The default scheduler runs on a single shared daemon thread named {@code nagare-scheduler}.
 * Work scheduled on it, and continuations chained on the futures returned by {@link #delay},
 * must be short and non-blocking.
 */
public interface Scheduler {

    /**
     * Runs {@code task} once after {@code delay}.
     */
    ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit);

    /**
     * Runs {@code task} repeatedly with {@code period} between the starts of two runs.
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelay, long period, TimeUnit unit);

    /**
     * Returns a future that completes after {@code delay}. A non-positive delay yields an already
     * completed future.
     */
    default CompletableFuture<Void> delay(long delay, TimeUnit unit) {
        if (delay <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        schedule(() -> future.complete(null), delay, unit);
        return future;
    }

    /**
     * Returns the shared scheduler backed by a daemon thread.
     */
    static Scheduler systemScheduler() {
        return SystemScheduler.INSTANCE;
    }

    /**
     * Wraps an existing executor. The caller owns its lifecycle.
     */
    static Scheduler of(ScheduledExecutorService executor) {
        return new Scheduler() {
            @Override
            public ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit) {
                return executor.schedule(task, delay, unit);
            }

            @Override
            public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelay, long period, TimeUnit unit) {
                return executor.scheduleAtFixedRate(task, initialDelay, period, unit);
            }
        };
    }

    /**
     * Lazily started shared scheduler.
     */
    final class SystemScheduler implements Scheduler {
        static final SystemScheduler INSTANCE = new SystemScheduler();

        private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "nagare-scheduler");
            t.setDaemon(true);
            return t;
        });

        private SystemScheduler() {
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit) {
            return executor.schedule(task, delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelay, long period, TimeUnit unit) {
            return executor.scheduleAtFixedRate(task, initialDelay, period, unit);
        }

        @Override
        public String toString() {
            return "Scheduler.systemScheduler()";
        }
    }
}
