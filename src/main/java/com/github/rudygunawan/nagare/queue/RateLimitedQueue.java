package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.metrics.QueueMetrics;
import com.github.rudygunawan.nagare.time.Scheduler;
import com.github.rudygunawan.nagare.time.Ticker;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks one at a time, starting each at least {@code 1000 / rateLimit} milliseconds after
 * the previous start, however long the tasks take.
 */
public class RateLimitedQueue implements QueueMetrics {

    private final TaskQueue queue = new TaskQueue(1);
    private final long minIntervalNanos;
    private final Scheduler scheduler;
    private final Ticker ticker;

    // Only touched by the single running wrapper
    private volatile long lastStart;
    private volatile boolean started;

    /**
     * Creates a queue limited to {@code rateLimit} task starts per second. A non-positive rate
     * means no limit.
     */
    public RateLimitedQueue(double rateLimit) {
        this(rateLimit, Scheduler.systemScheduler(), Ticker.systemTicker());
    }

    public RateLimitedQueue(double rateLimit, Scheduler scheduler, Ticker ticker) {
        this.minIntervalNanos = rateLimit > 0 ? (long) (TimeUnit.SECONDS.toNanos(1) / rateLimit) : 0;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    /**
     * Queues {@code task}; it starts once every earlier task has settled and the minimum interval
     * since the previous start has elapsed.
     */
    public <T> CompletableFuture<T> add(AsyncTask<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        return queue.add(() -> {
            long wait = 0;
            if (started) {
                long elapsed = ticker.read() - lastStart;
                wait = minIntervalNanos - elapsed;
            }
            return scheduler.delay(wait, TimeUnit.NANOSECONDS).thenCompose(ignored -> {
                lastStart = ticker.read();
                started = true;
                return AsyncTask.start(task);
            });
        });
    }

    public long minIntervalNanos() {
        return minIntervalNanos;
    }

    public void pause() {
        queue.pause();
    }

    public void resume() {
        queue.resume();
    }

    public void clear() {
        queue.clear();
    }

    public int size() {
        return queue.size();
    }

    @Override
    public int pending() {
        return queue.pending();
    }

    @Override
    public int active() {
        return queue.active();
    }

    @Override
    public long completedCount() {
        return queue.completedCount();
    }

    @Override
    public long failedCount() {
        return queue.failedCount();
    }
}
