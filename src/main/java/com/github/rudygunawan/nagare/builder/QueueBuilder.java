package com.github.rudygunawan.nagare.builder;

import com.github.rudygunawan.nagare.api.AsyncFunction;
import com.github.rudygunawan.nagare.policy.RetryPolicy;
import com.github.rudygunawan.nagare.queue.BatchQueue;
import com.github.rudygunawan.nagare.queue.PriorityTaskQueue;
import com.github.rudygunawan.nagare.queue.RateLimitedQueue;
import com.github.rudygunawan.nagare.queue.RetryQueue;
import com.github.rudygunawan.nagare.queue.TaskQueue;
import com.github.rudygunawan.nagare.time.Scheduler;
import com.github.rudygunawan.nagare.time.Ticker;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A builder for the task queue family. Each {@code build*} method uses only the settings that
 * apply to that variant.
 *
 * <pre>{@code
 * TaskQueue writes = QueueBuilder.newBuilder().concurrency(2).build();
 *
 * RateLimitedQueue rpc = QueueBuilder.newBuilder().rateLimit(5).buildRateLimited();
 *
 * RetryQueue reads = QueueBuilder.newBuilder()
 *     .maxRetries(2)
 *     .retryDelay(250, TimeUnit.MILLISECONDS)
 *     .backoff(true)
 *     .buildRetry();
 * }</pre>
 */
public class QueueBuilder {
    private int concurrency = 1;
    private double rateLimit;
    private int maxBatchSize = BatchQueue.DEFAULT_MAX_BATCH_SIZE;
    private long maxWaitNanos = TimeUnit.MILLISECONDS.toNanos(BatchQueue.DEFAULT_MAX_WAIT_MILLIS);
    private int maxRetries = RetryQueue.DEFAULT_MAX_RETRIES;
    private long retryDelayMillis = RetryQueue.DEFAULT_RETRY_DELAY_MILLIS;
    private boolean backoff = true;
    private Scheduler scheduler = Scheduler.systemScheduler();
    private Ticker ticker = Ticker.systemTicker();

    private QueueBuilder() {
    }

    public static QueueBuilder newBuilder() {
        return new QueueBuilder();
    }

    /**
     * Maximum number of tasks running at once. Defaults to 1.
     *
     * @throws IllegalArgumentException if {@code concurrency} is less than 1
     */
    public QueueBuilder concurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Maximum task starts per second for {@link #buildRateLimited()}. Zero means unlimited.
     */
    public QueueBuilder rateLimit(double startsPerSecond) {
        if (startsPerSecond < 0) {
            throw new IllegalArgumentException("rate limit must not be negative");
        }
        this.rateLimit = startsPerSecond;
        return this;
    }

    /**
     * Batch size that triggers a flush. Defaults to 10.
     */
    public QueueBuilder maxBatchSize(int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1");
        }
        this.maxBatchSize = maxBatchSize;
        return this;
    }

    /**
     * Longest time the first item of a batch waits before a flush. Defaults to 100 ms.
     */
    public QueueBuilder maxWait(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        this.maxWaitNanos = unit.toNanos(duration);
        return this;
    }

    /**
     * Retries after the first failure. Defaults to 3.
     */
    public QueueBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * Base delay between attempts. Defaults to one second.
     */
    public QueueBuilder retryDelay(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        this.retryDelayMillis = unit.toMillis(duration);
        return this;
    }

    /**
     * Whether the retry delay doubles after each failure. Defaults to {@code true}.
     */
    public QueueBuilder backoff(boolean backoff) {
        this.backoff = backoff;
        return this;
    }

    public QueueBuilder scheduler(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        return this;
    }

    public QueueBuilder ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    public TaskQueue build() {
        return new TaskQueue(concurrency);
    }

    public PriorityTaskQueue buildPriority() {
        return new PriorityTaskQueue(concurrency);
    }

    public RateLimitedQueue buildRateLimited() {
        return new RateLimitedQueue(rateLimit, scheduler, ticker);
    }

    public <T, R> BatchQueue<T, R> buildBatch(AsyncFunction<? super List<T>, R> processor) {
        return new BatchQueue<>(processor, maxBatchSize, maxWaitNanos, TimeUnit.NANOSECONDS, scheduler);
    }

    public RetryQueue buildRetry() {
        return new RetryQueue(RetryPolicy.of(maxRetries, retryDelayMillis, TimeUnit.MILLISECONDS, backoff), scheduler);
    }
}
