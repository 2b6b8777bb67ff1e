package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncFunction;
import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.metrics.QueueMetrics;
import com.github.rudygunawan.nagare.time.Scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Collects items and hands them to a processor in batches.
 *
 * <p>A batch is flushed when it reaches {@code maxBatchSize} items or when {@code maxWait} has
 * elapsed since its first item was added, whichever happens first. {@link #flush()} may also be
 * called directly; on an empty batch it does nothing.
 *
 * <pre>{@code
 * BatchQueue<String, Map<String, Balance>> balances =
 *     new BatchQueue<>(addresses -> client.balances(addresses), 50, 20, TimeUnit.MILLISECONDS);
 * balances.add("0xabc").thenAccept(byAddress -> render(byAddress.get("0xabc")));
 * }</pre>
 *
 * @param <T> the type of items
 * @param <R> the type of the processor's result for one batch
 */
public class BatchQueue<T, R> implements QueueMetrics {
    public static final int DEFAULT_MAX_BATCH_SIZE = 10;
    public static final long DEFAULT_MAX_WAIT_MILLIS = 100;

    private final AsyncFunction<? super List<T>, R> processor;
    private final int maxBatchSize;
    private final long maxWaitNanos;
    private final Scheduler scheduler;

    // Guarded by this
    private List<T> batch = new ArrayList<>();
    private CompletableFuture<R> batchResult = new CompletableFuture<>();
    private ScheduledFuture<?> timer;
    private int inFlight;
    private long completedCount;
    private long failedCount;

    public BatchQueue(AsyncFunction<? super List<T>, R> processor) {
        this(processor, DEFAULT_MAX_BATCH_SIZE, DEFAULT_MAX_WAIT_MILLIS, TimeUnit.MILLISECONDS);
    }

    public BatchQueue(AsyncFunction<? super List<T>, R> processor, int maxBatchSize, long maxWait, TimeUnit unit) {
        this(processor, maxBatchSize, maxWait, unit, Scheduler.systemScheduler());
    }

    public BatchQueue(AsyncFunction<? super List<T>, R> processor, int maxBatchSize, long maxWait, TimeUnit unit,
                      Scheduler scheduler) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1");
        }
        if (maxWait < 0) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        this.processor = Objects.requireNonNull(processor, "processor cannot be null");
        this.maxBatchSize = maxBatchSize;
        this.maxWaitNanos = unit.toNanos(maxWait);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Adds {@code item} to the current batch.
     *
     * @param item the item to batch
     * @return a future completing with the processor's result for the batch containing the item
     */
    public CompletableFuture<R> add(T item) {
        CompletableFuture<R> result;
        boolean full;
        synchronized (this) {
            batch.add(item);
            result = batchResult;
            full = batch.size() >= maxBatchSize;
            if (!full && timer == null) {
                timer = scheduler.schedule(this::flushOnTimer, maxWaitNanos, TimeUnit.NANOSECONDS);
            }
        }
        if (full) {
            flush();
        }
        return result.copy();
    }

    /**
     * Hands the current batch to the processor now.
     *
     * @return the processor's result, or a future completed with {@code null} if the batch was
     *     empty
     */
    public CompletableFuture<R> flush() {
        List<T> items;
        CompletableFuture<R> result;
        synchronized (this) {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            if (batch.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            items = Collections.unmodifiableList(batch);
            result = batchResult;
            batch = new ArrayList<>();
            batchResult = new CompletableFuture<>();
            inFlight++;
        }
        AsyncTask.start(() -> processor.apply(items)).whenComplete((value, error) -> {
            synchronized (this) {
                inFlight--;
                if (error == null) {
                    completedCount++;
                } else {
                    failedCount++;
                }
            }
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        return result.copy();
    }

    private void flushOnTimer() {
        flush().whenComplete((value, error) -> {
            if (error != null) {
                AbstractTaskQueue.LOGGER.log(Level.WARNING, "Batch flushed by timer failed", error);
            }
        });
    }

    @Override
    public synchronized int pending() {
        return batch.size();
    }

    /**
     * Returns the number of batches being processed.
     */
    @Override
    public synchronized int active() {
        return inFlight;
    }

    @Override
    public synchronized long completedCount() {
        return completedCount;
    }

    @Override
    public synchronized long failedCount() {
        return failedCount;
    }
}
