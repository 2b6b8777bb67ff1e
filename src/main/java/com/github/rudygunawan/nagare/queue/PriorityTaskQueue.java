package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncTask;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Queue that starts the task with the highest numeric priority first, FIFO among tasks of the
 * same priority. Concurrency is bounded like {@link TaskQueue}.
 */
public class PriorityTaskQueue extends AbstractTaskQueue {
    public static final int DEFAULT_PRIORITY = 0;

    // Highest priority first; empty buckets are removed
    private final TreeMap<Integer, ArrayDeque<Job<?>>> buckets = new TreeMap<>((a, b) -> Integer.compare(b, a));
    private int queued;

    public PriorityTaskQueue() {
        this(1);
    }

    public PriorityTaskQueue(int concurrency) {
        super(concurrency);
    }

    /**
     * Queues {@code task} with {@link #DEFAULT_PRIORITY}.
     */
    public <T> CompletableFuture<T> add(AsyncTask<T> task) {
        return add(task, DEFAULT_PRIORITY);
    }

    /**
     * Queues {@code task} with the given priority. Higher values start earlier.
     *
     * @param task the task to run
     * @param priority the priority of the task
     * @param <T> the type of the task's result
     * @return a future completing with the task's outcome
     */
    public <T> CompletableFuture<T> add(AsyncTask<T> task, int priority) {
        Objects.requireNonNull(task, "task cannot be null");
        Job<T> job = new Job<>(task);
        synchronized (this) {
            buckets.computeIfAbsent(priority, p -> new ArrayDeque<>()).addLast(job);
            queued++;
        }
        drain();
        return job.result;
    }

    @Override
    protected Job<?> pollNext() {
        Iterator<Map.Entry<Integer, ArrayDeque<Job<?>>>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            ArrayDeque<Job<?>> bucket = it.next().getValue();
            Job<?> job = bucket.pollFirst();
            if (bucket.isEmpty()) {
                it.remove();
            }
            if (job != null) {
                queued--;
                return job;
            }
        }
        return null;
    }

    @Override
    protected List<Job<?>> drainQueued() {
        List<Job<?>> dropped = new ArrayList<>(queued);
        for (ArrayDeque<Job<?>> bucket : buckets.values()) {
            dropped.addAll(bucket);
        }
        buckets.clear();
        queued = 0;
        return dropped;
    }

    @Override
    protected int queuedCount() {
        return queued;
    }
}
