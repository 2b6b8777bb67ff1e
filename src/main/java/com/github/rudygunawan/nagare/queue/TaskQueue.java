package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncTask;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * FIFO queue running at most {@code concurrency} tasks at once.
 *
 * <p>Among tasks that are ready together, tasks start in the order they were added. When a
 * running task settles, the next queued task starts immediately.
 *
 * <pre>{@code
 * TaskQueue queue = new TaskQueue(2);
 * CompletableFuture<Receipt> receipt = queue.add(() -> wallet.send(tx));
 * }</pre>
 */
public class TaskQueue extends AbstractTaskQueue {

    private final ArrayDeque<Job<?>> queue = new ArrayDeque<>();

    /**
     * Creates a queue that runs one task at a time.
     */
    public TaskQueue() {
        this(1);
    }

    public TaskQueue(int concurrency) {
        super(concurrency);
    }

    /**
     * Queues {@code task} and returns a future for its outcome. A task's failure fails only its
     * own future.
     *
     * @param task the task to run
     * @param <T> the type of the task's result
     * @return a future completing with the task's outcome, cancelled if the queue is cleared first
     */
    public <T> CompletableFuture<T> add(AsyncTask<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        Job<T> job = new Job<>(task);
        synchronized (this) {
            queue.addLast(job);
        }
        drain();
        return job.result;
    }

    @Override
    protected Job<?> pollNext() {
        return queue.pollFirst();
    }

    @Override
    protected List<Job<?>> drainQueued() {
        List<Job<?>> dropped = new ArrayList<>(queue);
        queue.clear();
        return dropped;
    }

    @Override
    protected int queuedCount() {
        return queue.size();
    }
}
