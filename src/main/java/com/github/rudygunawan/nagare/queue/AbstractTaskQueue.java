package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.metrics.QueueMetrics;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Engine shared by the bounded-concurrency queues. Subclasses decide which queued job starts
 * next; this class guarantees that no more than {@code concurrency} jobs run at once and that a
 * new job is started as soon as a running one settles.
 *
 * <p>Tasks are started outside the queue's lock. A task that settles synchronously does not
 * recurse into the next start: the thread already draining the queue picks it up.
 */
public abstract class AbstractTaskQueue implements QueueMetrics {
    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.nagare.Queue");

    private final int concurrency;

    // Guarded by this
    private int running;
    private boolean paused;
    private boolean draining;
    private boolean redrain;
    private long completedCount;
    private long failedCount;

    protected AbstractTaskQueue(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.concurrency = concurrency;
    }

    /**
     * Removes and returns the job to start next, or {@code null} if none is queued. Called while
     * holding the lock.
     */
    protected abstract Job<?> pollNext();

    /**
     * Removes and returns all queued jobs. Called while holding the lock.
     */
    protected abstract List<Job<?>> drainQueued();

    /**
     * Returns the number of queued jobs. Called while holding the lock.
     */
    protected abstract int queuedCount();

    /**
     * Starts queued jobs until the concurrency limit is reached, the queue is paused or empty.
     */
    protected final void drain() {
        synchronized (this) {
            if (draining) {
                redrain = true;
                return;
            }
            draining = true;
        }
        while (true) {
            Job<?> next;
            synchronized (this) {
                next = paused || running >= concurrency ? null : pollNext();
                if (next == null) {
                    if (redrain) {
                        redrain = false;
                        continue;
                    }
                    draining = false;
                    return;
                }
                if (next.result.isDone()) {
                    // cancelled by the caller while queued
                    continue;
                }
                running++;
            }
            start(next);
        }
    }

    private <T> void start(Job<T> job) {
        AsyncTask.start(job.task).whenComplete((value, error) -> {
            synchronized (this) {
                running--;
                if (error == null) {
                    completedCount++;
                } else {
                    failedCount++;
                }
            }
            if (error != null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.log(Level.FINE, "Queued task failed", error);
                }
                job.result.completeExceptionally(error);
            } else {
                job.result.complete(value);
            }
            drain();
        });
    }

    /**
     * Stops starting new tasks. Running tasks are not affected.
     */
    public void pause() {
        synchronized (this) {
            paused = true;
        }
    }

    /**
     * Resumes starting tasks after {@link #pause()}.
     */
    public void resume() {
        synchronized (this) {
            paused = false;
        }
        drain();
    }

    /**
     * Drops every queued task that has not started. Their futures are cancelled; running tasks
     * are not affected.
     */
    public void clear() {
        List<Job<?>> dropped;
        synchronized (this) {
            dropped = drainQueued();
        }
        for (Job<?> job : dropped) {
            job.result.cancel(false);
        }
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public int concurrency() {
        return concurrency;
    }

    @Override
    public synchronized int pending() {
        return queuedCount();
    }

    @Override
    public synchronized int active() {
        return running;
    }

    /**
     * Returns the number of queued and running tasks.
     */
    public synchronized int size() {
        return queuedCount() + running;
    }

    @Override
    public synchronized long completedCount() {
        return completedCount;
    }

    @Override
    public synchronized long failedCount() {
        return failedCount;
    }

    /**
     * A task waiting in a queue together with the future handed to the caller.
     */
    protected static final class Job<T> {
        final AsyncTask<T> task;
        final CompletableFuture<T> result = new CompletableFuture<>();

        Job(AsyncTask<T> task) {
            this.task = task;
        }
    }
}
