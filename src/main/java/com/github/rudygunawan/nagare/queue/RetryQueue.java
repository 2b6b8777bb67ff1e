package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.policy.RetryPolicy;
import com.github.rudygunawan.nagare.time.Scheduler;
import com.github.rudygunawan.nagare.util.Futures;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

/**
 * Runs tasks, retrying failures according to a {@link RetryPolicy}.
 *
 * <p>A task is attempted at most {@code retries + 1} times. The failure of the last attempt is the
 * one propagated to the caller, unwrapped from any {@code CompletionException}.
 */
public class RetryQueue {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MILLIS = 1000;

    private final RetryPolicy policy;
    private final Scheduler scheduler;
    private final AtomicLong attemptCount = new AtomicLong();

    /**
     * Creates a queue retrying three times with exponential backoff starting at one second.
     */
    public RetryQueue() {
        this(RetryPolicy.exponential(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_MILLIS, TimeUnit.MILLISECONDS));
    }

    public RetryQueue(RetryPolicy policy) {
        this(policy, Scheduler.systemScheduler());
    }

    public RetryQueue(RetryPolicy policy, Scheduler scheduler) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Runs {@code task} until it succeeds or the retries are exhausted.
     *
     * @param task the task to run
     * @param <T> the type of the task's result
     * @return a future completing with the first successful result or the last failure
     */
    public <T> CompletableFuture<T> execute(AsyncTask<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(task, 0, result);
        return result;
    }

    private <T> void attempt(AsyncTask<T> task, int attempt, CompletableFuture<T> result) {
        attemptCount.incrementAndGet();
        AsyncTask.start(task).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable failure = Futures.unwrap(error);
            if (attempt >= policy.retries()) {
                result.completeExceptionally(failure);
                return;
            }
            long delay = policy.delayAfterAttempt(attempt);
            if (AbstractTaskQueue.LOGGER.isLoggable(Level.FINE)) {
                AbstractTaskQueue.LOGGER.fine("Attempt " + (attempt + 1) + " failed (" + failure
                        + "), retrying in " + delay + " ms");
            }
            scheduler.delay(delay, TimeUnit.MILLISECONDS).thenRun(() -> attempt(task, attempt + 1, result));
        });
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Returns the total number of attempts started by this queue.
     */
    public long attemptCount() {
        return attemptCount.get();
    }
}
