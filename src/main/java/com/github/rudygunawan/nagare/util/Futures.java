package com.github.rudygunawan.nagare.util;

import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.queue.TaskQueue;
import com.github.rudygunawan.nagare.time.Scheduler;
import com.github.rudygunawan.nagare.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;

/**
 * Static helpers for composing {@link CompletableFuture}s.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * dependent stages and blocking getters add around the original failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns a future that completes after {@code delay} on the shared scheduler.
     */
    public static CompletableFuture<Void> delay(long delay, TimeUnit unit) {
        return Scheduler.systemScheduler().delay(delay, unit);
    }

    /**
     * Runs the tasks one after another, each starting when the previous one succeeded. The first
     * failure fails the result and stops the sequence.
     */
    public static <T> CompletableFuture<List<T>> sequence(List<? extends AsyncTask<T>> tasks) {
        Objects.requireNonNull(tasks, "tasks cannot be null");
        List<T> results = new ArrayList<>(tasks.size());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (AsyncTask<T> task : tasks) {
            chain = chain.thenCompose(ignored -> AsyncTask.start(task)).thenAccept(results::add);
        }
        return chain.thenApply(ignored -> Collections.unmodifiableList(results));
    }

    /**
     * Runs the tasks with at most {@code concurrency} in flight, in list order. Results keep the
     * order of {@code tasks}. The first failure fails the result; tasks already started keep
     * running.
     */
    public static <T> CompletableFuture<List<T>> parallel(List<? extends AsyncTask<T>> tasks, int concurrency) {
        Objects.requireNonNull(tasks, "tasks cannot be null");
        TaskQueue queue = new TaskQueue(concurrency);
        int count = tasks.size();
        AtomicReferenceArray<T> results = new AtomicReferenceArray<>(count);
        CompletableFuture<List<T>> result = new CompletableFuture<>();
        if (count == 0) {
            result.complete(Collections.emptyList());
            return result;
        }
        CompletableFuture<?>[] all = new CompletableFuture<?>[count];
        for (int i = 0; i < count; i++) {
            int index = i;
            all[i] = queue.add(tasks.get(i)).whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    results.set(index, value);
                }
            });
        }
        CompletableFuture.allOf(all).thenRun(() -> {
            List<T> ordered = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                ordered.add(results.get(i));
            }
            result.complete(Collections.unmodifiableList(ordered));
        });
        return result;
    }

    /**
     * Fails with a {@link TimeoutException} if {@code future} has not completed within
     * {@code timeout}. The underlying work is not interrupted.
     */
    public static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future, long timeout, TimeUnit unit) {
        return withTimeout(future, timeout, unit, () -> new TimeoutException("Timed out after " + timeout + " " + unit),
                Scheduler.systemScheduler());
    }

    /**
     * Fails with the error supplied by {@code timeoutError} if {@code future} has not completed
     * within {@code timeout}.
     */
    public static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future, long timeout, TimeUnit unit,
                                                       Supplier<? extends Throwable> timeoutError,
                                                       Scheduler scheduler) {
        Objects.requireNonNull(future, "future cannot be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> result.completeExceptionally(timeoutError.get()), timeout, unit);
        future.whenComplete((value, error) -> {
            timer.cancel(false);
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * Evaluates {@code condition} every {@code interval} until it yields {@code true}. Fails with
     * a {@link TimeoutException} once more than {@code timeout} has passed, or with the
     * condition's own failure.
     */
    public static CompletableFuture<Void> pollUntil(AsyncTask<Boolean> condition, long interval, long timeout,
                                                    TimeUnit unit) {
        return pollUntil(condition, interval, timeout, unit, Scheduler.systemScheduler(), Ticker.systemTicker());
    }

    public static CompletableFuture<Void> pollUntil(AsyncTask<Boolean> condition, long interval, long timeout,
                                                    TimeUnit unit, Scheduler scheduler, Ticker ticker) {
        Objects.requireNonNull(condition, "condition cannot be null");
        CompletableFuture<Void> result = new CompletableFuture<>();
        long deadline = ticker.read() + unit.toNanos(timeout);
        poll(condition, interval, unit, deadline, scheduler, ticker, result);
        return result;
    }

    private static void poll(AsyncTask<Boolean> condition, long interval, TimeUnit unit, long deadline,
                             Scheduler scheduler, Ticker ticker, CompletableFuture<Void> result) {
        AsyncTask.start(condition).whenComplete((satisfied, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else if (Boolean.TRUE.equals(satisfied)) {
                result.complete(null);
            } else if (ticker.read() - deadline > 0) {
                result.completeExceptionally(new TimeoutException("Polling timeout"));
            } else {
                scheduler.delay(interval, unit)
                        .thenRun(() -> poll(condition, interval, unit, deadline, scheduler, ticker, result));
            }
        });
    }
}
