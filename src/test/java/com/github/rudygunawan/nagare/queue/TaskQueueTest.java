package com.github.rudygunawan.nagare.queue;

import com.github.rudygunawan.nagare.api.AsyncTask;
import com.github.rudygunawan.nagare.time.Scheduler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    @Test
    @Timeout(5)
    void testConcurrencyLimit() throws Exception {
        TaskQueue queue = new TaskQueue(2);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        List<CompletableFuture<Integer>> results = new ArrayList<>();
        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            int id = i;
            results.add(queue.add(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                return Scheduler.systemScheduler().delay(100, TimeUnit.MILLISECONDS).thenApply(ignored -> {
                    running.decrementAndGet();
                    return id;
                });
            }));
        }
        assertEquals(2, queue.active());
        assertEquals(3, queue.pending());

        CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0])).get();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(2, maxRunning.get());
        assertTrue(elapsedMillis >= 300, "three waves of 100ms, took " + elapsedMillis + "ms");
        for (int i = 0; i < 5; i++) {
            assertEquals(i, results.get(i).get());
        }
        assertEquals(5, queue.completedCount());
        assertEquals(0, queue.size());
    }

    @Test
    void testTasksStartInFifoOrder() throws Exception {
        TaskQueue queue = new TaskQueue();
        List<String> started = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<String> gate = new CompletableFuture<>();

        CompletableFuture<String> first = queue.add(() -> {
            started.add("first");
            return gate;
        });
        CompletableFuture<String> second = queue.add(() -> {
            started.add("second");
            return CompletableFuture.completedFuture("second");
        });
        CompletableFuture<String> third = queue.add(() -> {
            started.add("third");
            return CompletableFuture.completedFuture("third");
        });

        assertEquals(Collections.singletonList("first"), started);
        gate.complete("first");

        assertEquals("third", third.get(1, TimeUnit.SECONDS));
        assertEquals("first", first.get());
        assertEquals("second", second.get());
        assertEquals(Arrays.asList("first", "second", "third"), started);
    }

    @Test
    void testFailureDoesNotStopQueue() throws Exception {
        TaskQueue queue = new TaskQueue();

        CompletableFuture<String> failing = queue.add(() -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = queue.add(() -> CompletableFuture.completedFuture("ok"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> failing.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("ok", next.get(1, TimeUnit.SECONDS));
        assertEquals(1, queue.failedCount());
        assertEquals(1, queue.completedCount());
    }

    @Test
    void testPauseAndResume() throws Exception {
        TaskQueue queue = new TaskQueue(2);
        queue.pause();
        assertTrue(queue.isPaused());

        CompletableFuture<String> result = queue.add(() -> CompletableFuture.completedFuture("done"));
        assertFalse(result.isDone());
        assertEquals(1, queue.pending());

        queue.resume();
        assertEquals("done", result.get(1, TimeUnit.SECONDS));
        assertFalse(queue.isPaused());
    }

    @Test
    void testClearDropsQueuedTasks() throws Exception {
        TaskQueue queue = new TaskQueue();
        AtomicInteger executed = new AtomicInteger();
        CompletableFuture<String> gate = new CompletableFuture<>();

        CompletableFuture<String> running = queue.add(() -> gate);
        CompletableFuture<String> queued = queue.add(() -> {
            executed.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });

        queue.clear();
        assertEquals(0, queue.pending());
        assertEquals(1, queue.size());
        assertThrows(CancellationException.class, queued::join);

        gate.complete("finished");
        assertEquals("finished", running.get(1, TimeUnit.SECONDS));
        assertEquals(0, executed.get());
    }

    @Test
    void testCancelledTaskIsSkipped() throws Exception {
        TaskQueue queue = new TaskQueue();
        AtomicInteger executed = new AtomicInteger();
        CompletableFuture<String> gate = new CompletableFuture<>();

        queue.add(() -> gate);
        CompletableFuture<String> cancelled = queue.add(() -> {
            executed.incrementAndGet();
            return CompletableFuture.completedFuture("skipped");
        });
        CompletableFuture<String> last = queue.add(() -> CompletableFuture.completedFuture("last"));

        cancelled.cancel(false);
        gate.complete("done");

        assertEquals("last", last.get(1, TimeUnit.SECONDS));
        assertEquals(0, executed.get());
    }

    @Test
    @Timeout(5)
    void testManySynchronousTasksDoNotOverflowStack() throws Exception {
        TaskQueue queue = new TaskQueue();
        queue.pause();
        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            int id = i;
            AsyncTask<Integer> task = () -> CompletableFuture.completedFuture(id);
            results.add(queue.add(task));
        }
        queue.resume();

        assertEquals(19_999, results.get(19_999).get());
        assertEquals(20_000, queue.completedCount());
    }

    @Test
    void testInvalidConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new TaskQueue(0));
    }
}
