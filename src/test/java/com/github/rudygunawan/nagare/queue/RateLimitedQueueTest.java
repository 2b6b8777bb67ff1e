package com.github.rudygunawan.nagare.queue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitedQueueTest {

    @Test
    @Timeout(5)
    void testStartsAreSpacedByMinimumInterval() throws Exception {
        RateLimitedQueue queue = new RateLimitedQueue(10);
        assertEquals(TimeUnit.MILLISECONDS.toNanos(100), queue.minIntervalNanos());

        List<Long> starts = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int id = i;
            results.add(queue.add(() -> {
                starts.add(System.nanoTime());
                return CompletableFuture.completedFuture(id);
            }));
        }
        CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0])).get();

        assertEquals(3, starts.size());
        for (int i = 1; i < starts.size(); i++) {
            long gapMillis = TimeUnit.NANOSECONDS.toMillis(starts.get(i) - starts.get(i - 1));
            assertTrue(gapMillis >= 95, "gap between starts was " + gapMillis + "ms");
        }
        assertEquals(2, results.get(2).get());
        assertEquals(3, queue.completedCount());
    }

    @Test
    @Timeout(5)
    void testFirstTaskStartsImmediately() throws Exception {
        RateLimitedQueue queue = new RateLimitedQueue(0.5);
        long start = System.nanoTime();

        queue.add(() -> CompletableFuture.completedFuture("now")).get();

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
    }

    @Test
    void testNonPositiveRateMeansUnlimited() throws Exception {
        RateLimitedQueue queue = new RateLimitedQueue(0);
        assertEquals(0, queue.minIntervalNanos());

        CompletableFuture<String> first = queue.add(() -> CompletableFuture.completedFuture("a"));
        CompletableFuture<String> second = queue.add(() -> CompletableFuture.completedFuture("b"));

        assertEquals("a", first.get(1, TimeUnit.SECONDS));
        assertEquals("b", second.get(1, TimeUnit.SECONDS));
    }
}
