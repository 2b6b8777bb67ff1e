package com.github.rudygunawan.nagare.builder;

import com.github.rudygunawan.nagare.policy.RetryPolicy;
import com.github.rudygunawan.nagare.queue.BatchQueue;
import com.github.rudygunawan.nagare.queue.PriorityTaskQueue;
import com.github.rudygunawan.nagare.queue.RateLimitedQueue;
import com.github.rudygunawan.nagare.queue.RetryQueue;
import com.github.rudygunawan.nagare.queue.TaskQueue;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueueBuilderTest {

    @Test
    void testDefaults() {
        TaskQueue queue = QueueBuilder.newBuilder().build();
        assertEquals(1, queue.concurrency());

        RetryQueue retry = QueueBuilder.newBuilder().buildRetry();
        assertEquals(RetryPolicy.exponential(3, 1, TimeUnit.SECONDS), retry.policy());
    }

    @Test
    void testConfiguredVariants() throws Exception {
        PriorityTaskQueue priority = QueueBuilder.newBuilder().concurrency(4).buildPriority();
        assertEquals(4, priority.concurrency());

        RateLimitedQueue rateLimited = QueueBuilder.newBuilder().rateLimit(4).buildRateLimited();
        assertEquals(TimeUnit.MILLISECONDS.toNanos(250), rateLimited.minIntervalNanos());

        RetryQueue retry = QueueBuilder.newBuilder()
                .maxRetries(1)
                .retryDelay(250, TimeUnit.MILLISECONDS)
                .backoff(false)
                .buildRetry();
        assertEquals(RetryPolicy.linear(1, 250, TimeUnit.MILLISECONDS), retry.policy());

        BatchQueue<String, Integer> batch = QueueBuilder.newBuilder()
                .maxBatchSize(2)
                .maxWait(1, TimeUnit.MINUTES)
                .buildBatch(items -> CompletableFuture.completedFuture(items.size()));
        batch.add("a");
        assertEquals(2, batch.add("b").get());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> QueueBuilder.newBuilder().concurrency(0));
        assertThrows(IllegalArgumentException.class, () -> QueueBuilder.newBuilder().rateLimit(-1));
        assertThrows(IllegalArgumentException.class, () -> QueueBuilder.newBuilder().maxBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> QueueBuilder.newBuilder().maxRetries(-1));
    }
}
