package com.github.rudygunawan.nagare.state;

import com.github.rudygunawan.nagare.util.Futures;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PollerTest {

    @Test
    @Timeout(5)
    void testPollsAtInterval() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Poller<Integer> poller = Poller.newBuilder(() -> CompletableFuture.completedFuture(calls.incrementAndGet()))
                .interval(20, TimeUnit.MILLISECONDS)
                .build();
        try {
            assertTrue(poller.isPolling());
            assertTrue(calls.get() >= 1);

            Futures.pollUntil(() -> CompletableFuture.completedFuture(calls.get() >= 3),
                    10, 2, TimeUnit.SECONDS).get();
            assertTrue(poller.getState().isSuccess());
        } finally {
            poller.close();
        }

        assertFalse(poller.isPolling());
        int afterClose = calls.get();
        Thread.sleep(100);
        assertEquals(afterClose, calls.get());
    }

    @Test
    void testDisabledPollerStartsStopped() {
        AtomicInteger calls = new AtomicInteger();
        Poller<Integer> poller = Poller.newBuilder(() -> CompletableFuture.completedFuture(calls.incrementAndGet()))
                .interval(1, TimeUnit.HOURS)
                .enabled(false)
                .build();

        assertFalse(poller.isPolling());
        assertEquals(0, calls.get());
        assertTrue(poller.getState().isIdle());

        poller.start();
        poller.start();
        assertTrue(poller.isPolling());
        assertEquals(1, calls.get());
        poller.close();
    }

    @Test
    void testTickSkippedWhileLoading() {
        AtomicInteger calls = new AtomicInteger();
        Poller<String> poller = Poller.newBuilder(() -> {
            calls.incrementAndGet();
            return new CompletableFuture<String>();
        }).interval(1, TimeUnit.HOURS).build();

        poller.tick();
        poller.tick();

        assertEquals(1, calls.get());
        assertTrue(poller.getState().isLoading());
        poller.close();
    }

    @Test
    void testTickSkippedAfterErrorUnlessRetryOnError() {
        AtomicInteger calls = new AtomicInteger();
        Poller<String> strict = Poller.newBuilder(() -> {
            calls.incrementAndGet();
            return CompletableFuture.<String>failedFuture(new IllegalStateException("down"));
        }).interval(1, TimeUnit.HOURS).build();

        strict.tick();
        assertEquals(1, calls.get());
        assertTrue(strict.getState().isError());
        strict.close();

        AtomicInteger retried = new AtomicInteger();
        Poller<String> lenient = Poller.newBuilder(() -> {
            retried.incrementAndGet();
            return CompletableFuture.<String>failedFuture(new IllegalStateException("down"));
        }).interval(1, TimeUnit.HOURS).retryOnError(true).build();

        lenient.tick();
        lenient.tick();
        assertEquals(3, retried.get());
        lenient.close();
    }

    @Test
    void testCancelledCallDoesNotStallPolling() {
        AtomicInteger calls = new AtomicInteger();
        Poller<String> poller = Poller.newBuilder(() -> calls.incrementAndGet() == 1
                ? CompletableFuture.<String>failedFuture(new CancellationException("request cancelled"))
                : CompletableFuture.completedFuture("price"))
                .interval(1, TimeUnit.HOURS)
                .retryOnError(true)
                .build();

        assertTrue(poller.getState().isError());
        poller.tick();

        assertEquals(2, calls.get());
        assertEquals("price", poller.getState().getData());
        poller.close();
    }

    @Test
    void testStopKeepsLastState() {
        Poller<String> poller = Poller.newBuilder(() -> CompletableFuture.completedFuture("price"))
                .interval(1, TimeUnit.HOURS)
                .build();

        poller.stop();

        assertFalse(poller.isPolling());
        assertEquals("price", poller.getState().getData());
    }
}
