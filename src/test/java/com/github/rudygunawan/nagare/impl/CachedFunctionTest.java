package com.github.rudygunawan.nagare.impl;

import com.github.rudygunawan.nagare.builder.CacheBuilder;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachedFunctionTest {

    @Test
    void testResultsAreMemoizedPerArgument() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MemoryCache<String, Integer> cache = CacheBuilder.newBuilder().build();
        CachedFunction<Integer, Integer> square = new CachedFunction<>(n -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(n * n);
        }, cache);

        assertEquals(9, square.apply(3).get());
        assertEquals(9, square.apply(3).get());
        assertEquals(16, square.apply(4).get());
        assertEquals(2, calls.get());
        assertEquals(9, square.cache().getIfPresent("3"));
    }

    @Test
    void testCustomKeyGenerator() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MemoryCache<String, String> cache = CacheBuilder.newBuilder().build();
        CachedFunction<String, String> lookup = new CachedFunction<>(address -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("name:" + address);
        }, address -> address.toLowerCase(), cache);

        assertEquals("name:0xAB", lookup.apply("0xAB").get());
        assertEquals("name:0xAB", lookup.apply("0xab").get());
        assertEquals(1, calls.get());
    }

    @Test
    void testFailuresAreNotCached() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MemoryCache<String, String> cache = CacheBuilder.newBuilder().build();
        CachedFunction<String, String> flaky = new CachedFunction<>(key -> calls.incrementAndGet() == 1
                ? CompletableFuture.failedFuture(new IllegalStateException("down"))
                : CompletableFuture.completedFuture("up"), cache);

        assertThrows(ExecutionException.class, () -> flaky.apply("k").get());
        assertEquals("up", flaky.apply("k").get());
        assertEquals(2, calls.get());
    }
}
