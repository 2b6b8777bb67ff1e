package com.github.rudygunawan.nagare.impl;

import com.github.rudygunawan.nagare.api.AsyncFunction;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Memoizes an asynchronous function through a {@link MemoryCache}.
 *
 * <p>Results are cached under the key produced by the key generator, {@code String.valueOf}
 * of the argument by default. Failures are not cached. Concurrent misses for the same key each
 * call the function; wrap it with a {@link RequestDeduplicator} when that matters.
 *
 * @param <A> the type of the argument
 * @param <R> the type of the result
 */
public class CachedFunction<A, R> implements AsyncFunction<A, R> {

    private final AsyncFunction<? super A, R> function;
    private final Function<? super A, String> keyGenerator;
    private final MemoryCache<String, R> cache;

    public CachedFunction(AsyncFunction<? super A, R> function, MemoryCache<String, R> cache) {
        this(function, String::valueOf, cache);
    }

    public CachedFunction(AsyncFunction<? super A, R> function, Function<? super A, String> keyGenerator,
                          MemoryCache<String, R> cache) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    @Override
    public CompletableFuture<R> apply(A argument) throws Exception {
        String key = keyGenerator.apply(argument);
        R cached = cache.getIfPresent(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return function.apply(argument).thenApply(result -> {
            cache.put(key, result);
            return result;
        });
    }

    /**
     * Returns the backing cache, for invalidation.
     */
    public MemoryCache<String, R> cache() {
        return cache;
    }
}
