package com.github.rudygunawan.nagare.impl;

import com.github.rudygunawan.nagare.builder.CacheBuilder;
import com.github.rudygunawan.nagare.storage.FileKeyValueStorage;
import com.github.rudygunawan.nagare.storage.InMemoryKeyValueStorage;
import com.github.rudygunawan.nagare.storage.KeyValueStorage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PersistentCacheTest {

    @TempDir
    Path directory;

    @Test
    void testValuesSurviveReopening() {
        MutableClock clock = new MutableClock();
        PersistentCache<Balance> first = CacheBuilder.newBuilder()
                .clock(clock)
                .buildPersistent("balances", new FileKeyValueStorage(directory), Balance.class);

        first.put("alice", new Balance("ETH", 42));

        PersistentCache<Balance> reopened = CacheBuilder.newBuilder()
                .clock(clock)
                .buildPersistent("balances", new FileKeyValueStorage(directory), Balance.class);
        Balance balance = reopened.getIfPresent("alice");
        assertNotNull(balance);
        assertEquals("ETH", balance.asset);
        assertEquals(42, balance.amount);
        assertTrue(reopened.containsKey("alice"));
        assertEquals(1, reopened.size());
    }

    @Test
    void testExpiredItemIsRemovedOnRead() throws IOException {
        MutableClock clock = new MutableClock();
        InMemoryKeyValueStorage storage = new InMemoryKeyValueStorage();
        PersistentCache<String> cache = CacheBuilder.newBuilder()
                .clock(clock)
                .expireAfterWrite(1, TimeUnit.HOURS)
                .buildPersistent("tokens", storage, String.class);

        cache.put("a", "value");
        clock.advanceMillis(TimeUnit.MINUTES.toMillis(59));
        assertEquals("value", cache.getIfPresent("a"));

        clock.advanceMillis(TimeUnit.MINUTES.toMillis(2));
        assertNull(cache.getIfPresent("a"));
        assertNull(storage.getItem("tokens:a"));
    }

    @Test
    void testDefaultTimeToLiveIsOneDay() {
        MutableClock clock = new MutableClock();
        PersistentCache<String> cache = CacheBuilder.newBuilder()
                .clock(clock)
                .buildPersistent("ns", new InMemoryKeyValueStorage(), String.class);

        cache.put("a", "value");
        clock.advanceMillis(TimeUnit.HOURS.toMillis(23));
        assertEquals("value", cache.getIfPresent("a"));

        clock.advanceMillis(TimeUnit.HOURS.toMillis(2));
        assertNull(cache.getIfPresent("a"));
    }

    @Test
    void testStoredDocumentFormat() throws IOException {
        MutableClock clock = new MutableClock();
        InMemoryKeyValueStorage storage = new InMemoryKeyValueStorage();
        PersistentCache<Integer> cache = CacheBuilder.newBuilder()
                .clock(clock)
                .buildPersistent("ns", storage, Integer.class);

        cache.put("answer", 42, 10, TimeUnit.SECONDS);

        assertEquals("{\"value\":42,\"expiresAt\":" + (clock.millis() + 10_000) + "}", storage.getItem("ns:answer"));
    }

    @Test
    void testCorruptItemIsAMiss() throws IOException {
        InMemoryKeyValueStorage storage = new InMemoryKeyValueStorage();
        PersistentCache<String> cache = CacheBuilder.newBuilder()
                .buildPersistent("ns", storage, String.class);

        storage.setItem("ns:broken", "{not json");
        assertNull(cache.getIfPresent("broken"));
        assertFalse(cache.containsKey("broken"));
    }

    @Test
    void testInvalidateAllOnlyTouchesOwnNamespace() throws IOException {
        InMemoryKeyValueStorage storage = new InMemoryKeyValueStorage();
        PersistentCache<String> cache = CacheBuilder.newBuilder()
                .buildPersistent("mine", storage, String.class);

        cache.put("a", "1");
        cache.put("b", "2");
        storage.setItem("theirs:a", "untouched");

        assertTrue(cache.invalidate("a"));
        assertFalse(cache.invalidate("a"));
        cache.invalidateAll();

        assertEquals(0, cache.size());
        assertEquals(Set.of("theirs:a"), storage.keys());
    }

    @Test
    void testStorageFailuresDegradeToMisses() {
        PersistentCache<String> cache = CacheBuilder.newBuilder()
                .buildPersistent("ns", new FailingStorage(), String.class);

        assertDoesNotThrow(() -> cache.put("a", "value"));
        assertNull(cache.getIfPresent("a"));
        assertFalse(cache.invalidate("a"));
        assertDoesNotThrow(cache::invalidateAll);
        assertEquals(0, cache.size());
    }

    public static class Balance {
        public String asset;
        public long amount;

        public Balance() {
        }

        Balance(String asset, long amount) {
            this.asset = asset;
            this.amount = amount;
        }
    }

    private static final class MutableClock extends Clock {
        private long millis = 1_700_000_000_000L;

        void advanceMillis(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }

    private static final class FailingStorage implements KeyValueStorage {
        @Override
        public String getItem(String key) throws IOException {
            throw new IOException("disk unavailable");
        }

        @Override
        public void setItem(String key, String value) throws IOException {
            throw new IOException("disk unavailable");
        }

        @Override
        public boolean removeItem(String key) throws IOException {
            throw new IOException("disk unavailable");
        }

        @Override
        public Set<String> keys() throws IOException {
            throw new IOException("disk unavailable");
        }
    }
}
