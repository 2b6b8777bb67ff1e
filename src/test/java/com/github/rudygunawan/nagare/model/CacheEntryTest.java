package com.github.rudygunawan.nagare.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheEntryTest {

    @Test
    void testExpirationTime() {
        CacheEntry<String> entry = new CacheEntry<>("v", 100, 50);

        assertEquals(150, entry.getExpirationTime());
        assertFalse(entry.isExpiredAt(150));
        assertTrue(entry.isExpiredAt(151));
    }

    @Test
    void testHugeTtlSaturates() {
        long now = Long.MAX_VALUE - 10;
        CacheEntry<String> entry = new CacheEntry<>("v", now, Long.MAX_VALUE);

        assertEquals(Long.MAX_VALUE, entry.getExpirationTime());
        assertFalse(entry.isExpiredAt(now));
        assertFalse(entry.isExpiredAt(now + 10));
    }

    @Test
    void testNoTtlNeverExpires() {
        CacheEntry<String> entry = new CacheEntry<>("v", 0, 0);

        assertFalse(entry.isExpiredAt(Long.MAX_VALUE));
    }

    @Test
    void testDeadline() {
        assertEquals(30, CacheEntry.deadline(10, 20));
        assertEquals(Long.MAX_VALUE, CacheEntry.deadline(1, Long.MAX_VALUE));
    }
}
