package com.github.rudygunawan.nagare.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileKeyValueStorageTest {

    @TempDir
    Path directory;

    @Test
    void testItemLifecycle() throws Exception {
        FileKeyValueStorage storage = new FileKeyValueStorage(directory.resolve("cache"));

        assertNull(storage.getItem("ns:key"));
        assertTrue(storage.keys().isEmpty());

        storage.setItem("ns:key", "{\"value\":1}");
        storage.setItem("ns:other/key", "2");
        assertEquals("{\"value\":1}", storage.getItem("ns:key"));
        assertEquals(Set.of("ns:key", "ns:other/key"), storage.keys());

        storage.setItem("ns:key", "replaced");
        assertEquals("replaced", storage.getItem("ns:key"));

        assertTrue(storage.removeItem("ns:key"));
        assertFalse(storage.removeItem("ns:key"));
        assertEquals(Set.of("ns:other/key"), storage.keys());
    }
}
