package com.github.rudygunawan.nagare.storage;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Stores each item as a UTF-8 file in one directory. File names are the URL-encoded keys with a
 * {@code .item} suffix. Writes go through a temporary file and an atomic move when the file
 * system supports it.
 */
public class FileKeyValueStorage implements KeyValueStorage {
    private static final String SUFFIX = ".item";

    private final Path directory;

    public FileKeyValueStorage(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
    }

    @Override
    public String getItem(String key) throws IOException {
        try {
            return Files.readString(pathFor(key), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public void setItem(String key, String value) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(key);
        Path temp = Files.createTempFile(directory, "nagare", ".tmp");
        try {
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public boolean removeItem(String key) throws IOException {
        return Files.deleteIfExists(pathFor(key));
    }

    @Override
    public Set<String> keys() throws IOException {
        Set<String> keys = new HashSet<>();
        if (!Files.isDirectory(directory)) {
            return keys;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                keys.add(URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8));
            }
        }
        return keys;
    }

    private Path pathFor(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
