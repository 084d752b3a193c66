package com.example.fundlens.cache;

import com.example.fundlens.config.FundLensProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * One JSON file per key under {@code fundlens.cache.directory}. Writes go to a temporary
 * file in the same directory and are then moved over the target, so a concurrent reader
 * sees either the old or the new document. Last writer wins.
 */
@Component
public class FileCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);

    // Created on first write
    private final Path directory;

    @Autowired
    public FileCacheStore(FundLensProperties properties) {
        this(Paths.get(properties.cache().directory()));
    }

    public FileCacheStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<String> read(String key) {
        Path file = resolve(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cache file " + file, e);
        }
    }

    @Override
    public Optional<Instant> lastModified(String key) {
        Path file = resolve(key);
        try {
            return Optional.of(Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    @Override
    public void write(String key, String document) {
        Path target = resolve(key);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            // Temporary file next to the target so the move stays on one file system
            tmp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, document, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                // e.g. some network file systems; plain replace
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote cache file {}", target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Cannot write cache file " + target, e);
        }
    }

    private Path resolve(String key) {
        return directory.resolve(key + ".json");
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary cache file {}: {}", tmp, e.getMessage());
        }
    }
}
