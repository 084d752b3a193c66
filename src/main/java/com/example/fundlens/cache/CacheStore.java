package com.example.fundlens.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Key-value storage for serialized cache entries. Implementations must make a write
 * visible to readers either entirely or not at all.
 */
public interface CacheStore {

    /** @return the stored document, or empty when nothing is stored under the key */
    Optional<String> read(String key);

    /** @return when the document under the key was last written, if known */
    Optional<Instant> lastModified(String key);

    /** Replaces whatever is stored under the key. */
    void write(String key, String document);
}
