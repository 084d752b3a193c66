package com.example.fundlens.cache;

/**
 * What a cache entry holds. Each kind has its own time-to-live under
 * {@code fundlens.cache.*-ttl} and its own file suffix.
 */
public enum CacheKind {
    HISTORICAL("historical"),
    DESCRIPTION("description"),
    BENCHMARK("benchmark"),
    COMPOSITION("composition");

    // Appended to the sanitized identifier: <identifier>_<suffix>.json
    private final String fileSuffix;

    CacheKind(String fileSuffix) {
        this.fileSuffix = fileSuffix;
    }

    public String fileSuffix() {
        return fileSuffix;
    }
}
