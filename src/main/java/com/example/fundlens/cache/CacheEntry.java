package com.example.fundlens.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Payload plus provenance as stored on disk.
 *
 * @param data       series records, description text, or composition object
 * @param timestamp  when the payload was stored
 * @param source     name of the source that produced the payload
 * @param validation validation report for series payloads, null otherwise
 */
public record CacheEntry(JsonNode data, Instant timestamp, String source, JsonNode validation) {
}
