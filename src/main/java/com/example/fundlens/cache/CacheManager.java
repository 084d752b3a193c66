package com.example.fundlens.cache;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.domain.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Kind-aware cache over a {@link CacheStore}. Stale entries and entries that do not
 * deserialize are reported as misses; nothing here throws on bad cache content.
 */
@Component
public class CacheManager {
    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    // Where serialized entries live (one JSON file per key in production)
    private final CacheStore store;
    private final ObjectMapper mapper;
    // Per-kind time-to-live
    private final FundLensProperties.Cache settings;
    // Source of "now" for entry timestamps and expiry
    private final Clock clock;
    // Record array <-> PriceSeries
    private final PriceSeriesCodec codec;

    public CacheManager(CacheStore store, ObjectMapper mapper, FundLensProperties properties, Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.settings = properties.cache();
        this.clock = clock;
        this.codec = new PriceSeriesCodec(mapper);
    }

    public Optional<CacheEntry> get(String identifier, CacheKind kind) {
        String key = key(identifier, kind);
        Optional<String> document;
        try {
            document = store.read(key);
        } catch (RuntimeException e) {
            log.warn("Cache entry {} unreadable, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (document.isEmpty()) return Optional.empty(); // plain miss

        CacheEntry entry;
        try {
            entry = parse(key, document.get());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Cache entry {} is corrupt, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        Duration age = Duration.between(entry.timestamp(), clock.instant());
        // a timestamp in the future is clock skew or a hand edit, never fresh
        if (age.isNegative()) {
            log.warn("Cache entry {} is timestamped in the future ({}), treating as miss", key, entry.timestamp());
            return Optional.empty();
        }
        if (age.compareTo(settings.ttlFor(kind)) >= 0) {
            log.debug("Cache entry {} expired ({} old)", key, age);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String identifier, CacheKind kind, JsonNode data, String source, ValidationReport validation) {
        // { data, timestamp, source, validation? }
        ObjectNode root = mapper.createObjectNode();
        root.set("data", data);
        root.put("timestamp", clock.instant().toString());
        root.put("source", source == null ? "Unknown" : source);
        if (validation != null) {
            root.set("validation", mapper.valueToTree(validation));
        }
        String key = key(identifier, kind);
        try {
            store.write(key, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not store cache entry {}: {}", key, e.getMessage());
        }
    }

    /** Series cached under a historical or benchmark kind; fetch time is the entry timestamp. */
    public Optional<PriceSeries> getSeries(String identifier, CacheKind kind) {
        Optional<CacheEntry> entry = get(identifier, kind);
        if (entry.isEmpty()) return Optional.empty();
        try {
            PriceSeries series = codec.decode(entry.get().data(), entry.get().source(), entry.get().timestamp());
            return Optional.of(series);
        } catch (RuntimeException e) {
            log.warn("Cached {} series for {} does not decode, treating as miss: {}", kind.fileSuffix(), identifier, e.getMessage());
            return Optional.empty();
        }
    }

    public void putSeries(String identifier, CacheKind kind, PriceSeries series, ValidationReport validation) {
        put(identifier, kind, codec.encode(series), series.getSourceName(), validation);
    }

    public Optional<String> getText(String identifier, CacheKind kind) {
        return get(identifier, kind)
                .map(CacheEntry::data)
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
    }

    public void putText(String identifier, CacheKind kind, String text, String source) {
        put(identifier, kind, mapper.getNodeFactory().textNode(text), source, null);
    }

    static String key(String identifier, CacheKind kind) {
        return Identifiers.sanitize(identifier) + "_" + kind.fileSuffix();
    }

    private CacheEntry parse(String key, String document) throws JsonProcessingException {
        JsonNode root = mapper.readTree(document);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("entry is not a JSON object");
        }
        // Description entries were once written under "description" instead of "data"
        JsonNode data = root.has("data") ? root.get("data") : root.get("description");
        if (data == null) {
            throw new IllegalArgumentException("entry has no payload");
        }
        // Older writers stored the record array as an embedded JSON string
        if (data.isTextual()) {
            String text = data.asText().trim();
            if (text.startsWith("[") || text.startsWith("{")) {
                data = mapper.readTree(text);
            }
        }
        JsonNode sourceNode = root.get("source");
        String source = sourceNode == null || sourceNode.isNull() ? "Unknown" : sourceNode.asText();
        JsonNode validation = root.get("validation");
        return new CacheEntry(data, timestamp(key, root.get("timestamp")), source, validation);
    }

    private Instant timestamp(String key, JsonNode node) {
        if (node != null && node.isTextual()) {
            String text = node.asText();
            try {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
                if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
                // No offset: local time of the configured clock
                return ((LocalDateTime) parsed).atZone(clock.getZone()).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Cache entry {} has unparseable timestamp {}", key, text);
            }
        }
        // Fall back to the file's modification time
        return store.lastModified(key)
                .orElseThrow(() -> new IllegalArgumentException("entry has no usable timestamp"));
    }
}
