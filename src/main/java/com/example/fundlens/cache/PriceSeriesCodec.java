package com.example.fundlens.cache;

import com.example.fundlens.domain.DailyRecord;
import com.example.fundlens.domain.PriceSeries;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts price series to and from the record array stored in cache files.
 *
 * Reading accepts older spellings as well ({@code Date}, {@code Price}, {@code Dividends},
 * {@code Capital Gains}, {@code _is_adjusted}); a missing distribution reads as zero and a
 * missing adjustment flag is inferred from the recorded source name.
 */
final class PriceSeriesCodec {
    // Vendors whose historical prices always embed reinvested distributions
    private static final List<String> ADJUSTED_SOURCES = List.of("EOD Historical Data", "Alpha Vantage", "Financial Modeling Prep");

    private final ObjectMapper mapper;

    PriceSeriesCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ArrayNode encode(PriceSeries series) {
        ArrayNode array = mapper.createArrayNode();
        for (DailyRecord r : series.getRecords()) {
            ObjectNode node = array.addObject();
            // Distributions are written for adjusted records too, always zero there
            node.put("date", r.date().toString());
            node.put("price", r.price());
            node.put("dividend", r.dividend());
            node.put("capitalGain", r.capitalGain());
            node.put("adjusted", r.adjusted());
        }
        return array;
    }

    /**
     * @throws IllegalArgumentException when the payload is not a record array or a record is unusable
     */
    PriceSeries decode(JsonNode data, String source, Instant fetchedAt) {
        if (data == null || !data.isArray()) {
            throw new IllegalArgumentException("historical payload is not an array");
        }
        boolean inferredAdjusted = isAdjustedSource(source);
        List<DailyRecord> records = new ArrayList<>(data.size());
        for (JsonNode node : data) {
            JsonNode dateNode = first(node, "date", "Date");
            JsonNode priceNode = first(node, "price", "Price", "Close");
            if (dateNode == null || priceNode == null || priceNode.isNull()) {
                throw new IllegalArgumentException("record without date or price: " + node);
            }
            LocalDate date = parseDate(dateNode);
            double price = priceNode.asDouble();
            // Per-record flag wins over what the source name suggests
            JsonNode adjustedNode = first(node, "adjusted", "_is_adjusted", "is_adjusted");
            boolean adjusted = adjustedNode == null || adjustedNode.isNull() ? inferredAdjusted : adjustedNode.asBoolean();
            if (adjusted) {
                records.add(DailyRecord.adjusted(date, price));
            } else {
                double dividend = amount(first(node, "dividend", "Dividends"));
                double capitalGain = amount(first(node, "capitalGain", "Capital Gains", "capital_gain"));
                records.add(DailyRecord.raw(date, price, dividend, capitalGain));
            }
        }
        return new PriceSeries(records, source, fetchedAt);
    }

    static boolean isAdjustedSource(String source) {
        if (source == null) return false;
        for (String s : ADJUSTED_SOURCES) {
            if (source.contains(s)) return true;
        }
        return false;
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null) return v;
        }
        return null;
    }

    private static double amount(JsonNode node) {
        if (node == null || node.isNull()) return 0.0;
        double v = node.asDouble();
        return Double.isFinite(v) && v > 0 ? v : 0.0; // negative or NaN amounts read as none
    }

    // ISO date, ISO date-time (first ten characters), or epoch milliseconds
    private static LocalDate parseDate(JsonNode node) {
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong()).atZone(ZoneOffset.UTC).toLocalDate();
        }
        String text = node.asText().trim();
        if (text.length() < 10) {
            throw new IllegalArgumentException("unparseable date: " + text);
        }
        return LocalDate.parse(text.substring(0, 10));
    }
}
