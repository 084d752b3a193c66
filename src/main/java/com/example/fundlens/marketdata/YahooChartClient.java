package com.example.fundlens.marketdata;

import com.example.fundlens.domain.DateRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Daily bars from the Yahoo Finance v8 chart endpoint, including the adjusted close and
 * the dividend and capital-gain events.
 */
@Component
public class YahooChartClient {
    static final String PROVIDER = "yahoo";
    private static final Logger log = LoggerFactory.getLogger(YahooChartClient.class);
    private static final String CHART_URL =
            "https://query1.finance.yahoo.com/v8/finance/chart/{symbol}?period1={from}&period2={to}&interval=1d&events={events}";

    private final RestClient http;
    private final ProviderThrottle throttle;

    public YahooChartClient(RestClient.Builder builder, ProviderThrottle throttle) {
        this.http = builder.build();
        this.throttle = throttle;
    }

    /** @return bars for the symbol, empty when Yahoo does not know it or returns nothing */
    public Optional<RawHistory> fetchDaily(String symbol, DateRange range) {
        long from = range.start().atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long to = range.end().plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        Map<?, ?> resp;
        try {
            resp = throttle.call(PROVIDER, () -> http.get()
                    .uri(CHART_URL, symbol, from, to, "div|capitalGain")
                    .retrieve()
                    .body(Map.class));
        } catch (RestClientResponseException e) {
            // Unknown symbols come back as 404 with an error body
            log.debug("Yahoo chart {} answered {}", symbol, e.getStatusCode());
            return Optional.empty();
        }
        RawHistory history = parse(resp);
        return history.isEmpty() ? Optional.empty() : Optional.of(history);
    }

    static RawHistory parse(Map<?, ?> resp) {
        if (resp == null || !(resp.get("chart") instanceof Map<?, ?> chart)) return new RawHistory(List.of());
        if (!(chart.get("result") instanceof List<?> results) || results.isEmpty()) return new RawHistory(List.of());
        Map<?, ?> first = (Map<?, ?>) results.get(0);
        List<?> timestamps = first.get("timestamp") instanceof List<?> l ? l : List.of();
        ZoneId zone = zoneOf(first.get("meta"));

        Map<?, ?> indicators = first.get("indicators") instanceof Map<?, ?> m ? m : Map.of();
        List<?> closes = series(indicators.get("quote"), "close");
        List<?> adjCloses = series(indicators.get("adjclose"), "adjclose");

        Map<?, ?> events = first.get("events") instanceof Map<?, ?> e ? e : Map.of();
        Map<LocalDate, Double> dividends = eventAmounts(events.get("dividends"), zone);
        Map<LocalDate, Double> capitalGains = eventAmounts(events.get("capitalGains"), zone);

        List<RawBar> bars = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size() && i < closes.size(); i++) {
            if (!(timestamps.get(i) instanceof Number ts) || !(closes.get(i) instanceof Number close)) continue;
            LocalDate date = Instant.ofEpochSecond(ts.longValue()).atZone(zone).toLocalDate();
            Double adj = i < adjCloses.size() && adjCloses.get(i) instanceof Number a ? a.doubleValue() : null;
            bars.add(new RawBar(date, close.doubleValue(), adj,
                    dividends.getOrDefault(date, 0.0), capitalGains.getOrDefault(date, 0.0)));
        }
        return new RawHistory(bars);
    }

    private static List<?> series(Object block, String field) {
        if (block instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?> m
                && m.get(field) instanceof List<?> values) {
            return values;
        }
        return List.of();
    }

    private static Map<LocalDate, Double> eventAmounts(Object events, ZoneId zone) {
        Map<LocalDate, Double> amounts = new HashMap<>();
        if (!(events instanceof Map<?, ?> byKey)) return amounts;
        for (Object value : byKey.values()) {
            if (value instanceof Map<?, ?> event && event.get("date") instanceof Number d
                    && event.get("amount") instanceof Number amount && amount.doubleValue() > 0) {
                LocalDate date = Instant.ofEpochSecond(d.longValue()).atZone(zone).toLocalDate();
                amounts.merge(date, amount.doubleValue(), Double::sum);
            }
        }
        return amounts;
    }

    private static ZoneId zoneOf(Object meta) {
        if (meta instanceof Map<?, ?> m && m.get("exchangeTimezoneName") instanceof String tz) {
            try {
                return ZoneId.of(tz);
            } catch (DateTimeException e) {
                log.debug("Unknown exchange timezone {}, using UTC", tz);
            }
        }
        return ZoneOffset.UTC;
    }
}
