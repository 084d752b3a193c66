package com.example.fundlens.marketdata;

import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Stooq daily CSV for plain US tickers. Closes are raw and Stooq reports no distributions.
 */
@Component
@Order(80)
public class StooqSource implements HistoricalSource {
    private static final Logger log = LoggerFactory.getLogger(StooqSource.class);
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private final RestClient http;
    private final ProviderThrottle throttle;

    public StooqSource(RestClient.Builder builder, ProviderThrottle throttle) {
        this.http = builder.build();
        this.throttle = throttle;
    }

    @Override
    public String name() {
        return "stooq";
    }

    @Override
    public Optional<SourceResult> fetch(Instrument instrument, DateRange range) {
        String symbol = toStooqSymbol(instrument.getTicker() != null ? instrument.getTicker() : instrument.getIdentifier());
        if (symbol == null) return Optional.empty();
        String body = throttle.call(name(), () -> http.get()
                .uri("https://stooq.com/q/d/l/?s={symbol}&d1={from}&d2={to}&i=d",
                        symbol, range.start().format(BASIC), range.end().format(BASIC))
                .retrieve()
                .body(String.class));
        RawHistory history = parseCsv(body);
        if (history.isEmpty()) return Optional.empty();
        return Optional.of(new SourceResult(history, "Stooq (" + symbol + ")", false));
    }

    static String toStooqSymbol(String symbol) {
        // Plain US tickers → ticker.us (e.g., PRHSX → prhsx.us); anything with a venue suffix is skipped
        if (symbol != null && symbol.matches("^[A-Z]{1,5}$")) {
            return symbol.toLowerCase(Locale.ROOT) + ".us";
        }
        return null;
    }

    // Date,Open,High,Low,Close,Volume
    static RawHistory parseCsv(String body) {
        List<RawBar> bars = new ArrayList<>();
        if (body == null) return new RawHistory(bars);
        String[] lines = body.trim().split("\n");
        for (int i = 1; i < lines.length; i++) { // skip header
            String[] parts = lines[i].trim().split(",");
            if (parts.length < 5) continue;
            String closeStr = parts[4].trim();
            if (closeStr.equalsIgnoreCase("N/D")) continue;
            try {
                bars.add(new RawBar(LocalDate.parse(parts[0].trim()), Double.parseDouble(closeStr), null, 0.0, 0.0));
            } catch (DateTimeParseException | NumberFormatException e) {
                log.debug("Skipping malformed Stooq row '{}'", lines[i]);
            }
        }
        return new RawHistory(bars);
    }
}
