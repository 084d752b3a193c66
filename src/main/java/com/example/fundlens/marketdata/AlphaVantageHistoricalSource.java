package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Alpha Vantage daily adjusted series. The endpoint needs a ticker; the identifier is used
 * when none is known. Error and throttling notes in the body yield no bars.
 */
@Component
@Order(30)
public class AlphaVantageHistoricalSource extends AdjustedVendorSource {
    private static final Logger log = LoggerFactory.getLogger(AlphaVantageHistoricalSource.class);
    private static final String URL =
            "https://www.alphavantage.co/query?function=TIME_SERIES_DAILY_ADJUSTED&symbol={symbol}&outputsize=full&apikey={key}";

    private final RestClient http;
    private final FundLensProperties.Apis apis;

    public AlphaVantageHistoricalSource(RestClient.Builder builder, ProviderThrottle throttle, FundLensProperties properties) {
        super(throttle);
        this.http = builder.build();
        this.apis = properties.apis();
    }

    @Override
    public String name() {
        return "alphavantage";
    }

    @Override
    protected String vendorName() {
        return "Alpha Vantage";
    }

    @Override
    protected boolean configured() {
        return apis.hasAlphaVantageKey();
    }

    @Override
    protected String symbolFor(Instrument instrument) {
        return instrument.getTicker() != null ? instrument.getTicker() : instrument.getIdentifier();
    }

    @Override
    protected List<RawBar> download(String symbol, DateRange range) {
        Map<?, ?> resp = http.get()
                .uri(URL, symbol, apis.alphaVantageApiKey())
                .retrieve()
                .body(Map.class);
        List<RawBar> bars = new ArrayList<>();
        if (resp == null) return bars;
        if (!(resp.get("Time Series (Daily)") instanceof Map<?, ?> series)) {
            Object note = resp.containsKey("Error Message") ? resp.get("Error Message") : resp.get("Note");
            log.debug("Alpha Vantage returned no series for {}: {}", symbol, note);
            return bars;
        }
        for (Map.Entry<?, ?> e : series.entrySet()) {
            LocalDate date = date(e.getKey());
            if (date == null || !(e.getValue() instanceof Map<?, ?> values)) continue;
            Double close = number(values.get("4. close"));
            if (close == null) continue;
            bars.add(new RawBar(date, close, number(values.get("5. adjusted close")), 0.0, 0.0));
        }
        return bars;
    }
}
