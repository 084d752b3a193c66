package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** EOD Historical Data end-of-day prices, queried by ISIN. */
@Component
@Order(10)
public class EodHistoricalSource extends AdjustedVendorSource {
    private static final String URL =
            "https://eodhistoricaldata.com/api/eod/{symbol}?api_token={key}&from={from}&to={to}&period=d&fmt=json";

    private final RestClient http;
    private final FundLensProperties.Apis apis;

    public EodHistoricalSource(RestClient.Builder builder, ProviderThrottle throttle, FundLensProperties properties) {
        super(throttle);
        this.http = builder.build();
        this.apis = properties.apis();
    }

    @Override
    public String name() {
        return "eod";
    }

    @Override
    protected String vendorName() {
        return "EOD Historical Data";
    }

    @Override
    protected boolean configured() {
        return apis.hasEodKey();
    }

    @Override
    protected String symbolFor(Instrument instrument) {
        return instrument.getIdentifier();
    }

    @Override
    protected List<RawBar> download(String symbol, DateRange range) {
        List<?> rows = http.get()
                .uri(URL, symbol, apis.eodApiKey(), range.start(), range.end())
                .retrieve()
                .body(List.class);
        List<RawBar> bars = new ArrayList<>();
        if (rows == null) return bars;
        for (Object row : rows) {
            if (!(row instanceof Map<?, ?> m)) continue;
            LocalDate date = date(m.get("date"));
            Double close = number(m.get("close"));
            if (date == null || close == null) continue;
            bars.add(new RawBar(date, close, number(m.get("adjusted_close")), 0.0, 0.0));
        }
        return bars;
    }
}
