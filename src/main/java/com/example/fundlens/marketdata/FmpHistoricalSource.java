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

/** Financial Modeling Prep full daily history, which accepts ISINs for some funds. */
@Component
@Order(20)
public class FmpHistoricalSource extends AdjustedVendorSource {
    private static final String URL =
            "https://financialmodelingprep.com/api/v3/historical-price-full/{symbol}?apikey={key}&from={from}&to={to}";

    private final RestClient http;
    private final FundLensProperties.Apis apis;

    public FmpHistoricalSource(RestClient.Builder builder, ProviderThrottle throttle, FundLensProperties properties) {
        super(throttle);
        this.http = builder.build();
        this.apis = properties.apis();
    }

    @Override
    public String name() {
        return "fmp";
    }

    @Override
    protected String vendorName() {
        return "Financial Modeling Prep";
    }

    @Override
    protected boolean configured() {
        return apis.hasFmpKey();
    }

    @Override
    protected String symbolFor(Instrument instrument) {
        return instrument.getIdentifier();
    }

    @Override
    protected List<RawBar> download(String symbol, DateRange range) {
        Map<?, ?> resp = http.get()
                .uri(URL, symbol, apis.fmpApiKey(), range.start(), range.end())
                .retrieve()
                .body(Map.class);
        List<RawBar> bars = new ArrayList<>();
        if (resp == null || !(resp.get("historical") instanceof List<?> rows)) return bars;
        for (Object row : rows) {
            if (!(row instanceof Map<?, ?> m)) continue;
            LocalDate date = date(m.get("date"));
            Double close = number(m.get("close"));
            if (date == null || close == null) continue;
            bars.add(new RawBar(date, close, number(m.get("adjClose")), 0.0, 0.0));
        }
        return bars;
    }
}
