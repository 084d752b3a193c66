package com.example.fundlens.metadata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.marketdata.ProviderThrottle;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.Optional;

/** Company overview text from Alpha Vantage, when a key is configured. */
@Component
@Order(20)
public class AlphaVantageDescriptions implements DescriptionProvider {
    private final RestClient http;
    private final ProviderThrottle throttle;
    private final FundLensProperties.Apis apis;

    public AlphaVantageDescriptions(RestClient.Builder builder, ProviderThrottle throttle, FundLensProperties properties) {
        this.http = builder.build();
        this.throttle = throttle;
        this.apis = properties.apis();
    }

    @Override
    public String sourceName() {
        return "Alpha Vantage";
    }

    @Override
    public Optional<String> describe(String identifier, String ticker, String name) {
        if (ticker == null || !apis.hasAlphaVantageKey()) return Optional.empty();
        Map<?, ?> resp = throttle.call("alphavantage", () -> http.get()
                .uri("https://www.alphavantage.co/query?function=OVERVIEW&symbol={symbol}&apikey={key}",
                        ticker, apis.alphaVantageApiKey())
                .retrieve()
                .body(Map.class));
        if (resp != null && resp.get("Description") instanceof String s && !s.isBlank()) {
            return Optional.of(s.trim());
        }
        return Optional.empty();
    }
}
