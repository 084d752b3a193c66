package com.example.fundlens.metadata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.marketdata.ProviderThrottle;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Profile description from Financial Modeling Prep, when a key is configured. */
@Component
@Order(30)
public class FmpDescriptions implements DescriptionProvider {
    private final RestClient http;
    private final ProviderThrottle throttle;
    private final FundLensProperties.Apis apis;

    public FmpDescriptions(RestClient.Builder builder, ProviderThrottle throttle, FundLensProperties properties) {
        this.http = builder.build();
        this.throttle = throttle;
        this.apis = properties.apis();
    }

    @Override
    public String sourceName() {
        return "Financial Modeling Prep";
    }

    @Override
    public Optional<String> describe(String identifier, String ticker, String name) {
        if (ticker == null || !apis.hasFmpKey()) return Optional.empty();
        List<?> resp = throttle.call("fmp", () -> http.get()
                .uri("https://financialmodelingprep.com/api/v3/profile/{symbol}?apikey={key}", ticker, apis.fmpApiKey())
                .retrieve()
                .body(List.class));
        if (resp != null && !resp.isEmpty() && resp.get(0) instanceof Map<?, ?> profile
                && profile.get("description") instanceof String s && !s.isBlank()) {
            return Optional.of(s.trim());
        }
        return Optional.empty();
    }
}
