package com.example.fundlens.metadata;

import com.example.fundlens.marketdata.ProviderThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Yahoo v10 quote-summary modules (profile, top holdings) for one symbol. */
@Component
public class YahooQuoteSummaryClient {
    private static final Logger log = LoggerFactory.getLogger(YahooQuoteSummaryClient.class);
    private static final String URL = "https://query2.finance.yahoo.com/v10/finance/quoteSummary/{symbol}?modules={modules}";

    private final RestClient http;
    private final ProviderThrottle throttle;

    public YahooQuoteSummaryClient(RestClient.Builder builder, ProviderThrottle throttle) {
        this.http = builder.build();
        this.throttle = throttle;
    }

    /** @return the first result object, keyed by module name */
    public Optional<Map<?, ?>> modules(String symbol, String modules) {
        Map<?, ?> resp;
        try {
            resp = throttle.call("yahoo", () -> http.get()
                    .uri(URL, symbol, modules)
                    .retrieve()
                    .body(Map.class));
        } catch (RestClientException e) {
            log.debug("Yahoo quote summary {} for {} failed: {}", modules, symbol, e.getMessage());
            return Optional.empty();
        }
        if (resp != null && resp.get("quoteSummary") instanceof Map<?, ?> summary
                && summary.get("result") instanceof List<?> results && !results.isEmpty()
                && results.get(0) instanceof Map<?, ?> first) {
            return Optional.of(first);
        }
        return Optional.empty();
    }
}
