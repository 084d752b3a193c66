package com.example.fundlens.metadata;

import com.example.fundlens.marketdata.ProviderThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Page summary from the Wikipedia REST API, Italian edition first and English second,
 * searched by name, else ticker, else identifier.
 */
@Component
@Order(40)
public class WikipediaDescriptions implements DescriptionProvider {
    private static final Logger log = LoggerFactory.getLogger(WikipediaDescriptions.class);
    private static final List<String> LANGUAGES = List.of("it", "en");
    private static final int MIN_LENGTH = 50;

    private final RestClient http;
    private final ProviderThrottle throttle;

    public WikipediaDescriptions(RestClient.Builder builder, ProviderThrottle throttle) {
        this.http = builder.build();
        this.throttle = throttle;
    }

    @Override
    public String sourceName() {
        return "Wikipedia";
    }

    @Override
    public Optional<String> describe(String identifier, String ticker, String name) {
        String title = name != null ? name : ticker != null ? ticker : identifier;
        for (String lang : LANGUAGES) {
            Map<?, ?> resp;
            try {
                resp = throttle.call("wikipedia", () -> http.get()
                        .uri("https://{lang}.wikipedia.org/api/rest_v1/page/summary/{title}", lang, title.replace(' ', '_'))
                        .retrieve()
                        .body(Map.class));
            } catch (RestClientResponseException e) {
                log.debug("Wikipedia ({}) has no page for '{}': {}", lang, title, e.getStatusCode());
                continue;
            }
            // Disambiguation pages list candidates rather than describe the fund
            if (resp != null && !"disambiguation".equals(resp.get("type"))
                    && resp.get("extract") instanceof String s && s.trim().length() >= MIN_LENGTH) {
                return Optional.of(s.trim());
            }
        }
        return Optional.empty();
    }
}
