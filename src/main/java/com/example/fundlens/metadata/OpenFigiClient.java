package com.example.fundlens.metadata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.marketdata.ProviderThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ISIN to name/ticker lookup through the OpenFIGI mapping API. Works without a key at a
 * lower rate limit; any failure yields empty.
 */
@Component
public class OpenFigiClient {
    private static final Logger log = LoggerFactory.getLogger(OpenFigiClient.class);
    private static final String MAPPING_URL = "https://api.openfigi.com/v3/mapping";

    private final RestClient http;
    private final ProviderThrottle throttle;
    private final FundLensProperties.Apis apis;

    public OpenFigiClient(RestClient.Builder builder, ProviderThrottle throttle, FundLensProperties properties) {
        this.http = builder.build();
        this.throttle = throttle;
        this.apis = properties.apis();
    }

    public Optional<FigiRecord> lookup(String isin) {
        if (!apis.openFigiEnabled() || !Identifiers.isIsin(isin)) return Optional.empty();
        List<?> resp;
        try {
            resp = throttle.call("openfigi", () -> http.post()
                    .uri(MAPPING_URL)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (apis.hasOpenFigiKey()) h.set("X-OPENFIGI-APIKEY", apis.openFigiApiKey());
                    })
                    .body(List.of(Map.of("idType", "ID_ISIN", "idValue", Identifiers.normalize(isin))))
                    .retrieve()
                    .body(List.class));
        } catch (RestClientException e) {
            log.warn("OpenFIGI lookup failed for {}: {}", isin, e.getMessage());
            return Optional.empty();
        }
        if (resp == null || resp.isEmpty() || !(resp.get(0) instanceof Map<?, ?> first)
                || !(first.get("data") instanceof List<?> data) || data.isEmpty()
                || !(data.get(0) instanceof Map<?, ?> m)) {
            log.debug("OpenFIGI has no mapping for {}", isin);
            return Optional.empty();
        }
        return Optional.of(new FigiRecord(
                text(m.get("name")), text(m.get("ticker")), text(m.get("exchCode")),
                text(m.get("marketSector")), text(m.get("securityType")),
                text(m.get("figi")), text(m.get("compositeFIGI"))));
    }

    private static String text(Object value) {
        return value instanceof String s ? s : "";
    }
}
