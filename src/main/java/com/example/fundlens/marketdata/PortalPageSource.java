package com.example.fundlens.marketdata;

import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort check against a finance portal's fund page. The page is fetched and its
 * title inspected so a missing fund is logged as such, but price tables are not parsed,
 * so these sources never produce bars.
 */
public abstract class PortalPageSource implements HistoricalSource {
    private static final Logger log = LoggerFactory.getLogger(PortalPageSource.class);
    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final RestClient http;
    private final ProviderThrottle throttle;

    protected PortalPageSource(RestClient.Builder builder, ProviderThrottle throttle) {
        this.http = builder.build();
        this.throttle = throttle;
    }

    /** URL template with a single {isin} variable. */
    protected abstract String pageUrl();

    @Override
    public Optional<SourceResult> fetch(Instrument instrument, DateRange range) {
        if (!Identifiers.isIsin(instrument.getIdentifier())) return Optional.empty();
        String html = throttle.call(name(), () -> http.get()
                .uri(pageUrl(), instrument.getIdentifier())
                .retrieve()
                .body(String.class));
        if (pageExists(html)) {
            log.debug("{} has a page for {} but its price history is not parsed", name(), instrument.getIdentifier());
        } else {
            log.debug("{} has no page for {}", name(), instrument.getIdentifier());
        }
        return Optional.empty();
    }

    static boolean pageExists(String html) {
        if (html == null || html.isBlank()) return false;
        Matcher m = TITLE.matcher(html);
        if (!m.find()) return true;
        String title = m.group(1).toLowerCase(Locale.ROOT);
        return !(title.contains("not found") || title.contains("errore") || title.contains("404"));
    }
}
