package com.example.fundlens.metadata;

import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.marketdata.ProviderThrottle;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Meta description of the Morningstar fund snapshot page, for ISINs only. */
@Component
@Order(50)
public class MorningstarDescriptions implements DescriptionProvider {
    private static final Pattern META_DESCRIPTION = Pattern.compile(
            "<meta\\s+name=[\"']description[\"']\\s+content=[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final int MIN_LENGTH = 50;

    private final RestClient http;
    private final ProviderThrottle throttle;

    public MorningstarDescriptions(RestClient.Builder builder, ProviderThrottle throttle) {
        this.http = builder.build();
        this.throttle = throttle;
    }

    @Override
    public String sourceName() {
        return "Morningstar";
    }

    @Override
    public Optional<String> describe(String identifier, String ticker, String name) {
        if (!Identifiers.isIsin(identifier)) return Optional.empty();
        String html = throttle.call("morningstar", () -> http.get()
                .uri("https://www.morningstar.it/it/funds/snapshot/snapshot.aspx?id={isin}", identifier)
                .retrieve()
                .body(String.class));
        return extract(html);
    }

    static Optional<String> extract(String html) {
        if (html == null) return Optional.empty();
        Matcher title = TITLE.matcher(html);
        if (title.find()) {
            String t = title.group(1).toLowerCase(Locale.ROOT);
            if (t.contains("not found") || t.contains("errore")) return Optional.empty();
        }
        Matcher m = META_DESCRIPTION.matcher(html);
        if (m.find()) {
            String text = m.group(1).replaceAll("\\s+", " ").trim();
            if (text.length() >= MIN_LENGTH) return Optional.of(text);
        }
        return Optional.empty();
    }
}
