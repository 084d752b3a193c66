package com.example.fundlens.metadata;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/** Business summary from the Yahoo quote-summary profile modules. */
@Component
@Order(10)
public class YahooProfileDescriptions implements DescriptionProvider {
    private final YahooQuoteSummaryClient quoteSummary;

    public YahooProfileDescriptions(YahooQuoteSummaryClient quoteSummary) {
        this.quoteSummary = quoteSummary;
    }

    @Override
    public String sourceName() {
        return "Yahoo Finance";
    }

    @Override
    public Optional<String> describe(String identifier, String ticker, String name) {
        if (ticker == null) return Optional.empty();
        return quoteSummary.modules(ticker, "assetProfile,summaryProfile").flatMap(result -> {
            for (String module : new String[]{"assetProfile", "summaryProfile"}) {
                if (result.get(module) instanceof Map<?, ?> profile
                        && profile.get("longBusinessSummary") instanceof String s && !s.isBlank()) {
                    return Optional.of(s.trim());
                }
            }
            return Optional.empty();
        });
    }
}
