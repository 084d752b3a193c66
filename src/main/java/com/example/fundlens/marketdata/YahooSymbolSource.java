package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Base for sources that try one or more Yahoo symbols derived from the instrument and
 * keep the first that yields more than the configured minimum of records.
 */
public abstract class YahooSymbolSource implements HistoricalSource {
    private static final Logger log = LoggerFactory.getLogger(YahooSymbolSource.class);

    private final YahooChartClient client;
    private final int minRecords;

    protected YahooSymbolSource(YahooChartClient client, FundLensProperties properties) {
        this.client = client;
        this.minRecords = properties.fetch().minRecords();
    }

    /** Candidate Yahoo symbols for the instrument, in the order they should be tried. */
    protected abstract List<String> candidates(Instrument instrument);

    @Override
    public Optional<SourceResult> fetch(Instrument instrument, DateRange range) {
        for (String symbol : candidates(instrument)) {
            Optional<RawHistory> history;
            try {
                history = client.fetchDaily(symbol, range);
            } catch (RuntimeException e) {
                log.debug("{}: symbol {} failed: {}", name(), symbol, e.getMessage());
                continue;
            }
            if (history.isPresent() && history.get().size() > minRecords) {
                return Optional.of(new SourceResult(history.get(), "Yahoo Finance (" + symbol + ")", false));
            }
            log.debug("{}: symbol {} had too few records", name(), symbol);
        }
        return Optional.empty();
    }
}
