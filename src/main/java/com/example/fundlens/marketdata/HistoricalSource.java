package com.example.fundlens.marketdata;

import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;

import java.util.Optional;

/**
 * One place daily price history can come from. Implementations are tried in their
 * {@link org.springframework.core.annotation.Order} by {@link SourceResolver}.
 */
public interface HistoricalSource {

    /** Short provider name used in logs and as the rate-limit key. */
    String name();

    /**
     * Fetch daily bars for the instrument over the range.
     * Implementations may throw; the resolver logs the failure and moves on.
     *
     * @return the bars found, or empty when this source has nothing for the instrument
     */
    Optional<SourceResult> fetch(Instrument instrument, DateRange range);
}
