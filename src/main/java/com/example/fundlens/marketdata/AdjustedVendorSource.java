package com.example.fundlens.marketdata;

import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for premium vendors whose historical endpoint returns an adjusted close embedding
 * reinvested distributions. A vendor without a configured key reports nothing.
 */
public abstract class AdjustedVendorSource implements HistoricalSource {
    private static final Logger log = LoggerFactory.getLogger(AdjustedVendorSource.class);

    private final ProviderThrottle throttle;
    private final AtomicBoolean disabledLogged = new AtomicBoolean();

    protected AdjustedVendorSource(ProviderThrottle throttle) {
        this.throttle = throttle;
    }

    /** Vendor name as recorded in cache entries, e.g. "EOD Historical Data". */
    protected abstract String vendorName();

    protected abstract boolean configured();

    /** Symbol the vendor expects for the instrument. */
    protected abstract String symbolFor(Instrument instrument);

    /** Performs the vendor call; invoked under the vendor's rate limit. */
    protected abstract List<RawBar> download(String symbol, DateRange range);

    @Override
    public Optional<SourceResult> fetch(Instrument instrument, DateRange range) {
        if (!configured()) {
            if (disabledLogged.compareAndSet(false, true)) {
                log.debug("{} disabled: no API key configured", vendorName());
            }
            return Optional.empty();
        }
        String symbol = symbolFor(instrument);
        List<RawBar> bars = throttle.call(name(), () -> download(symbol, range));
        RawHistory history = new RawHistory(bars.stream().filter(b -> range.contains(b.date())).toList());
        if (history.isEmpty()) return Optional.empty();
        return Optional.of(new SourceResult(history, vendorName() + " (" + symbol + ")", true));
    }

    protected static Double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    protected static LocalDate date(Object value) {
        if (value instanceof String s && s.length() >= 10) {
            return LocalDate.parse(s.substring(0, 10));
        }
        return null;
    }
}
