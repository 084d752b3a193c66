package com.example.fundlens.service;

import com.example.fundlens.analytics.SeriesValidator;
import com.example.fundlens.cache.CacheKind;
import com.example.fundlens.cache.CacheManager;
import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.domain.InstrumentClass;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.domain.ValidationReport;
import com.example.fundlens.marketdata.AdjustmentClassifier;
import com.example.fundlens.marketdata.InstrumentClassifier;
import com.example.fundlens.marketdata.SourceResolver;
import com.example.fundlens.marketdata.SourceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Price history for one instrument: a fresh cache entry when there is one, otherwise the
 * source chain, classified, validated and cached. Validation failures are logged and the
 * data is still returned.
 */
@Service
public class HistoricalDataService {
    private static final Logger log = LoggerFactory.getLogger(HistoricalDataService.class);

    private final CacheManager cache;
    private final SourceResolver resolver;
    private final InstrumentClassifier instrumentClassifier;
    private final AdjustmentClassifier adjustmentClassifier;
    private final SeriesValidator validator;
    private final FundLensProperties properties;
    private final Clock clock;

    public HistoricalDataService(CacheManager cache, SourceResolver resolver, InstrumentClassifier instrumentClassifier,
                                 AdjustmentClassifier adjustmentClassifier, SeriesValidator validator,
                                 FundLensProperties properties, Clock clock) {
        this.cache = cache;
        this.resolver = resolver;
        this.instrumentClassifier = instrumentClassifier;
        this.adjustmentClassifier = adjustmentClassifier;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<PriceSeries> history(Instrument instrument) {
        return fetch(instrument).map(FetchedSeries::series);
    }

    public Optional<FetchedSeries> fetch(Instrument instrument) {
        return fetch(instrument, CacheKind.HISTORICAL, resolver::resolve);
    }

    Optional<FetchedSeries> fetch(Instrument instrument, CacheKind kind,
                                  BiFunction<Instrument, DateRange, Optional<SourceResult>> lookup) {
        String id = instrument.getIdentifier();
        Optional<PriceSeries> cached = cache.getSeries(id, kind);
        if (cached.isPresent()) {
            log.debug("Serving {} {} from cache ({})", kind.fileSuffix(), id, cached.get().getSourceName());
            return Optional.of(new FetchedSeries(cached.get(), validator.validate(cached.get()), true));
        }

        DateRange range = DateRange.lastYears(properties.analysis().yearsBack(), clock);
        Optional<SourceResult> result = lookup.apply(instrument, range);
        if (result.isEmpty()) {
            log.warn("No data available for {} from any source", id);
            return Optional.empty();
        }

        InstrumentClass instrumentClass = instrumentClassifier.classify(id, instrument.getTicker());
        PriceSeries series = adjustmentClassifier.toSeries(result.get(), instrumentClass, clock.instant());
        ValidationReport report = validator.validate(series);
        logFailures(id, report);
        cache.putSeries(id, kind, series, report);
        return Optional.of(new FetchedSeries(series, report, false));
    }

    private static void logFailures(String id, ValidationReport report) {
        if (!report.totalReturn().passed()) log.warn("Validation total_return failed for {}: {}", id, report.totalReturn().message());
        if (!report.consistency().passed()) log.warn("Validation consistency failed for {}: {}", id, report.consistency().message());
        if (!report.completeness().passed()) log.warn("Validation completeness failed for {}: {}", id, report.completeness().message());
        for (String warning : report.warnings()) {
            log.info("Validation warning for {}: {}", id, warning);
        }
    }
}
