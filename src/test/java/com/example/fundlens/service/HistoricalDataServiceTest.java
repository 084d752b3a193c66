package com.example.fundlens.service;

import com.example.fundlens.analytics.SeriesValidator;
import com.example.fundlens.analytics.TotalReturnCalculator;
import com.example.fundlens.cache.CacheKind;
import com.example.fundlens.cache.CacheManager;
import com.example.fundlens.cache.FileCacheStore;
import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.marketdata.AdjustmentClassifier;
import com.example.fundlens.marketdata.InstrumentClassifier;
import com.example.fundlens.marketdata.RawBar;
import com.example.fundlens.marketdata.RawHistory;
import com.example.fundlens.marketdata.SourceResolver;
import com.example.fundlens.marketdata.SourceResult;
import com.example.fundlens.util.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HistoricalDataServiceTest {
    private static final Instrument FOREIGN_FUND = new Instrument("LU0097089360", null, "AB International Health Care");
    private static final Instrument DOMESTIC_FUND = new Instrument("US87281Y1029", "PRHSX", "T. Rowe Price Health Sciences");

    @TempDir
    Path dir;

    private MutableClock clock;
    private CacheManager cache;
    private SourceResolver resolver;
    private HistoricalDataService service;
    private final AtomicInteger lookups = new AtomicInteger();

    @BeforeEach
    void setUp() {
        FundLensProperties properties = FundLensProperties.defaults();
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        cache = new CacheManager(new FileCacheStore(dir), new ObjectMapper(), properties, clock);
        resolver = mock(SourceResolver.class);
        TotalReturnCalculator calculator = new TotalReturnCalculator(properties);
        service = new HistoricalDataService(cache, resolver, new InstrumentClassifier(properties),
                new AdjustmentClassifier(calculator), new SeriesValidator(calculator, properties), properties, clock);
    }

    /** Weekday bars with a dividend and a 2% drop on the 20th bar; adjusted close only when asked for. */
    private static RawHistory bars(int count, boolean withAdjClose, int jumpAt) {
        List<RawBar> list = new ArrayList<>();
        LocalDate d = LocalDate.of(2024, 1, 1);
        double close = 100.0;
        for (int i = 0; i < count; i++) {
            while (d.getDayOfWeek().getValue() > 5) d = d.plusDays(1);
            double dividend = 0.0;
            if (i == 20) {
                close *= 0.98;
                dividend = 1.5;
            } else if (i == jumpAt) {
                close *= 1.25;
            } else if (i > 0) {
                close *= 1.001;
            }
            list.add(new RawBar(d, close, withAdjClose ? close * 0.9 : null, dividend, 0.0));
            d = d.plusDays(1);
        }
        return new RawHistory(list);
    }

    private BiFunction<Instrument, DateRange, Optional<SourceResult>> source(RawHistory history, String name) {
        return (instrument, range) -> {
            lookups.incrementAndGet();
            return Optional.of(new SourceResult(history, name, false));
        };
    }

    @Test
    void foreignFundKeepsRawCloseAndIsCached() {
        BiFunction<Instrument, DateRange, Optional<SourceResult>> lookup = source(bars(40, true, -1), "Yahoo Finance (LU0097089360.L)");

        FetchedSeries first = service.fetch(FOREIGN_FUND, CacheKind.HISTORICAL, lookup).orElseThrow();
        FetchedSeries second = service.fetch(FOREIGN_FUND, CacheKind.HISTORICAL, lookup).orElseThrow();

        assertThat(first.fromCache()).isFalse();
        assertThat(first.series().isAdjusted()).isFalse();
        assertThat(first.series().hasDistributions()).isTrue();
        assertThat(first.series().getFetchedAt()).isEqualTo(clock.instant());
        assertThat(first.validation().valid()).isTrue();
        assertThat(second.fromCache()).isTrue();
        assertThat(second.series().getRecords()).isEqualTo(first.series().getRecords());
        assertThat(lookups).hasValue(1);
    }

    @Test
    void domesticFundWithoutAdjustedCloseIsRebuilt() {
        FetchedSeries fetched = service.fetch(DOMESTIC_FUND, CacheKind.HISTORICAL,
                source(bars(40, false, -1), "Yahoo Finance (PRHSX)")).orElseThrow();

        assertThat(fetched.series().isAdjusted()).isTrue();
        assertThat(fetched.series().hasDistributions()).isFalse();
        // Distribution reinvested on the ex-day: adjusted price ends above the raw close
        assertThat(fetched.series().prices()[39]).isGreaterThan(bars(40, false, -1).getBars().get(39).close());
    }

    @Test
    void failedValidationStillReturnsAndCachesData() {
        FetchedSeries fetched = service.fetch(FOREIGN_FUND, CacheKind.HISTORICAL,
                source(bars(40, false, 30), "Stooq (x)")).orElseThrow();

        assertThat(fetched.validation().consistency().passed()).isFalse();
        assertThat(cache.getSeries(FOREIGN_FUND.getIdentifier(), CacheKind.HISTORICAL)).isPresent();
    }

    @Test
    void expiredEntryIsRefetched() {
        BiFunction<Instrument, DateRange, Optional<SourceResult>> lookup = source(bars(40, false, -1), "Yahoo Finance (x)");
        service.fetch(FOREIGN_FUND, CacheKind.HISTORICAL, lookup);

        clock.advance(Duration.ofHours(25));
        FetchedSeries refreshed = service.fetch(FOREIGN_FUND, CacheKind.HISTORICAL, lookup).orElseThrow();

        assertThat(refreshed.fromCache()).isFalse();
        assertThat(lookups).hasValue(2);
    }

    @Test
    void historyUsesTheSourceChainOverTheConfiguredWindow() {
        when(resolver.resolve(eq(FOREIGN_FUND), any())).thenAnswer(inv -> {
            DateRange range = inv.getArgument(1);
            assertThat(range.end()).isEqualTo(LocalDate.of(2024, 6, 1));
            assertThat(range.start()).isEqualTo(LocalDate.of(2024, 6, 1).minusDays(5 * 365L));
            return Optional.of(new SourceResult(bars(40, true, -1), "EOD Historical Data (LU0097089360)", true));
        });

        assertThat(service.history(FOREIGN_FUND)).get().satisfies(s -> {
            assertThat(s.isAdjusted()).isTrue();
            assertThat(s.getSourceName()).isEqualTo("EOD Historical Data (LU0097089360)");
        });
    }

    @Test
    void noSourceMeansNoDataAndNoCacheEntry() {
        when(resolver.resolve(eq(FOREIGN_FUND), any())).thenReturn(Optional.empty());

        assertThat(service.fetch(FOREIGN_FUND)).isEmpty();
        assertThat(cache.get(FOREIGN_FUND.getIdentifier(), CacheKind.HISTORICAL)).isEmpty();
    }
}
