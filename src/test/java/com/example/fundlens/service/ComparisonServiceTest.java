package com.example.fundlens.service;

import com.example.fundlens.analytics.BenchmarkSelector;
import com.example.fundlens.analytics.BetaCalculator;
import com.example.fundlens.analytics.ComparisonNormalizer;
import com.example.fundlens.analytics.PerformanceMetricsCalculator;
import com.example.fundlens.analytics.TotalReturnCalculator;
import com.example.fundlens.api.dto.ComparisonDtos.ComparisonRequest;
import com.example.fundlens.api.dto.ComparisonDtos.ComparisonResponse;
import com.example.fundlens.api.dto.ComparisonDtos.InstrumentRef;
import com.example.fundlens.api.dto.ComparisonDtos.InstrumentSummary;
import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComparisonServiceTest {
    private static final LocalDate START = LocalDate.of(2022, 1, 3);

    @Mock
    private InstrumentResolver instrumentResolver;
    @Mock
    private HistoricalDataService historicalData;
    @Mock
    private BenchmarkService benchmarkService;

    private ComparisonService service;

    @BeforeEach
    void setUp() {
        FundLensProperties properties = FundLensProperties.defaults();
        TotalReturnCalculator calculator = new TotalReturnCalculator(properties);
        service = new ComparisonService(instrumentResolver, historicalData, benchmarkService, calculator,
                new ComparisonNormalizer(properties), new PerformanceMetricsCalculator(), new BetaCalculator(),
                new BenchmarkSelector(properties));
    }

    /** Adjusted series with a zig-zag so daily returns have dispersion. */
    private static PriceSeries wiggly(LocalDate start, int days, double amplitude) {
        double[] prices = new double[days];
        for (int i = 0; i < days; i++) prices[i] = 100.0 * (1.0 + 0.0004 * i) * (1.0 + amplitude * ((i % 4) - 1.5) / 100.0);
        return TestSeriesFactory.adjusted(start, prices);
    }

    private Instrument stubResolve(String identifier, String name) {
        Instrument instrument = new Instrument(identifier, null, name);
        when(instrumentResolver.resolve(identifier, null, null)).thenReturn(instrument);
        return instrument;
    }

    @Test
    void unavailableInstrumentsDoNotStopTheComparison() {
        Instrument alpha = stubResolve("LU0097089360", "Alpha");
        Instrument broken = stubResolve("LU1960219225", "Broken");
        Instrument empty = stubResolve("IE0003111113", "Empty");
        Instrument late = stubResolve("LU0823417067", "Late");
        when(historicalData.history(alpha)).thenReturn(Optional.of(wiggly(START, 120, 1.0)));
        when(historicalData.history(broken)).thenThrow(new IllegalStateException("provider exploded"));
        when(historicalData.history(empty)).thenReturn(Optional.empty());
        when(historicalData.history(late)).thenReturn(Optional.of(wiggly(START.plusDays(14), 100, 2.0)));
        when(benchmarkService.benchmark("EZU")).thenReturn(Optional.of(wiggly(START, 120, 0.5)));

        ComparisonResponse response = service.compare(new ComparisonRequest(List.of(
                new InstrumentRef("LU0097089360", null, null),
                new InstrumentRef("LU1960219225", null, null),
                new InstrumentRef("IE0003111113", null, null),
                new InstrumentRef("LU0823417067", null, null)), null));

        assertThat(response.unavailable()).containsExactly("LU1960219225", "IE0003111113");
        assertThat(response.series()).containsOnlyKeys("Alpha", "Late");
        assertThat(response.commonStartDate()).isEqualTo(LocalDate.of(2022, 1, 17));
        assertThat(response.baseValue()).isEqualTo(100.0);
        assertThat(response.dates().get(0)).isEqualTo(response.commonStartDate());
        assertThat(response.series().get("Alpha").get(0)).isEqualTo(100.0);
        assertThat(response.series().get("Late").get(0)).isEqualTo(100.0);

        InstrumentSummary summary = response.instruments().get(0);
        assertThat(summary.identifier()).isEqualTo("LU0097089360");
        assertThat(summary.adjusted()).isTrue();
        assertThat(summary.source()).isEqualTo("Test");
        assertThat(summary.metrics().totalReturn()).isNotNull();
        assertThat(summary.metrics().beta()).isNotNull();
        assertThat(summary.metrics().benchmark()).isEqualTo("Euro Stoxx 50");
        verify(benchmarkService, times(1)).benchmark("EZU");
    }

    @Test
    void duplicateNamesGetDistinctColumns() {
        Instrument first = stubResolve("LU0097089360", "Health");
        Instrument second = stubResolve("US87281Y1029", "Health");
        when(historicalData.history(first)).thenReturn(Optional.of(wiggly(START, 60, 1.0)));
        when(historicalData.history(second)).thenReturn(Optional.of(wiggly(START, 60, 1.0)));
        when(benchmarkService.benchmark("EZU")).thenReturn(Optional.empty());
        when(benchmarkService.benchmark("SPY")).thenThrow(new IllegalStateException("no benchmark"));

        ComparisonResponse response = service.compare(new ComparisonRequest(List.of(
                new InstrumentRef("LU0097089360", null, null),
                new InstrumentRef("US87281Y1029", null, null)), null));

        assertThat(response.series()).containsOnlyKeys("Health", "Health (US87281Y1029)");
        assertThat(response.instruments()).extracting(s -> s.metrics().beta()).containsOnlyNulls();
        assertThat(response.unavailable()).isEmpty();
    }

    @Test
    void repeatedInstrumentKeepsEveryColumn() {
        Instrument fund = stubResolve("LU0097089360", "Health");
        when(historicalData.history(fund)).thenReturn(Optional.of(wiggly(START, 60, 1.0)));
        when(benchmarkService.benchmark("EZU")).thenReturn(Optional.empty());

        ComparisonResponse response = service.compare(new ComparisonRequest(List.of(
                new InstrumentRef("LU0097089360", null, null),
                new InstrumentRef("LU0097089360", null, null),
                new InstrumentRef("LU0097089360", null, null)), null));

        assertThat(response.series())
                .containsOnlyKeys("Health", "Health (LU0097089360)", "Health (LU0097089360 #2)");
        assertThat(response.instruments()).hasSize(3);
    }

    @Test
    void explicitStartDateIsHonoured() {
        Instrument alpha = stubResolve("LU0097089360", "Alpha");
        when(historicalData.history(alpha)).thenReturn(Optional.of(wiggly(START, 60, 1.0)));
        when(benchmarkService.benchmark("EZU")).thenReturn(Optional.empty());

        ComparisonResponse response = service.compare(new ComparisonRequest(
                List.of(new InstrumentRef("LU0097089360", null, null)), LocalDate.of(2022, 2, 1)));

        assertThat(response.commonStartDate()).isEqualTo(LocalDate.of(2022, 2, 1));
        assertThat(response.dates().get(0)).isEqualTo(LocalDate.of(2022, 2, 1));
        assertThat(response.series().get("Alpha").get(0)).isEqualTo(100.0);
    }
}
