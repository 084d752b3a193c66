package com.example.fundlens.service;

import com.example.fundlens.analytics.BenchmarkSelector;
import com.example.fundlens.analytics.BetaCalculator;
import com.example.fundlens.analytics.ComparisonNormalizer;
import com.example.fundlens.analytics.PerformanceMetricsCalculator;
import com.example.fundlens.analytics.TotalReturnCalculator;
import com.example.fundlens.api.dto.ComparisonDtos.*;
import com.example.fundlens.config.FundLensProperties.Benchmarks.BenchmarkRef;
import com.example.fundlens.domain.ComparisonTable;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.domain.InstrumentMetrics;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.domain.TotalReturnSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds a base-100 comparison across instruments. Instruments are processed one after
 * another; one that fails or has no data is reported as unavailable and the rest proceed.
 */
@Service
public class ComparisonService {
    private static final Logger log = LoggerFactory.getLogger(ComparisonService.class);

    private final InstrumentResolver instrumentResolver;
    private final HistoricalDataService historicalData;
    private final BenchmarkService benchmarkService;
    private final TotalReturnCalculator totalReturnCalculator;
    private final ComparisonNormalizer normalizer;
    private final PerformanceMetricsCalculator metricsCalculator;
    private final BetaCalculator betaCalculator;
    private final BenchmarkSelector benchmarkSelector;

    public ComparisonService(InstrumentResolver instrumentResolver, HistoricalDataService historicalData,
                             BenchmarkService benchmarkService, TotalReturnCalculator totalReturnCalculator,
                             ComparisonNormalizer normalizer, PerformanceMetricsCalculator metricsCalculator,
                             BetaCalculator betaCalculator, BenchmarkSelector benchmarkSelector) {
        this.instrumentResolver = instrumentResolver;
        this.historicalData = historicalData;
        this.benchmarkService = benchmarkService;
        this.totalReturnCalculator = totalReturnCalculator;
        this.normalizer = normalizer;
        this.metricsCalculator = metricsCalculator;
        this.betaCalculator = betaCalculator;
        this.benchmarkSelector = benchmarkSelector;
    }

    public ComparisonResponse compare(ComparisonRequest request) {
        // Column label -> instrument, series and total return, in request order
        Map<String, Instrument> instruments = new LinkedHashMap<>();
        Map<String, PriceSeries> prices = new LinkedHashMap<>();
        Map<String, TotalReturnSeries> totalReturns = new LinkedHashMap<>();
        List<String> unavailable = new ArrayList<>();

        for (InstrumentRef ref : request.instruments()) {
            try {
                Instrument instrument = instrumentResolver.resolve(ref.identifier(), ref.ticker(), ref.name());
                Optional<PriceSeries> series = historicalData.history(instrument);
                if (series.isEmpty() || series.get().isEmpty()) {
                    unavailable.add(instrument.getIdentifier());
                    continue;
                }
                String label = uniqueLabel(instrument, instruments.keySet());
                instruments.put(label, instrument);
                prices.put(label, series.get());
                totalReturns.put(label, totalReturnCalculator.compute(series.get()));
            } catch (RuntimeException e) {
                log.warn("Skipping {} in comparison: {}", ref.identifier(), e.getMessage(), e);
                unavailable.add(ref.identifier());
            }
        }

        ComparisonTable table = normalizer.normalize(totalReturns, request.startDate());
        Map<String, Optional<TotalReturnSeries>> benchmarks = new HashMap<>();
        List<InstrumentSummary> summaries = new ArrayList<>(instruments.size());
        for (Map.Entry<String, Instrument> e : instruments.entrySet()) {
            String label = e.getKey();
            Instrument instrument = e.getValue();
            TotalReturnSeries window = table.getCommonStartDate() == null
                    ? totalReturns.get(label)
                    : totalReturns.get(label).from(table.getCommonStartDate());
            InstrumentMetrics metrics = metricsCalculator.compute(window, null);
            BenchmarkRef ref = benchmarkSelector.select(instrument.getIdentifier());
            Optional<TotalReturnSeries> benchmark = benchmarks.computeIfAbsent(ref.ticker(), this::benchmarkTotalReturn);
            if (benchmark.isPresent()) {
                Double beta = betaCalculator.beta(window, benchmark.get()).orElse(null);
                metrics = metrics.withBeta(beta, ref.name());
            }
            PriceSeries series = prices.get(label);
            summaries.add(new InstrumentSummary(instrument.getIdentifier(), label, series.getSourceName(), series.isAdjusted(), metrics));
        }

        return new ComparisonResponse(table.getCommonStartDate(), normalizer.getBaseValue(), table.getDates(),
                table.getColumns(), summaries, unavailable);
    }

    private Optional<TotalReturnSeries> benchmarkTotalReturn(String ticker) {
        try {
            return benchmarkService.benchmark(ticker).map(totalReturnCalculator::compute);
        } catch (RuntimeException e) {
            log.warn("Benchmark {} unavailable: {}", ticker, e.getMessage());
            return Optional.empty();
        }
    }

    private static String uniqueLabel(Instrument instrument, Set<String> taken) {
        String label = instrument.getName();
        if (!taken.contains(label)) return label;
        String qualified = label + " (" + instrument.getIdentifier() + ")";
        // same name and identifier listed more than once
        for (int n = 2; taken.contains(qualified); n++) {
            qualified = label + " (" + instrument.getIdentifier() + " #" + n + ")";
        }
        return qualified;
    }
}
