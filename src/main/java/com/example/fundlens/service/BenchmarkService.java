package com.example.fundlens.service;

import com.example.fundlens.cache.CacheKind;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.marketdata.YahooTickerSource;
import org.springframework.stereotype.Service;

import java.util.Optional;

/** Benchmark index or ETF history, looked up by ticker and cached under its own kind. */
@Service
public class BenchmarkService {
    private final HistoricalDataService historicalData;
    private final YahooTickerSource tickerSource;

    public BenchmarkService(HistoricalDataService historicalData, YahooTickerSource tickerSource) {
        this.historicalData = historicalData;
        this.tickerSource = tickerSource;
    }

    public Optional<PriceSeries> benchmark(String ticker) {
        Instrument benchmark = new Instrument(ticker, ticker, ticker);
        return historicalData.fetch(benchmark, CacheKind.BENCHMARK, tickerSource::fetch)
                .map(FetchedSeries::series);
    }
}
