package com.example.fundlens.analytics;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.config.FundLensProperties.Benchmarks.BenchmarkRef;
import com.example.fundlens.domain.Identifiers;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the benchmark an instrument is measured against from its ISIN country: European
 * listings use the regional index, everything else (including bare tickers) the domestic one.
 */
@Component
public class BenchmarkSelector {
    // Regional and domestic index tickers plus the countries mapped to the regional one
    private final FundLensProperties.Benchmarks benchmarks;

    public BenchmarkSelector(FundLensProperties properties) {
        this.benchmarks = properties.benchmarks();
    }

    public BenchmarkRef select(String identifier) {
        Optional<String> country = Identifiers.countryCode(identifier);
        if (country.isPresent() && benchmarks.regionalCountries().contains(country.get())) {
            return benchmarks.regional();
        }
        return benchmarks.domestic();
    }
}
