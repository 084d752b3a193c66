package com.example.fundlens.config;

import com.example.fundlens.cache.CacheKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single typed configuration tree for the engine, bound once from {@code fundlens.*}
 * and handed to the components that need it. Every field is optional; absent values
 * fall back to the defaults declared in the compact constructors.
 */
@Validated
@ConfigurationProperties(prefix = "fundlens")
public record FundLensProperties(
        Analysis analysis,
        Cache cache,
        Fetch fetch,
        Apis apis,
        Classification classification,
        TotalReturn totalReturn,
        Validation validation,
        Benchmarks benchmarks,
        String instrumentsResource
) {
    public FundLensProperties {
        analysis = Objects.requireNonNullElseGet(analysis, () -> new Analysis(null, null));
        cache = Objects.requireNonNullElseGet(cache, () -> new Cache(null, null, null, null, null));
        fetch = Objects.requireNonNullElseGet(fetch, () -> new Fetch(null, null, null, null, null, null));
        apis = Objects.requireNonNullElseGet(apis, () -> new Apis(null, null, null, null, null));
        classification = Objects.requireNonNullElseGet(classification, () -> new Classification(null, null));
        totalReturn = Objects.requireNonNullElseGet(totalReturn, () -> new TotalReturn(null));
        validation = Objects.requireNonNullElseGet(validation, () -> new Validation(null, null, null));
        benchmarks = Objects.requireNonNullElseGet(benchmarks, () -> new Benchmarks(null, null, null));
        instrumentsResource = instrumentsResource == null ? "instruments/default.csv" : instrumentsResource;
    }

    /** Configuration with every default applied; handy outside a Spring context. */
    public static FundLensProperties defaults() {
        return new FundLensProperties(null, null, null, null, null, null, null, null, null);
    }

    public record Analysis(Integer yearsBack, Double baseValue) {
        public Analysis {
            yearsBack = yearsBack == null ? 5 : yearsBack;
            baseValue = baseValue == null ? 100.0 : baseValue;
        }
    }

    public record Cache(
            String directory,
            Duration historicalTtl,
            Duration descriptionTtl,
            Duration benchmarkTtl,
            Duration compositionTtl
    ) {
        public Cache {
            directory = directory == null ? "cache" : directory;
            historicalTtl = historicalTtl == null ? Duration.ofHours(24) : historicalTtl;
            descriptionTtl = descriptionTtl == null ? Duration.ofDays(7) : descriptionTtl;
            benchmarkTtl = benchmarkTtl == null ? Duration.ofHours(24) : benchmarkTtl;
            compositionTtl = compositionTtl == null ? Duration.ofHours(24) : compositionTtl;
        }

        public Duration ttlFor(CacheKind kind) {
            return switch (kind) {
                case HISTORICAL -> historicalTtl;
                case DESCRIPTION -> descriptionTtl;
                case BENCHMARK -> benchmarkTtl;
                case COMPOSITION -> compositionTtl;
            };
        }
    }

    public record Fetch(
            Duration providerDelay,
            Integer minRecords,
            List<String> exchangeSuffixes,
            Map<String, String> nationalSuffixes,
            Duration connectTimeout,
            Duration readTimeout
    ) {
        public Fetch {
            providerDelay = providerDelay == null ? Duration.ofSeconds(1) : providerDelay;
            minRecords = minRecords == null ? 10 : minRecords;
            exchangeSuffixes = exchangeSuffixes == null
                    ? List.of("L", "PA", "DE", "MI", "AS", "SW", "BR", "VI", "IR", "LN", "LS")
                    : List.copyOf(exchangeSuffixes);
            nationalSuffixes = nationalSuffixes == null ? Map.of("IE", "IR") : Map.copyOf(nationalSuffixes);
            connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
            readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
        }
    }

    /** Optional vendor credentials. A blank key disables the matching source. */
    public record Apis(
            String eodApiKey,
            String fmpApiKey,
            String alphaVantageApiKey,
            String openFigiApiKey,
            Boolean openFigiEnabled
    ) {
        public Apis {
            openFigiEnabled = openFigiEnabled == null ? Boolean.TRUE : openFigiEnabled;
        }

        public boolean hasEodKey() { return isSet(eodApiKey); }
        public boolean hasFmpKey() { return isSet(fmpApiKey); }
        public boolean hasAlphaVantageKey() { return isSet(alphaVantageApiKey); }
        public boolean hasOpenFigiKey() { return isSet(openFigiApiKey); }

        private static boolean isSet(String key) {
            return key != null && !key.isBlank();
        }
    }

    public record Classification(String homeMarket, String fundTickerPattern) {
        public Classification {
            homeMarket = homeMarket == null ? "US" : homeMarket;
            fundTickerPattern = fundTickerPattern == null ? "^[A-Z]{4}X$" : fundTickerPattern;
        }
    }

    /**
     * @param exDistributionDrop day-over-day change below which a distribution day is
     *                           treated as ex-distribution (e.g. -0.01 for a drop of more than 1%)
     */
    public record TotalReturn(Double exDistributionDrop) {
        public TotalReturn {
            exDistributionDrop = exDistributionDrop == null ? -0.01 : exDistributionDrop;
        }
    }

    public record Validation(Double maxDailyChange, Double suspiciousDailyChange, Integer maxGapDays) {
        public Validation {
            maxDailyChange = maxDailyChange == null ? 0.20 : maxDailyChange;
            suspiciousDailyChange = suspiciousDailyChange == null ? 0.10 : suspiciousDailyChange;
            maxGapDays = maxGapDays == null ? 5 : maxGapDays;
        }
    }

    public record Benchmarks(BenchmarkRef domestic, BenchmarkRef regional, List<String> regionalCountries) {
        public Benchmarks {
            domestic = domestic == null ? new BenchmarkRef("SPY", "S&P 500") : domestic;
            regional = regional == null ? new BenchmarkRef("EZU", "Euro Stoxx 50") : regional;
            regionalCountries = regionalCountries == null
                    ? List.of("LU", "IE", "FR", "DE", "IT", "ES", "NL", "GB", "BE", "AT", "CH", "SE", "NO", "DK", "FI")
                    : List.copyOf(regionalCountries);
        }

        public record BenchmarkRef(String ticker, String name) {}
    }
}
