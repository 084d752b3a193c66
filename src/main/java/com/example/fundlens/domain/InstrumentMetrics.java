package com.example.fundlens.domain;

/**
 * Performance bundle of one instrument over a comparison window. Percent values are
 * rounded to two decimals; a null field could not be computed.
 */
public record InstrumentMetrics(
        Double totalReturn,
        Double annualizedReturn,
        Double volatility,
        Double sharpeRatio,
        Double maxDrawdown,
        Double beta,
        String benchmark
) {
    public static InstrumentMetrics unavailable() {
        return new InstrumentMetrics(null, null, null, null, null, null, null);
    }

    public InstrumentMetrics withBeta(Double beta, String benchmark) {
        return new InstrumentMetrics(totalReturn, annualizedReturn, volatility, sharpeRatio, maxDrawdown, beta, benchmark);
    }
}
