package com.example.fundlens.analytics;

import com.example.fundlens.domain.TotalReturnSeries;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Beta of an instrument against a benchmark: sample covariance of daily returns over sample
 * variance of benchmark returns, on the dates both series share.
 */
@Component
public class BetaCalculator {
    // Fewer aligned daily returns than this give no beta
    static final int MIN_RETURNS = 30;

    public Optional<Double> beta(TotalReturnSeries instrument, TotalReturnSeries benchmark) {
        if (instrument == null || benchmark == null || instrument.isEmpty() || benchmark.isEmpty()) {
            return Optional.empty();
        }
        // Inner join on dates both series have; no filling
        NavigableMap<LocalDate, Double> bench = benchmark.asMap();
        List<double[]> aligned = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> e : instrument.asMap().entrySet()) {
            Double b = bench.get(e.getKey());
            if (b != null) aligned.add(new double[]{e.getValue(), b});
        }
        int n = aligned.size() - 1;
        if (n < MIN_RETURNS) return Optional.empty();

        double[] fundReturns = new double[n];
        double[] benchReturns = new double[n];
        for (int i = 1; i < aligned.size(); i++) {
            fundReturns[i - 1] = aligned.get(i)[0] / aligned.get(i - 1)[0] - 1.0;
            benchReturns[i - 1] = aligned.get(i)[1] / aligned.get(i - 1)[1] - 1.0;
        }
        // Sample (n - 1) covariance and variance
        double fundMean = mean(fundReturns);
        double benchMean = mean(benchReturns);
        double cov = 0.0;
        double var = 0.0;
        for (int i = 0; i < n; i++) {
            cov += (fundReturns[i] - fundMean) * (benchReturns[i] - benchMean);
            var += (benchReturns[i] - benchMean) * (benchReturns[i] - benchMean);
        }
        cov /= n - 1;
        var /= n - 1;
        if (!(var > 0) || !Double.isFinite(cov)) return Optional.empty();
        return Optional.ofNullable(PerformanceMetricsCalculator.round(cov / var));
    }

    private static double mean(double[] xs) {
        double sum = 0.0;
        for (double x : xs) sum += x;
        return sum / xs.length;
    }
}
