package com.example.fundlens.analytics;

import com.example.fundlens.domain.InstrumentMetrics;
import com.example.fundlens.domain.TotalReturnSeries;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;

/**
 * Return, risk and drawdown figures for one total-return series over a window.
 * Volatility annualizes daily returns with 252 trading days; years are days / 365.25;
 * the Sharpe ratio assumes a zero risk-free rate.
 */
@Component
public class PerformanceMetricsCalculator {
    // Annualization factor for daily volatility
    private static final double TRADING_DAYS = 252.0;
    // Calendar days per year, for the annualized return
    private static final double DAYS_PER_YEAR = 365.25;

    /** Metrics over the observations on or after {@code from} (all of them when null). */
    public InstrumentMetrics compute(TotalReturnSeries series, LocalDate from) {
        if (series == null || series.isEmpty()) return InstrumentMetrics.unavailable();
        NavigableMap<LocalDate, Double> window = from == null ? series.asMap() : series.asMap().tailMap(from, true);
        if (window.isEmpty()) return InstrumentMetrics.unavailable();

        List<Double> values = new ArrayList<>(window.values());
        double first = values.get(0);
        double last = values.get(values.size() - 1);
        // All figures in percent except Sharpe
        Double totalReturn = (last / first - 1.0) * 100.0;

        Double annualized = null;
        long days = ChronoUnit.DAYS.between(window.firstKey(), window.lastKey());
        if (values.size() > 1 && days > 0) {
            double years = days / DAYS_PER_YEAR;
            annualized = (Math.pow(last / first, 1.0 / years) - 1.0) * 100.0;
        }

        Double volatility = null;
        if (values.size() > 1) {
            double[] returns = new double[values.size() - 1];
            for (int i = 1; i < values.size(); i++) returns[i - 1] = values.get(i) / values.get(i - 1) - 1.0;
            volatility = populationStd(returns) * Math.sqrt(TRADING_DAYS) * 100.0;
        }

        Double sharpe = annualized != null && volatility != null && volatility > 0 ? annualized / volatility : null;

        // Deepest fall from a running peak, zero or negative
        double runningMax = first;
        double maxDrawdown = 0.0;
        for (double v : values) {
            runningMax = Math.max(runningMax, v);
            maxDrawdown = Math.min(maxDrawdown, (v - runningMax) / runningMax * 100.0);
        }

        return new InstrumentMetrics(round(totalReturn), round(annualized), round(volatility), round(sharpe),
                round(maxDrawdown), null, null);
    }

    static Double round(Double value) {
        if (value == null || !Double.isFinite(value)) return null;
        return Math.round(value * 100.0) / 100.0;
    }

    private static double populationStd(double[] xs) {
        double mean = 0.0;
        for (double x : xs) mean += x;
        mean /= xs.length;
        double var = 0.0;
        for (double x : xs) var += (x - mean) * (x - mean);
        return Math.sqrt(var / xs.length);
    }
}
