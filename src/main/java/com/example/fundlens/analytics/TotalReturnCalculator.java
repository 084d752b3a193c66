package com.example.fundlens.analytics;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DailyRecord;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.domain.TotalReturnSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cumulative total return of a price series, seeded at its first price.
 *
 * An adjusted series already embeds distributions, so its total return is the chained
 * price ratio. A raw series reinvests a distribution on the day it is paid, but only when
 * the price actually dropped by more than {@code fundlens.total-return.ex-distribution-drop}
 * that day; otherwise the distribution is assumed to be reflected in the price already.
 */
@Component
public class TotalReturnCalculator {
    private static final Logger log = LoggerFactory.getLogger(TotalReturnCalculator.class);

    // Daily price change (as decimal, e.g. -0.01) below which a distribution counts as paid that day
    private final double exDistributionDrop;

    public TotalReturnCalculator(FundLensProperties properties) {
        this.exDistributionDrop = properties.totalReturn().exDistributionDrop();
    }

    public TotalReturnSeries compute(PriceSeries series) {
        if (series.isEmpty()) return TotalReturnSeries.empty();
        double[] prices = series.prices();
        // Adjusted prices already embed distributions: only chain the price ratios
        double[] values;
        if (series.isAdjusted()) {
            values = chain(prices);
        } else {
            // Raw prices: dividends and capital gains paid each day, zero on most days
            List<DailyRecord> records = series.getRecords();
            double[] distributions = new double[records.size()];
            for (int i = 0; i < distributions.length; i++) distributions[i] = records.get(i).distribution();
            values = reinvest(prices, distributions);
        }
        TotalReturnSeries result = new TotalReturnSeries(series.dates(), values);
        // Reinvesting can only add value; a lower ratio points at bad distribution data
        if (!series.isAdjusted() && series.hasDistributions() && result.ratio() < series.priceReturnRatio()) {
            log.warn("Total return {} below price return {} for series from {}",
                    result.ratio(), series.priceReturnRatio(), series.getSourceName());
        }
        return result;
    }

    /**
     * Running product of daily multipliers over raw prices and same-day distributions,
     * seeded at the first price. Also used to rebuild an adjusted close.
     */
    public double[] reinvest(double[] prices, double[] distributions) {
        double[] values = new double[prices.length];
        if (prices.length == 0) return values;
        values[0] = prices[0];
        for (int t = 1; t < prices.length; t++) {
            values[t] = values[t - 1] * multiplier(prices[t - 1], prices[t], distributions[t]);
        }
        return values;
    }

    double multiplier(double prev, double curr, double distribution) {
        // Reinvest only when the price actually fell on the distribution day
        if (distribution > 0 && (curr - prev) / prev < exDistributionDrop) {
            return (curr + distribution) / prev;
        }
        return curr / prev;
    }

    private static double[] chain(double[] prices) {
        double[] values = new double[prices.length];
        values[0] = prices[0];
        for (int t = 1; t < prices.length; t++) {
            values[t] = values[t - 1] * (prices[t] / prices[t - 1]);
        }
        return values;
    }
}
