package com.example.fundlens.marketdata;

import com.example.fundlens.analytics.TotalReturnCalculator;
import com.example.fundlens.domain.DailyRecord;
import com.example.fundlens.domain.InstrumentClass;
import com.example.fundlens.domain.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a source result into a price series with a definite adjustment flag.
 *
 * Adjusted vendors always yield an adjusted series; a bar the vendor left without an
 * adjusted close takes its raw close. Home-market funds keep the source's adjusted close,
 * or get one rebuilt from raw close and distributions when the source has none.
 * Everything else keeps the raw close and its distributions. An adjusted series never
 * carries distributions.
 */
@Component
public class AdjustmentClassifier {
    private static final Logger log = LoggerFactory.getLogger(AdjustmentClassifier.class);

    private final TotalReturnCalculator calculator;

    public AdjustmentClassifier(TotalReturnCalculator calculator) {
        this.calculator = calculator;
    }

    public PriceSeries toSeries(SourceResult result, InstrumentClass instrumentClass, Instant fetchedAt) {
        RawHistory history = result.history();
        boolean domestic = instrumentClass == InstrumentClass.DOMESTIC_ADJUSTED_FUND;
        if (result.adjustedVendor()) {
            return vendorAdjusted(history, result.sourceName(), fetchedAt);
        }
        if (domestic && history.hasAdjustedClose()) {
            return adjustedClose(history, result.sourceName(), fetchedAt);
        }
        if (domestic) {
            log.debug("{} has no adjusted close, rebuilding it from distributions", result.sourceName());
            return reconstructed(history, result.sourceName(), fetchedAt);
        }
        return rawClose(history, result.sourceName(), fetchedAt);
    }

    private static PriceSeries adjustedClose(RawHistory history, String source, Instant fetchedAt) {
        List<DailyRecord> records = new ArrayList<>(history.size());
        for (RawBar bar : history.getBars()) {
            records.add(DailyRecord.adjusted(bar.date(), bar.adjClose()));
        }
        return new PriceSeries(records, source, fetchedAt);
    }

    private static PriceSeries vendorAdjusted(RawHistory history, String source, Instant fetchedAt) {
        List<DailyRecord> records = new ArrayList<>(history.size());
        int filled = 0;
        for (RawBar bar : history.getBars()) {
            Double adjClose = bar.adjClose();
            if (adjClose == null || !(adjClose > 0)) {
                adjClose = bar.close();
                filled++;
            }
            records.add(DailyRecord.adjusted(bar.date(), adjClose));
        }
        if (filled > 0) {
            log.debug("{} left {} of {} bars without adjusted close, using close", source, filled, history.size());
        }
        return new PriceSeries(records, source, fetchedAt);
    }

    private PriceSeries reconstructed(RawHistory history, String source, Instant fetchedAt) {
        List<RawBar> bars = history.getBars();
        double[] prices = new double[bars.size()];
        double[] distributions = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            prices[i] = bars.get(i).close();
            distributions[i] = bars.get(i).dividend() + bars.get(i).capitalGain();
        }
        double[] adjusted = calculator.reinvest(prices, distributions);
        List<DailyRecord> records = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            records.add(DailyRecord.adjusted(bars.get(i).date(), adjusted[i]));
        }
        return new PriceSeries(records, source, fetchedAt);
    }

    private static PriceSeries rawClose(RawHistory history, String source, Instant fetchedAt) {
        List<DailyRecord> records = new ArrayList<>(history.size());
        for (RawBar bar : history.getBars()) {
            records.add(DailyRecord.raw(bar.date(), bar.close(), bar.dividend(), bar.capitalGain()));
        }
        return new PriceSeries(records, source, fetchedAt);
    }
}
