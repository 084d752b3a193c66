package com.example.fundlens.analytics;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DailyRecord;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.domain.TotalReturnSeries;
import com.example.fundlens.domain.ValidationReport;
import com.example.fundlens.domain.ValidationReport.CheckResult;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sanity checks over a fetched series: total return not below price return, no implausible
 * single-day moves, no long gaps. The report is advisory.
 */
@Component
public class SeriesValidator {
    // Jump dates quoted in a failed consistency check
    private static final int MAX_LISTED_DATES = 5;
    // Floating-point slack when comparing total return and price return ratios
    private static final double RATIO_TOLERANCE = 1e-9;

    private final TotalReturnCalculator calculator;
    // Daily change and gap limits from fundlens.validation.*
    private final FundLensProperties.Validation thresholds;

    public SeriesValidator(TotalReturnCalculator calculator, FundLensProperties properties) {
        this.calculator = calculator;
        this.thresholds = properties.validation();
    }

    public ValidationReport validate(PriceSeries series) {
        List<String> warnings = new ArrayList<>();
        CheckResult totalReturn = checkTotalReturn(series);
        CheckResult consistency = checkConsistency(series, warnings);
        CheckResult completeness = checkCompleteness(series);
        return new ValidationReport(totalReturn, consistency, completeness, warnings);
    }

    CheckResult checkTotalReturn(PriceSeries series) {
        if (series.size() < 2) {
            return CheckResult.fail("Insufficient data: " + series.size() + " records");
        }
        if (series.isAdjusted()) {
            return CheckResult.pass("Prices are adjusted; distributions already included");
        }
        if (!series.hasDistributions()) {
            return CheckResult.pass("No distributions; total return equals price return");
        }
        double priceRatio = series.priceReturnRatio();
        TotalReturnSeries tr = calculator.compute(series);
        double trRatio = tr.ratio();
        String detail = String.format(Locale.ROOT, "total return ratio %.4f, price ratio %.4f, distributions %.4f",
                trRatio, priceRatio, series.totalDistributions());
        if (trRatio >= priceRatio - RATIO_TOLERANCE) {
            return CheckResult.pass("Total return consistent: " + detail);
        }
        return CheckResult.fail("Total return below price return: " + detail);
    }

    CheckResult checkConsistency(PriceSeries series, List<String> warnings) {
        List<DailyRecord> records = series.getRecords();
        List<LocalDate> jumps = new ArrayList<>();
        double maxChange = 0.0;
        for (int i = 1; i < records.size(); i++) {
            double change = Math.abs(records.get(i).price() / records.get(i - 1).price() - 1.0);
            maxChange = Math.max(maxChange, change);
            if (change > thresholds.maxDailyChange()) jumps.add(records.get(i).date());
        }
        // Any move above the hard limit fails; above the soft limit only warns
        if (!jumps.isEmpty()) {
            List<LocalDate> listed = jumps.subList(0, Math.min(MAX_LISTED_DATES, jumps.size()));
            return CheckResult.fail(String.format(Locale.ROOT, "%d daily changes above %.0f%%: %s",
                    jumps.size(), thresholds.maxDailyChange() * 100, listed));
        }
        if (maxChange > thresholds.suspiciousDailyChange()) {
            warnings.add(String.format(Locale.ROOT, "Largest daily change %.2f%% exceeds %.0f%%",
                    maxChange * 100, thresholds.suspiciousDailyChange() * 100));
        }
        return CheckResult.pass(String.format(Locale.ROOT, "Largest daily change %.2f%%", maxChange * 100));
    }

    CheckResult checkCompleteness(PriceSeries series) {
        List<DailyRecord> records = series.getRecords();
        long maxGap = 0;
        LocalDate gapEnd = null;
        for (int i = 1; i < records.size(); i++) {
            // Calendar days, so a normal weekend counts as 3
            long gap = ChronoUnit.DAYS.between(records.get(i - 1).date(), records.get(i).date());
            if (gap > maxGap) {
                maxGap = gap;
                gapEnd = records.get(i).date();
            }
        }
        if (maxGap > thresholds.maxGapDays()) {
            return CheckResult.fail("Gap of " + maxGap + " days ending " + gapEnd);
        }
        return CheckResult.pass("Largest gap " + maxGap + " days");
    }
}
