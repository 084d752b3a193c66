package com.example.fundlens.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Date-ordered, date-unique price history of one instrument together with its provenance.
 * Instances are immutable; a refreshed fetch replaces the whole series.
 */
public final class PriceSeries {
    private final List<DailyRecord> records;
    // Name of the source that produced the data, e.g. "Yahoo Finance (PRHSX)"
    private final String sourceName;
    private final Instant fetchedAt;
    private final boolean adjusted;

    public PriceSeries(List<DailyRecord> records, String sourceName, Instant fetchedAt) {
        Objects.requireNonNull(records, "records");
        List<DailyRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(DailyRecord::date));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).date().equals(sorted.get(i - 1).date())) {
                throw new IllegalArgumentException("duplicate date " + sorted.get(i).date() + " in series from " + sourceName);
            }
        }
        boolean flag = !sorted.isEmpty() && sorted.get(0).adjusted();
        for (DailyRecord r : sorted) {
            if (r.adjusted() != flag) {
                throw new IllegalArgumentException("mixed adjustment flags in series from " + sourceName);
            }
        }
        this.records = Collections.unmodifiableList(sorted);
        this.sourceName = sourceName == null ? "Unknown" : sourceName;
        this.fetchedAt = fetchedAt;
        this.adjusted = flag;
    }

    public List<DailyRecord> getRecords() { return records; }
    public String getSourceName() { return sourceName; }
    public Instant getFetchedAt() { return fetchedAt; }
    public boolean isAdjusted() { return adjusted; }
    public int size() { return records.size(); }
    public boolean isEmpty() { return records.isEmpty(); }

    public LocalDate firstDate() {
        return records.isEmpty() ? null : records.get(0).date();
    }

    public LocalDate lastDate() {
        return records.isEmpty() ? null : records.get(records.size() - 1).date();
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(records.size());
        for (DailyRecord r : records) dates.add(r.date());
        return dates;
    }

    public double[] prices() {
        double[] prices = new double[records.size()];
        for (int i = 0; i < prices.length; i++) prices[i] = records.get(i).price();
        return prices;
    }

    public boolean hasDistributions() {
        for (DailyRecord r : records) {
            if (r.distribution() > 0) return true;
        }
        return false;
    }

    public double totalDistributions() {
        double sum = 0.0;
        for (DailyRecord r : records) sum += r.distribution();
        return sum;
    }

    /** @return last price over first price, or NaN with fewer than two records */
    public double priceReturnRatio() {
        if (records.size() < 2) return Double.NaN;
        return records.get(records.size() - 1).price() / records.get(0).price();
    }

    @Override
    public String toString() {
        return "PriceSeries[" + sourceName + ", " + records.size() + " records, adjusted=" + adjusted + "]";
    }
}
