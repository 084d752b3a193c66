package com.example.fundlens.domain;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Cumulative total-return values, one per date, seeded at the first price of the
 * underlying series.
 */
public final class TotalReturnSeries {
    private final List<LocalDate> dates;
    private final double[] values;

    public TotalReturnSeries(List<LocalDate> dates, double[] values) {
        if (dates.size() != values.length) {
            throw new IllegalArgumentException("dates and values differ in length: " + dates.size() + " vs " + values.length);
        }
        this.dates = List.copyOf(dates);
        this.values = values.clone();
    }

    public static TotalReturnSeries empty() {
        return new TotalReturnSeries(List.of(), new double[0]);
    }

    public List<LocalDate> getDates() { return dates; }
    public double[] getValues() { return values.clone(); }
    public int size() { return values.length; }
    public boolean isEmpty() { return values.length == 0; }

    public LocalDate firstDate() {
        return dates.isEmpty() ? null : dates.get(0);
    }

    public double valueAt(int index) {
        return values[index];
    }

    /** @return last value over first value, or NaN with fewer than two points */
    public double ratio() {
        if (values.length < 2) return Double.NaN;
        return values[values.length - 1] / values[0];
    }

    /** @return the observations on or after {@code start} */
    public TotalReturnSeries from(LocalDate start) {
        int i = 0;
        while (i < dates.size() && dates.get(i).isBefore(start)) i++;
        return new TotalReturnSeries(dates.subList(i, dates.size()), Arrays.copyOfRange(values, i, values.length));
    }

    public NavigableMap<LocalDate, Double> asMap() {
        NavigableMap<LocalDate, Double> map = new TreeMap<>();
        for (int i = 0; i < values.length; i++) map.put(dates.get(i), values[i]);
        return map;
    }

    @Override
    public String toString() {
        return "TotalReturnSeries[" + values.length + " points, " + Arrays.toString(Arrays.copyOf(values, Math.min(3, values.length))) + "...]";
    }
}
