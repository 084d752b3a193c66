package com.example.fundlens.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dates by instruments, every column re-based to the same value at {@link #getCommonStartDate()}.
 * A null cell means the instrument had no observation yet on that date.
 */
public final class ComparisonTable {
    private final LocalDate commonStartDate;
    private final List<LocalDate> dates;
    // Column label -> values aligned with dates, in insertion order
    private final Map<String, List<Double>> columns;

    public ComparisonTable(LocalDate commonStartDate, List<LocalDate> dates, Map<String, List<Double>> columns) {
        this.commonStartDate = commonStartDate;
        this.dates = List.copyOf(dates);
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (values.size() != dates.size()) {
                throw new IllegalArgumentException("column " + name + " has " + values.size() + " values for " + dates.size() + " dates");
            }
            copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        });
        this.columns = Collections.unmodifiableMap(copy);
    }

    public static ComparisonTable empty() {
        return new ComparisonTable(null, List.of(), Map.of());
    }

    public LocalDate getCommonStartDate() { return commonStartDate; }
    public List<LocalDate> getDates() { return dates; }
    public Map<String, List<Double>> getColumns() { return columns; }

    public boolean isEmpty() {
        return dates.isEmpty() || columns.isEmpty();
    }

    /** @return the cell for an instrument on a date, or null when absent */
    public Double valueAt(String column, LocalDate date) {
        List<Double> values = columns.get(column);
        int idx = Collections.binarySearch(dates, date);
        if (values == null || idx < 0) return null;
        return values.get(idx);
    }
}
