package com.example.fundlens.analytics;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.ComparisonTable;
import com.example.fundlens.domain.TotalReturnSeries;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeSet;

/**
 * Aligns many total-return series on one date axis and re-bases each to the base value.
 *
 * The common start is the latest first date among the inputs unless the caller supplies
 * one. Each column is scaled so its first observation on or after the common start equals
 * the base value exactly; later holes are filled with the last observation.
 */
@Component
public class ComparisonNormalizer {
    // Value every column starts from at the common start date (e.g. 100)
    private final double baseValue;

    public ComparisonNormalizer(FundLensProperties properties) {
        this.baseValue = properties.analysis().baseValue();
    }

    public double getBaseValue() {
        return baseValue;
    }

    /** @param startOverride explicit common start date, or null to derive it */
    public ComparisonTable normalize(Map<String, TotalReturnSeries> seriesByName, LocalDate startOverride) {
        Map<String, NavigableMap<LocalDate, Double>> inputs = new LinkedHashMap<>();
        LocalDate derivedStart = null;
        for (Map.Entry<String, TotalReturnSeries> e : seriesByName.entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) continue;
            inputs.put(e.getKey(), e.getValue().asMap());
            LocalDate first = e.getValue().firstDate();
            if (derivedStart == null || first.isAfter(derivedStart)) derivedStart = first;
        }
        if (inputs.isEmpty()) return ComparisonTable.empty();
        LocalDate commonStart = startOverride != null ? startOverride : derivedStart;

        // Union of all dates from the common start on

        TreeSet<LocalDate> axis = new TreeSet<>();
        for (NavigableMap<LocalDate, Double> values : inputs.values()) {
            axis.addAll(values.tailMap(commonStart, true).keySet());
        }
        List<LocalDate> dates = new ArrayList<>(axis);

        Map<String, List<Double>> columns = new LinkedHashMap<>();
        for (Map.Entry<String, NavigableMap<LocalDate, Double>> e : inputs.entrySet()) {
            columns.put(e.getKey(), rebase(e.getValue().tailMap(commonStart, true), dates, commonStart));
        }
        return new ComparisonTable(commonStart, dates, columns);
    }

    private List<Double> rebase(NavigableMap<LocalDate, Double> values, List<LocalDate> dates, LocalDate commonStart) {
        List<Double> column = new ArrayList<>(dates.size());
        if (values.isEmpty()) {
            for (int i = 0; i < dates.size(); i++) column.add(null);
            return column;
        }
        // First observation on or after the common start anchors the column
        LocalDate firstValidDate = values.firstKey();
        double firstValid = values.firstEntry().getValue();
        Double last = null;
        for (LocalDate date : dates) {
            Double raw = values.get(date);
            if (raw != null) {
                last = date.equals(firstValidDate) ? baseValue : raw / firstValid * baseValue;
            }
            column.add(last); // forward-filled; null until the column's first observation
        }
        // Exactly the base value at the common start wherever the column has a value there
        int startIdx = dates.indexOf(commonStart);
        if (startIdx >= 0 && column.get(startIdx) != null) {
            column.set(startIdx, baseValue);
        }
        return column;
    }
}
