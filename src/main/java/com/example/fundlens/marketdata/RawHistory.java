package com.example.fundlens.marketdata;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily bars of one source response, date-ordered with one bar per date (a later bar for
 * the same date replaces the earlier one).
 */
public final class RawHistory {
    private final List<RawBar> bars;

    public RawHistory(List<RawBar> bars) {
        Map<LocalDate, RawBar> byDate = new TreeMap<>();
        for (RawBar bar : bars) {
            if (bar != null && Double.isFinite(bar.close()) && bar.close() > 0) {
                byDate.put(bar.date(), bar);
            }
        }
        this.bars = Collections.unmodifiableList(new ArrayList<>(byDate.values()));
    }

    public List<RawBar> getBars() { return bars; }
    public int size() { return bars.size(); }
    public boolean isEmpty() { return bars.isEmpty(); }

    /** @return true when every bar carries a positive adjusted close */
    public boolean hasAdjustedClose() {
        if (bars.isEmpty()) return false;
        for (RawBar bar : bars) {
            if (bar.adjClose() == null || !(bar.adjClose() > 0)) return false;
        }
        return true;
    }
}
