package com.example.fundlens.metadata;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Sector weights and top holdings from the Yahoo {@code topHoldings} module. */
@Component
public class YahooHoldingsClient {
    private final YahooQuoteSummaryClient quoteSummary;

    public YahooHoldingsClient(YahooQuoteSummaryClient quoteSummary) {
        this.quoteSummary = quoteSummary;
    }

    public Composition composition(String ticker) {
        Optional<Map<?, ?>> result = quoteSummary.modules(ticker, "topHoldings");
        if (result.isEmpty() || !(result.get().get("topHoldings") instanceof Map<?, ?> top)) {
            return Composition.empty();
        }
        return parse(top);
    }

    static Composition parse(Map<?, ?> top) {
        Map<String, Double> sectors = new LinkedHashMap<>();
        if (top.get("sectorWeightings") instanceof List<?> weightings) {
            for (Object w : weightings) {
                if (!(w instanceof Map<?, ?> entry)) continue;
                for (Map.Entry<?, ?> e : entry.entrySet()) {
                    Double v = raw(e.getValue());
                    if (v != null && v > 0) sectors.put(String.valueOf(e.getKey()), v);
                }
            }
        }
        List<Composition.Holding> holdings = new ArrayList<>();
        if (top.get("holdings") instanceof List<?> list) {
            for (Object h : list) {
                if (!(h instanceof Map<?, ?> m)) continue;
                String symbol = m.get("symbol") instanceof String s ? s : null;
                String name = m.get("holdingName") instanceof String n ? n : symbol;
                holdings.add(new Composition.Holding(symbol, name, raw(m.get("holdingPercent"))));
            }
        }
        return new Composition(sectors, holdings);
    }

    // Yahoo wraps numbers as {"raw": 0.12, "fmt": "12.00%"}
    private static Double raw(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Map<?, ?> m && m.get("raw") instanceof Number n) return n.doubleValue();
        return null;
    }
}
