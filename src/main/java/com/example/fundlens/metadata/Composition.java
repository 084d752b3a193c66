package com.example.fundlens.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio breakdown of a fund. Weights are fractions of the portfolio (0.12 for 12%).
 */
public record Composition(Map<String, Double> sectors, List<Holding> topHoldings) {

    public Composition {
        sectors = sectors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sectors));
        topHoldings = topHoldings == null ? List.of() : List.copyOf(topHoldings);
    }

    public static Composition empty() {
        return new Composition(Map.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sectors.isEmpty() && topHoldings.isEmpty();
    }

    public record Holding(String symbol, String name, Double weight) {}
}
