package com.example.fundlens.api.dto;

import com.example.fundlens.domain.InstrumentMetrics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class ComparisonDtos {
    // One instrument to compare; ticker and name are optional hints
    public record InstrumentRef(
            @NotBlank String identifier,
            String ticker,
            String name
    ) {}

    // Instruments to compare and an optional common start date overriding the derived one
    public record ComparisonRequest(
            @NotEmpty List<@Valid InstrumentRef> instruments,
            LocalDate startDate
    ) {}

    // Per-instrument outcome: column label, provenance and performance bundle
    public record InstrumentSummary(
            String identifier,
            String name,
            String source,
            boolean adjusted,
            InstrumentMetrics metrics
    ) {}

    // Base-100 table: one value list per column label, aligned with dates; nulls before first observation
    public record ComparisonResponse(
            LocalDate commonStartDate,
            double baseValue,
            List<LocalDate> dates,
            Map<String, List<Double>> series,
            List<InstrumentSummary> instruments,
            List<String> unavailable
    ) {}
}
