package com.example.fundlens.api.dto;

import com.example.fundlens.domain.DailyRecord;
import com.example.fundlens.domain.ValidationReport;

import java.time.Instant;
import java.util.List;

public class SeriesDtos {
    // Price history of one instrument with provenance and its validation report
    public record SeriesResponse(
            String identifier,
            String source,
            boolean adjusted,
            Instant fetchedAt,
            boolean fromCache,
            List<DailyRecord> records,
            ValidationReport validation
    ) {}

    public record DescriptionResponse(
            String identifier,
            String description,
            String source
    ) {}
}
