package com.example.fundlens.service;

import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.domain.ValidationReport;

/**
 * A price series with its validation report.
 *
 * @param fromCache true when the series was served from a fresh cache entry
 */
public record FetchedSeries(PriceSeries series, ValidationReport validation, boolean fromCache) {
}
