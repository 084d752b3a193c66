package com.example.fundlens.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Advisory result of the sanity checks run over one price series. It annotates the
 * data and never gates it.
 */
public record ValidationReport(
        @JsonProperty("total_return") CheckResult totalReturn,
        @JsonProperty("consistency") CheckResult consistency,
        @JsonProperty("completeness") CheckResult completeness,
        @JsonProperty("warnings") List<String> warnings
) {
    public ValidationReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonIgnore
    public boolean valid() {
        return totalReturn.passed() && consistency.passed() && completeness.passed();
    }

    public record CheckResult(@JsonProperty("valid") boolean passed, @JsonProperty("message") String message) {
        public static CheckResult pass(String message) {
            return new CheckResult(true, message);
        }

        public static CheckResult fail(String message) {
            return new CheckResult(false, message);
        }
    }
}
