package com.example.fundlens.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifiersTest {

    @Test
    void recognizesIsinsAndTickers() {
        assertThat(Identifiers.isIsin("LU0097089360")).isTrue();
        assertThat(Identifiers.isIsin(" us87281y1029 ")).isTrue();
        assertThat(Identifiers.isIsin("PRHSX")).isFalse();
        assertThat(Identifiers.isTicker("PRHSX")).isTrue();
        assertThat(Identifiers.isTicker("AAPL")).isTrue();
        assertThat(Identifiers.isTicker("LU0097089360")).isFalse();
    }

    @Test
    void countryCodeOnlyForIsins() {
        assertThat(Identifiers.countryCode("IE0003111113")).contains("IE");
        assertThat(Identifiers.countryCode("SPY")).isEmpty();
    }

    @Test
    void sanitizesForFileNames() {
        assertThat(Identifiers.sanitize("^GSPC")).isEqualTo("_GSPC");
        assertThat(Identifiers.sanitize("LU0097089360.L")).isEqualTo("LU0097089360.L");
        assertThat(Identifiers.sanitize("a/b")).isEqualTo("a_b");
    }
}
