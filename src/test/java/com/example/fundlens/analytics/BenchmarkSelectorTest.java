package com.example.fundlens.analytics;

import com.example.fundlens.config.FundLensProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BenchmarkSelectorTest {
    private final BenchmarkSelector selector = new BenchmarkSelector(FundLensProperties.defaults());

    @Test
    void europeanIsinsUseRegionalIndex() {
        assertThat(selector.select("LU0097089360").ticker()).isEqualTo("EZU");
        assertThat(selector.select("IE00BKSBD728").ticker()).isEqualTo("EZU");
    }

    @Test
    void everythingElseUsesDomesticIndex() {
        assertThat(selector.select("US87281Y1029").ticker()).isEqualTo("SPY");
        assertThat(selector.select("PRHSX").ticker()).isEqualTo("SPY");
        assertThat(selector.select("JP3633400001").name()).isEqualTo("S&P 500");
    }
}
