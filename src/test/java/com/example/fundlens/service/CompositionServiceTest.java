package com.example.fundlens.service;

import com.example.fundlens.cache.CacheManager;
import com.example.fundlens.cache.FileCacheStore;
import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.metadata.Composition;
import com.example.fundlens.metadata.YahooHoldingsClient;
import com.example.fundlens.util.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositionServiceTest {
    @TempDir
    Path dir;

    @Mock
    private YahooHoldingsClient holdings;

    private CompositionService service;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        CacheManager cache = new CacheManager(new FileCacheStore(dir), mapper, FundLensProperties.defaults(),
                new MutableClock(Instant.parse("2024-06-01T12:00:00Z")));
        service = new CompositionService(cache, holdings, mapper);
    }

    @Test
    void compositionIsCachedAfterFirstLookup() {
        Composition composition = new Composition(Map.of("healthcare", 0.97),
                List.of(new Composition.Holding("LLY", "Eli Lilly", 0.08)));
        when(holdings.composition("PRHSX")).thenReturn(composition);
        Instrument fund = new Instrument("US87281Y1029", "PRHSX", null);

        assertThat(service.composition(fund)).isEqualTo(composition);
        assertThat(service.composition(fund)).isEqualTo(composition);
        verify(holdings, times(1)).composition("PRHSX");
    }

    @Test
    void instrumentWithoutTickerHasEmptyComposition() {
        assertThat(service.composition(new Instrument("LU0097089360", null, null)).isEmpty()).isTrue();
        verifyNoInteractions(holdings);
    }

    @Test
    void lookupFailureGivesEmptyComposition() {
        when(holdings.composition("PRHSX")).thenThrow(new ResourceAccessException("timeout"));

        assertThat(service.composition(new Instrument("US87281Y1029", "PRHSX", null)).isEmpty()).isTrue();
    }
}
