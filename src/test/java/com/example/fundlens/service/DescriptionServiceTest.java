package com.example.fundlens.service;

import com.example.fundlens.cache.CacheEntry;
import com.example.fundlens.cache.CacheKind;
import com.example.fundlens.cache.CacheManager;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.metadata.DescriptionProvider;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DescriptionServiceTest {
    private static final Instrument FUND = new Instrument("LU0097089360", null, "AB International Health Care");
    private static final String TEXT = "The fund invests in healthcare companies across developed and emerging markets.";

    @Mock
    private CacheManager cache;
    @Mock
    private DescriptionProvider yahoo;
    @Mock
    private DescriptionProvider wikipedia;
    @Mock
    private DescriptionProvider morningstar;

    @Test
    void firstProviderWithTextWinsAndIsCached() {
        when(cache.get(FUND.getIdentifier(), CacheKind.DESCRIPTION)).thenReturn(Optional.empty());
        when(yahoo.describe("LU0097089360", null, "AB International Health Care")).thenThrow(new IllegalStateException("down"));
        when(yahoo.sourceName()).thenReturn("Yahoo Finance");
        when(wikipedia.describe("LU0097089360", null, "AB International Health Care")).thenReturn(Optional.of("  "));
        when(morningstar.describe("LU0097089360", null, "AB International Health Care")).thenReturn(Optional.of(TEXT));
        when(morningstar.sourceName()).thenReturn("Morningstar");
        DescriptionService service = new DescriptionService(cache, List.of(yahoo, wikipedia, morningstar));

        Optional<DescriptionService.Description> description = service.describe(FUND);

        assertThat(description).contains(new DescriptionService.Description(TEXT, "Morningstar"));
        verify(cache).putText(FUND.getIdentifier(), CacheKind.DESCRIPTION, TEXT, "Morningstar");
    }

    @Test
    void cachedDescriptionSkipsProviders() {
        when(cache.get(FUND.getIdentifier(), CacheKind.DESCRIPTION)).thenReturn(Optional.of(
                new CacheEntry(TextNode.valueOf(TEXT), Instant.now(), "Wikipedia", null)));
        DescriptionService service = new DescriptionService(cache, List.of(yahoo));

        assertThat(service.describe(FUND)).contains(new DescriptionService.Description(TEXT, "Wikipedia"));
        verifyNoInteractions(yahoo);
    }

    @Test
    void nothingFoundIsEmptyAndNotCached() {
        Instrument bare = new Instrument("IE0003111113", null, null);
        when(cache.get(bare.getIdentifier(), CacheKind.DESCRIPTION)).thenReturn(Optional.empty());
        // A name equal to the identifier is not passed on as a name
        when(yahoo.describe("IE0003111113", null, null)).thenReturn(Optional.empty());
        DescriptionService service = new DescriptionService(cache, List.of(yahoo));

        assertThat(service.describe(bare)).isEmpty();
        verify(cache, never()).putText(any(), any(), any(), any());
    }

    @Test
    void shortTextIsKept() {
        assertThat(DescriptionService.truncate(TEXT)).isEqualTo(TEXT);
    }

    @Test
    void longTextIsCutAtSentenceEnd() {
        String text = "a".repeat(750) + ". " + "b".repeat(448);

        assertThat(DescriptionService.truncate(text)).isEqualTo("a".repeat(750) + ".");
    }

    @Test
    void longTextWithoutLateSentenceIsCutAtWord() {
        String text = "x".repeat(950) + " " + "y".repeat(100);

        assertThat(DescriptionService.truncate(text)).isEqualTo("x".repeat(950) + "...");
    }

    @Test
    void unbrokenTextIsHardCut() {
        assertThat(DescriptionService.truncate("z".repeat(1200))).isEqualTo("z".repeat(DescriptionService.MAX_LENGTH) + "...");
    }
}
