package com.example.fundlens.service;

import com.example.fundlens.cache.CacheEntry;
import com.example.fundlens.cache.CacheKind;
import com.example.fundlens.cache.CacheManager;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.metadata.Composition;
import com.example.fundlens.metadata.YahooHoldingsClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/** Sector weights and top holdings, cached for a day whether or not anything was found. */
@Service
public class CompositionService {
    private static final Logger log = LoggerFactory.getLogger(CompositionService.class);

    private final CacheManager cache;
    private final YahooHoldingsClient holdings;
    private final ObjectMapper mapper;

    public CompositionService(CacheManager cache, YahooHoldingsClient holdings, ObjectMapper mapper) {
        this.cache = cache;
        this.holdings = holdings;
        this.mapper = mapper;
    }

    public Composition composition(Instrument instrument) {
        String id = instrument.getIdentifier();
        Optional<CacheEntry> cached = cache.get(id, CacheKind.COMPOSITION);
        if (cached.isPresent()) {
            try {
                return mapper.treeToValue(cached.get().data(), Composition.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Cached composition for {} does not decode: {}", id, e.getMessage());
            }
        }
        Composition composition = Composition.empty();
        if (instrument.getTicker() != null) {
            try {
                composition = holdings.composition(instrument.getTicker());
            } catch (RestClientException e) {
                log.debug("Holdings lookup failed for {}: {}", id, e.getMessage());
            }
        }
        cache.put(id, CacheKind.COMPOSITION, mapper.valueToTree(composition), "Yahoo Finance", null);
        return composition;
    }
}
