package com.example.fundlens.api;

import com.example.fundlens.api.dto.SeriesDtos.DescriptionResponse;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.metadata.Composition;
import com.example.fundlens.repository.InstrumentRepository;
import com.example.fundlens.service.CompositionService;
import com.example.fundlens.service.DescriptionService;
import com.example.fundlens.service.InstrumentResolver;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {
    // Read-only repository serving the curated instrument list
    private final InstrumentRepository repository;
    private final InstrumentResolver instrumentResolver;
    private final DescriptionService descriptionService;
    private final CompositionService compositionService;

    public InstrumentController(InstrumentRepository repository, InstrumentResolver instrumentResolver,
                                DescriptionService descriptionService, CompositionService compositionService) {
        this.repository = repository;
        this.instrumentResolver = instrumentResolver;
        this.descriptionService = descriptionService;
        this.compositionService = compositionService;
    }

    // Returns the full list of instruments available for selection on the frontend
    @GetMapping
    public List<Instrument> list() {
        return repository.findAll();
    }

    @GetMapping("/{identifier}/description")
    public DescriptionResponse description(@PathVariable String identifier,
                                           @RequestParam(required = false) String ticker) {
        Instrument instrument = instrumentResolver.resolve(identifier, ticker, null);
        return descriptionService.describe(instrument)
                .map(d -> new DescriptionResponse(instrument.getIdentifier(), d.text(), d.source()))
                .orElseThrow(() -> new NoDataAvailableException("No description available for " + identifier));
    }

    // Empty composition when nothing is known; never 404
    @GetMapping("/{identifier}/composition")
    public Composition composition(@PathVariable String identifier,
                                   @RequestParam(required = false) String ticker) {
        return compositionService.composition(instrumentResolver.resolve(identifier, ticker, null));
    }
}
