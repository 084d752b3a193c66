package com.example.fundlens.api;

import com.example.fundlens.api.dto.SeriesDtos.SeriesResponse;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.domain.PriceSeries;
import com.example.fundlens.service.FetchedSeries;
import com.example.fundlens.service.HistoricalDataService;
import com.example.fundlens.service.InstrumentResolver;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/series")
public class SeriesController {
    private final InstrumentResolver instrumentResolver;
    private final HistoricalDataService historicalDataService;

    public SeriesController(InstrumentResolver instrumentResolver, HistoricalDataService historicalDataService) {
        this.instrumentResolver = instrumentResolver;
        this.historicalDataService = historicalDataService;
    }

    // Price history with provenance and validation; 404 when no source has data
    @GetMapping("/{identifier}")
    public SeriesResponse series(@PathVariable String identifier, @RequestParam(required = false) String ticker) {
        Instrument instrument = instrumentResolver.resolve(identifier, ticker, null);
        FetchedSeries fetched = historicalDataService.fetch(instrument)
                .orElseThrow(() -> new NoDataAvailableException("No historical data available for " + identifier));
        PriceSeries series = fetched.series();
        return new SeriesResponse(instrument.getIdentifier(), series.getSourceName(), series.isAdjusted(),
                series.getFetchedAt(), fetched.fromCache(), series.getRecords(), fetched.validation());
    }
}
