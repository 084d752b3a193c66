package com.example.fundlens.api;

import com.example.fundlens.api.dto.ComparisonDtos.ComparisonRequest;
import com.example.fundlens.api.dto.ComparisonDtos.ComparisonResponse;
import com.example.fundlens.service.ComparisonService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/comparisons")
public class ComparisonController {
    // Application service that fetches, normalizes and scores the requested instruments
    private final ComparisonService comparisonService;

    public ComparisonController(ComparisonService comparisonService) {
        this.comparisonService = comparisonService;
    }

    // Accepts the instruments to compare and an optional start date
    // and returns the base-100 table with per-instrument metrics
    @PostMapping
    public ComparisonResponse compare(@Valid @RequestBody ComparisonRequest request) {
        return comparisonService.compare(request);
    }
}
