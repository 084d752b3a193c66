package com.example.fundlens.service;

import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.metadata.FigiRecord;
import com.example.fundlens.metadata.OpenFigiClient;
import com.example.fundlens.repository.InstrumentRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Completes what a caller knows about an instrument. Caller values win, then the curated
 * list; a bare ticker identifier is its own ticker, and OpenFIGI supplies a missing name.
 */
@Service
public class InstrumentResolver {
    private final InstrumentRepository repository;
    private final OpenFigiClient openFigi;

    public InstrumentResolver(InstrumentRepository repository, OpenFigiClient openFigi) {
        this.repository = repository;
        this.openFigi = openFigi;
    }

    public Instrument resolve(String identifier, String ticker, String name) {
        String id = Identifiers.normalize(identifier);
        Optional<Instrument> known = repository.findByIdentifier(id);
        String t = firstNonBlank(ticker, known.map(Instrument::getTicker).orElse(null));
        if (t == null && Identifiers.isTicker(id)) t = id;
        String n = firstNonBlank(name, known.map(Instrument::getName).filter(s -> !s.equals(id)).orElse(null));
        if (n == null) {
            n = openFigi.lookup(id).map(FigiRecord::name).filter(s -> !s.isBlank()).orElse(id);
        }
        return new Instrument(id, t, n);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a.trim();
        if (b != null && !b.isBlank()) return b.trim();
        return null;
    }
}
