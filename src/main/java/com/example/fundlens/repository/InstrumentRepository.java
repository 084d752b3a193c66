package com.example.fundlens.repository;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.marketdata.InstrumentListLoader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.*;

@Repository
public class InstrumentRepository {
    // Curated instruments keyed by normalized identifier, in file order
    private final Map<String, Instrument> instrumentsById = new LinkedHashMap<>();

    @Autowired
    public InstrumentRepository(FundLensProperties properties) {
        this(InstrumentListLoader.load(properties.instrumentsResource()));
    }

    InstrumentRepository(List<Instrument> instruments) {
        for (Instrument inst : instruments) {
            instrumentsById.putIfAbsent(Identifiers.normalize(inst.getIdentifier()), inst);
        }
    }

    // Find a single instrument by ISIN or ticker
    public Optional<Instrument> findByIdentifier(String identifier) {
        return Optional.ofNullable(instrumentsById.get(Identifiers.normalize(identifier)));
    }

    // Return all instruments in a stable iteration order
    public List<Instrument> findAll() {
        return new ArrayList<>(instrumentsById.values());
    }
}
