package com.example.fundlens.marketdata;

import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the curated instrument list from a classpath CSV.
 * CSV format: identifier,ticker,name
 * - Header is optional
 * - Lines starting with '#' are ignored
 * - A line may hold just an identifier; ticker and name are then unknown
 */
public final class InstrumentListLoader {
    private static final Logger log = LoggerFactory.getLogger(InstrumentListLoader.class);

    private InstrumentListLoader() {}

    public static List<Instrument> load(String resourcePath) {
        List<Instrument> items = new ArrayList<>();
        ClassPathResource res = new ClassPathResource(resourcePath);
        if (!res.exists()) {
            log.warn("Instrument list {} not found on the classpath", resourcePath);
            return items;
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            boolean first = true;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String lower = line.toLowerCase(Locale.ROOT);
                if (first && (lower.startsWith("isin") || lower.startsWith("identifier"))) {
                    first = false;
                    continue;
                }
                first = false;
                String[] parts = line.split(",", 3);
                String identifier = Identifiers.normalize(parts[0]);
                if (identifier.isEmpty()) continue;
                String ticker = parts.length >= 2 ? parts[1].trim() : null;
                String name = parts.length >= 3 ? parts[2].trim() : null;
                items.add(new Instrument(identifier, ticker, name));
            }
        } catch (IOException e) {
            log.warn("Could not read instrument list {}: {}", resourcePath, e.getMessage());
        }
        log.info("Loaded {} instruments from {}", items.size(), resourcePath);
        return items;
    }
}
