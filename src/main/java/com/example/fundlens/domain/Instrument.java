package com.example.fundlens.domain;

/**
 * Immutable description of an instrument the engine can compare.
 *
 * Each instrument carries:
 * - an identifier (ISIN for funds, or a plain ticker for equities and indices),
 * - an optional exchange ticker known to resolve at the market-data provider, and
 * - a human-readable name used as the column label in comparisons.
 */
public class Instrument {
    // ISIN or bare ticker; the cache key and the label callers use
    private final String identifier;
    // Provider symbol when known (e.g. PRHSX), null otherwise
    private final String ticker;
    // Display name (curated list, OpenFIGI, or the identifier itself)
    private final String name;

    public Instrument(String identifier, String ticker, String name) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        this.identifier = identifier.trim();
        this.ticker = ticker == null || ticker.isBlank() ? null : ticker.trim();
        this.name = name == null || name.isBlank() ? this.identifier : name.trim();
    }

    /** @return ISIN or ticker used to identify the instrument */
    public String getIdentifier() {
        return identifier;
    }

    /** @return provider ticker, or null when only the identifier is known */
    public String getTicker() {
        return ticker;
    }

    /** @return display name */
    public String getName() {
        return name;
    }

    /** @return true when this instrument is identified by an ISIN */
    public boolean isIsin() {
        return Identifiers.isIsin(identifier);
    }

    @Override
    public String toString() {
        return name + " (" + identifier + (ticker != null ? ", " + ticker : "") + ")";
    }
}
