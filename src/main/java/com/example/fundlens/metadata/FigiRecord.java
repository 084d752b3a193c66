package com.example.fundlens.metadata;

/** First OpenFIGI mapping match for an ISIN. */
public record FigiRecord(
        String name,
        String ticker,
        String exchange,
        String marketSector,
        String securityType,
        String figi,
        String compositeFigi
) {
}
