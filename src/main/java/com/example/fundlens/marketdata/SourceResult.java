package com.example.fundlens.marketdata;

/**
 * What a source produced, tagged with its provenance.
 *
 * @param sourceName     source name including the symbol used, e.g. "Yahoo Finance (PRHSX)"
 * @param adjustedVendor true when the source is known to always deliver adjusted prices
 */
public record SourceResult(RawHistory history, String sourceName, boolean adjustedVendor) {
}
