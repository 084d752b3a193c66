package com.example.fundlens.domain;

/**
 * How a source's prices for an instrument are expected to treat distributions.
 * DOMESTIC_ADJUSTED_FUND: home-market mutual fund; prefer the source's adjusted close.
 * FOREIGN_OR_EQUITY_OR_ETF: raw close, distributions reported separately.
 */
public enum InstrumentClass {
    DOMESTIC_ADJUSTED_FUND,   // adjusted close embeds reinvested distributions
    FOREIGN_OR_EQUITY_OR_ETF  // raw close plus separate dividends and capital gains
}
