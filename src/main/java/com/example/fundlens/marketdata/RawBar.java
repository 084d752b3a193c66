package com.example.fundlens.marketdata;

import java.time.LocalDate;

/**
 * One daily bar exactly as a source reported it, before any adjustment decision.
 *
 * @param adjClose source-provided adjusted close, null when the source has none
 */
public record RawBar(LocalDate date, double close, Double adjClose, double dividend, double capitalGain) {

    public RawBar withDistributions(double dividend, double capitalGain) {
        return new RawBar(date, close, adjClose, dividend, capitalGain);
    }
}
