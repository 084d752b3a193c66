package com.example.fundlens.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One calendar day of one instrument.
 *
 * @param date        trading day, no time of day
 * @param price       raw or adjusted close, always positive
 * @param dividend    cash distribution paid that day
 * @param capitalGain realized-gain distribution paid that day
 * @param adjusted    true when {@code price} already embeds reinvested distributions
 */
public record DailyRecord(LocalDate date, double price, double dividend, double capitalGain, boolean adjusted) {

    public DailyRecord {
        Objects.requireNonNull(date, "date");
        if (!Double.isFinite(price) || price <= 0) {
            throw new IllegalArgumentException("price must be positive on " + date + ": " + price);
        }
        if (!Double.isFinite(dividend) || dividend < 0) {
            throw new IllegalArgumentException("dividend must be non-negative on " + date + ": " + dividend);
        }
        if (!Double.isFinite(capitalGain) || capitalGain < 0) {
            throw new IllegalArgumentException("capital gain must be non-negative on " + date + ": " + capitalGain);
        }
        // Distributions are already folded into an adjusted price
        if (adjusted && (dividend > 0 || capitalGain > 0)) {
            throw new IllegalArgumentException("adjusted record on " + date + " must not carry distributions");
        }
    }

    public static DailyRecord adjusted(LocalDate date, double price) {
        return new DailyRecord(date, price, 0.0, 0.0, true);
    }

    public static DailyRecord raw(LocalDate date, double price, double dividend, double capitalGain) {
        return new DailyRecord(date, price, dividend, capitalGain, false);
    }

    /** @return dividend plus capital gain */
    public double distribution() {
        return dividend + capitalGain;
    }
}
