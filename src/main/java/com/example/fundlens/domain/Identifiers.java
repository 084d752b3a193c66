package com.example.fundlens.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shape checks for the two identifier kinds accepted everywhere: ISIN-like codes and
 * short alphabetic tickers.
 */
public final class Identifiers {
    private static final Pattern ISIN = Pattern.compile("^[A-Z]{2}[A-Z0-9]{10,}$");
    private static final Pattern TICKER = Pattern.compile("^[A-Z]{1,5}$");

    private Identifiers() {}

    public static String normalize(String identifier) {
        return identifier == null ? "" : identifier.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isIsin(String identifier) {
        return ISIN.matcher(normalize(identifier)).matches();
    }

    public static boolean isTicker(String identifier) {
        return TICKER.matcher(normalize(identifier)).matches();
    }

    /** @return the two-letter country prefix of an ISIN-like identifier */
    public static Optional<String> countryCode(String identifier) {
        if (!isIsin(identifier)) return Optional.empty();
        return Optional.of(normalize(identifier).substring(0, 2));
    }

    /** @return identifier reduced to characters safe for a file name */
    public static String sanitize(String identifier) {
        String cleaned = identifier == null ? "" : identifier.trim().replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isEmpty() ? "_" : cleaned;
    }
}
