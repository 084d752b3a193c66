package com.example.fundlens.metadata;

import java.util.Optional;

/**
 * One place a textual fund description can come from. Providers are tried in
 * {@link org.springframework.core.annotation.Order}; any of the arguments except the
 * identifier may be null.
 */
public interface DescriptionProvider {

    /** Source name recorded with the cached description. */
    String sourceName();

    Optional<String> describe(String identifier, String ticker, String name);
}
