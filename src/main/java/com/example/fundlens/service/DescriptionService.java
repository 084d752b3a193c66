package com.example.fundlens.service;

import com.example.fundlens.cache.CacheEntry;
import com.example.fundlens.cache.CacheKind;
import com.example.fundlens.cache.CacheManager;
import com.example.fundlens.domain.Instrument;
import com.example.fundlens.metadata.DescriptionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Fund description from the first provider that has one, shortened to a paragraph and
 * cached for a week.
 */
@Service
public class DescriptionService {
    private static final Logger log = LoggerFactory.getLogger(DescriptionService.class);
    static final int MAX_LENGTH = 1000;
    private static final int SENTENCE_CUT_AFTER = 700;
    private static final int WORD_CUT_AFTER = 900;

    public record Description(String text, String source) {}

    private final CacheManager cache;
    private final List<DescriptionProvider> providers;

    public DescriptionService(CacheManager cache, List<DescriptionProvider> providers) {
        this.cache = cache;
        this.providers = List.copyOf(providers);
    }

    public Optional<Description> describe(Instrument instrument) {
        String id = instrument.getIdentifier();
        Optional<CacheEntry> cached = cache.get(id, CacheKind.DESCRIPTION);
        if (cached.isPresent() && cached.get().data().isTextual() && !cached.get().data().asText().isBlank()) {
            return Optional.of(new Description(cached.get().data().asText(), cached.get().source()));
        }
        for (DescriptionProvider provider : providers) {
            Optional<String> text;
            try {
                text = provider.describe(id, instrument.getTicker(), instrument.getName().equals(id) ? null : instrument.getName());
            } catch (RuntimeException e) {
                log.debug("{} description lookup failed for {}: {}", provider.sourceName(), id, e.getMessage());
                continue;
            }
            if (text.isPresent() && !text.get().isBlank()) {
                String shortened = truncate(text.get().trim());
                cache.putText(id, CacheKind.DESCRIPTION, shortened, provider.sourceName());
                return Optional.of(new Description(shortened, provider.sourceName()));
            }
        }
        log.info("No description found for {}", id);
        return Optional.empty();
    }

    /**
     * Shortens text longer than {@value #MAX_LENGTH} characters: at the last sentence end past
     * character 700, else at the last space past 900 with an ellipsis, else hard-cut with one.
     */
    static String truncate(String text) {
        if (text.length() <= MAX_LENGTH) return text;
        String head = text.substring(0, MAX_LENGTH);
        int lastPeriod = head.lastIndexOf('.');
        if (lastPeriod > SENTENCE_CUT_AFTER) return text.substring(0, lastPeriod + 1);
        int lastSpace = head.lastIndexOf(' ');
        if (lastSpace > WORD_CUT_AFTER) return text.substring(0, lastSpace) + "...";
        return head + "...";
    }
}
