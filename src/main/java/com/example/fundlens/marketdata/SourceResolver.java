package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Optional;

/**
 * Walks the ordered source list and returns the first result with more than
 * {@code fundlens.fetch.min-records} records. A failing source is logged and skipped;
 * running out of sources is a normal outcome reported as empty.
 */
@Component
public class SourceResolver {
    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    private final List<HistoricalSource> sources;
    private final int minRecords;

    public SourceResolver(List<HistoricalSource> sources, FundLensProperties properties) {
        this.sources = List.copyOf(sources);
        this.minRecords = properties.fetch().minRecords();
    }

    public List<HistoricalSource> getSources() {
        return sources;
    }

    public Optional<SourceResult> resolve(Instrument instrument, DateRange range) {
        for (HistoricalSource source : sources) {
            Optional<SourceResult> result;
            try {
                result = source.fetch(instrument, range);
            } catch (RequestNotPermitted e) {
                log.warn("{}: rate limit wait exceeded for {}", source.name(), instrument.getIdentifier());
                continue;
            } catch (RestClientException e) {
                log.debug("{}: no data for {}: {}", source.name(), instrument.getIdentifier(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.warn("{}: unexpected failure for {}", source.name(), instrument.getIdentifier(), e);
                continue;
            }
            if (result.isPresent() && result.get().history().size() > minRecords) {
                SourceResult found = result.get();
                log.info("Fetched {} records for {} from {}", found.history().size(), instrument.getIdentifier(), found.sourceName());
                return result;
            }
        }
        log.debug("No source had data for {}", instrument.getIdentifier());
        return Optional.empty();
    }
}
