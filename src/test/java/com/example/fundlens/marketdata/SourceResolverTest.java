package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.DateRange;
import com.example.fundlens.domain.Instrument;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SourceResolverTest {
    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30));
    private static final Instrument FUND = new Instrument("LU0097089360", null, "Test fund");

    private final List<String> calls = new ArrayList<>();

    private final class StubSource implements HistoricalSource {
        private final String name;
        private final int records;
        private final RuntimeException failure;

        StubSource(String name, int records, RuntimeException failure) {
            this.name = name;
            this.records = records;
            this.failure = failure;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<SourceResult> fetch(Instrument instrument, DateRange range) {
            calls.add(name);
            if (failure != null) throw failure;
            if (records == 0) return Optional.empty();
            List<RawBar> bars = new ArrayList<>();
            for (int i = 0; i < records; i++) {
                bars.add(new RawBar(range.start().plusDays(i), 10.0 + i, null, 0.0, 0.0));
            }
            return Optional.of(new SourceResult(new RawHistory(bars), name + " (" + instrument.getIdentifier() + ")", false));
        }
    }

    private SourceResolver resolver(HistoricalSource... sources) {
        return new SourceResolver(List.of(sources), FundLensProperties.defaults());
    }

    @Test
    void fifthSourceWinsWhenFirstFourFail() {
        SourceResolver resolver = resolver(
                new StubSource("one", 0, null),
                new StubSource("two", 0, new ResourceAccessException("timeout")),
                new StubSource("three", 0, new IllegalStateException("boom")),
                new StubSource("four", 5, null),
                new StubSource("five", 15, null),
                new StubSource("six", 30, null));

        Optional<SourceResult> result = resolver.resolve(FUND, RANGE);

        assertThat(result).isPresent();
        assertThat(result.get().sourceName()).isEqualTo("five (LU0097089360)");
        assertThat(result.get().history().size()).isEqualTo(15);
        assertThat(calls).containsExactly("one", "two", "three", "four", "five");
    }

    @Test
    void exactlyMinimumRecordsIsNotEnough() {
        SourceResolver resolver = resolver(new StubSource("ten", 10, null), new StubSource("eleven", 11, null));

        assertThat(resolver.resolve(FUND, RANGE)).get()
                .extracting(SourceResult::sourceName).isEqualTo("eleven (LU0097089360)");
    }

    @Test
    void exhaustedSourcesYieldEmpty() {
        SourceResolver resolver = resolver(new StubSource("one", 0, null), new StubSource("two", 3, null));

        assertThat(resolver.resolve(FUND, RANGE)).isEmpty();
    }
}
