package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.Instrument;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Suffix chosen by the ISIN country prefix, e.g. IE listings on Euronext Dublin (.IR). */
@Component
@Order(70)
public class YahooNationalSuffixSource extends YahooSymbolSource {
    private final Map<String, String> nationalSuffixes;

    public YahooNationalSuffixSource(YahooChartClient client, FundLensProperties properties) {
        super(client, properties);
        this.nationalSuffixes = properties.fetch().nationalSuffixes();
    }

    @Override
    public String name() {
        return "yahoo-national-suffix";
    }

    @Override
    protected List<String> candidates(Instrument instrument) {
        return Identifiers.countryCode(instrument.getIdentifier())
                .map(nationalSuffixes::get)
                .map(suffix -> List.of(instrument.getIdentifier() + "." + suffix))
                .orElse(List.of());
    }
}
