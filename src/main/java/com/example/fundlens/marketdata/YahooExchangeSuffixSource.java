package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Instrument;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Identifier combined with each configured exchange suffix (London, Paris, Frankfurt, ...),
 * stopping at the first listing that answers.
 */
@Component
@Order(50)
public class YahooExchangeSuffixSource extends YahooSymbolSource {
    private final List<String> suffixes;

    public YahooExchangeSuffixSource(YahooChartClient client, FundLensProperties properties) {
        super(client, properties);
        this.suffixes = properties.fetch().exchangeSuffixes();
    }

    @Override
    public String name() {
        return "yahoo-exchange-suffix";
    }

    @Override
    protected List<String> candidates(Instrument instrument) {
        List<String> symbols = new ArrayList<>(suffixes.size());
        for (String suffix : suffixes) {
            symbols.add(instrument.getIdentifier() + "." + suffix);
        }
        return symbols;
    }
}
