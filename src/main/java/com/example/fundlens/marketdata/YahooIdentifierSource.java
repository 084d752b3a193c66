package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Instrument;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** The identifier itself used as a Yahoo symbol. */
@Component
@Order(60)
public class YahooIdentifierSource extends YahooSymbolSource {

    public YahooIdentifierSource(YahooChartClient client, FundLensProperties properties) {
        super(client, properties);
    }

    @Override
    public String name() {
        return "yahoo-identifier";
    }

    @Override
    protected List<String> candidates(Instrument instrument) {
        if (instrument.getIdentifier().equals(instrument.getTicker())) {
            // Already tried as the ticker
            return List.of();
        }
        return List.of(instrument.getIdentifier());
    }
}
