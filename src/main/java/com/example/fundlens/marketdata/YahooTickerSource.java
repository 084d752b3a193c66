package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Instrument;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** The instrument's known ticker, as supplied by the caller or the configured list. */
@Component
@Order(40)
public class YahooTickerSource extends YahooSymbolSource {

    public YahooTickerSource(YahooChartClient client, FundLensProperties properties) {
        super(client, properties);
    }

    @Override
    public String name() {
        return "yahoo-ticker";
    }

    @Override
    protected List<String> candidates(Instrument instrument) {
        return instrument.getTicker() == null ? List.of() : List.of(instrument.getTicker());
    }
}
