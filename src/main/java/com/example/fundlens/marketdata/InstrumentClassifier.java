package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import com.example.fundlens.domain.Identifiers;
import com.example.fundlens.domain.InstrumentClass;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides from identifier shape alone whether a source's adjusted close should be trusted
 * for an instrument. Home-market mutual funds (five-letter tickers ending in X in the US)
 * get the adjusted treatment; everything else is handled as raw close plus distributions.
 */
@Component
public class InstrumentClassifier {
    private final String homeMarket;
    private final Pattern fundTicker;

    public InstrumentClassifier(FundLensProperties properties) {
        this.homeMarket = properties.classification().homeMarket();
        this.fundTicker = Pattern.compile(properties.classification().fundTickerPattern());
    }

    public InstrumentClass classify(String identifier, String ticker) {
        Optional<String> country = Identifiers.countryCode(identifier);
        String symbol = ticker;
        if (country.isEmpty() && Identifiers.isTicker(identifier)) {
            // Bare tickers are home-market symbols at the provider
            country = Optional.of(homeMarket);
            if (symbol == null) symbol = Identifiers.normalize(identifier);
        }
        boolean domestic = country.filter(homeMarket::equals).isPresent();
        if (domestic && symbol != null && fundTicker.matcher(symbol.trim()).matches()) {
            return InstrumentClass.DOMESTIC_ADJUSTED_FUND;
        }
        return InstrumentClass.FOREIGN_OR_EQUITY_OR_ETF;
    }
}
