package com.example.fundlens.marketdata;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@Order(92)
public class JustEtfPageSource extends PortalPageSource {

    public JustEtfPageSource(RestClient.Builder builder, ProviderThrottle throttle) {
        super(builder, throttle);
    }

    @Override
    public String name() {
        return "justetf";
    }

    @Override
    protected String pageUrl() {
        return "https://www.justetf.com/it/etf-profile.html?isin={isin}";
    }
}
