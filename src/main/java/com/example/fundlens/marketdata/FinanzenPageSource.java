package com.example.fundlens.marketdata;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@Order(91)
public class FinanzenPageSource extends PortalPageSource {

    public FinanzenPageSource(RestClient.Builder builder, ProviderThrottle throttle) {
        super(builder, throttle);
    }

    @Override
    public String name() {
        return "finanzen";
    }

    @Override
    protected String pageUrl() {
        return "https://www.finanzen.net/fonds/{isin}";
    }
}
