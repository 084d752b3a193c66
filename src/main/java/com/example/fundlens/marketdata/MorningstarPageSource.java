package com.example.fundlens.marketdata;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@Order(90)
public class MorningstarPageSource extends PortalPageSource {

    public MorningstarPageSource(RestClient.Builder builder, ProviderThrottle throttle) {
        super(builder, throttle);
    }

    @Override
    public String name() {
        return "morningstar";
    }

    @Override
    protected String pageUrl() {
        return "https://www.morningstar.it/it/funds/snapshot/snapshot.aspx?id={isin}";
    }
}
