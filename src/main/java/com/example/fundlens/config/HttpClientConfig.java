package com.example.fundlens.config;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    // Browser-like headers reduce the chance of being blocked by finance portals
    static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36";

    @Bean
    public RestClientCustomizer browserHeadersCustomizer(FundLensProperties properties) {
        FundLensProperties.Fetch fetch = properties.fetch();
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(fetch.connectTimeout())
                .withReadTimeout(fetch.readTimeout());
        return builder -> builder
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json, text/csv, text/html;q=0.9, */*;q=0.8");
    }

    /**
     * One permit per provider per {@code fundlens.fetch.provider-delay}; callers wait for the
     * next permit, which spaces consecutive calls to the same provider.
     */
    @Bean
    public RateLimiterRegistry providerRateLimiters(FundLensProperties properties) {
        Duration delay = properties.fetch().providerDelay();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(delay.isZero() || delay.isNegative() ? Duration.ofNanos(1) : delay)
                .timeoutDuration(Duration.ofMinutes(1))
                .build();
        return RateLimiterRegistry.of(config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
