package com.example.fundlens.marketdata;

import com.example.fundlens.config.FundLensProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Spaces consecutive calls to the same provider by at least {@code fundlens.fetch.provider-delay},
 * on top of one resilience4j limiter per provider name.
 */
@Component
public class ProviderThrottle {
    private final RateLimiterRegistry registry;
    private final long minimumGapNanos;
    // provider name -> start of its last call
    private final Map<String, LastCall> lastCalls = new ConcurrentHashMap<>();

    public ProviderThrottle(RateLimiterRegistry providerRateLimiters, FundLensProperties properties) {
        this.registry = providerRateLimiters;
        Duration delay = properties.fetch().providerDelay();
        this.minimumGapNanos = delay.isNegative() ? 0L : delay.toNanos();
    }

    /**
     * Runs the call once the provider's gap has elapsed and its limiter grants a permit.
     *
     * @throws io.github.resilience4j.ratelimiter.RequestNotPermitted when no permit arrives in time
     * @throws IllegalStateException when interrupted while waiting
     */
    public <T> T call(String provider, Supplier<T> call) {
        RateLimiter limiter = registry.rateLimiter(provider);
        LastCall last = lastCalls.computeIfAbsent(provider, p -> new LastCall());
        synchronized (last) {
            if (last.startedAt != null) {
                long remaining = minimumGapNanos - (System.nanoTime() - last.startedAt);
                if (remaining > 0) pause(provider, remaining);
            }
            RateLimiter.waitForPermission(limiter);
            last.startedAt = System.nanoTime();
        }
        return call.get();
    }

    private static void pause(String provider, long nanos) {
        try {
            Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to call " + provider, e);
        }
    }

    private static final class LastCall {
        private Long startedAt;
    }
}
