package com.smartmoneyradar.valuation.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Valuation module configuration: properties and the DexScreener rate limiter shared by snapshot and SOL price lookups.
 */
@Configuration
@EnableConfigurationProperties(ValuationProperties.class)
public class ValuationConfig {

    @Bean(name = "dexScreenerRateLimiter")
    public RateLimiter dexScreenerRateLimiter(ValuationProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getDexscreenerRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("dexscreener", config);
    }
}
