package com.walletpnl.pricing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.walletpnl.pricing.JupiterTokenPricer;
import com.walletpnl.pricing.TokenMeta;
import com.walletpnl.pricing.TokenPricer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Pricing module wiring: Jupiter WebClient, Caffeine caches and the local rate limiter.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public JupiterTokenPricer.Caches jupiterCaches(PricingProperties properties) {
        Cache<String, BigDecimal> fresh = Caffeine.newBuilder()
                .expireAfterWrite(properties.getPriceTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(5_000)
                .build();
        Cache<String, BigDecimal> stale = Caffeine.newBuilder()
                .expireAfterWrite(properties.getStalePriceTtlHours(), TimeUnit.HOURS)
                .maximumSize(5_000)
                .build();
        Cache<String, TokenMeta> meta = Caffeine.newBuilder()
                .expireAfterWrite(properties.getMetaTtlHours(), TimeUnit.HOURS)
                .maximumSize(5_000)
                .build();
        Cache<String, Boolean> misses = Caffeine.newBuilder()
                .expireAfterWrite(properties.getPriceTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(5_000)
                .build();
        return new JupiterTokenPricer.Caches(fresh, stale, meta, misses);
    }

    @Bean(name = "jupiterRateLimiter")
    public RateLimiter jupiterRateLimiter(PricingProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(properties.getTimeoutMs()))
                .build();
        return RateLimiter.of("jupiter", config);
    }

    @Bean
    public TokenPricer tokenPricer(PricingProperties properties,
                                   WebClient.Builder webClientBuilder,
                                   JupiterTokenPricer.Caches jupiterCaches,
                                   RateLimiter jupiterRateLimiter,
                                   ObjectMapper objectMapper) {
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(properties.effectiveBaseUrl());
        if (properties.hasApiKey()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getJupiterApiKey());
        }
        return new JupiterTokenPricer(builder.build(), properties, jupiterCaches, jupiterRateLimiter, objectMapper);
    }
}
