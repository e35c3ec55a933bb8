package com.walletpnl.pricing.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pricing module configuration. Documented in application.yml under walletpnl.pricing.
 */
@ConfigurationProperties(prefix = "walletpnl.pricing")
@Validated
@Getter
@Setter
public class PricingProperties {

    /**
     * Jupiter Ultra API base URL used when an API key is configured.
     */
    @NotBlank
    private String jupiterBaseUrl = "https://api.jup.ag/ultra/v1";

    /**
     * Keyless Jupiter endpoint (lower rate limits).
     */
    @NotBlank
    private String jupiterLiteBaseUrl = "https://lite-api.jup.ag/ultra/v1";

    /**
     * Optional bearer token for Jupiter. When blank the lite endpoint is used.
     */
    private String jupiterApiKey;

    /**
     * Per-request timeout. Kept short so ledger application never stalls on the oracle.
     */
    @Min(100)
    private long timeoutMs = 3_000;

    /**
     * Fresh price TTL; after this a new lookup is attempted.
     */
    @Min(1)
    private int priceTtlSeconds = 60;

    /**
     * How long a last-known price is kept as fallback when a fresh lookup fails.
     */
    @Min(1)
    private int stalePriceTtlHours = 24;

    /**
     * Token metadata (symbol, name, decimals) TTL.
     */
    @Min(1)
    private int metaTtlHours = 24;

    /**
     * Local rate limit for Jupiter lookups.
     */
    @Min(1)
    private int requestsPerSecond = 10;

    public boolean hasApiKey() {
        return jupiterApiKey != null && !jupiterApiKey.isBlank();
    }

    public String effectiveBaseUrl() {
        return hasApiKey() ? jupiterBaseUrl : jupiterLiteBaseUrl;
    }
}
