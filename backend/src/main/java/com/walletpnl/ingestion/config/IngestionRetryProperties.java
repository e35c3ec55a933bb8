package com.walletpnl.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy for getTransaction (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "walletpnl.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Upper bound for a single backoff delay. Default 8s. */
    private long maxDelayMs = 8_000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. Default 3. */
    private int maxAttempts = 3;
}
