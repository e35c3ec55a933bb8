package com.walletpnl.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Solana transport: HTTP RPC endpoints for getTransaction and the WebSocket endpoint for logsSubscribe.
 */
@ConfigurationProperties(prefix = "walletpnl.ingestion.solana")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SolanaProperties {

    /** When false no WebSocket subscription is opened; the REST read side still starts. */
    private boolean enabled = true;

    /** HTTP JSON-RPC endpoints, used round-robin. */
    @NotEmpty
    private List<String> rpcUrls = new ArrayList<>(List.of("https://api.mainnet-beta.solana.com"));

    @NotBlank
    private String wsUrl = "wss://api.mainnet-beta.solana.com";

    @NotBlank
    private String commitment = "confirmed";

    /** Per-request timeout for HTTP RPC calls. */
    @Min(100)
    private long requestTimeoutMs = 10_000;

    /** Fixed delay before reconnecting a dropped WebSocket. */
    @Min(0)
    private long reconnectDelayMs = 5_000;

    /** Consecutive failed reconnects before giving up; reset on every successful connect. */
    @Min(1)
    private int maxReconnectAttempts = 10;
}
