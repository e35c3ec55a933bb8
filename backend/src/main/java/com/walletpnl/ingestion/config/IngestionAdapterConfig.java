package com.walletpnl.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletpnl.common.RetryPolicy;
import com.walletpnl.ingestion.adapter.RpcEndpointRotator;
import com.walletpnl.ingestion.adapter.solana.SolanaRpcClient;
import com.walletpnl.ingestion.adapter.solana.SolanaTransactionFetcher;
import com.walletpnl.ingestion.adapter.solana.WebClientSolanaRpcClient;
import com.walletpnl.ingestion.stream.SolanaLogsSubscriber;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.time.Duration;

/**
 * Solana transport wiring: RPC rotator with retry policy, HTTP client, transaction fetcher, log subscriber.
 */
@Configuration
@EnableConfigurationProperties({ SolanaProperties.class, IngestionRetryProperties.class })
public class IngestionAdapterConfig {

    @Bean(name = "solanaRpcEndpointRotator")
    public RpcEndpointRotator solanaRpcEndpointRotator(SolanaProperties solanaProperties,
                                                       IngestionRetryProperties retryProperties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
        return new RpcEndpointRotator(solanaProperties.getRpcUrls(), retryPolicy);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, SolanaProperties solanaProperties) {
        return new WebClientSolanaRpcClient(webClientBuilder.clone(),
                Duration.ofMillis(solanaProperties.getRequestTimeoutMs()));
    }

    @Bean
    public SolanaTransactionFetcher solanaTransactionFetcher(SolanaRpcClient solanaRpcClient,
                                                             RpcEndpointRotator solanaRpcEndpointRotator,
                                                             ObjectMapper objectMapper,
                                                             SolanaProperties solanaProperties) {
        return new SolanaTransactionFetcher(solanaRpcClient, solanaRpcEndpointRotator, objectMapper,
                solanaProperties.getCommitment());
    }

    @Bean
    public WebSocketClient solanaWebSocketClient() {
        return new ReactorNettyWebSocketClient();
    }

    @Bean
    public SolanaLogsSubscriber solanaLogsSubscriber(WebSocketClient solanaWebSocketClient,
                                                     SolanaProperties solanaProperties,
                                                     ObjectMapper objectMapper) {
        return new SolanaLogsSubscriber(solanaWebSocketClient, solanaProperties, objectMapper,
                RetryPolicy.fixed(solanaProperties.getReconnectDelayMs(), solanaProperties.getMaxReconnectAttempts()));
    }
}
