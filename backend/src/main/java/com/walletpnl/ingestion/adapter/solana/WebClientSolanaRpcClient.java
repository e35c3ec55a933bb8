package com.walletpnl.ingestion.adapter.solana;

import com.walletpnl.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC 2.0 over HTTP POST via WebClient.
 */
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientSolanaRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : List.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException(method + " failed with HTTP " + e.getStatusCode().value(), e));
    }
}
