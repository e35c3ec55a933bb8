package com.walletpnl.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletpnl.common.RetryPolicy;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.ingestion.adapter.RpcEndpointRotator;
import com.walletpnl.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches one transaction by signature with getTransaction (jsonParsed, v0 supported).
 * Rotates endpoints between attempts and backs off per the rotator's retry policy. A null result is
 * retried too, since a just-confirmed signature may not be visible on every node yet.
 */
@Slf4j
public class SolanaTransactionFetcher {

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final ObjectMapper objectMapper;
    private final String commitment;

    public SolanaTransactionFetcher(SolanaRpcClient rpcClient, RpcEndpointRotator rotator,
                                    ObjectMapper objectMapper, String commitment) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.objectMapper = objectMapper;
        this.commitment = commitment;
    }

    /**
     * Fetches and maps the transaction as seen from {@code walletAddress}. Empty when no node returned it
     * or the transaction failed on chain.
     *
     * @throws RpcException when every attempt failed with an error
     */
    public Optional<RawSwapTransaction> fetch(String signature, String walletAddress) {
        return fetchResult(signature)
                .flatMap(result -> SolanaTransactionMapper.map(signature, walletAddress, result));
    }

    Optional<JsonNode> fetchResult(String signature) {
        RetryPolicy policy = rotator.getRetryPolicy();
        Exception lastError = null;
        int attempts = 0;
        while (policy.hasAttemptsLeft(attempts)) {
            if (attempts > 0 && !policy.sleepBeforeRetry(attempts - 1)) {
                throw new RpcException("Interrupted while retrying getTransaction for " + signature);
            }
            attempts++;
            String endpoint = rotator.getNextEndpoint();
            try {
                String json = rpcClient.call(endpoint, "getTransaction", List.of(signature, Map.of(
                        "encoding", "jsonParsed",
                        "maxSupportedTransactionVersion", 0,
                        "commitment", commitment))).block();
                JsonNode root = objectMapper.readTree(json);
                JsonNode error = root.path("error");
                if (!error.isMissingNode() && !error.isNull()) {
                    throw new RpcException("getTransaction error: " + error);
                }
                JsonNode result = root.path("result");
                if (!result.isMissingNode() && !result.isNull()) {
                    return Optional.of(result);
                }
                log.debug("getTransaction returned no result for {} from {} (attempt {})", signature, endpoint, attempts);
                lastError = null;
            } catch (Exception e) {
                log.debug("getTransaction attempt {} for {} via {} failed: {}", attempts, signature, endpoint, e.getMessage());
                lastError = e;
            }
        }
        if (lastError != null) {
            throw new RpcException("getTransaction failed for " + signature + " after " + attempts + " attempts", lastError);
        }
        return Optional.empty();
    }
}
