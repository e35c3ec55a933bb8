package com.walletpnl.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC client abstraction, separated from the fetcher for testing and endpoint rotation.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
