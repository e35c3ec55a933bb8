package com.walletpnl.ingestion.adapter;

/**
 * Thrown when a Solana RPC call fails (HTTP, JSON-RPC error, or retries exhausted).
 * Retryable from the caller's point of view; never reaches the ledger.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
