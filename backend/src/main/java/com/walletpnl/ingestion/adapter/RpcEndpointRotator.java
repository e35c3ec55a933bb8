package com.walletpnl.ingestion.adapter;

import com.walletpnl.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the configured RPC endpoints, paired with the retry policy callers back off with.
 * Each retry goes to the next endpoint so one failing node does not absorb every attempt.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger cursor = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        return endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
