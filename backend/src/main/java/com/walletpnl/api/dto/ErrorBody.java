package com.walletpnl.api.dto;

import java.time.Instant;

/**
 * Standard error response body: error (code), message, timestamp (ISO 8601).
 * Used for 400 on invalid address or limit and 404 on unknown wallet.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
