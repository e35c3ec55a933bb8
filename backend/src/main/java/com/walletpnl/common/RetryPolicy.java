package com.walletpnl.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, shared by RPC fetch retries and WebSocket reconnects.
 * Delay for attempt n is {@code baseDelay * 2^n}, capped at {@code maxDelay}, then scaled by ±jitterFactor.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 16;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid delay bounds: base=" + baseDelayMs + " max=" + maxDelayMs);
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], got " + jitterFactor);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Constant delay, no jitter. Used for reconnect loops that want a predictable cadence.
     */
    public static RetryPolicy fixed(long delayMs, int maxAttempts) {
        return new RetryPolicy(delayMs, delayMs, 0, maxAttempts);
    }

    /**
     * 500ms base, 8s cap, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 8_000L, 0.2, 3);
    }

    /**
     * Delay in milliseconds before retrying after the given zero-based attempt.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), MAX_SHIFT));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    /**
     * Sleeps for {@link #delayMs(int)}; restores the interrupt flag and reports false when interrupted.
     */
    public boolean sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(delayMs(attempt));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }
}
