package com.eainde.monitor.ratelimit;

/**
 * Outcome of one token consumption attempt.
 */
public record ConsumeResult(boolean allowed, long remainingTokens, long retryAfterSeconds) {

    public static ConsumeResult allowed(long remainingTokens) {
        return new ConsumeResult(true, remainingTokens, 0);
    }

    public static ConsumeResult rejected(long retryAfterSeconds) {
        return new ConsumeResult(false, 0, retryAfterSeconds);
    }
}
