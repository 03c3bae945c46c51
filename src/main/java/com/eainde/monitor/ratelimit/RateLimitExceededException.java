package com.eainde.monitor.ratelimit;

import lombok.Getter;

/**
 * Answered with 429 and a {@code Retry-After} header.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final RateLimitCategory category;
    private final long retryAfterSeconds;

    public RateLimitExceededException(RateLimitCategory category, long retryAfterSeconds) {
        super("Request was throttled. Expected available in " + retryAfterSeconds + " second"
                + (retryAfterSeconds == 1 ? "" : "s") + ".");
        this.category = category;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
