package com.eainde.monitor.ratelimit;

import java.time.Duration;

public interface RateLimiter {

    /**
     * Takes one token from the bucket identified by {@code key}, creating the bucket
     * with the given limit on first use.
     */
    ConsumeResult tryConsume(String key, int limit, Duration window);
}
