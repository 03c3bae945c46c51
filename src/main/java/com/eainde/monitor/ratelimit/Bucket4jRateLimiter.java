package com.eainde.monitor.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token buckets held in process memory, one per key, refilled greedily.
 */
@Log4j2
@Component
public class Bucket4jRateLimiter implements RateLimiter {

    private final Cache<String, Bucket> buckets;

    public Bucket4jRateLimiter(RateLimitProperties properties) {
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(properties.getBucketExpiry())
                .maximumSize(properties.getMaximumBuckets())
                .build();
    }

    @Override
    public ConsumeResult tryConsume(String key, int limit, Duration window) {
        Bucket bucket = buckets.get(key, k -> newBucket(limit, window));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            return ConsumeResult.allowed(probe.getRemainingTokens());
        }

        long retryAfterSeconds = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(
                probe.getNanosToWaitForRefill() + TimeUnit.SECONDS.toNanos(1) - 1));
        log.debug("Rate limit hit for {}, retry after {}s", key, retryAfterSeconds);
        return ConsumeResult.rejected(retryAfterSeconds);
    }

    private static Bucket newBucket(int limit, Duration window) {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(limit)
                        .refillGreedy(limit, window)
                        .build())
                .build();
    }
}
