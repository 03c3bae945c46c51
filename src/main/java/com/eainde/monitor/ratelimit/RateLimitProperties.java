package com.eainde.monitor.ratelimit;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "monitor.ratelimit")
public class RateLimitProperties {

    private boolean enabled = true;

    /** Idle buckets are dropped after this long. */
    private Duration bucketExpiry = Duration.ofMinutes(10);

    private long maximumBuckets = 100_000;
}
