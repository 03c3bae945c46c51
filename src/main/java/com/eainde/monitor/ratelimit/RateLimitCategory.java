package com.eainde.monitor.ratelimit;

public enum RateLimitCategory {
    IP,
    USER,
    ORGANIZATION
}
