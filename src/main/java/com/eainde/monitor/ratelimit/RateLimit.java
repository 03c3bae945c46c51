package com.eainde.monitor.ratelimit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Limits a handler method to {@code limit} requests per {@code windowSeconds} for
 * each distinct value of the given category. Repeat the annotation to limit on
 * several categories at once; a request must pass all of them.
 */
@Documented
@Repeatable(RateLimits.class)
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    RateLimitCategory category();

    int limit();

    int windowSeconds() default 1;
}
