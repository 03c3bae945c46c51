package com.eainde.monitor.ratelimit;

import com.eainde.monitor.web.RequestActor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Enforces the {@link RateLimit} declarations of the matched handler method.
 */
@Log4j2
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String ORGANIZATION_VARIABLE = "organizationSlug";

    private final RateLimiter rateLimiter;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RateLimit[] limits = handlerMethod.getMethod().getAnnotationsByType(RateLimit.class);
        if (limits.length == 0) {
            return true;
        }

        String endpoint = handlerMethod.getBeanType().getSimpleName() + "#" + handlerMethod.getMethod().getName();
        for (RateLimit limit : limits) {
            String subject = subject(limit.category(), request);
            if (subject == null) {
                continue;
            }
            String key = limit.category().name().toLowerCase(Locale.ROOT) + ":" + endpoint + ":" + subject;
            ConsumeResult result = rateLimiter.tryConsume(key, limit.limit(), Duration.ofSeconds(limit.windowSeconds()));
            if (!result.allowed()) {
                log.info("Rate limited {} on {} by {}", subject, endpoint, limit.category());
                throw new RateLimitExceededException(limit.category(), result.retryAfterSeconds());
            }
        }
        return true;
    }

    private static String subject(RateLimitCategory category, HttpServletRequest request) {
        switch (category) {
            case IP:
                return request.getRemoteAddr();
            case USER:
                return RequestActor.resolve(request);
            case ORGANIZATION:
                Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
                return variables instanceof Map<?, ?> map ? (String) map.get(ORGANIZATION_VARIABLE) : null;
            default:
                return null;
        }
    }
}
