package com.eainde.monitor.config;

import com.eainde.monitor.ratelimit.RateLimitInterceptor;
import com.eainde.monitor.ratelimit.RateLimitProperties;
import com.eainde.monitor.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final RateLimiter rateLimiter;
    private final RateLimitProperties rateLimitProperties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!rateLimitProperties.isEnabled()) {
            log.warn("Rate limiting is disabled");
            return;
        }
        registry.addInterceptor(new RateLimitInterceptor(rateLimiter)).addPathPatterns("/api/**");
    }
}
