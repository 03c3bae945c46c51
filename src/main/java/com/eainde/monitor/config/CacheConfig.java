package com.eainde.monitor.config;

import com.eainde.monitor.cache.CaffeineSuggestionCache;
import com.eainde.monitor.cache.SuggestionCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnMissingBean(SuggestionCache.class)
    public SuggestionCache suggestionCache(AiSuggestProperties properties) {
        return new CaffeineSuggestionCache(Caffeine.newBuilder()
                .recordStats()
                .expireAfterWrite(properties.getCacheTtl())
                .maximumSize(properties.getCacheMaximumSize())
                .build());
    }
}
