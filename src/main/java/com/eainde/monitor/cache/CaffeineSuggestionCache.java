package com.eainde.monitor.cache;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public class CaffeineSuggestionCache implements SuggestionCache {

    private final Cache<String, String> cache;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, String suggestion) {
        cache.put(key, suggestion);
    }
}
