package com.eainde.monitor.cache;

import java.util.Optional;

/**
 * Key/value store for generated suggestions. Entries expire after a fixed time to live.
 */
public interface SuggestionCache {

    Optional<String> get(String key);

    void put(String key, String suggestion);
}
