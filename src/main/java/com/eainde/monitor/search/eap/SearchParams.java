package com.eainde.monitor.search.eap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param projectIdMap project id to project slug, for the projects in the query; slugs may be null
 */
public record SearchParams(Map<Long, String> projectIdMap) {

    public SearchParams {
        projectIdMap = Collections.unmodifiableMap(new LinkedHashMap<>(projectIdMap));
    }
}
