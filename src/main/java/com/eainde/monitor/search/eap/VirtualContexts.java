package com.eainde.monitor.search.eap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Columns that do not exist in storage and are computed by the RPC from another column.
 */
public final class VirtualContexts {

    public static final Map<String, Function<SearchParams, VirtualColumnContext>> CONSTRUCTORS = Map.of(
            "project", projectContext("project"),
            "project.slug", projectContext("project.slug")
    );

    private VirtualContexts() {
    }

    public static Optional<VirtualColumnContext> forColumn(String publicAlias, SearchParams params) {
        return Optional.ofNullable(CONSTRUCTORS.get(publicAlias)).map(constructor -> constructor.apply(params));
    }

    /**
     * Projects without a slug are left out of the value map.
     */
    static Function<SearchParams, VirtualColumnContext> projectContext(String columnName) {
        return params -> {
            Map<String, String> valueMap = new LinkedHashMap<>();
            params.projectIdMap().forEach((projectId, slug) -> {
                if (slug != null) {
                    valueMap.put(String.valueOf(projectId), slug);
                }
            });
            return new VirtualColumnContext("project_id", columnName, valueMap);
        };
    }
}
