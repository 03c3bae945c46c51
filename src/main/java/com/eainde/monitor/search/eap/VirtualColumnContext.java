package com.eainde.monitor.search.eap;

import java.util.Map;

/**
 * Tells the RPC to derive {@code toColumnName} by looking up the values of
 * {@code fromColumnName} in {@code valueMap}.
 */
public record VirtualColumnContext(String fromColumnName, String toColumnName, Map<String, String> valueMap) {

    public VirtualColumnContext {
        valueMap = Map.copyOf(valueMap);
    }
}
