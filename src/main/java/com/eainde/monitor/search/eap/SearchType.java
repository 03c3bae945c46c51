package com.eainde.monitor.search.eap;

import java.util.Arrays;

/**
 * Public type of a search column, and the RPC type it maps to unless a column overrides it.
 */
public enum SearchType {
    STRING("string", AttributeType.STRING),
    NUMBER("number", AttributeType.FLOAT),
    DURATION("duration", AttributeType.FLOAT),
    INTEGER("integer", AttributeType.INT),
    BOOLEAN("boolean", AttributeType.BOOLEAN);

    private final String publicName;
    private final AttributeType defaultAttributeType;

    SearchType(String publicName, AttributeType defaultAttributeType) {
        this.publicName = publicName;
        this.defaultAttributeType = defaultAttributeType;
    }

    public String publicName() {
        return publicName;
    }

    public AttributeType defaultAttributeType() {
        return defaultAttributeType;
    }

    public static SearchType fromPublicName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.publicName.equals(name))
                .findFirst()
                .orElseThrow(() -> new InvalidSearchQueryException("Unknown search type " + name));
    }
}
