package com.eainde.monitor.search.eap;

/**
 * Attribute types understood by the trace item RPC.
 */
public enum AttributeType {
    STRING,
    BOOLEAN,
    FLOAT,
    INT
}
