package com.eainde.monitor.search.eap;

/**
 * Column reference as sent to the RPC.
 */
public record AttributeKey(String name, AttributeType type) {
}
