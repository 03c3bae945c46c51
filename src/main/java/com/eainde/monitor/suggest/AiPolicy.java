package com.eainde.monitor.suggest;

import java.util.Arrays;
import java.util.Optional;

/**
 * Whether an organization may send event data to the model provider.
 */
public enum AiPolicy {
    ALLOWED("allowed"),
    /** The provider is not an approved subprocessor of the organization. */
    SUBPROCESSOR("subprocessor"),
    /** Each request needs explicit consent from the requesting user. */
    INDIVIDUAL_CONSENT("individual_consent");

    private final String value;

    AiPolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AiPolicy> fromValue(String value) {
        return Arrays.stream(values())
                .filter(policy -> policy.value.equals(value))
                .findFirst();
    }
}
