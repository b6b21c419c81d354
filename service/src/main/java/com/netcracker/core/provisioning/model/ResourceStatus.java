package com.netcracker.core.provisioning.model;

import java.util.Arrays;

/**
 * Observed status of a resource as written back to the {@code resources.status} column.
 */
public enum ResourceStatus {
    PENDING("pending"),
    PROVISIONING("provisioning"),
    ACTIVE("active"),
    UPDATING("updating"),
    ERROR("error"),
    DELETED("deleted");

    private final String value;

    ResourceStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ResourceStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resource status: " + value));
    }
}
