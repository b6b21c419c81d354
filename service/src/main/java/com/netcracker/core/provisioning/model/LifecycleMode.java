package com.netcracker.core.provisioning.model;

import java.util.Arrays;

public enum LifecycleMode {
    FULL("full"),
    PARTIAL("partial"),
    MONITOR_ONLY("monitor_only");

    private final String value;

    LifecycleMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static LifecycleMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown lifecycle mode: " + value));
    }
}
