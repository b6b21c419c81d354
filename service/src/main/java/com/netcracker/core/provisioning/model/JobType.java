package com.netcracker.core.provisioning.model;

import java.util.Arrays;

public enum JobType {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    SCALE("scale");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static JobType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job type: " + value));
    }
}
