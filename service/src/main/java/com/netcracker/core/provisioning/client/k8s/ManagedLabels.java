package com.netcracker.core.provisioning.client.k8s;

import java.util.HashMap;
import java.util.Map;

public final class ManagedLabels {
    public static final String APP = "app";
    public static final String MANAGED_BY = "managed-by";
    public static final String RESOURCE_ID = "resource-id";
    public static final String MANAGED_BY_VALUE = "nest-controller";

    private ManagedLabels() {
    }

    public static Map<String, String> forResource(String name, long resourceId) {
        Map<String, String> labels = new HashMap<>();
        labels.put(APP, name);
        labels.put(MANAGED_BY, MANAGED_BY_VALUE);
        labels.put(RESOURCE_ID, String.valueOf(resourceId));
        return labels;
    }

    public static Map<String, String> selector(String name) {
        return Map.of(APP, name);
    }

    public static Map<String, String> managedNamespace() {
        return Map.of(MANAGED_BY, MANAGED_BY_VALUE);
    }
}
