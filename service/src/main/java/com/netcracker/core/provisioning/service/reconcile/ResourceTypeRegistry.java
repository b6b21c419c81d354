package com.netcracker.core.provisioning.service.reconcile;

import com.netcracker.core.provisioning.configuration.ControllerConfig;
import com.netcracker.core.provisioning.exception.UnsupportedResourceTypeException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps a resource type name to the container image and port of its workload object.
 * <p>
 * Built-in entries can be overridden and new types added through
 * {@code controller.resource-types."<name>".image/port}.
 */
@Slf4j
@ApplicationScoped
public class ResourceTypeRegistry {
    static final Map<String, WorkloadImage> BUILT_IN = Map.of(
            "postgresql", new WorkloadImage("postgres:16-alpine", 5432),
            "mariadb", new WorkloadImage("mariadb:11-jammy", 3306),
            "redis", new WorkloadImage("redis:7-alpine", 6379)
    );

    private final Map<String, WorkloadImage> images;

    @Inject
    public ResourceTypeRegistry(ControllerConfig config) {
        this(toImages(config.resourceTypes()));
    }

    public ResourceTypeRegistry(Map<String, WorkloadImage> configured) {
        Map<String, WorkloadImage> merged = new TreeMap<>(BUILT_IN);
        configured.forEach((name, image) -> merged.put(normalize(name), image));
        this.images = Collections.unmodifiableMap(merged);
        log.info("Registered resource types: {}", this.images.keySet());
    }

    public boolean supports(String typeName) {
        return typeName != null && images.containsKey(normalize(typeName));
    }

    public WorkloadImage resolve(String typeName) {
        if (!supports(typeName)) {
            throw new UnsupportedResourceTypeException(typeName);
        }
        return images.get(normalize(typeName));
    }

    public Map<String, WorkloadImage> registered() {
        return images;
    }

    private static Map<String, WorkloadImage> toImages(Map<String, ControllerConfig.ResourceTypeImage> configured) {
        Map<String, WorkloadImage> result = new TreeMap<>();
        configured.forEach((name, entry) -> result.put(name, new WorkloadImage(entry.image(), entry.port())));
        return result;
    }

    private static String normalize(String typeName) {
        return typeName.trim().toLowerCase(Locale.ROOT);
    }
}
