package com.netcracker.core.provisioning.service.reconcile;

import com.netcracker.core.provisioning.client.k8s.ManagedLabels;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceType;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

/**
 * Builds the desired StatefulSet for a resource.
 */
@Slf4j
@ApplicationScoped
public class StatefulSetSpecBuilder {
    public static final String KIND = "StatefulSet";
    static final String REPLICAS_KEY = "replicas";
    static final int DEFAULT_REPLICAS = 1;
    private static final int MAX_PORT_NAME_LENGTH = 15;

    private final ResourceTypeRegistry registry;

    @Inject
    public StatefulSetSpecBuilder(ResourceTypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws com.netcracker.core.provisioning.exception.UnsupportedResourceTypeException if the type has no image
     * @throws IllegalStateException                                                        if the resource has no target namespace
     */
    public StatefulSet build(Resource resource, ResourceType type) {
        WorkloadImage image = registry.resolve(type.getName());
        String namespace = resource.getK8sNamespace();
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalStateException("resource '%s' has no target namespace".formatted(resource.getName()));
        }
        String containerName = type.getName().toLowerCase(Locale.ROOT);

        return new StatefulSetBuilder()
                .withNewMetadata()
                    .withName(resource.getName())
                    .withNamespace(namespace)
                    .withLabels(ManagedLabels.forResource(resource.getName(), resource.getId()))
                .endMetadata()
                .withNewSpec()
                    .withReplicas(desiredReplicas(resource))
                    .withServiceName(resource.getName())
                    .withNewSelector()
                        .withMatchLabels(ManagedLabels.selector(resource.getName()))
                    .endSelector()
                    .withNewTemplate()
                        .withNewMetadata()
                            .withLabels(ManagedLabels.forResource(resource.getName(), resource.getId()))
                        .endMetadata()
                        .withNewSpec()
                            .addNewContainer()
                                .withName(containerName)
                                .withImage(image.getImage())
                                .addNewPort()
                                    .withName(portName(containerName))
                                    .withContainerPort(image.getPort())
                                .endPort()
                            .endContainer()
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .build();
    }

    /**
     * Replica count from {@code config.replicas}; accepts a number or a numeric string, otherwise 1.
     */
    public int desiredReplicas(Resource resource) {
        Map<String, Object> config = resource.getConfig();
        Object value = config == null ? null : config.get(REPLICAS_KEY);
        if (value instanceof Number number) {
            long whole = number.longValue();
            if (whole == number.doubleValue() && whole >= 0 && whole <= Integer.MAX_VALUE) {
                return (int) whole;
            }
            log.warn("Resource '{}' has replicas '{}' that is not a whole number in range, using {}",
                    resource.getName(), number, DEFAULT_REPLICAS);
            return DEFAULT_REPLICAS;
        }
        if (value instanceof String text) {
            try {
                int parsed = Integer.parseInt(text.trim());
                if (parsed >= 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                log.warn("Resource '{}' has non-numeric replicas '{}', using {}", resource.getName(), text, DEFAULT_REPLICAS);
                return DEFAULT_REPLICAS;
            }
        }
        if (value != null) {
            log.warn("Resource '{}' has invalid replicas '{}', using {}", resource.getName(), value, DEFAULT_REPLICAS);
        }
        return DEFAULT_REPLICAS;
    }

    private static String portName(String containerName) {
        String sanitized = containerName.replaceAll("[^a-z0-9-]", "-");
        return sanitized.length() > MAX_PORT_NAME_LENGTH ? sanitized.substring(0, MAX_PORT_NAME_LENGTH) : sanitized;
    }
}
