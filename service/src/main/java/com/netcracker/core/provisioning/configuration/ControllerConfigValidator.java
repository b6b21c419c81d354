package com.netcracker.core.provisioning.configuration;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rejects configuration that converts cleanly but cannot work. Runs once at startup;
 * any violation aborts the boot.
 */
@ApplicationScoped
@Startup
@Slf4j
public class ControllerConfigValidator {
    private static final Set<String> LOG_FORMATS = Set.of("json", "text");

    private final ControllerConfig config;

    @Inject
    public ControllerConfigValidator(ControllerConfig config) {
        this.config = config;
    }

    @PostConstruct
    void onStartup() {
        validate();
        log.info("Configuration loaded: reconcileInterval={}, workers={}, namespacePrefix='{}', inCluster={}, backoff={}..{}",
                config.reconcile().interval(),
                config.reconcile().workers(),
                config.cluster().namespacePrefix(),
                config.cluster().inCluster(),
                config.retry().backoffBase(),
                config.retry().backoffMax());
    }

    public void validate() {
        List<String> violations = new ArrayList<>();

        if (isNotPositive(config.reconcile().interval())) {
            violations.add("reconcile interval must be > 0");
        }
        if (config.reconcile().workers() < 0) {
            violations.add("worker count must be >= 0");
        }
        if (config.reconcile().queueCapacity() <= 0) {
            violations.add("work queue capacity must be > 0");
        }
        if (config.cluster().eventBufferSize() <= 0) {
            violations.add("event buffer size must be > 0");
        }
        if (config.cluster().watchReconnectDelay().isNegative()) {
            violations.add("watch reconnect delay must be >= 0");
        }
        if (isNotPositive(config.retry().backoffBase())) {
            violations.add("backoff base must be > 0");
        }
        if (config.retry().backoffBase().compareTo(config.retry().backoffMax()) > 0) {
            violations.add("backoff base must be <= backoff max");
        }
        if (config.retry().maxRetries() < 0) {
            violations.add("max retries must be >= 0");
        }
        if (!LOG_FORMATS.contains(config.log().format().toLowerCase())) {
            violations.add("log format must be one of " + LOG_FORMATS + ", got '" + config.log().format() + "'");
        }
        if (!config.cluster().inCluster()
                && config.cluster().kubeconfig().filter(path -> !path.isBlank()).isEmpty()) {
            violations.add("KUBECONFIG must be set when IN_CLUSTER=false");
        }
        checkPort("health", config.health(), violations);
        checkPort("metrics", config.metrics(), violations);
        config.resourceTypes().forEach((type, image) -> {
            if (image.image() == null || image.image().isBlank()) {
                violations.add("resource type '" + type + "' has no image");
            }
            if (image.port() <= 0 || image.port() > 65535) {
                violations.add("resource type '" + type + "' has invalid port " + image.port());
            }
        });

        if (!violations.isEmpty()) {
            throw new IllegalStateException("Invalid controller configuration: " + String.join("; ", violations));
        }
    }

    private static boolean isNotPositive(Duration duration) {
        return duration.isZero() || duration.isNegative();
    }

    private static void checkPort(String name, ControllerConfig.Endpoint endpoint, List<String> violations) {
        if (endpoint.enabled() && (endpoint.port() <= 0 || endpoint.port() > 65535)) {
            violations.add(name + " port must be in 1..65535, got " + endpoint.port());
        }
    }
}
