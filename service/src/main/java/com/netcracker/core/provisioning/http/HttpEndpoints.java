package com.netcracker.core.provisioning.http;

import com.netcracker.core.provisioning.configuration.ControllerConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.vertx.core.Vertx;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.interceptor.Interceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Liveness/readiness and Prometheus listeners on their own ports. Readiness does not check
 * any dependency.
 */
@Slf4j
@ApplicationScoped
public class HttpEndpoints {
    public static final String HEALTHZ = "/healthz";
    public static final String READYZ = "/readyz";
    public static final String METRICS = "/metrics";
    // after the configuration validator, before the controller loops
    public static final int STARTUP_PRIORITY = Interceptor.Priority.APPLICATION + 900;

    private final Vertx vertx;
    private final ControllerConfig config;
    private final PrometheusMeterRegistry registry;
    private final List<EndpointServer> servers = new ArrayList<>();

    @Inject
    public HttpEndpoints(Vertx vertx, ControllerConfig config, PrometheusMeterRegistry registry) {
        this.vertx = vertx;
        this.config = config;
        this.registry = registry;
    }

    void onStart(@Observes @Priority(STARTUP_PRIORITY) StartupEvent ev) {
        start();
    }

    void onStop(@Observes ShutdownEvent ev) {
        stop();
    }

    public synchronized void start() {
        if (config.health().enabled()) {
            EndpointServer health = healthServer(vertx);
            health.start(config.health().port());
            servers.add(health);
        } else {
            log.info("Health endpoint disabled");
        }
        if (config.metrics().enabled()) {
            EndpointServer metrics = metricsServer(vertx, registry);
            metrics.start(config.metrics().port());
            servers.add(metrics);
        } else {
            log.info("Metrics endpoint disabled");
        }
    }

    public synchronized void stop() {
        servers.forEach(EndpointServer::stop);
        servers.clear();
    }

    static EndpointServer healthServer(Vertx vertx) {
        return new EndpointServer(vertx, "health", Map.of(
                HEALTHZ, EndpointServer.Route.text("ok"),
                READYZ, EndpointServer.Route.text("ready")));
    }

    static EndpointServer metricsServer(Vertx vertx, PrometheusMeterRegistry registry) {
        return new EndpointServer(vertx, "metrics", Map.of(
                METRICS, new EndpointServer.Route(TextFormat.CONTENT_TYPE_004, registry::scrape)));
    }
}
