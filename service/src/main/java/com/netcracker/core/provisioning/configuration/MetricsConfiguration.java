package com.netcracker.core.provisioning.configuration;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.util.List;

public class MetricsConfiguration {
    static final String APPLICATION_TAG = "nest-k8s-controller";

    @Produces
    @Singleton
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        registry.config().meterFilter(commonTags());
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        return registry;
    }

    void closeRegistry(@Disposes PrometheusMeterRegistry registry) {
        registry.close();
    }

    static MeterFilter commonTags() {
        return MeterFilter.commonTags(List.of(Tag.of("application", APPLICATION_TAG)));
    }
}
