package com.netcracker.core.provisioning.service;

import com.netcracker.core.provisioning.service.retry.RetryQueue;
import com.netcracker.core.provisioning.service.watch.ClusterEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Controller meters, exposed with Prometheus naming ({@code nest_controller_*}).
 */
@ApplicationScoped
public class ControllerMetrics {
    static final String RECONCILE = "nest.controller.reconcile";
    static final String RECONCILE_DURATION = "nest.controller.reconcile.duration";
    static final String RETRY_QUEUE_SIZE = "nest.controller.retry.queue.size";
    static final String RETRY_EXHAUSTED = "nest.controller.retry.exhausted";
    static final String EVENTS = "nest.controller.events";
    static final String WATCH_RECONNECTS = "nest.controller.watch.reconnects";
    static final String WORK_QUEUE_SIZE = "nest.controller.work.queue.size";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;
    private final Timer reconcileDuration;
    private final Counter retryExhausted;

    @Inject
    public ControllerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.reconcileDuration = Timer.builder(RECONCILE_DURATION)
                .description("Time spent reconciling one resource")
                .register(registry);
        this.retryExhausted = Counter.builder(RETRY_EXHAUSTED)
                .description("Failures recorded after the retry count passed the configured maximum")
                .register(registry);
    }

    public void recordReconcile(String outcome, long durationNanos) {
        registry.counter(RECONCILE, "outcome", outcome).increment();
        reconcileDuration.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void retryExhausted() {
        retryExhausted.increment();
    }

    public void event(ClusterEvent.Kind kind, ClusterEvent.Type type) {
        registry.counter(EVENTS, "kind", kind.getValue(), "type", type.name()).increment();
    }

    public void watchReconnect(ClusterEvent.Kind kind) {
        registry.counter(WATCH_RECONNECTS, "kind", kind.getValue()).increment();
    }

    public void bindRetryQueue(RetryQueue retryQueue) {
        Gauge.builder(RETRY_QUEUE_SIZE, retryQueue, RetryQueue::size)
                .description("Resources currently tracked by the retry queue")
                .strongReference(true)
                .register(registry);
    }

    public void bindWorkQueue(Supplier<Number> size) {
        Gauge.builder(WORK_QUEUE_SIZE, size)
                .description("Resources waiting for a reconcile worker")
                .strongReference(true)
                .register(registry);
    }
}
