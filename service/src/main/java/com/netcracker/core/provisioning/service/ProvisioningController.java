package com.netcracker.core.provisioning.service;

import com.netcracker.core.provisioning.client.db.DatabaseGateway;
import com.netcracker.core.provisioning.configuration.ControllerConfig;
import com.netcracker.core.provisioning.exception.ReconciliationException;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.service.reconcile.Reconciler;
import com.netcracker.core.provisioning.service.retry.RetryEntry;
import com.netcracker.core.provisioning.service.retry.RetryQueue;
import com.netcracker.core.provisioning.service.watch.ClusterEvent;
import com.netcracker.core.provisioning.service.watch.ClusterWatcher;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.interceptor.Interceptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

/**
 * Owns the controller loops: the periodic reconcile pass, the cluster event loop and the
 * reconcile workers.
 * <p>
 * The periodic pass loads every {@code full} resource (live rows and soft-deleted rows still
 * awaiting teardown), skips those in backoff and hands the rest to the workers. With zero workers
 * resources are reconciled on the ticker thread. {@link #stop()} returns only after every thread
 * it started, including watch reconnect threads, has exited.
 */
@Slf4j
@ApplicationScoped
public class ProvisioningController {
    public static final int STARTUP_PRIORITY = Interceptor.Priority.APPLICATION + 1000;
    static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
    private static final Duration STOP_GRACE = Duration.ofSeconds(30);

    private final DatabaseGateway database;
    private final Reconciler reconciler;
    private final RetryQueue retryQueue;
    private final ClusterWatcher watcher;
    private final ClusterEventHandler eventHandler;
    private final ResourceLocks locks;
    private final ControllerMetrics metrics;

    private final Duration interval;
    private final int workers;
    private final int maxRetries;
    private final Duration watchStopTimeout;
    private final ReconcileWorkQueue workQueue;

    private final Object lifecycle = new Object();
    private volatile boolean running;
    private ScheduledExecutorService ticker;
    private ExecutorService loops;

    @Inject
    public ProvisioningController(ControllerConfig config,
                                  DatabaseGateway database,
                                  Reconciler reconciler,
                                  RetryQueue retryQueue,
                                  ClusterWatcher watcher,
                                  ClusterEventHandler eventHandler,
                                  ResourceLocks locks,
                                  ControllerMetrics metrics) {
        this(database, reconciler, retryQueue, watcher, eventHandler, locks, metrics,
                config.reconcile().interval(),
                config.reconcile().workers(),
                config.reconcile().queueCapacity(),
                config.retry().maxRetries(),
                config.cluster().watchReconnectDelay().plusSeconds(1));
    }

    ProvisioningController(DatabaseGateway database,
                           Reconciler reconciler,
                           RetryQueue retryQueue,
                           ClusterWatcher watcher,
                           ClusterEventHandler eventHandler,
                           ResourceLocks locks,
                           ControllerMetrics metrics,
                           Duration interval,
                           int workers,
                           int queueCapacity,
                           int maxRetries,
                           Duration watchStopTimeout) {
        this.database = database;
        this.reconciler = reconciler;
        this.retryQueue = retryQueue;
        this.watcher = watcher;
        this.eventHandler = eventHandler;
        this.locks = locks;
        this.metrics = metrics;
        this.interval = interval;
        this.workers = workers;
        this.maxRetries = maxRetries;
        this.watchStopTimeout = watchStopTimeout;
        this.workQueue = new ReconcileWorkQueue(queueCapacity);
        metrics.bindRetryQueue(retryQueue);
        metrics.bindWorkQueue(workQueue::size);
    }

    // after the configuration validator
    void onStart(@Observes @Priority(STARTUP_PRIORITY) StartupEvent ev) {
        start();
    }

    void onStop(@Observes ShutdownEvent ev) {
        stop();
    }

    /**
     * Starts the watcher and all loops and returns immediately.
     *
     * @throws com.netcracker.core.provisioning.exception.ControllerStartupException if the watcher cannot start
     */
    public void start() {
        synchronized (lifecycle) {
            if (running) {
                throw new IllegalStateException("Controller is already running");
            }
            watcher.start();
            running = true;

            loops = Executors.newFixedThreadPool(workers + 1, threadFactory("controller"));
            loops.execute(this::eventLoop);
            for (int i = 0; i < workers; i++) {
                loops.execute(this::workerLoop);
            }
            ticker = Executors.newSingleThreadScheduledExecutor(threadFactory("reconcile-ticker"));
            ticker.scheduleWithFixedDelay(this::reconcilePassSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Controller started: interval={}, workers={}", interval, workers);
        }
    }

    /**
     * Signals every loop to finish and waits for them.
     */
    public void stop() {
        synchronized (lifecycle) {
            if (!running) {
                return;
            }
            running = false;
            ticker.shutdown();
            watcher.stop(watchStopTimeout);
            loops.shutdown();
            awaitTermination(ticker, "reconcile ticker");
            awaitTermination(loops, "controller loops");
            workQueue.clear();
            log.info("Controller stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    void reconcilePassSafely() {
        try {
            reconcilePass();
        } catch (RuntimeException e) {
            log.error("Reconcile pass failed", e);
        }
    }

    void reconcilePass() {
        try {
            watcher.syncNamespaces();
        } catch (RuntimeException e) {
            log.warn("Cannot refresh watched namespaces: {}", e.getMessage());
        }

        List<Resource> resources = new ArrayList<>();
        try {
            resources.addAll(database.findFullLifecycleResources());
            resources.addAll(database.findPendingTeardown());
        } catch (RuntimeException e) {
            log.error("Cannot load resources for reconciliation", e);
            return;
        }
        log.debug("Reconcile pass over {} resource(s)", resources.size());

        for (Resource resource : resources) {
            if (!running) {
                return;
            }
            if (retryQueue.shouldSkip(resource.getId())) {
                log.debug("Resource '{}' is backing off", resource.getId());
                continue;
            }
            if (workers == 0) {
                reconcileOne(resource);
            } else if (!workQueue.offer(resource)) {
                log.debug("Resource '{}' not queued, already pending or queue full", resource.getId());
            }
        }
    }

    void reconcileOne(Resource resource) {
        Lock lock = locks.lockFor(resource.getId());
        lock.lock();
        long started = System.nanoTime();
        try {
            // queued or listed rows can be stale by the time the lock is held
            Optional<Resource> current = database.findById(resource.getId());
            if (current.isEmpty()) {
                log.debug("Resource '{}' no longer exists, skipping", resource.getId());
                retryQueue.remove(resource.getId());
                return;
            }
            reconciler.reconcile(current.get());
            retryQueue.remove(resource.getId());
            metrics.recordReconcile(ControllerMetrics.OUTCOME_SUCCESS, System.nanoTime() - started);
        } catch (ReconciliationException e) {
            metrics.recordReconcile(ControllerMetrics.OUTCOME_FAILURE, System.nanoTime() - started);
            backOff(resource, e.isTerminal(), e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordReconcile(ControllerMetrics.OUTCOME_FAILURE, System.nanoTime() - started);
            log.error("Unexpected error reconciling resource '{}'", resource.getId(), e);
            backOff(resource, false, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void backOff(Resource resource, boolean terminal, String reason) {
        RetryEntry entry = retryQueue.add(resource.getId());
        if (entry.getRetryCount() > maxRetries) {
            metrics.retryExhausted();
            log.warn("Resource '{}' failed {} times (max {}), still retrying in {}: {}",
                    resource.getId(), entry.getRetryCount(), maxRetries, entry.getBackoff(), reason);
        } else if (terminal) {
            log.warn("Resource '{}' cannot converge until its type is configured, retry {} in {}: {}",
                    resource.getId(), entry.getRetryCount(), entry.getBackoff(), reason);
        } else {
            log.warn("Resource '{}' failed, retry {} in {}: {}",
                    resource.getId(), entry.getRetryCount(), entry.getBackoff(), reason);
        }
    }

    private void eventLoop() {
        while (running) {
            try {
                ClusterEvent event = watcher.poll(POLL_TIMEOUT);
                if (event != null) {
                    eventHandler.handle(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Failed to handle cluster event", e);
            }
        }
    }

    private void workerLoop() {
        while (running) {
            try {
                Resource resource = workQueue.poll(POLL_TIMEOUT);
                if (resource != null && running) {
                    reconcileOne(resource);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void awaitTermination(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not finish within {}, interrupting", name, STOP_GRACE);
                executor.shutdownNow();
                executor.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicLong seq = new AtomicLong();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) ->
                    log.error("Uncaught exception in '{}'", th.getName(), ex));
            return t;
        };
    }
}
