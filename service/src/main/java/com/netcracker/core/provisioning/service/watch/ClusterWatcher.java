package com.netcracker.core.provisioning.service.watch;

import com.netcracker.core.provisioning.client.k8s.ClusterClient;
import com.netcracker.core.provisioning.configuration.ControllerConfig;
import com.netcracker.core.provisioning.exception.ControllerStartupException;
import com.netcracker.core.provisioning.service.ControllerMetrics;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens a StatefulSet and a Pod watch stream in every relevant namespace and funnels their events
 * into one bounded queue. Never writes to the cluster or the database.
 * <p>
 * All streams reopen on one small reconnect pool, so the thread count does not grow with the
 * number of watched namespaces.
 */
@Slf4j
@ApplicationScoped
public class ClusterWatcher {
    private static final long OFFER_TIMEOUT_MS = 100;
    static final int RECONNECT_THREADS = 2;
    static final String RECONNECT_THREAD_PREFIX = "watch-reconnect-";

    private final ClusterClient cluster;
    private final ControllerMetrics metrics;
    private final String namespacePrefix;
    private final boolean watchAllNamespaces;
    private final Duration reconnectDelay;
    private final BlockingQueue<ClusterEvent> events;

    private final Map<String, List<WatchStream<?>>> streams = new LinkedHashMap<>();
    private volatile boolean running;
    private ScheduledExecutorService reconnects;

    @Inject
    public ClusterWatcher(ClusterClient cluster, ControllerMetrics metrics, ControllerConfig config) {
        this(cluster, metrics,
                config.cluster().namespacePrefix(),
                config.cluster().watchAllNamespaces(),
                config.cluster().watchReconnectDelay(),
                config.cluster().eventBufferSize());
    }

    public ClusterWatcher(ClusterClient cluster,
                          ControllerMetrics metrics,
                          String namespacePrefix,
                          boolean watchAllNamespaces,
                          Duration reconnectDelay,
                          int eventBufferSize) {
        this.cluster = cluster;
        this.metrics = metrics;
        this.namespacePrefix = namespacePrefix;
        this.watchAllNamespaces = watchAllNamespaces;
        this.reconnectDelay = reconnectDelay;
        this.events = new ArrayBlockingQueue<>(eventBufferSize);
    }

    /**
     * @throws ControllerStartupException if the namespaces cannot be listed
     */
    public synchronized void start() {
        reconnects = Executors.newScheduledThreadPool(RECONNECT_THREADS, reconnectThreadFactory());
        running = true;
        try {
            syncNamespaces();
        } catch (RuntimeException e) {
            running = false;
            reconnects.shutdownNow();
            throw new ControllerStartupException("Cannot list namespaces to watch", e);
        }
        log.info("Watching {} namespace(s): {}", streams.size(), streams.keySet());
    }

    /**
     * Opens streams for namespaces that appeared since the last call.
     */
    public synchronized void syncNamespaces() {
        if (!running) {
            return;
        }
        for (String namespace : cluster.listNamespaces()) {
            if (!streams.containsKey(namespace) && isWatched(namespace)) {
                streams.put(namespace, openStreams(namespace));
            }
        }
    }

    /**
     * Closes every stream, then waits up to {@code awaitTermination} for reconnects in flight.
     */
    public void stop(Duration awaitTermination) {
        List<WatchStream<?>> toStop = new ArrayList<>();
        ScheduledExecutorService pool;
        synchronized (this) {
            running = false;
            streams.values().forEach(toStop::addAll);
            streams.clear();
            pool = reconnects;
            reconnects = null;
        }
        toStop.forEach(WatchStream::stop);
        if (pool != null) {
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(awaitTermination.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Watch reconnects did not finish within {}", awaitTermination);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Stopped {} watch stream(s)", toStop.size());
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public ClusterEvent poll(Duration timeout) throws InterruptedException {
        return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized List<String> watchedNamespaces() {
        return List.copyOf(streams.keySet());
    }

    public boolean isRunning() {
        return running;
    }

    boolean isWatched(String namespace) {
        return watchAllNamespaces || namespace.startsWith(namespacePrefix);
    }

    private List<WatchStream<?>> openStreams(String namespace) {
        WatchStream<StatefulSet> statefulSets = new WatchStream<>(namespace, ClusterEvent.Kind.STATEFUL_SET,
                cluster::watchStatefulSets, this::publish,
                () -> metrics.watchReconnect(ClusterEvent.Kind.STATEFUL_SET), reconnectDelay, reconnects);
        WatchStream<Pod> pods = new WatchStream<>(namespace, ClusterEvent.Kind.POD,
                cluster::watchPods, this::publish,
                () -> metrics.watchReconnect(ClusterEvent.Kind.POD), reconnectDelay, reconnects);
        statefulSets.start();
        pods.start();
        return List.of(statefulSets, pods);
    }

    private static ThreadFactory reconnectThreadFactory() {
        AtomicLong seq = new AtomicLong();
        return r -> {
            Thread t = new Thread(r, RECONNECT_THREAD_PREFIX + seq.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) ->
                    log.error("Uncaught exception in '{}'", th.getName(), ex));
            return t;
        };
    }

    /**
     * Blocks while the buffer is full, giving up once the watcher stops.
     */
    void publish(ClusterEvent event) {
        try {
            while (running) {
                if (events.offer(event, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
            log.debug("Dropping {} {} '{}/{}', watcher stopped",
                    event.getType(), event.getKind().getValue(), event.getNamespace(), event.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
