package com.netcracker.core.provisioning.service.watch;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Long-lived watch of one object kind in one namespace. A closed or failed watch is reopened
 * after a fixed delay, without limit, until {@link #stop()} is called. Reopen attempts run on the
 * reconnect pool shared by all streams; at most one is pending per stream.
 */
@Slf4j
public class WatchStream<T extends HasMetadata> {
    private final String namespace;
    private final ClusterEvent.Kind kind;
    private final BiFunction<String, Watcher<T>, Watch> opener;
    private final Consumer<ClusterEvent> sink;
    private final Runnable onReconnect;
    private final Duration reconnectDelay;
    private final ScheduledExecutorService reconnects;

    private final Object lock = new Object();
    private volatile boolean stopped;
    private Watch watch;
    private ScheduledFuture<?> pendingReconnect;

    public WatchStream(String namespace,
                       ClusterEvent.Kind kind,
                       BiFunction<String, Watcher<T>, Watch> opener,
                       Consumer<ClusterEvent> sink,
                       Runnable onReconnect,
                       Duration reconnectDelay,
                       ScheduledExecutorService reconnects) {
        this.namespace = namespace;
        this.kind = kind;
        this.opener = opener;
        this.sink = sink;
        this.onReconnect = onReconnect;
        this.reconnectDelay = reconnectDelay;
        this.reconnects = reconnects;
    }

    public void start() {
        open();
    }

    /**
     * Closes the watch and cancels a pending reopen. A reopen already running finishes on the pool.
     */
    public void stop() {
        stopped = true;
        synchronized (lock) {
            if (pendingReconnect != null) {
                pendingReconnect.cancel(false);
                pendingReconnect = null;
            }
            if (watch != null) {
                try {
                    watch.close();
                } catch (RuntimeException e) {
                    log.debug("Error while closing {} watch in '{}'", kind.getValue(), namespace, e);
                }
                watch = null;
            }
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    public String getNamespace() {
        return namespace;
    }

    public ClusterEvent.Kind getKind() {
        return kind;
    }

    private void open() {
        if (stopped) {
            return;
        }
        try {
            Watch opened = opener.apply(namespace, new StreamWatcher());
            synchronized (lock) {
                if (stopped) {
                    opened.close();
                    return;
                }
                watch = opened;
            }
            log.debug("Opened {} watch in '{}'", kind.getValue(), namespace);
        } catch (RuntimeException e) {
            log.warn("Cannot open {} watch in '{}', retrying in {}: {}", kind.getValue(), namespace, reconnectDelay, e.getMessage());
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        synchronized (lock) {
            if (stopped || pendingReconnect != null) {
                return;
            }
            try {
                pendingReconnect = reconnects.schedule(this::reconnect, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Reconnect pool is shut down, {} watch in '{}' stays closed", kind.getValue(), namespace);
            }
        }
    }

    private void reconnect() {
        synchronized (lock) {
            pendingReconnect = null;
        }
        if (stopped) {
            return;
        }
        onReconnect.run();
        open();
    }

    private class StreamWatcher implements Watcher<T> {

        @Override
        public void eventReceived(Action action, T resource) {
            if (stopped) {
                return;
            }
            ClusterEvent.Type.from(action)
                    .ifPresentOrElse(
                            type -> sink.accept(ClusterEvent.of(type, kind, resource)),
                            () -> log.trace("Ignoring '{}' on {} watch in '{}'", action, kind.getValue(), namespace));
        }

        @Override
        public void onClose() {
            if (!stopped) {
                log.warn("{} watch in '{}' closed, reopening in {}", kind.getValue(), namespace, reconnectDelay);
                scheduleReconnect();
            }
        }

        @Override
        public void onClose(WatcherException cause) {
            if (!stopped) {
                log.warn("{} watch in '{}' failed, reopening in {}: {}", kind.getValue(), namespace, reconnectDelay, cause.getMessage());
                scheduleReconnect();
            }
        }
    }
}
