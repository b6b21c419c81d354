package com.netcracker.core.provisioning.service;

import com.netcracker.core.provisioning.client.db.DatabaseGateway;
import com.netcracker.core.provisioning.client.k8s.ManagedLabels;
import com.netcracker.core.provisioning.model.ConnectionInfo;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceStatus;
import com.netcracker.core.provisioning.service.watch.ClusterEvent;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Reflects observed cluster state onto the owning resource row. Never creates or deletes
 * cluster objects.
 */
@Slf4j
@ApplicationScoped
public class ClusterEventHandler {
    static final String POD_FAILED = "Failed";
    static final String POD_FAILED_MESSAGE = "Pod failed";

    private final DatabaseGateway database;
    private final ResourceLocks locks;
    private final ControllerMetrics metrics;

    @Inject
    public ClusterEventHandler(DatabaseGateway database, ResourceLocks locks, ControllerMetrics metrics) {
        this.database = database;
        this.locks = locks;
        this.metrics = metrics;
    }

    public void handle(ClusterEvent event) {
        metrics.event(event.getKind(), event.getType());
        switch (event.getType()) {
            case DELETED -> {
                log.info("{} '{}/{}' deleted", event.getKind().getValue(), event.getNamespace(), event.getName());
                return;
            }
            case ERROR -> {
                log.warn("Watch reported an error for {} '{}/{}'", event.getKind().getValue(), event.getNamespace(), event.getName());
                return;
            }
            default -> log.debug("{} {} '{}/{}'", event.getType(), event.getKind().getValue(), event.getNamespace(), event.getName());
        }

        Optional<Resource> owner = findOwner(event);
        if (owner.isEmpty()) {
            log.trace("No resource owns {} '{}/{}'", event.getKind().getValue(), event.getNamespace(), event.getName());
            return;
        }
        if (!isWritable(owner.get())) {
            return;
        }

        long resourceId = owner.get().getId();
        Lock lock = locks.lockFor(resourceId);
        lock.lock();
        try {
            // the row may have changed while waiting for the lock
            Optional<Resource> current = database.findById(resourceId);
            if (current.isEmpty() || !isWritable(current.get())) {
                log.debug("Resource '{}' changed before {} '{}/{}' could be applied, skipping",
                        resourceId, event.getKind().getValue(), event.getNamespace(), event.getName());
                return;
            }
            switch (event.getKind()) {
                case STATEFUL_SET -> onStatefulSet(current.get(), (StatefulSet) event.getObject());
                case POD -> onPod(current.get(), (Pod) event.getObject());
            }
        } finally {
            lock.unlock();
        }
    }

    private static boolean isWritable(Resource resource) {
        return resource.isFullLifecycle()
                && !resource.isSoftDeleted()
                && resource.getStatus() != ResourceStatus.DELETED;
    }

    private void onStatefulSet(Resource resource, StatefulSet statefulSet) {
        int replicas = statefulSet.getSpec() == null
                ? 1 : Objects.requireNonNullElse(statefulSet.getSpec().getReplicas(), 1);
        int ready = statefulSet.getStatus() == null
                ? 0 : Objects.requireNonNullElse(statefulSet.getStatus().getReadyReplicas(), 0);
        ResourceStatus status = ready >= replicas ? ResourceStatus.ACTIVE : ResourceStatus.UPDATING;

        Map<String, Object> connectionInfo = new HashMap<>();
        if (resource.getConnectionInfo() != null) {
            connectionInfo.putAll(resource.getConnectionInfo());
        }
        connectionInfo.remove("error");
        connectionInfo.remove("pod");
        connectionInfo.putAll(ConnectionInfo.builder()
                .readyReplicas(ready)
                .replicas(replicas)
                .serviceName(ConnectionInfo.serviceAddress(statefulSet.getMetadata().getName(), statefulSet.getMetadata().getNamespace()))
                .build()
                .toMap());

        database.updateStatus(resource.getId(), status, connectionInfo);
        log.debug("Resource '{}' set to '{}' from StatefulSet event ({}/{} ready)", resource.getId(), status.getValue(), ready, replicas);
    }

    private void onPod(Resource resource, Pod pod) {
        String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
        if (!POD_FAILED.equals(phase)) {
            return;
        }
        String podName = pod.getMetadata().getName();
        log.warn("Pod '{}/{}' of resource '{}' failed", pod.getMetadata().getNamespace(), podName, resource.getId());
        ConnectionInfo info = ConnectionInfo.builder()
                .error(POD_FAILED_MESSAGE)
                .pod(podName)
                .build();
        database.updateStatus(resource.getId(), ResourceStatus.ERROR, info.toMap());
    }

    /**
     * By stored (namespace, name) first, then by the resource-id label, then, for pods, by the app label.
     */
    Optional<Resource> findOwner(ClusterEvent event) {
        HasMetadata object = event.getObject();
        Map<String, String> labels = object.getMetadata().getLabels() == null ? Map.of() : object.getMetadata().getLabels();

        if (event.getKind() == ClusterEvent.Kind.STATEFUL_SET) {
            Optional<Resource> byIdentity = database.findByClusterObject(event.getNamespace(), event.getName());
            if (byIdentity.isPresent()) {
                return byIdentity;
            }
        }
        Optional<Long> labelledId = parseId(labels.get(ManagedLabels.RESOURCE_ID));
        if (labelledId.isPresent()) {
            return database.findById(labelledId.get());
        }
        String app = labels.get(ManagedLabels.APP);
        if (event.getKind() == ClusterEvent.Kind.POD && app != null) {
            return database.findByClusterObject(event.getNamespace(), app);
        }
        return Optional.empty();
    }

    private static Optional<Long> parseId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric resource-id label '{}'", value);
            return Optional.empty();
        }
    }
}
