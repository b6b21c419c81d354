package com.netcracker.core.provisioning.service.reconcile;

import com.netcracker.core.provisioning.client.db.DatabaseGateway;
import com.netcracker.core.provisioning.client.k8s.ClusterClient;
import com.netcracker.core.provisioning.client.k8s.ManagedLabels;
import com.netcracker.core.provisioning.exception.ReconciliationException;
import com.netcracker.core.provisioning.model.ConnectionInfo;
import com.netcracker.core.provisioning.model.JobType;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceStatus;
import com.netcracker.core.provisioning.model.ResourceType;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converges the cluster state of one resource towards its database row.
 * <p>
 * Every failure is written back to the row, the open provisioning job and the audit log before
 * a {@link ReconciliationException} is thrown; the exception only drives the retry queue.
 * Only resources with lifecycle mode {@code full} are ever touched.
 */
@Slf4j
@ApplicationScoped
public class Reconciler {
    public static final String AUDIT_CREATED = "resource.created";
    public static final String AUDIT_UPDATED = "resource.updated";
    public static final String AUDIT_DELETED = "resource.deleted";
    public static final String AUDIT_ERROR = "resource.error";

    static final String MDC_RESOURCE_ID = "resourceId";
    static final String MDC_RESOURCE_NAME = "resourceName";
    private static final String POD_RUNNING = "Running";

    private final DatabaseGateway database;
    private final ClusterClient cluster;
    private final ResourceTypeRegistry registry;
    private final StatefulSetSpecBuilder specBuilder;

    @Inject
    public Reconciler(DatabaseGateway database,
                      ClusterClient cluster,
                      ResourceTypeRegistry registry,
                      StatefulSetSpecBuilder specBuilder) {
        this.database = database;
        this.cluster = cluster;
        this.registry = registry;
        this.specBuilder = specBuilder;
    }

    public void reconcile(Resource resource) throws ReconciliationException {
        if (!resource.isFullLifecycle()) {
            log.trace("Skipping resource '{}' with lifecycle mode '{}'", resource.getName(), resource.getLifecycleMode());
            return;
        }
        MDC.put(MDC_RESOURCE_ID, String.valueOf(resource.getId()));
        MDC.put(MDC_RESOURCE_NAME, resource.getName());
        try {
            if (resource.isSoftDeleted()) {
                delete(resource);
            } else {
                converge(resource);
            }
        } finally {
            MDC.remove(MDC_RESOURCE_ID);
            MDC.remove(MDC_RESOURCE_NAME);
        }
    }

    private void converge(Resource resource) throws ReconciliationException {
        ResourceType type;
        Optional<StatefulSet> observed;
        try {
            type = database.findResourceType(resource.getResourceTypeId())
                    .orElseThrow(() -> new IllegalStateException("resource type %d not found".formatted(resource.getResourceTypeId())));
            if (!registry.supports(type.getName()) && !resource.hasClusterIdentity()) {
                // nothing can exist in the cluster for a type that was never mapped
                create(resource, type);
                return;
            }
            observed = observe(resource);
        } catch (RuntimeException e) {
            throw failure(resource, null, "observe", e);
        }

        if (observed.isPresent()) {
            update(resource, type, observed.get());
        } else {
            create(resource, type);
        }
    }

    /**
     * Looks the workload object up by stored identity, or adopts an object this resource created
     * earlier but never recorded.
     */
    private Optional<StatefulSet> observe(Resource resource) {
        if (resource.hasClusterIdentity()) {
            Optional<StatefulSet> existing = cluster.getStatefulSet(resource.getK8sNamespace(), resource.getK8sResourceName());
            if (existing.isEmpty()) {
                log.warn("StatefulSet '{}/{}' recorded for resource '{}' is missing, it will be re-created",
                        resource.getK8sNamespace(), resource.getK8sResourceName(), resource.getName());
            }
            return existing;
        }
        Optional<StatefulSet> orphan = findUnrecordedWorkload(resource);
        if (orphan.isPresent()) {
            log.info("Adopting existing StatefulSet '{}/{}' for resource '{}'", resource.getK8sNamespace(), resource.getName(), resource.getId());
            database.recordClusterIdentity(resource.getId(), resource.getK8sNamespace(), resource.getName(),
                    StatefulSetSpecBuilder.KIND, resource.getStatus());
        }
        return orphan;
    }

    /**
     * A StatefulSet named after the resource in its target namespace that carries this resource's
     * id label. Left behind when a create succeeded in the cluster but was never recorded.
     */
    private Optional<StatefulSet> findUnrecordedWorkload(Resource resource) {
        String namespace = resource.getK8sNamespace();
        if (namespace == null || namespace.isBlank()) {
            return Optional.empty();
        }
        Optional<StatefulSet> candidate = cluster.getStatefulSet(namespace, resource.getName());
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> labels = candidate.get().getMetadata().getLabels();
        String owner = labels == null ? null : labels.get(ManagedLabels.RESOURCE_ID);
        if (!String.valueOf(resource.getId()).equals(owner)) {
            log.warn("StatefulSet '{}/{}' exists but belongs to resource '{}'", namespace, resource.getName(), owner);
            return Optional.empty();
        }
        return candidate;
    }

    private void create(Resource resource, ResourceType type) throws ReconciliationException {
        Long jobId = null;
        try {
            database.updateStatus(resource.getId(), ResourceStatus.PROVISIONING, null);
            jobId = database.openJob(resource.getId(), JobType.CREATE);

            StatefulSet desired = specBuilder.build(resource, type);
            String namespace = desired.getMetadata().getNamespace();
            String name = desired.getMetadata().getName();
            ensureNamespace(namespace);
            cluster.createStatefulSet(desired);
            log.info("Created StatefulSet '{}/{}' for resource '{}'", namespace, name, resource.getId());

            database.recordClusterIdentity(resource.getId(), namespace, name, StatefulSetSpecBuilder.KIND, ResourceStatus.ACTIVE);
            database.completeJob(jobId, "created %s %s/%s".formatted(StatefulSetSpecBuilder.KIND, namespace, name));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("namespace", namespace);
            details.put("name", name);
            details.put("kind", StatefulSetSpecBuilder.KIND);
            details.put("resource_type", type.getName());
            details.put("replicas", desired.getSpec().getReplicas());
            database.appendAuditLog(AUDIT_CREATED, resource.getId(), resource.getTeamId(), details);
        } catch (RuntimeException e) {
            throw failure(resource, jobId, "create", e);
        }
    }

    private void ensureNamespace(String namespace) {
        if (!cluster.namespaceExists(namespace)) {
            cluster.createNamespace(namespace, ManagedLabels.managedNamespace());
        }
    }

    private void update(Resource resource, ResourceType type, StatefulSet observed) throws ReconciliationException {
        String namespace = observed.getMetadata().getNamespace() != null
                ? observed.getMetadata().getNamespace() : resource.getK8sNamespace();
        String name = observed.getMetadata().getName();
        StatefulSet current = observed;
        try {
            int desiredReplicas = specBuilder.build(resource, type).getSpec().getReplicas();
            int observedReplicas = Objects.requireNonNullElse(observed.getSpec().getReplicas(), StatefulSetSpecBuilder.DEFAULT_REPLICAS);
            if (desiredReplicas != observedReplicas) {
                current = scale(resource, observed, observedReplicas, desiredReplicas);
            }
        } catch (RuntimeException e) {
            throw failure(resource, null, "update", e);
        }

        try {
            refreshConnectionInfo(resource, namespace, name, current);
        } catch (RuntimeException e) {
            throw failure(resource, null, "refresh", e);
        }
    }

    private StatefulSet scale(Resource resource, StatefulSet observed, int from, int to) throws ReconciliationException {
        long jobId = database.openJob(resource.getId(), JobType.SCALE);
        StatefulSet scaled = new StatefulSetBuilder(observed)
                .editSpec()
                    .withReplicas(to)
                .endSpec()
                .build();
        try {
            StatefulSet updated = cluster.updateStatefulSet(scaled);
            log.info("Scaled StatefulSet '{}/{}' from {} to {} replicas",
                    observed.getMetadata().getNamespace(), observed.getMetadata().getName(), from, to);
            database.completeJob(jobId, "scaled from %d to %d replicas".formatted(from, to));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", "replicas");
            details.put("from", from);
            details.put("to", to);
            database.appendAuditLog(AUDIT_UPDATED, resource.getId(), resource.getTeamId(), details);
            return updated != null ? updated : scaled;
        } catch (RuntimeException e) {
            throw failure(resource, jobId, "scale", e);
        }
    }

    private void refreshConnectionInfo(Resource resource, String namespace, String name, StatefulSet statefulSet) {
        List<Pod> pods = cluster.listPods(namespace, ManagedLabels.selector(name));
        List<String> podIps = pods.stream()
                .map(Pod::getStatus)
                .filter(Objects::nonNull)
                .map(PodStatus::getPodIP)
                .filter(Objects::nonNull)
                .toList();
        int replicas = Objects.requireNonNullElse(statefulSet.getSpec().getReplicas(), StatefulSetSpecBuilder.DEFAULT_REPLICAS);
        int ready = statefulSet.getStatus() == null
                ? 0 : Objects.requireNonNullElse(statefulSet.getStatus().getReadyReplicas(), 0);
        boolean allRunning = pods.stream()
                .allMatch(pod -> pod.getStatus() != null && POD_RUNNING.equals(pod.getStatus().getPhase()));

        ResourceStatus status = allRunning && ready >= replicas ? ResourceStatus.ACTIVE : ResourceStatus.UPDATING;
        ConnectionInfo info = ConnectionInfo.builder()
                .podIps(podIps)
                .readyReplicas(ready)
                .replicas(replicas)
                .serviceName(ConnectionInfo.serviceAddress(name, namespace))
                .build();
        database.updateStatus(resource.getId(), status, info.toMap());
        log.debug("Resource '{}' is '{}' ({}/{} ready)", resource.getId(), status.getValue(), ready, replicas);
    }

    private void delete(Resource resource) throws ReconciliationException {
        if (resource.getStatus() == ResourceStatus.DELETED) {
            return;
        }
        String namespace;
        String name;
        try {
            if (resource.hasClusterIdentity()) {
                namespace = resource.getK8sNamespace();
                name = resource.getK8sResourceName();
            } else if (findUnrecordedWorkload(resource).isPresent()) {
                namespace = resource.getK8sNamespace();
                name = resource.getName();
                log.info("Found unrecorded StatefulSet '{}/{}' of deleted resource '{}'", namespace, name, resource.getId());
            } else {
                database.updateStatus(resource.getId(), ResourceStatus.DELETED, null);
                database.appendAuditLog(AUDIT_DELETED, resource.getId(), resource.getTeamId(),
                        Map.of("reason", "no cluster object recorded"));
                return;
            }
        } catch (RuntimeException e) {
            throw failure(resource, null, "delete", e);
        }

        Long jobId = null;
        try {
            jobId = database.openJob(resource.getId(), JobType.DELETE);
            boolean existed = cluster.deleteStatefulSet(namespace, name);
            if (existed) {
                log.info("Deleted StatefulSet '{}/{}' of resource '{}'", namespace, name, resource.getId());
            } else {
                log.info("StatefulSet '{}/{}' of resource '{}' is already gone", namespace, name, resource.getId());
            }
            database.updateStatus(resource.getId(), ResourceStatus.DELETED, null);
            database.completeJob(jobId, existed ? "deleted %s/%s".formatted(namespace, name) : "already absent");

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("namespace", namespace);
            details.put("name", name);
            details.put("kind", Objects.requireNonNullElse(resource.getK8sResourceType(), StatefulSetSpecBuilder.KIND));
            details.put("existed", existed);
            database.appendAuditLog(AUDIT_DELETED, resource.getId(), resource.getTeamId(), details);
        } catch (RuntimeException e) {
            throw failure(resource, jobId, "delete", e);
        }
    }

    /**
     * Persists a failure and returns the exception the caller should throw. Errors while persisting
     * are logged; the original cause is kept.
     */
    private ReconciliationException failure(Resource resource, Long jobId, String operation, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("Failed to {} resource '{}': {}", operation, resource.getId(), message, cause);
        try {
            database.updateStatus(resource.getId(), ResourceStatus.ERROR, ConnectionInfo.error(message).toMap());
            if (jobId != null) {
                database.failJob(jobId, message);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("operation", operation);
            details.put("error", message);
            database.appendAuditLog(AUDIT_ERROR, resource.getId(), resource.getTeamId(), details);
        } catch (RuntimeException e) {
            log.error("Could not record failure of resource '{}'", resource.getId(), e);
        }
        return new ReconciliationException(resource.getId(), "%s failed for resource %d: %s".formatted(operation, resource.getId(), message), cause);
    }
}
