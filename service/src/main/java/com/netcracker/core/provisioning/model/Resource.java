package com.netcracker.core.provisioning.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a {@code resources} row as seen by one reconcile pass.
 * <p>
 * {@code k8sNamespace} is the team-scoped target namespace set by the API layer;
 * {@code k8sResourceName} and {@code k8sResourceType} stay empty until the cluster object is created.
 */
@Value
@Builder(toBuilder = true)
public class Resource {
    long id;
    String name;
    long teamId;
    long resourceTypeId;
    LifecycleMode lifecycleMode;
    ResourceStatus status;
    @Builder.Default
    Map<String, Object> config = Map.of();
    Map<String, Object> connectionInfo;
    String k8sNamespace;
    String k8sResourceName;
    String k8sResourceType;
    Instant deletedAt;

    public boolean isFullLifecycle() {
        return lifecycleMode == LifecycleMode.FULL;
    }

    public boolean isSoftDeleted() {
        return deletedAt != null;
    }

    public boolean hasClusterIdentity() {
        return k8sNamespace != null && !k8sNamespace.isBlank()
                && k8sResourceName != null && !k8sResourceName.isBlank();
    }
}
