package com.netcracker.core.provisioning.client.db;

import com.netcracker.core.provisioning.model.JobType;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceStatus;
import com.netcracker.core.provisioning.model.ResourceType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational access to {@code resources}, {@code resource_types}, {@code provisioning_jobs}
 * and {@code audit_logs}. Every method runs in its own transaction; multi-step operations
 * are not atomic across calls.
 */
public interface DatabaseGateway {

    /**
     * Non-deleted resources with {@code lifecycle_mode = 'full'}.
     */
    List<Resource> findFullLifecycleResources();

    /**
     * Soft-deleted {@code full} resources whose status has not reached {@code deleted} yet.
     */
    List<Resource> findPendingTeardown();

    Optional<Resource> findById(long id);

    Optional<Resource> findByClusterObject(String namespace, String name);

    Optional<ResourceType> findResourceType(long id);

    /**
     * Sets the status and, when {@code connectionInfo} is not {@code null}, replaces the connection info.
     */
    void updateStatus(long id, ResourceStatus status, Map<String, Object> connectionInfo);

    void recordClusterIdentity(long id, String namespace, String name, String kind, ResourceStatus status);

    long openJob(long resourceId, JobType type);

    void completeJob(long jobId, String logs);

    void failJob(long jobId, String errorMessage);

    void appendAuditLog(String action, long resourceId, long teamId, Map<String, Object> details);
}
