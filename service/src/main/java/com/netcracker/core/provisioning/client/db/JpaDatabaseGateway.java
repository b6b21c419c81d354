package com.netcracker.core.provisioning.client.db;

import com.netcracker.core.provisioning.client.db.entity.AuditLogEntity;
import com.netcracker.core.provisioning.client.db.entity.ProvisioningJobEntity;
import com.netcracker.core.provisioning.client.db.entity.ResourceEntity;
import com.netcracker.core.provisioning.client.db.entity.ResourceTypeEntity;
import com.netcracker.core.provisioning.model.JobStatus;
import com.netcracker.core.provisioning.model.JobType;
import com.netcracker.core.provisioning.model.LifecycleMode;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceStatus;
import com.netcracker.core.provisioning.model.ResourceType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
@Slf4j
public class JpaDatabaseGateway implements DatabaseGateway {
    static final String AUDIT_RESOURCE_TYPE = "resources";

    private final EntityManager entityManager;
    private final Clock clock;

    @Inject
    public JpaDatabaseGateway(EntityManager entityManager) {
        this(entityManager, Clock.systemUTC());
    }

    JpaDatabaseGateway(EntityManager entityManager, Clock clock) {
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Override
    @Transactional
    public List<Resource> findFullLifecycleResources() {
        return entityManager.createQuery(
                        "select r from ResourceEntity r where r.lifecycleMode = :mode and r.deletedAt is null order by r.id",
                        ResourceEntity.class)
                .setParameter("mode", LifecycleMode.FULL)
                .getResultStream()
                .map(JpaDatabaseGateway::toResource)
                .toList();
    }

    @Override
    @Transactional
    public List<Resource> findPendingTeardown() {
        return entityManager.createQuery(
                        "select r from ResourceEntity r where r.lifecycleMode = :mode and r.deletedAt is not null"
                                + " and (r.status is null or r.status <> :deleted) order by r.id",
                        ResourceEntity.class)
                .setParameter("mode", LifecycleMode.FULL)
                .setParameter("deleted", ResourceStatus.DELETED)
                .getResultStream()
                .map(JpaDatabaseGateway::toResource)
                .toList();
    }

    @Override
    @Transactional
    public Optional<Resource> findById(long id) {
        return Optional.ofNullable(entityManager.find(ResourceEntity.class, id))
                .map(JpaDatabaseGateway::toResource);
    }

    @Override
    @Transactional
    public Optional<Resource> findByClusterObject(String namespace, String name) {
        return entityManager.createQuery(
                        "select r from ResourceEntity r where r.k8sNamespace = :namespace and r.k8sResourceName = :name order by r.id",
                        ResourceEntity.class)
                .setParameter("namespace", namespace)
                .setParameter("name", name)
                .setMaxResults(1)
                .getResultStream()
                .findFirst()
                .map(JpaDatabaseGateway::toResource);
    }

    @Override
    @Transactional
    public Optional<ResourceType> findResourceType(long id) {
        return Optional.ofNullable(entityManager.find(ResourceTypeEntity.class, id))
                .map(entity -> ResourceType.builder()
                        .id(entity.getId())
                        .name(entity.getName())
                        .category(entity.getCategory())
                        .supportsFullLifecycle(entity.isSupportsFullLifecycle())
                        .build());
    }

    @Override
    @Transactional
    public void updateStatus(long id, ResourceStatus status, Map<String, Object> connectionInfo) {
        ResourceEntity entity = entityManager.find(ResourceEntity.class, id);
        if (entity == null) {
            log.warn("Resource {} disappeared before status '{}' could be written", id, status.getValue());
            return;
        }
        entity.setStatus(status);
        if (connectionInfo != null) {
            entity.setConnectionInfo(connectionInfo);
        }
        entity.setUpdatedAt(Instant.now(clock));
    }

    @Override
    @Transactional
    public void recordClusterIdentity(long id, String namespace, String name, String kind, ResourceStatus status) {
        ResourceEntity entity = entityManager.find(ResourceEntity.class, id);
        if (entity == null) {
            log.warn("Resource {} disappeared before cluster identity '{}/{}' could be written", id, namespace, name);
            return;
        }
        entity.setK8sNamespace(namespace);
        entity.setK8sResourceName(name);
        entity.setK8sResourceType(kind);
        entity.setStatus(status);
        entity.setUpdatedAt(Instant.now(clock));
    }

    @Override
    @Transactional
    public long openJob(long resourceId, JobType type) {
        Instant now = Instant.now(clock);
        ProvisioningJobEntity job = new ProvisioningJobEntity();
        job.setResourceId(resourceId);
        job.setJobType(type);
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(now);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        entityManager.persist(job);
        entityManager.flush();
        return job.getId();
    }

    @Override
    @Transactional
    public void completeJob(long jobId, String logs) {
        closeJob(jobId, JobStatus.COMPLETED, logs, null);
    }

    @Override
    @Transactional
    public void failJob(long jobId, String errorMessage) {
        closeJob(jobId, JobStatus.FAILED, null, errorMessage);
    }

    private void closeJob(long jobId, JobStatus status, String logs, String errorMessage) {
        ProvisioningJobEntity job = entityManager.find(ProvisioningJobEntity.class, jobId);
        if (job == null) {
            log.warn("Provisioning job {} not found, cannot mark it '{}'", jobId, status.getValue());
            return;
        }
        if (job.getStatus() == JobStatus.COMPLETED || job.getStatus() == JobStatus.FAILED) {
            log.warn("Provisioning job {} is already closed with status '{}'", jobId, job.getStatus().getValue());
            return;
        }
        Instant now = Instant.now(clock);
        job.setStatus(status);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        if (logs != null) {
            job.setLogs(logs);
        }
        if (errorMessage != null) {
            job.setErrorMessage(errorMessage);
        }
    }

    @Override
    @Transactional
    public void appendAuditLog(String action, long resourceId, long teamId, Map<String, Object> details) {
        AuditLogEntity entry = new AuditLogEntity();
        entry.setAction(action);
        entry.setResourceType(AUDIT_RESOURCE_TYPE);
        entry.setResourceId(resourceId);
        entry.setTeamId(teamId);
        entry.setDetails(details);
        entry.setTimestamp(Instant.now(clock));
        entityManager.persist(entry);
    }

    static Resource toResource(ResourceEntity entity) {
        return Resource.builder()
                .id(entity.getId())
                .name(entity.getName())
                .teamId(entity.getTeamId())
                .resourceTypeId(entity.getResourceTypeId())
                .lifecycleMode(entity.getLifecycleMode())
                .status(entity.getStatus() != null ? entity.getStatus() : ResourceStatus.PENDING)
                .config(entity.getConfig() != null ? entity.getConfig() : Map.of())
                .connectionInfo(entity.getConnectionInfo())
                .k8sNamespace(entity.getK8sNamespace())
                .k8sResourceName(entity.getK8sResourceName())
                .k8sResourceType(entity.getK8sResourceType())
                .deletedAt(entity.getDeletedAt())
                .build();
    }
}
