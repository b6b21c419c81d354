package com.netcracker.core.provisioning.client.db.entity;

import com.netcracker.core.provisioning.model.JobStatus;
import com.netcracker.core.provisioning.model.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "provisioning_jobs")
@Getter
@Setter
public class ProvisioningJobEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Convert(converter = JobTypeConverter.class)
    @Column(name = "job_type", nullable = false, length = 50)
    private JobType jobType;

    @Convert(converter = JobStatusConverter.class)
    @Column(name = "status", length = 50)
    private JobStatus status;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "logs", columnDefinition = "text")
    private String logs;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
