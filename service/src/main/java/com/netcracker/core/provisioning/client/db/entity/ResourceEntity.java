package com.netcracker.core.provisioning.client.db.entity;

import com.netcracker.core.provisioning.model.LifecycleMode;
import com.netcracker.core.provisioning.model.ResourceStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "resources")
@Getter
@Setter
public class ResourceEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "resource_type_id", nullable = false)
    private Long resourceTypeId;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Convert(converter = ResourceStatusConverter.class)
    @Column(name = "status", length = 50)
    private ResourceStatus status;

    @Convert(converter = LifecycleModeConverter.class)
    @Column(name = "lifecycle_mode", length = 50, nullable = false)
    private LifecycleMode lifecycleMode;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "connection_info", columnDefinition = "jsonb")
    private Map<String, Object> connectionInfo;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config", columnDefinition = "jsonb")
    private Map<String, Object> config;

    @Column(name = "k8s_namespace")
    private String k8sNamespace;

    @Column(name = "k8s_resource_name")
    private String k8sResourceName;

    @Column(name = "k8s_resource_type", length = 50)
    private String k8sResourceType;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;
}
