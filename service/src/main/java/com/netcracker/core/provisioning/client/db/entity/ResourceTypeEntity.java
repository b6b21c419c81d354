package com.netcracker.core.provisioning.client.db.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "resource_types")
@Getter
@Setter
public class ResourceTypeEntity {
    @Id
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "supports_full_lifecycle")
    private boolean supportsFullLifecycle;
}
