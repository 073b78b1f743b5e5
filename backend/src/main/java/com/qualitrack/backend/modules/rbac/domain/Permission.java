package com.qualitrack.backend.modules.rbac.domain;

import com.qualitrack.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Atomic capability named in a dotted namespace, e.g. {@code materials.create}.
 */
@Entity
@Table(name = "permission")
public class Permission extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, updatable = false, length = 100)
    private String name;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "system_permission", nullable = false)
    private boolean systemPermission;

    protected Permission() {
    }

    public Permission(String name, String displayName, String description, String category, boolean systemPermission) {
        this.name = name;
        this.displayName = displayName;
        this.description = description;
        this.category = category;
        this.systemPermission = systemPermission;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public boolean isSystemPermission() {
        return systemPermission;
    }
}
