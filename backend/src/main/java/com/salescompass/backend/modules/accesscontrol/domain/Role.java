package com.salescompass.backend.modules.accesscontrol.domain;

import java.util.List;
import java.util.UUID;

import com.salescompass.backend.global.jpa.AbstractTimestampedEntity;
import com.salescompass.backend.modules.tenant.domain.Tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Tenant-aware role. A role without a tenant is system wide.
 * Roles form a forest through {@code parent}; a role inherits every grant of its ancestors.
 */
@Entity
@Table(name = "crm_role")
public class Role extends AbstractTimestampedEntity {

    /** Roles provisioned for every new tenant. */
    public static final List<RoleTemplate> DEFAULT_ROLES = List.of(
            new RoleTemplate("Tenant Admin", "Full administrative access to tenant resources.", true, true),
            new RoleTemplate("Standard User", "Standard access to tenant features.", false, true),
            new RoleTemplate("Read Only", "Read-only access to tenant data.", false, true)
    );

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", nullable = false)
    private String description = "";

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tenant_id")
    private Tenant tenant;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private Role parent;

    @Column(name = "is_system_role", nullable = false)
    private boolean systemRole;

    @Column(name = "is_assignable", nullable = false)
    private boolean assignable = true;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Tenant getTenant() {
        return tenant;
    }

    public void setTenant(Tenant tenant) {
        this.tenant = tenant;
    }

    public Role getParent() {
        return parent;
    }

    public void setParent(Role parent) {
        this.parent = parent;
    }

    public boolean isSystemRole() {
        return systemRole;
    }

    public void setSystemRole(boolean systemRole) {
        this.systemRole = systemRole;
    }

    public boolean isAssignable() {
        return assignable;
    }

    public void setAssignable(boolean assignable) {
        this.assignable = assignable;
    }

    public record RoleTemplate(String name, String description, boolean systemRole, boolean assignable) {
    }
}
