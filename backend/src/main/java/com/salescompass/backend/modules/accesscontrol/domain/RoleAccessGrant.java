package com.salescompass.backend.modules.accesscontrol.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Enables or configures a definition for a role and, through the hierarchy, its descendant roles.
 */
@Entity
@Table(name = "role_access_grant")
public class RoleAccessGrant extends AbstractAccessGrant {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @Override
    public ScopeType getScope() {
        return ScopeType.ROLE;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }
}
