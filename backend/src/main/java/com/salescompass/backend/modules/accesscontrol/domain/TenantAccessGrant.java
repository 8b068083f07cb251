package com.salescompass.backend.modules.accesscontrol.domain;

import com.salescompass.backend.modules.tenant.domain.Tenant;

import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Enables or configures a definition for every user of a tenant.
 */
@Entity
@Table(name = "tenant_access_grant")
public class TenantAccessGrant extends AbstractAccessGrant {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tenant_id", nullable = false)
    private Tenant tenant;

    @Override
    public ScopeType getScope() {
        return ScopeType.TENANT;
    }

    public Tenant getTenant() {
        return tenant;
    }

    public void setTenant(Tenant tenant) {
        this.tenant = tenant;
    }
}
