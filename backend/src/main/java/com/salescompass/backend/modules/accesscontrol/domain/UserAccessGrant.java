package com.salescompass.backend.modules.accesscontrol.domain;

import com.salescompass.backend.modules.auth.domain.CrmUser;

import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Grants a definition to one user directly.
 */
@Entity
@Table(name = "user_access_grant")
public class UserAccessGrant extends AbstractAccessGrant {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private CrmUser user;

    @Override
    public ScopeType getScope() {
        return ScopeType.USER;
    }

    public CrmUser getUser() {
        return user;
    }

    public void setUser(CrmUser user) {
        this.user = user;
    }
}
