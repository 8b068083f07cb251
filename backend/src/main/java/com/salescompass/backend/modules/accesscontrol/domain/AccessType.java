package com.salescompass.backend.modules.accesscontrol.domain;

import java.util.Locale;

/**
 * Kind of checkable resource described by an {@link AccessDefinition}.
 */
public enum AccessType {

    /** User/role specific permission; resolved through user, role chain and tenant grants. */
    PERMISSION(false),

    /** On/off feature toggle; resolved through tenant grants only. */
    FEATURE_FLAG(true),

    /** Plan-based feature entitlement; resolved through tenant grants only. */
    ENTITLEMENT(true);

    private final boolean tenantScopedOnly;

    AccessType(boolean tenantScopedOnly) {
        this.tenantScopedOnly = tenantScopedOnly;
    }

    public boolean isTenantScopedOnly() {
        return tenantScopedOnly;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AccessType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("access type must not be blank");
        }
        return AccessType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
