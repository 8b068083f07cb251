package com.salescompass.backend.modules.accesscontrol.domain;

import java.util.Locale;

/**
 * Level at which a grant applies. The system scope is the {@link AccessDefinition} itself.
 */
public enum ScopeType {
    TENANT,
    ROLE,
    USER;

    public static ScopeType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
        return ScopeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
