package com.salescompass.backend.modules.accesscontrol.application;

import java.util.Locale;

/**
 * Which cached decisions a grant mutation clears.
 */
public enum CacheInvalidationMode {

    /** Only the user who performed the mutation; others see the change once their entries expire. */
    ACTING_USER,

    /** Every user under the affected tenant or role subtree, plus the acting user. */
    AFFECTED_USERS;

    public static CacheInvalidationMode from(String value) {
        if (value == null || value.isBlank()) {
            return ACTING_USER;
        }
        return CacheInvalidationMode.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
