package com.salescompass.backend.modules.accesscontrol.application;

import java.util.UUID;

/**
 * Key layout of the decision cache: {@code access_{userId}_{resourceKey}_{action}}.
 */
public final class DecisionCacheKeys {

    private static final String PREFIX = "access_";

    private DecisionCacheKeys() {
    }

    public static String decision(UUID userId, String resourceKey, String action) {
        return PREFIX + userId + "_" + resourceKey + "_" + action;
    }

    public static String userPattern(UUID userId) {
        return PREFIX + userId + "_*";
    }
}
