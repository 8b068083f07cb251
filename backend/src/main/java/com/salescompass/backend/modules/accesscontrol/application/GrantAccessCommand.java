package com.salescompass.backend.modules.accesscontrol.application;

import java.util.Map;

import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;

/**
 * Grant request; {@code name} defaults to the resource key and {@code configData} to an empty map.
 */
public record GrantAccessCommand(
        String resourceKey,
        AccessType accessType,
        ScopeType scope,
        String name,
        String description,
        boolean enabled,
        Map<String, Object> configData
) {

    public GrantAccessCommand {
        if (resourceKey == null || resourceKey.isBlank()) {
            throw new IllegalArgumentException("resourceKey must not be blank");
        }
        if (accessType == null || scope == null) {
            throw new IllegalArgumentException("accessType and scope are required");
        }
        name = name == null || name.isBlank() ? resourceKey : name;
        description = description == null ? "" : description;
        configData = configData == null ? Map.of() : configData;
    }
}
