package com.salescompass.backend.modules.accesscontrol.application;

import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.Role;

public record RoleView(
        UUID id,
        String name,
        String description,
        UUID tenantId,
        UUID parentId,
        boolean systemRole,
        boolean assignable
) {

    public static RoleView from(Role role) {
        return new RoleView(
                role.getId(),
                role.getName(),
                role.getDescription(),
                role.getTenant() != null ? role.getTenant().getId() : null,
                role.getParent() != null ? role.getParent().getId() : null,
                role.isSystemRole(),
                role.isAssignable()
        );
    }
}
