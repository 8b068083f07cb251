package com.salescompass.backend.modules.accesscontrol.application;

import java.util.UUID;

/**
 * {@code tenantId == null} creates a system-wide role.
 */
public record CreateRoleCommand(
        String name,
        String description,
        UUID tenantId,
        UUID parentId,
        boolean systemRole,
        boolean assignable
) {
}
