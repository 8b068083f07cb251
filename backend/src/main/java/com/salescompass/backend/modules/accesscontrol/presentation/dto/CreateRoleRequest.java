package com.salescompass.backend.modules.accesscontrol.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank @Size(max = 100) String name,
        String description,
        UUID tenantId,
        UUID parentId,
        Boolean systemRole,
        Boolean assignable
) {
}
