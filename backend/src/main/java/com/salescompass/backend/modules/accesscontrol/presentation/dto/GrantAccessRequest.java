package com.salescompass.backend.modules.accesscontrol.presentation.dto;

import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GrantAccessRequest(
        @Schema(example = "leads.export") @NotBlank @Size(max = 255) String resource,
        @Schema(allowableValues = {"permission", "feature_flag", "entitlement"}) @NotBlank String accessType,
        @Schema(allowableValues = {"user", "role", "tenant"}) @NotBlank String scope,
        @Size(max = 255) String name,
        String description,
        Boolean enabled,
        Map<String, Object> configData
) {
}
