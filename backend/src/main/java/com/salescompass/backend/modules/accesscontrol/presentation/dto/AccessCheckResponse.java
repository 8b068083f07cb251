package com.salescompass.backend.modules.accesscontrol.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessCheckResponse(
        String resource,
        String action,
        boolean granted,
        String reason,
        List<String> trace
) {
}
