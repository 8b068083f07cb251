package com.salescompass.backend.modules.accesscontrol.application;

import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;

public record GrantResult(
        UUID definitionId,
        UUID grantId,
        ScopeType scope,
        boolean definitionCreated
) {
}
