package com.salescompass.backend.modules.accesscontrol.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Diagnostic snapshot of everything that feeds a user's access decisions.
 */
public record PermissionsSummary(
        UUID userId,
        boolean superuser,
        Reference tenant,
        Reference plan,
        List<Reference> roleChain,
        List<String> userGrants,
        Map<String, List<String>> roleGrants,
        List<String> tenantGrants,
        List<AvailableResource> availableResources,
        OffsetDateTime generatedAt
) {

    public record Reference(UUID id, String name) {
    }
}
