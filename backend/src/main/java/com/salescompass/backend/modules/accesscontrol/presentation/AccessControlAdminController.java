package com.salescompass.backend.modules.accesscontrol.presentation;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.salescompass.backend.global.error.ProblemException;
import com.salescompass.backend.modules.accesscontrol.application.AccessDecision;
import com.salescompass.backend.modules.accesscontrol.application.AccessSeedService;
import com.salescompass.backend.modules.accesscontrol.application.AvailableResource;
import com.salescompass.backend.modules.accesscontrol.application.GrantAccessCommand;
import com.salescompass.backend.modules.accesscontrol.application.GrantResult;
import com.salescompass.backend.modules.accesscontrol.application.PermissionsSummary;
import com.salescompass.backend.modules.accesscontrol.application.SeedResult;
import com.salescompass.backend.modules.accesscontrol.application.UnifiedAccessService;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;
import com.salescompass.backend.modules.accesscontrol.presentation.dto.AccessCheckResponse;
import com.salescompass.backend.modules.accesscontrol.presentation.dto.GrantAccessRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

@RestController
@RequestMapping("/admin/access")
public class AccessControlAdminController {

    private final UnifiedAccessService unifiedAccessService;
    private final AccessSeedService accessSeedService;

    public AccessControlAdminController(UnifiedAccessService unifiedAccessService, AccessSeedService accessSeedService) {
        this.unifiedAccessService = unifiedAccessService;
        this.accessSeedService = accessSeedService;
    }

    @Operation(summary = "Check access", description = "Resolves whether the user may perform the action on the resource.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision computed"),
            @ApiResponse(responseCode = "404", description = "Unknown user")
    })
    @GetMapping("/users/{userId}/check")
    public ResponseEntity<AccessCheckResponse> check(
            @PathVariable UUID userId,
            @RequestParam(name = "resource") String resource,
            @RequestParam(name = "action", defaultValue = "access") String action,
            @RequestParam(name = "explain", defaultValue = "false") boolean explain
    ) {
        if (explain) {
            AccessDecision decision = unifiedAccessService.hasAccessWithReason(userId, resource, action);
            return ResponseEntity.ok(new AccessCheckResponse(resource, action, decision.granted(), decision.reason(), decision.trace()));
        }
        boolean granted = unifiedAccessService.hasAccess(userId, resource, action);
        return ResponseEntity.ok(new AccessCheckResponse(resource, action, granted, null, null));
    }

    @Operation(summary = "Merged access config", description = "Tenant, role chain and user config layered in that order.")
    @GetMapping("/users/{userId}/config")
    public ResponseEntity<Map<String, Object>> getConfig(
            @PathVariable UUID userId,
            @RequestParam(name = "resource") String resource
    ) {
        return ResponseEntity.ok(unifiedAccessService.getAccessConfig(userId, resource));
    }

    @GetMapping("/users/{userId}/resources")
    public ResponseEntity<List<AvailableResource>> getResources(@PathVariable UUID userId) {
        return ResponseEntity.ok(unifiedAccessService.getAvailableResources(userId));
    }

    @GetMapping("/users/{userId}/summary")
    public ResponseEntity<PermissionsSummary> getSummary(@PathVariable UUID userId) {
        return ResponseEntity.ok(unifiedAccessService.getUserPermissionsSummary(userId));
    }

    @Operation(summary = "Grant access", description = "Creates the grant at the requested scope for the user.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Grant stored"),
            @ApiResponse(responseCode = "400", description = "Unknown type or scope, or missing role/tenant"),
            @ApiResponse(responseCode = "409", description = "Resource already defined with another type, or grant already exists")
    })
    @PostMapping("/users/{userId}/grants")
    public ResponseEntity<GrantResult> grant(
            @PathVariable UUID userId,
            @Valid @RequestBody GrantAccessRequest request
    ) {
        GrantAccessCommand command = new GrantAccessCommand(
                request.resource(),
                parseAccessType(request.accessType()),
                parseScope(request.scope()),
                request.name(),
                request.description(),
                request.enabled() == null || request.enabled(),
                request.configData()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(unifiedAccessService.grantAccess(userId, command));
    }

    @DeleteMapping("/users/{userId}/grants")
    public ResponseEntity<Void> revoke(
            @PathVariable UUID userId,
            @RequestParam(name = "resource") String resource,
            @RequestParam(name = "scope", defaultValue = "user") String scope
    ) {
        unifiedAccessService.revokeAccess(userId, resource, parseScope(scope));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Seed app access", description = "Creates entitlement, feature flag and permission grants for every registered app.")
    @PostMapping("/seed")
    public ResponseEntity<SeedResult> seed() {
        return ResponseEntity.ok(accessSeedService.seed());
    }

    private static AccessType parseAccessType(String value) {
        try {
            return AccessType.from(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_type", "Unknown access type: " + value);
        }
    }

    private static ScopeType parseScope(String value) {
        try {
            return ScopeType.from(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_scope", "Unknown scope: " + value);
        }
    }
}
