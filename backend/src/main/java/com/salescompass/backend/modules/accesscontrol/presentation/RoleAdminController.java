package com.salescompass.backend.modules.accesscontrol.presentation;

import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.salescompass.backend.modules.accesscontrol.application.CreateRoleCommand;
import com.salescompass.backend.modules.accesscontrol.application.RoleAdminService;
import com.salescompass.backend.modules.accesscontrol.application.RoleView;
import com.salescompass.backend.modules.accesscontrol.presentation.dto.AssignParentRequest;
import com.salescompass.backend.modules.accesscontrol.presentation.dto.CreateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

@RestController
@RequestMapping("/admin")
public class RoleAdminController {

    private final RoleAdminService roleAdminService;

    public RoleAdminController(RoleAdminService roleAdminService) {
        this.roleAdminService = roleAdminService;
    }

    @PostMapping("/roles")
    public ResponseEntity<RoleView> createRole(@Valid @RequestBody CreateRoleRequest request) {
        RoleView created = roleAdminService.createRole(new CreateRoleCommand(
                request.name().trim(),
                request.description(),
                request.tenantId(),
                request.parentId(),
                Boolean.TRUE.equals(request.systemRole()),
                request.assignable() == null || request.assignable()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Set role parent", description = "Sets or clears the parent role; writes that would create a cycle are rejected.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Parent updated"),
            @ApiResponse(responseCode = "404", description = "Unknown role"),
            @ApiResponse(responseCode = "409", description = "Hierarchy cycle or depth limit")
    })
    @PutMapping("/roles/{roleId}/parent")
    public ResponseEntity<RoleView> assignParent(
            @PathVariable UUID roleId,
            @RequestBody AssignParentRequest request
    ) {
        return ResponseEntity.ok(roleAdminService.assignParent(roleId, request.parentId()));
    }

    @PostMapping("/tenants/{tenantId}/roles/defaults")
    public ResponseEntity<List<RoleView>> provisionDefaults(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(roleAdminService.provisionDefaultRoles(tenantId));
    }
}
