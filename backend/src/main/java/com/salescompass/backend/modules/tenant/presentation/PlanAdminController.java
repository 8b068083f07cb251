package com.salescompass.backend.modules.tenant.presentation;

import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.salescompass.backend.modules.tenant.application.PlanAccessService;
import com.salescompass.backend.modules.tenant.application.PlanAccessService.PlanSyncResult;

import io.swagger.v3.oas.annotations.Operation;

@RestController
@RequestMapping("/admin/plans")
public class PlanAdminController {

    private final PlanAccessService planAccessService;

    public PlanAdminController(PlanAccessService planAccessService) {
        this.planAccessService = planAccessService;
    }

    @Operation(summary = "Sync plan access", description = "Rebuilds the module and feature rows from the plan's features config.")
    @PostMapping("/{planId}/sync")
    public ResponseEntity<PlanSyncResult> sync(@PathVariable UUID planId) {
        return ResponseEntity.ok(planAccessService.syncPlanAccess(planId));
    }
}
