package com.salescompass.backend.modules.tenant.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.tenant.domain.PlanModuleAccess;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PlanModuleAccessRepository extends JpaRepository<PlanModuleAccess, UUID> {

    Optional<PlanModuleAccess> findByPlanIdAndModuleName(UUID planId, String moduleName);
}
