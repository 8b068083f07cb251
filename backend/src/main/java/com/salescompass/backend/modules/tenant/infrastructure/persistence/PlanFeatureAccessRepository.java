package com.salescompass.backend.modules.tenant.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.tenant.domain.PlanFeatureAccess;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PlanFeatureAccessRepository extends JpaRepository<PlanFeatureAccess, UUID> {

    Optional<PlanFeatureAccess> findByPlanIdAndFeatureKey(UUID planId, String featureKey);
}
