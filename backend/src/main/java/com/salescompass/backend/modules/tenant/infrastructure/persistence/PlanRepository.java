package com.salescompass.backend.modules.tenant.infrastructure.persistence;

import java.util.UUID;

import com.salescompass.backend.modules.tenant.domain.Plan;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PlanRepository extends JpaRepository<Plan, UUID> {
}
