package com.salescompass.backend.modules.tenant.infrastructure.persistence;

import java.util.UUID;

import com.salescompass.backend.modules.tenant.domain.Tenant;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {
}
