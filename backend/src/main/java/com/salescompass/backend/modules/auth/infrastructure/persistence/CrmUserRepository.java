package com.salescompass.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.salescompass.backend.modules.auth.domain.CrmUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CrmUserRepository extends JpaRepository<CrmUser, UUID> {

    @Query("select u.id from CrmUser u where u.tenant.id = :tenantId")
    List<UUID> findIdsByTenantId(@Param("tenantId") UUID tenantId);

    @Query("select u.id from CrmUser u where u.role.id in :roleIds")
    List<UUID> findIdsByRoleIdIn(@Param("roleIds") Collection<UUID> roleIds);
}
