package com.salescompass.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.TenantAccessGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantAccessGrantRepository extends JpaRepository<TenantAccessGrant, UUID> {

    Optional<TenantAccessGrant> findByTenantIdAndDefinitionId(UUID tenantId, UUID definitionId);

    @Query("""
            select g from TenantAccessGrant g join fetch g.definition d
            where g.tenant.id = :tenantId and g.enabled = true and d.accessType in :types
            order by g.createdAt, g.id
            """)
    List<TenantAccessGrant> findEnabledByTenantAndTypes(
            @Param("tenantId") UUID tenantId,
            @Param("types") Collection<AccessType> types
    );

    long deleteByTenantIdAndDefinitionId(UUID tenantId, UUID definitionId);
}
