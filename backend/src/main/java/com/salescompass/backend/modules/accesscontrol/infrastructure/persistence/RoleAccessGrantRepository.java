package com.salescompass.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.RoleAccessGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleAccessGrantRepository extends JpaRepository<RoleAccessGrant, UUID> {

    Optional<RoleAccessGrant> findByRoleIdAndDefinitionId(UUID roleId, UUID definitionId);

    @Query("""
            select g from RoleAccessGrant g join fetch g.definition d
            where g.role.id = :roleId and g.enabled = true and d.accessType = :type
            order by g.createdAt, g.id
            """)
    List<RoleAccessGrant> findEnabledByRoleAndType(@Param("roleId") UUID roleId, @Param("type") AccessType type);

    long deleteByRoleIdAndDefinitionId(UUID roleId, UUID definitionId);
}
