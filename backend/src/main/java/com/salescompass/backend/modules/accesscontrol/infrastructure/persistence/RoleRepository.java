package com.salescompass.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    @Query("select r.id from Role r where r.parent.id = :parentId")
    List<UUID> findChildIds(@Param("parentId") UUID parentId);

    Optional<Role> findByNameAndTenantId(String name, UUID tenantId);

    Optional<Role> findByNameAndTenantIsNull(String name);
}
