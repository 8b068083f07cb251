package com.salescompass.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.UserAccessGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccessGrantRepository extends JpaRepository<UserAccessGrant, UUID> {

    Optional<UserAccessGrant> findByUserIdAndDefinitionId(UUID userId, UUID definitionId);

    @Query("""
            select g from UserAccessGrant g join fetch g.definition d
            where g.user.id = :userId and g.enabled = true and d.accessType = :type
            order by g.createdAt, g.id
            """)
    List<UserAccessGrant> findEnabledByUserAndType(@Param("userId") UUID userId, @Param("type") AccessType type);

    long deleteByUserIdAndDefinitionId(UUID userId, UUID definitionId);
}
