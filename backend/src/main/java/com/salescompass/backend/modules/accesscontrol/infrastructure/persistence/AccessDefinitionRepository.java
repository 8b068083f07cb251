package com.salescompass.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AccessDefinitionRepository extends JpaRepository<AccessDefinition, UUID> {

    /**
     * Keys are not unique; the oldest definition for a key is the one that resolves.
     */
    Optional<AccessDefinition> findFirstByResourceKeyOrderByCreatedAtAscIdAsc(String resourceKey);
}
