package com.salescompass.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.salescompass.backend.modules.auth.domain.UserPermission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserPermissionRepository extends JpaRepository<UserPermission, UUID> {

    boolean existsByUserIdAndCodename(UUID userId, String codename);
}
