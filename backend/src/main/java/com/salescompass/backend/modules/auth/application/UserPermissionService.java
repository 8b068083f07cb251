package com.salescompass.backend.modules.auth.application;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.modules.accesscontrol.application.DirectPermissionChecker;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.auth.infrastructure.persistence.UserPermissionRepository;

@Service
@Transactional(readOnly = true)
public class UserPermissionService implements DirectPermissionChecker {

    private final UserPermissionRepository userPermissionRepository;

    public UserPermissionService(UserPermissionRepository userPermissionRepository) {
        this.userPermissionRepository = userPermissionRepository;
    }

    @Override
    public boolean hasPermission(CrmUser user, String codename) {
        if (user.getId() == null) {
            return false;
        }
        return userPermissionRepository.existsByUserIdAndCodename(user.getId(), codename);
    }
}
