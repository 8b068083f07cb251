package com.salescompass.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.modules.accesscontrol.application.EntitlementStore;
import com.salescompass.backend.modules.accesscontrol.application.GrantSnapshot;
import com.salescompass.backend.modules.accesscontrol.domain.AbstractAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.tenant.domain.Tenant;

@Repository
@Transactional(readOnly = true)
public class JpaEntitlementStore implements EntitlementStore {

    private final AccessDefinitionRepository accessDefinitionRepository;
    private final TenantAccessGrantRepository tenantAccessGrantRepository;
    private final RoleAccessGrantRepository roleAccessGrantRepository;
    private final UserAccessGrantRepository userAccessGrantRepository;

    public JpaEntitlementStore(
            AccessDefinitionRepository accessDefinitionRepository,
            TenantAccessGrantRepository tenantAccessGrantRepository,
            RoleAccessGrantRepository roleAccessGrantRepository,
            UserAccessGrantRepository userAccessGrantRepository
    ) {
        this.accessDefinitionRepository = accessDefinitionRepository;
        this.tenantAccessGrantRepository = tenantAccessGrantRepository;
        this.roleAccessGrantRepository = roleAccessGrantRepository;
        this.userAccessGrantRepository = userAccessGrantRepository;
    }

    @Override
    public Optional<AccessDefinition> findDefinitionByKey(String resourceKey) {
        return accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc(resourceKey);
    }

    @Override
    public Optional<GrantSnapshot> findTenantGrant(Tenant tenant, AccessDefinition definition) {
        return tenantAccessGrantRepository.findByTenantIdAndDefinitionId(tenant.getId(), definition.getId())
                .map(GrantSnapshot::of);
    }

    @Override
    public Optional<GrantSnapshot> findRoleGrant(Role role, AccessDefinition definition) {
        return roleAccessGrantRepository.findByRoleIdAndDefinitionId(role.getId(), definition.getId())
                .map(GrantSnapshot::of);
    }

    @Override
    public Optional<GrantSnapshot> findUserGrant(CrmUser user, AccessDefinition definition) {
        return userAccessGrantRepository.findByUserIdAndDefinitionId(user.getId(), definition.getId())
                .map(GrantSnapshot::of);
    }

    @Override
    public List<AccessDefinition> findEnabledTenantDefinitions(Tenant tenant, Set<AccessType> types) {
        return tenantAccessGrantRepository.findEnabledByTenantAndTypes(tenant.getId(), types).stream()
                .map(AbstractAccessGrant::getDefinition)
                .toList();
    }

    @Override
    public List<AccessDefinition> findEnabledRoleDefinitions(Role role, AccessType type) {
        return roleAccessGrantRepository.findEnabledByRoleAndType(role.getId(), type).stream()
                .map(AbstractAccessGrant::getDefinition)
                .toList();
    }

    @Override
    public List<AccessDefinition> findEnabledUserDefinitions(CrmUser user, AccessType type) {
        return userAccessGrantRepository.findEnabledByUserAndType(user.getId(), type).stream()
                .map(AbstractAccessGrant::getDefinition)
                .toList();
    }
}
