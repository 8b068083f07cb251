package com.salescompass.backend.modules.accesscontrol.application;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.tenant.domain.Tenant;

/**
 * Read side of the scope-qualified grants.
 * Point lookups return zero or one row regardless of its enabled flag; callers decide what a disabled row means.
 */
public interface EntitlementStore {

    Optional<AccessDefinition> findDefinitionByKey(String resourceKey);

    Optional<GrantSnapshot> findTenantGrant(Tenant tenant, AccessDefinition definition);

    Optional<GrantSnapshot> findRoleGrant(Role role, AccessDefinition definition);

    Optional<GrantSnapshot> findUserGrant(CrmUser user, AccessDefinition definition);

    /** Definitions enabled for the tenant, restricted to the given types, oldest grant first. */
    List<AccessDefinition> findEnabledTenantDefinitions(Tenant tenant, Set<AccessType> types);

    List<AccessDefinition> findEnabledRoleDefinitions(Role role, AccessType type);

    List<AccessDefinition> findEnabledUserDefinitions(CrmUser user, AccessType type);
}
