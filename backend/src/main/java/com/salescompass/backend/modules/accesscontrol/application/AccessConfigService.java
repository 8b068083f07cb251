package com.salescompass.backend.modules.accesscontrol.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.auth.domain.CrmUser;

/**
 * Layers grant config data for one resource: tenant first, then the role chain from root to leaf, then the user.
 * Each layer overwrites keys of the previous ones; nested maps are replaced, not merged.
 */
@Service
@Transactional(readOnly = true)
public class AccessConfigService {

    private static final Logger log = LoggerFactory.getLogger(AccessConfigService.class);

    private final EntitlementStore entitlementStore;
    private final RoleHierarchy roleHierarchy;

    public AccessConfigService(EntitlementStore entitlementStore, RoleHierarchy roleHierarchy) {
        this.entitlementStore = entitlementStore;
        this.roleHierarchy = roleHierarchy;
    }

    public Map<String, Object> getAccessConfig(CrmUser user, String resourceKey) {
        Objects.requireNonNull(user, "user");
        Optional<AccessDefinition> found = entitlementStore.findDefinitionByKey(resourceKey);
        if (found.isEmpty()) {
            return Map.of();
        }
        AccessDefinition definition = found.get();
        Map<String, Object> merged = new LinkedHashMap<>();

        if (user.getTenant() != null) {
            mergeInto(merged, entitlementStore.findTenantGrant(user.getTenant(), definition));
        }

        for (Role role : roleLayers(user)) {
            mergeInto(merged, entitlementStore.findRoleGrant(role, definition));
        }

        mergeInto(merged, entitlementStore.findUserGrant(user, definition));
        return merged;
    }

    private List<Role> roleLayers(CrmUser user) {
        if (user.getRole() == null) {
            return List.of();
        }
        try {
            return roleHierarchy.rootToLeaf(user.getRole());
        } catch (RoleHierarchyException ex) {
            log.warn("Skipping role config layer for user {}: {}", user.getId(), ex.getMessage());
            return List.of();
        }
    }

    private static void mergeInto(Map<String, Object> merged, Optional<GrantSnapshot> grant) {
        grant.filter(GrantSnapshot::enabled)
                .filter(GrantSnapshot::hasConfig)
                .ifPresent(snapshot -> merged.putAll(snapshot.configData()));
    }
}
