package com.salescompass.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.auth.domain.CrmUser;

/**
 * Lists the resources a user can see, one entry per base key.
 */
@Service
@Transactional(readOnly = true)
public class ResourceCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ResourceCatalogService.class);

    private final EntitlementStore entitlementStore;
    private final RoleHierarchy roleHierarchy;

    public ResourceCatalogService(EntitlementStore entitlementStore, RoleHierarchy roleHierarchy) {
        this.entitlementStore = entitlementStore;
        this.roleHierarchy = roleHierarchy;
    }

    public List<AvailableResource> getAvailableResources(CrmUser user) {
        Objects.requireNonNull(user, "user");
        if (user.getTenant() == null) {
            return List.of();
        }

        Map<String, AvailableResource> byBaseKey = new LinkedHashMap<>();
        collect(byBaseKey, entitlementStore.findEnabledTenantDefinitions(
                user.getTenant(), EnumSet.of(AccessType.FEATURE_FLAG, AccessType.ENTITLEMENT)));

        for (Role role : roleChain(user)) {
            collect(byBaseKey, entitlementStore.findEnabledRoleDefinitions(role, AccessType.PERMISSION));
        }

        collect(byBaseKey, entitlementStore.findEnabledUserDefinitions(user, AccessType.PERMISSION));
        return new ArrayList<>(byBaseKey.values());
    }

    /**
     * {@code leads.entitlement -> leads}; a key without a dot is its own base.
     */
    public static String baseKey(String resourceKey) {
        int dot = resourceKey.lastIndexOf('.');
        return dot < 0 ? resourceKey : resourceKey.substring(0, dot);
    }

    private List<Role> roleChain(CrmUser user) {
        if (user.getRole() == null) {
            return List.of();
        }
        try {
            return roleHierarchy.leafToRoot(user.getRole());
        } catch (RoleHierarchyException ex) {
            log.warn("Skipping role resources for user {}: {}", user.getId(), ex.getMessage());
            return List.of();
        }
    }

    private static void collect(Map<String, AvailableResource> byBaseKey, List<AccessDefinition> definitions) {
        for (AccessDefinition definition : definitions) {
            String base = baseKey(definition.getResourceKey());
            byBaseKey.putIfAbsent(base, new AvailableResource(base, definition.getName(), definition.getDescription()));
        }
    }
}
