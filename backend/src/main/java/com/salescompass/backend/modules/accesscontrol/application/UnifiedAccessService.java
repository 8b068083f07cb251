package com.salescompass.backend.modules.accesscontrol.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.global.error.ProblemException;
import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.auth.infrastructure.persistence.CrmUserRepository;
import com.salescompass.backend.modules.tenant.domain.Plan;
import com.salescompass.backend.modules.tenant.domain.Tenant;

/**
 * Entry point for access checks, config lookups, the resource catalog and grant mutations.
 * The {@link UUID} overloads load the user first and fail with {@code access.user_not_found}.
 */
@Service
public class UnifiedAccessService {

    private static final Logger log = LoggerFactory.getLogger(UnifiedAccessService.class);

    private final AccessDecisionService accessDecisionService;
    private final AccessConfigService accessConfigService;
    private final ResourceCatalogService resourceCatalogService;
    private final AccessGrantService accessGrantService;
    private final EntitlementStore entitlementStore;
    private final RoleHierarchy roleHierarchy;
    private final CrmUserRepository crmUserRepository;
    private final Clock clock;

    public UnifiedAccessService(
            AccessDecisionService accessDecisionService,
            AccessConfigService accessConfigService,
            ResourceCatalogService resourceCatalogService,
            AccessGrantService accessGrantService,
            EntitlementStore entitlementStore,
            RoleHierarchy roleHierarchy,
            CrmUserRepository crmUserRepository,
            Clock clock
    ) {
        this.accessDecisionService = accessDecisionService;
        this.accessConfigService = accessConfigService;
        this.resourceCatalogService = resourceCatalogService;
        this.accessGrantService = accessGrantService;
        this.entitlementStore = entitlementStore;
        this.roleHierarchy = roleHierarchy;
        this.crmUserRepository = crmUserRepository;
        this.clock = clock;
    }

    public boolean hasAccess(CrmUser user, String resourceKey, String action) {
        return accessDecisionService.hasAccess(user, resourceKey, action);
    }

    public AccessDecision hasAccessWithReason(CrmUser user, String resourceKey, String action) {
        return accessDecisionService.hasAccessWithReason(user, resourceKey, action);
    }

    public Map<String, Object> getAccessConfig(CrmUser user, String resourceKey) {
        return accessConfigService.getAccessConfig(user, resourceKey);
    }

    public List<AvailableResource> getAvailableResources(CrmUser user) {
        return resourceCatalogService.getAvailableResources(user);
    }

    public GrantResult grantAccess(CrmUser user, GrantAccessCommand command) {
        return accessGrantService.grantAccess(user, command);
    }

    public boolean revokeAccess(CrmUser user, String resourceKey, ScopeType scope) {
        return accessGrantService.revokeAccess(user, resourceKey, scope);
    }

    @Transactional(readOnly = true)
    public PermissionsSummary getUserPermissionsSummary(CrmUser user) {
        Tenant tenant = user.getTenant();
        Plan plan = tenant != null ? tenant.getPlan() : null;

        List<Role> chain = roleChain(user);
        List<PermissionsSummary.Reference> roleRefs = new ArrayList<>();
        Map<String, List<String>> roleGrants = new LinkedHashMap<>();
        for (Role role : chain) {
            roleRefs.add(new PermissionsSummary.Reference(role.getId(), role.getName()));
            List<String> keys = new ArrayList<>();
            for (AccessType type : AccessType.values()) {
                keys.addAll(keys(entitlementStore.findEnabledRoleDefinitions(role, type)));
            }
            roleGrants.put(role.getName(), keys);
        }

        List<String> userGrants = new ArrayList<>();
        for (AccessType type : AccessType.values()) {
            userGrants.addAll(keys(entitlementStore.findEnabledUserDefinitions(user, type)));
        }

        List<String> tenantGrants = tenant == null ? List.of()
                : keys(entitlementStore.findEnabledTenantDefinitions(tenant, EnumSet.allOf(AccessType.class)));

        return new PermissionsSummary(
                user.getId(),
                user.isSuperuser(),
                tenant == null ? null : new PermissionsSummary.Reference(tenant.getId(), tenant.getName()),
                plan == null ? null : new PermissionsSummary.Reference(plan.getId(), plan.getName()),
                roleRefs,
                userGrants,
                roleGrants,
                tenantGrants,
                resourceCatalogService.getAvailableResources(user),
                OffsetDateTime.now(clock)
        );
    }

    @Transactional(readOnly = true)
    public boolean hasAccess(UUID userId, String resourceKey, String action) {
        return hasAccess(requireUser(userId), resourceKey, action);
    }

    @Transactional(readOnly = true)
    public AccessDecision hasAccessWithReason(UUID userId, String resourceKey, String action) {
        return hasAccessWithReason(requireUser(userId), resourceKey, action);
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getAccessConfig(UUID userId, String resourceKey) {
        return getAccessConfig(requireUser(userId), resourceKey);
    }

    @Transactional(readOnly = true)
    public List<AvailableResource> getAvailableResources(UUID userId) {
        return getAvailableResources(requireUser(userId));
    }

    @Transactional(readOnly = true)
    public PermissionsSummary getUserPermissionsSummary(UUID userId) {
        return getUserPermissionsSummary(requireUser(userId));
    }

    @Transactional
    public GrantResult grantAccess(UUID userId, GrantAccessCommand command) {
        return grantAccess(requireUser(userId), command);
    }

    @Transactional
    public boolean revokeAccess(UUID userId, String resourceKey, ScopeType scope) {
        return revokeAccess(requireUser(userId), resourceKey, scope);
    }

    private CrmUser requireUser(UUID userId) {
        return crmUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.user_not_found", "User not found: " + userId));
    }

    private List<Role> roleChain(CrmUser user) {
        if (user.getRole() == null) {
            return List.of();
        }
        try {
            return roleHierarchy.leafToRoot(user.getRole());
        } catch (RoleHierarchyException ex) {
            log.warn("Role chain unavailable for user {}: {}", user.getId(), ex.getMessage());
            return List.of();
        }
    }

    private static List<String> keys(List<AccessDefinition> definitions) {
        return definitions.stream().map(AccessDefinition::getResourceKey).toList();
    }
}
