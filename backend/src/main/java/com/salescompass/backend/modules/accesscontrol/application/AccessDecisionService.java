package com.salescompass.backend.modules.accesscontrol.application;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.tenant.domain.Plan;
import com.salescompass.backend.modules.tenant.domain.Tenant;

/**
 * Decides whether a user may use a resource. The first rule that grants wins:
 * superuser, direct permission, then the definition's scoped grants, then the billing plan fallback.
 */
@Service
@Transactional(readOnly = true)
public class AccessDecisionService {

    public static final String DEFAULT_ACTION = "access";

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionService.class);

    private static final String BILLING_PREFIX = "billing.";
    private static final String BILLING_DASHBOARD = "billing.dashboard";
    private static final String BILLING_MODULE = "billing";

    private final EntitlementStore entitlementStore;
    private final RoleHierarchy roleHierarchy;
    private final DirectPermissionChecker directPermissionChecker;
    private final PlanModuleGate planModuleGate;
    private final DecisionCache decisionCache;
    private final Duration cacheTtl;

    public AccessDecisionService(
            EntitlementStore entitlementStore,
            RoleHierarchy roleHierarchy,
            DirectPermissionChecker directPermissionChecker,
            PlanModuleGate planModuleGate,
            DecisionCache decisionCache,
            @Value("${crm.access.cache.ttl:PT5M}") Duration cacheTtl
    ) {
        this.entitlementStore = entitlementStore;
        this.roleHierarchy = roleHierarchy;
        this.directPermissionChecker = directPermissionChecker;
        this.planModuleGate = planModuleGate;
        this.decisionCache = decisionCache;
        this.cacheTtl = cacheTtl;
    }

    public boolean hasAccess(CrmUser user, String resourceKey, String action) {
        Objects.requireNonNull(user, "user");
        String effectiveAction = normalizeAction(action);
        String cacheKey = DecisionCacheKeys.decision(user.getId(), resourceKey, effectiveAction);

        Optional<Boolean> cached = decisionCache.get(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        boolean granted = resolve(user, resourceKey, effectiveAction, DecisionTrace.silent()).granted();
        decisionCache.put(cacheKey, granted, cacheTtl);
        return granted;
    }

    /**
     * Same decision as {@link #hasAccess}, computed without the cache and explained.
     */
    public AccessDecision hasAccessWithReason(CrmUser user, String resourceKey, String action) {
        Objects.requireNonNull(user, "user");
        return resolve(user, resourceKey, normalizeAction(action), DecisionTrace.recording());
    }

    private AccessDecision resolve(CrmUser user, String resourceKey, String action, DecisionTrace trace) {
        if (user.isSuperuser()) {
            trace.step("superuser: granted");
            return decide(true, "superuser", trace);
        }

        if (hasDirectPermission(user, resourceKey, action, trace)) {
            return decide(true, "direct_permission", trace);
        }

        Optional<AccessDefinition> found = entitlementStore.findDefinitionByKey(resourceKey);
        if (found.isEmpty()) {
            trace.step("definition '" + resourceKey + "': not found");
            return decide(false, "definition_not_found", trace);
        }
        AccessDefinition definition = found.get();
        trace.step("definition '" + resourceKey + "': " + definition.getAccessType().code());

        Tenant tenant = user.getTenant();
        if (definition.getAccessType().isTenantScopedOnly()) {
            if (tenant == null) {
                trace.step("tenant grant: user has no tenant");
                return decide(false, "no_tenant", trace);
            }
            boolean granted = isEnabled(entitlementStore.findTenantGrant(tenant, definition));
            trace.step("tenant grant: " + (granted ? "enabled" : "absent or disabled"));
            return decide(granted, granted ? "tenant_grant" : "tenant_grant_missing", trace);
        }

        if (isEnabled(entitlementStore.findUserGrant(user, definition))) {
            trace.step("user grant: enabled");
            return decide(true, "user_grant", trace);
        }
        trace.step("user grant: absent or disabled");

        Optional<Role> grantingRole = findGrantingRole(user, definition, trace);
        if (grantingRole.isPresent()) {
            return decide(true, "role_grant", trace);
        }

        if (tenant != null) {
            if (isEnabled(entitlementStore.findTenantGrant(tenant, definition))) {
                trace.step("tenant grant: enabled");
                return decide(true, "tenant_grant", trace);
            }
            trace.step("tenant grant: absent or disabled");
        }

        if (billingFallback(resourceKey, tenant, trace)) {
            return decide(true, "billing_plan", trace);
        }

        return decide(false, "no_matching_grant", trace);
    }

    private boolean hasDirectPermission(CrmUser user, String resourceKey, String action, DecisionTrace trace) {
        int dot = resourceKey.indexOf('.');
        if (dot < 0) {
            trace.step("direct permission: skipped, key has no namespace");
            return false;
        }
        String codename = resourceKey.substring(0, dot) + "." + action + "_" + resourceKey.substring(dot + 1);
        try {
            boolean granted = directPermissionChecker.hasPermission(user, codename);
            trace.step("direct permission '" + codename + "': " + (granted ? "granted" : "absent"));
            return granted;
        } catch (DataAccessException ex) {
            log.warn("Direct permission lookup failed for user {} and codename {}", user.getId(), codename, ex);
            trace.step("direct permission '" + codename + "': lookup failed");
            return false;
        }
    }

    private Optional<Role> findGrantingRole(CrmUser user, AccessDefinition definition, DecisionTrace trace) {
        if (user.getRole() == null) {
            trace.step("role grants: user has no role");
            return Optional.empty();
        }
        List<Role> chain;
        try {
            chain = roleHierarchy.leafToRoot(user.getRole());
        } catch (RoleHierarchyException ex) {
            log.warn("Skipping role grants for user {}: {}", user.getId(), ex.getMessage());
            trace.step("role grants: skipped, " + ex.getMessage());
            return Optional.empty();
        }
        for (Role role : chain) {
            if (isEnabled(entitlementStore.findRoleGrant(role, definition))) {
                trace.step("role grant via '" + role.getName() + "': enabled");
                return Optional.of(role);
            }
        }
        trace.step("role grants: none enabled across " + chain.size() + " role(s)");
        return Optional.empty();
    }

    private boolean billingFallback(String resourceKey, Tenant tenant, DecisionTrace trace) {
        if (!resourceKey.startsWith(BILLING_PREFIX) || tenant == null) {
            return false;
        }
        Plan plan = tenant.getPlan();
        if (plan == null) {
            trace.step("billing plan: tenant has no plan");
            return false;
        }
        if (!BILLING_DASHBOARD.equals(resourceKey) && resourceKey.contains(".admin.")) {
            trace.step("billing plan: admin keys are not covered by the plan");
            return false;
        }
        try {
            boolean enabled = planModuleGate.isModuleEnabled(plan, BILLING_MODULE);
            trace.step("billing plan '" + plan.getName() + "': module " + (enabled ? "enabled" : "disabled"));
            return enabled;
        } catch (DataAccessException ex) {
            log.warn("Plan module lookup failed for plan {}", plan.getId(), ex);
            trace.step("billing plan: lookup failed");
            return false;
        }
    }

    private static boolean isEnabled(Optional<GrantSnapshot> grant) {
        return grant.map(GrantSnapshot::enabled).orElse(false);
    }

    private static AccessDecision decide(boolean granted, String reason, DecisionTrace trace) {
        return new AccessDecision(granted, reason, trace.steps());
    }

    static String normalizeAction(String action) {
        return action == null || action.isBlank() ? DEFAULT_ACTION : action.trim();
    }
}
