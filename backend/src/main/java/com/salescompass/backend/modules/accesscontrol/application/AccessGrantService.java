package com.salescompass.backend.modules.accesscontrol.application;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.global.error.ProblemException;
import com.salescompass.backend.modules.accesscontrol.domain.AbstractAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.domain.RoleAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;
import com.salescompass.backend.modules.accesscontrol.domain.TenantAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.UserAccessGrant;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.AccessDefinitionRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleAccessGrantRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.TenantAccessGrantRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.UserAccessGrantRepository;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.tenant.domain.Tenant;

/**
 * Creates and deletes scoped grants. At most one grant row exists per (target, definition);
 * creating a second one is rejected with {@code access.grant_exists}.
 */
@Service
@Transactional
public class AccessGrantService {

    private static final Logger log = LoggerFactory.getLogger(AccessGrantService.class);

    private final AccessDefinitionRepository accessDefinitionRepository;
    private final TenantAccessGrantRepository tenantAccessGrantRepository;
    private final RoleAccessGrantRepository roleAccessGrantRepository;
    private final UserAccessGrantRepository userAccessGrantRepository;
    private final DecisionCacheInvalidator decisionCacheInvalidator;

    public AccessGrantService(
            AccessDefinitionRepository accessDefinitionRepository,
            TenantAccessGrantRepository tenantAccessGrantRepository,
            RoleAccessGrantRepository roleAccessGrantRepository,
            UserAccessGrantRepository userAccessGrantRepository,
            DecisionCacheInvalidator decisionCacheInvalidator
    ) {
        this.accessDefinitionRepository = accessDefinitionRepository;
        this.tenantAccessGrantRepository = tenantAccessGrantRepository;
        this.roleAccessGrantRepository = roleAccessGrantRepository;
        this.userAccessGrantRepository = userAccessGrantRepository;
        this.decisionCacheInvalidator = decisionCacheInvalidator;
    }

    public GrantResult grantAccess(CrmUser user, GrantAccessCommand command) {
        Objects.requireNonNull(user, "user");
        DefinitionLookup lookup = getOrCreateDefinition(
                command.resourceKey(), command.accessType(), command.name(), command.description());
        AccessDefinition definition = lookup.definition();

        AbstractAccessGrant grant = switch (command.scope()) {
            case USER -> createUserGrant(user, definition, command.enabled(), command.configData());
            case ROLE -> createRoleGrant(requireRole(user), definition, command.enabled(), command.configData());
            case TENANT -> createTenantGrant(requireTenant(user), definition, command.enabled(), command.configData());
        };

        decisionCacheInvalidator.afterGrantChange(user, command.scope());
        log.info("Granted {} '{}' at {} scope for user {} (enabled={})",
                definition.getAccessType().code(), definition.getResourceKey(), command.scope(),
                user.getId(), command.enabled());
        return new GrantResult(definition.getId(), grant.getId(), command.scope(), lookup.created());
    }

    /**
     * Deletes the grant for {@code resourceKey} at {@code scope}. Returns {@code false} when nothing matched.
     */
    public boolean revokeAccess(CrmUser user, String resourceKey, ScopeType scope) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(scope, "scope");
        Optional<AccessDefinition> found = accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc(resourceKey);
        if (found.isEmpty()) {
            return false;
        }
        AccessDefinition definition = found.get();

        long deleted = switch (scope) {
            case USER -> userAccessGrantRepository.deleteByUserIdAndDefinitionId(user.getId(), definition.getId());
            case ROLE -> user.getRole() == null ? 0
                    : roleAccessGrantRepository.deleteByRoleIdAndDefinitionId(user.getRole().getId(), definition.getId());
            case TENANT -> user.getTenant() == null ? 0
                    : tenantAccessGrantRepository.deleteByTenantIdAndDefinitionId(user.getTenant().getId(), definition.getId());
        };
        if (deleted == 0) {
            return false;
        }

        decisionCacheInvalidator.afterGrantChange(user, scope);
        log.info("Revoked '{}' at {} scope for user {}", resourceKey, scope, user.getId());
        return true;
    }

    DefinitionLookup getOrCreateDefinition(String resourceKey, AccessType accessType, String name, String description) {
        Optional<AccessDefinition> existing = accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc(resourceKey);
        if (existing.isPresent()) {
            AccessDefinition definition = existing.get();
            if (definition.getAccessType() != accessType) {
                throw new ProblemException(HttpStatus.CONFLICT, "access.definition_type_mismatch",
                        "Resource '" + resourceKey + "' is already defined as " + definition.getAccessType().code());
            }
            return new DefinitionLookup(definition, false);
        }
        AccessDefinition definition = new AccessDefinition();
        definition.setResourceKey(resourceKey);
        definition.setAccessType(accessType);
        definition.setName(name == null || name.isBlank() ? resourceKey : name);
        definition.setDescription(description == null ? "" : description);
        return new DefinitionLookup(accessDefinitionRepository.save(definition), true);
    }

    private TenantAccessGrant createTenantGrant(Tenant tenant, AccessDefinition definition, boolean enabled, Map<String, Object> configData) {
        if (tenantAccessGrantRepository.findByTenantIdAndDefinitionId(tenant.getId(), definition.getId()).isPresent()) {
            throw grantExists(definition, ScopeType.TENANT);
        }
        return tenantAccessGrantRepository.save(newTenantGrant(tenant, definition, enabled, configData));
    }

    private RoleAccessGrant createRoleGrant(Role role, AccessDefinition definition, boolean enabled, Map<String, Object> configData) {
        if (roleAccessGrantRepository.findByRoleIdAndDefinitionId(role.getId(), definition.getId()).isPresent()) {
            throw grantExists(definition, ScopeType.ROLE);
        }
        return roleAccessGrantRepository.save(newRoleGrant(role, definition, enabled, configData));
    }

    private UserAccessGrant createUserGrant(CrmUser user, AccessDefinition definition, boolean enabled, Map<String, Object> configData) {
        if (userAccessGrantRepository.findByUserIdAndDefinitionId(user.getId(), definition.getId()).isPresent()) {
            throw grantExists(definition, ScopeType.USER);
        }
        UserAccessGrant grant = new UserAccessGrant();
        grant.setUser(user);
        grant.setDefinition(definition);
        grant.setEnabled(enabled);
        grant.setConfigData(configData);
        return userAccessGrantRepository.save(grant);
    }

    /**
     * Enables the tenant grant, creating it with an empty config when missing. An existing config is kept.
     */
    EnsuredGrant ensureTenantGrantEnabled(Tenant tenant, AccessDefinition definition) {
        Optional<TenantAccessGrant> existing = tenantAccessGrantRepository.findByTenantIdAndDefinitionId(tenant.getId(), definition.getId());
        if (existing.isPresent()) {
            TenantAccessGrant grant = existing.get();
            grant.setEnabled(true);
            return new EnsuredGrant(tenantAccessGrantRepository.save(grant), false);
        }
        return new EnsuredGrant(tenantAccessGrantRepository.save(newTenantGrant(tenant, definition, true, Map.of())), true);
    }

    /**
     * Enables the role grant, creating it with an empty config when missing. An existing config is kept.
     */
    EnsuredGrant ensureRoleGrantEnabled(Role role, AccessDefinition definition) {
        Optional<RoleAccessGrant> existing = roleAccessGrantRepository.findByRoleIdAndDefinitionId(role.getId(), definition.getId());
        if (existing.isPresent()) {
            RoleAccessGrant grant = existing.get();
            grant.setEnabled(true);
            return new EnsuredGrant(roleAccessGrantRepository.save(grant), false);
        }
        return new EnsuredGrant(roleAccessGrantRepository.save(newRoleGrant(role, definition, true, Map.of())), true);
    }

    private static TenantAccessGrant newTenantGrant(Tenant tenant, AccessDefinition definition, boolean enabled, Map<String, Object> configData) {
        TenantAccessGrant grant = new TenantAccessGrant();
        grant.setTenant(tenant);
        grant.setDefinition(definition);
        grant.setEnabled(enabled);
        grant.setConfigData(configData);
        return grant;
    }

    private static RoleAccessGrant newRoleGrant(Role role, AccessDefinition definition, boolean enabled, Map<String, Object> configData) {
        RoleAccessGrant grant = new RoleAccessGrant();
        grant.setRole(role);
        grant.setDefinition(definition);
        grant.setEnabled(enabled);
        grant.setConfigData(configData);
        return grant;
    }

    private static ProblemException grantExists(AccessDefinition definition, ScopeType scope) {
        return new ProblemException(HttpStatus.CONFLICT, "access.grant_exists",
                "A " + scope.name().toLowerCase(Locale.ROOT) + " grant for '" + definition.getResourceKey() + "' already exists");
    }

    private static Role requireRole(CrmUser user) {
        if (user.getRole() == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_missing", "User has no role to grant to");
        }
        return user.getRole();
    }

    private static Tenant requireTenant(CrmUser user) {
        if (user.getTenant() == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.tenant_missing", "User has no tenant to grant to");
        }
        return user.getTenant();
    }

    record DefinitionLookup(AccessDefinition definition, boolean created) {
    }

    record EnsuredGrant(AbstractAccessGrant grant, boolean created) {
    }
}
