package com.salescompass.backend.modules.accesscontrol.application;

import static com.salescompass.backend.support.AccessFixtures.definition;
import static com.salescompass.backend.support.AccessFixtures.role;
import static com.salescompass.backend.support.AccessFixtures.tenant;
import static com.salescompass.backend.support.AccessFixtures.user;
import static com.salescompass.backend.support.AccessFixtures.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import com.salescompass.backend.global.error.ProblemException;
import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.domain.RoleAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;
import com.salescompass.backend.modules.accesscontrol.domain.TenantAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.UserAccessGrant;
import com.salescompass.backend.modules.accesscontrol.infrastructure.cache.CaffeineDecisionCache;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.AccessDefinitionRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.JpaEntitlementStore;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleAccessGrantRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.TenantAccessGrantRepository;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.UserAccessGrantRepository;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.auth.infrastructure.persistence.CrmUserRepository;
import com.salescompass.backend.modules.tenant.domain.Tenant;

@ExtendWith(MockitoExtension.class)
class AccessGrantServiceTest {

    @Mock
    private AccessDefinitionRepository accessDefinitionRepository;

    @Mock
    private TenantAccessGrantRepository tenantAccessGrantRepository;

    @Mock
    private RoleAccessGrantRepository roleAccessGrantRepository;

    @Mock
    private UserAccessGrantRepository userAccessGrantRepository;

    @Mock
    private DecisionCacheInvalidator decisionCacheInvalidator;

    @Mock
    private CrmUserRepository crmUserRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private DirectPermissionChecker directPermissionChecker;

    @Mock
    private PlanModuleGate planModuleGate;

    private AccessGrantService service;
    private Tenant tenant;
    private Role role;
    private CrmUser user;

    @BeforeEach
    void setUp() {
        service = new AccessGrantService(
                accessDefinitionRepository,
                tenantAccessGrantRepository,
                roleAccessGrantRepository,
                userAccessGrantRepository,
                decisionCacheInvalidator
        );
        tenant = tenant("Acme", null);
        role = role("Rep", null);
        user = user("alice", tenant, role);
    }

    @Test
    void createsDefinitionAndUserGrant() {
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc("leads.export")).thenReturn(Optional.empty());
        when(accessDefinitionRepository.save(any(AccessDefinition.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        when(userAccessGrantRepository.findByUserIdAndDefinitionId(any(), any())).thenReturn(Optional.empty());
        when(userAccessGrantRepository.save(any(UserAccessGrant.class))).thenAnswer(inv -> withId(inv.getArgument(0)));

        GrantResult result = service.grantAccess(user, new GrantAccessCommand(
                "leads.export", AccessType.PERMISSION, ScopeType.USER, null, null, true, Map.of("limit", 100)));

        assertThat(result.definitionCreated()).isTrue();
        assertThat(result.scope()).isEqualTo(ScopeType.USER);

        ArgumentCaptor<AccessDefinition> definition = ArgumentCaptor.forClass(AccessDefinition.class);
        verify(accessDefinitionRepository).save(definition.capture());
        assertThat(definition.getValue().getName()).isEqualTo("leads.export");
        assertThat(definition.getValue().getAccessType()).isEqualTo(AccessType.PERMISSION);

        ArgumentCaptor<UserAccessGrant> grant = ArgumentCaptor.forClass(UserAccessGrant.class);
        verify(userAccessGrantRepository).save(grant.capture());
        assertThat(grant.getValue().getUser()).isSameAs(user);
        assertThat(grant.getValue().getConfigData()).containsEntry("limit", 100);
        verify(decisionCacheInvalidator).afterGrantChange(user, ScopeType.USER);
    }

    @Test
    void secondGrantAtTheSameScopeConflicts() {
        AccessDefinition existingDefinition = definition("leads.export", AccessType.PERMISSION);
        RoleAccessGrant existing = withId(new RoleAccessGrant());
        existing.setRole(role);
        existing.setDefinition(existingDefinition);
        existing.setConfigData(Map.of("old", true));
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc("leads.export"))
                .thenReturn(Optional.of(existingDefinition));
        when(roleAccessGrantRepository.findByRoleIdAndDefinitionId(role.getId(), existingDefinition.getId()))
                .thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.grantAccess(user, new GrantAccessCommand(
                "leads.export", AccessType.PERMISSION, ScopeType.ROLE, null, null, false, Map.of("new", 1))))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("access.grant_exists");
                });

        assertThat(existing.isEnabled()).isTrue();
        assertThat(existing.getConfigData()).containsOnlyKeys("old");
        verify(roleAccessGrantRepository, never()).save(any());
        verifyNoInteractions(decisionCacheInvalidator);
    }

    @Test
    void tenantScopeTargetsTheUsersTenant() {
        AccessDefinition flag = definition("marketing.feature_flag", AccessType.FEATURE_FLAG);
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc("marketing.feature_flag"))
                .thenReturn(Optional.of(flag));
        when(tenantAccessGrantRepository.findByTenantIdAndDefinitionId(tenant.getId(), flag.getId())).thenReturn(Optional.empty());
        when(tenantAccessGrantRepository.save(any(TenantAccessGrant.class))).thenAnswer(inv -> withId(inv.getArgument(0)));

        service.grantAccess(user, new GrantAccessCommand(
                "marketing.feature_flag", AccessType.FEATURE_FLAG, ScopeType.TENANT, "Marketing", "", true, null));

        ArgumentCaptor<TenantAccessGrant> grant = ArgumentCaptor.forClass(TenantAccessGrant.class);
        verify(tenantAccessGrantRepository).save(grant.capture());
        assertThat(grant.getValue().getTenant()).isSameAs(tenant);
        assertThat(grant.getValue().getConfigData()).isEmpty();
    }

    @Test
    void rejectsTypeMismatchOnExistingDefinition() {
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc("leads.export"))
                .thenReturn(Optional.of(definition("leads.export", AccessType.PERMISSION)));

        assertThatThrownBy(() -> service.grantAccess(user, new GrantAccessCommand(
                "leads.export", AccessType.FEATURE_FLAG, ScopeType.TENANT, null, null, true, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("access.definition_type_mismatch");
                });
        verifyNoInteractions(tenantAccessGrantRepository, decisionCacheInvalidator);
    }

    @Test
    void roleScopeRequiresARole() {
        CrmUser roleless = user("bob", tenant, null);
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc("leads.export"))
                .thenReturn(Optional.of(definition("leads.export", AccessType.PERMISSION)));

        assertThatThrownBy(() -> service.grantAccess(roleless, new GrantAccessCommand(
                "leads.export", AccessType.PERMISSION, ScopeType.ROLE, null, null, true, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.role_missing"));
    }

    @Test
    void revokesEachScope() {
        AccessDefinition export = definition("leads.export", AccessType.PERMISSION);
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc("leads.export")).thenReturn(Optional.of(export));
        when(userAccessGrantRepository.deleteByUserIdAndDefinitionId(user.getId(), export.getId())).thenReturn(1L);
        when(roleAccessGrantRepository.deleteByRoleIdAndDefinitionId(role.getId(), export.getId())).thenReturn(0L);
        when(tenantAccessGrantRepository.deleteByTenantIdAndDefinitionId(tenant.getId(), export.getId())).thenReturn(1L);

        assertThat(service.revokeAccess(user, "leads.export", ScopeType.USER)).isTrue();
        assertThat(service.revokeAccess(user, "leads.export", ScopeType.ROLE)).isFalse();
        assertThat(service.revokeAccess(user, "leads.export", ScopeType.TENANT)).isTrue();

        verify(decisionCacheInvalidator).afterGrantChange(user, ScopeType.USER);
        verify(decisionCacheInvalidator, never()).afterGrantChange(user, ScopeType.ROLE);
        verify(decisionCacheInvalidator).afterGrantChange(user, ScopeType.TENANT);
    }

    @Test
    void revokingUnknownKeyIsANoOp() {
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc(anyString())).thenReturn(Optional.empty());

        assertThat(service.revokeAccess(user, "leads.missing", ScopeType.USER)).isFalse();
        verifyNoInteractions(userAccessGrantRepository, decisionCacheInvalidator);
    }

    @Test
    @DisplayName("grant then revoke at user scope restores the previous decision")
    void grantThenRevokeRestoresThePreviousDecision() {
        Map<String, AccessDefinition> definitions = new HashMap<>();
        Map<UUID, UserAccessGrant> userGrants = new HashMap<>();
        when(accessDefinitionRepository.findFirstByResourceKeyOrderByCreatedAtAscIdAsc(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(definitions.get(inv.<String>getArgument(0))));
        when(accessDefinitionRepository.save(any(AccessDefinition.class))).thenAnswer(inv -> {
            AccessDefinition saved = withId(inv.<AccessDefinition>getArgument(0));
            definitions.put(saved.getResourceKey(), saved);
            return saved;
        });
        when(userAccessGrantRepository.findByUserIdAndDefinitionId(any(), any()))
                .thenAnswer(inv -> Optional.ofNullable(userGrants.get(inv.<UUID>getArgument(1))));
        when(userAccessGrantRepository.save(any(UserAccessGrant.class))).thenAnswer(inv -> {
            UserAccessGrant saved = withId(inv.<UserAccessGrant>getArgument(0));
            userGrants.put(saved.getDefinition().getId(), saved);
            return saved;
        });
        when(userAccessGrantRepository.deleteByUserIdAndDefinitionId(any(), any()))
                .thenAnswer(inv -> userGrants.remove(inv.<UUID>getArgument(1)) == null ? 0L : 1L);

        DecisionCache cache = new CaffeineDecisionCache(Duration.ofMinutes(5), 100);
        DecisionCacheInvalidator invalidator = new DecisionCacheInvalidator(
                cache, crmUserRepository, roleRepository, "acting-user", 32);
        AccessGrantService grants = new AccessGrantService(
                accessDefinitionRepository,
                tenantAccessGrantRepository,
                roleAccessGrantRepository,
                userAccessGrantRepository,
                invalidator
        );
        AccessDecisionService decisions = new AccessDecisionService(
                new JpaEntitlementStore(accessDefinitionRepository, tenantAccessGrantRepository,
                        roleAccessGrantRepository, userAccessGrantRepository),
                new RoleHierarchy(32), directPermissionChecker, planModuleGate, cache, Duration.ofMinutes(5));

        assertThat(decisions.hasAccess(user, "leads.export", "access")).isFalse();

        grants.grantAccess(user, new GrantAccessCommand(
                "leads.export", AccessType.PERMISSION, ScopeType.USER, null, null, true, Map.of()));
        assertThat(decisions.hasAccess(user, "leads.export", "access")).isTrue();

        assertThat(grants.revokeAccess(user, "leads.export", ScopeType.USER)).isTrue();
        assertThat(decisions.hasAccess(user, "leads.export", "access")).isFalse();
        assertThat(userGrants).isEmpty();
    }
}
