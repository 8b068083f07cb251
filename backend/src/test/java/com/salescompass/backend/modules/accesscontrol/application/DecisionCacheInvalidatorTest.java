package com.salescompass.backend.modules.accesscontrol.application;

import static com.salescompass.backend.support.AccessFixtures.role;
import static com.salescompass.backend.support.AccessFixtures.tenant;
import static com.salescompass.backend.support.AccessFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.auth.infrastructure.persistence.CrmUserRepository;
import com.salescompass.backend.modules.tenant.domain.Tenant;

@ExtendWith(MockitoExtension.class)
class DecisionCacheInvalidatorTest {

    @Mock
    private DecisionCache decisionCache;

    @Mock
    private CrmUserRepository crmUserRepository;

    @Mock
    private RoleRepository roleRepository;

    private Tenant tenant;
    private Role manager;
    private CrmUser actor;

    @BeforeEach
    void setUp() {
        tenant = tenant("Acme", null);
        manager = role("Manager", null);
        actor = user("alice", tenant, manager);
    }

    private DecisionCacheInvalidator invalidator(String mode) {
        return new DecisionCacheInvalidator(decisionCache, crmUserRepository, roleRepository, mode, 32);
    }

    @Test
    void defaultModeClearsOnlyTheActingUser() {
        DecisionCacheInvalidator invalidator = invalidator("acting-user");

        invalidator.afterGrantChange(actor, ScopeType.TENANT);

        assertThat(invalidator.getMode()).isEqualTo(CacheInvalidationMode.ACTING_USER);
        verify(decisionCache).deletePattern("access_" + actor.getId() + "_*");
        verifyNoMoreInteractions(decisionCache);
        verifyNoInteractions(crmUserRepository, roleRepository);
    }

    @Test
    void affectedUsersModeFansOutToTheTenant() {
        UUID colleague = UUID.randomUUID();
        when(crmUserRepository.findIdsByTenantId(tenant.getId())).thenReturn(List.of(actor.getId(), colleague));

        invalidator("affected-users").afterGrantChange(actor, ScopeType.TENANT);

        verify(decisionCache).deletePattern(DecisionCacheKeys.userPattern(actor.getId()));
        verify(decisionCache).deletePattern(DecisionCacheKeys.userPattern(colleague));
        verifyNoMoreInteractions(decisionCache);
    }

    @Test
    void affectedUsersModeWalksTheRoleSubtree() {
        UUID child = UUID.randomUUID();
        UUID grandchild = UUID.randomUUID();
        UUID subordinate = UUID.randomUUID();
        when(roleRepository.findChildIds(manager.getId())).thenReturn(List.of(child));
        when(roleRepository.findChildIds(child)).thenReturn(List.of(grandchild));
        when(roleRepository.findChildIds(grandchild)).thenReturn(List.of());
        when(crmUserRepository.findIdsByRoleIdIn(Set.of(manager.getId(), child, grandchild))).thenReturn(List.of(subordinate));

        invalidator("affected-users").afterGrantChange(actor, ScopeType.ROLE);

        verify(decisionCache).deletePattern(DecisionCacheKeys.userPattern(actor.getId()));
        verify(decisionCache).deletePattern(DecisionCacheKeys.userPattern(subordinate));
    }

    @Test
    void userScopeNeverFansOut() {
        invalidator("affected-users").afterGrantChange(actor, ScopeType.USER);

        verify(decisionCache).deletePattern(DecisionCacheKeys.userPattern(actor.getId()));
        verifyNoInteractions(crmUserRepository, roleRepository);
    }

    @Test
    void parsesModeNames() {
        assertThat(CacheInvalidationMode.from(null)).isEqualTo(CacheInvalidationMode.ACTING_USER);
        assertThat(CacheInvalidationMode.from("AFFECTED_USERS")).isEqualTo(CacheInvalidationMode.AFFECTED_USERS);
        assertThat(CacheInvalidationMode.from(" affected-users ")).isEqualTo(CacheInvalidationMode.AFFECTED_USERS);
    }
}
