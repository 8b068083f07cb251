package com.salescompass.backend.modules.accesscontrol.application;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.auth.infrastructure.persistence.CrmUserRepository;

@Component
public class DecisionCacheInvalidator {

    private static final Logger log = LoggerFactory.getLogger(DecisionCacheInvalidator.class);

    private final DecisionCache decisionCache;
    private final CrmUserRepository crmUserRepository;
    private final RoleRepository roleRepository;
    private final CacheInvalidationMode mode;
    private final int maxDepth;

    public DecisionCacheInvalidator(
            DecisionCache decisionCache,
            CrmUserRepository crmUserRepository,
            RoleRepository roleRepository,
            @Value("${crm.access.cache.invalidation:acting-user}") String mode,
            @Value("${crm.access.role-hierarchy.max-depth:32}") int maxDepth
    ) {
        this.decisionCache = decisionCache;
        this.crmUserRepository = crmUserRepository;
        this.roleRepository = roleRepository;
        this.mode = CacheInvalidationMode.from(mode);
        this.maxDepth = maxDepth;
    }

    public CacheInvalidationMode getMode() {
        return mode;
    }

    /**
     * Clears cached decisions after a grant at {@code scope} changed on behalf of {@code actingUser}.
     */
    public void afterGrantChange(CrmUser actingUser, ScopeType scope) {
        Set<UUID> userIds = new LinkedHashSet<>();
        userIds.add(actingUser.getId());
        if (mode == CacheInvalidationMode.AFFECTED_USERS) {
            if (scope == ScopeType.TENANT && actingUser.getTenant() != null) {
                userIds.addAll(crmUserRepository.findIdsByTenantId(actingUser.getTenant().getId()));
            } else if (scope == ScopeType.ROLE && actingUser.getRole() != null) {
                userIds.addAll(crmUserRepository.findIdsByRoleIdIn(roleSubtree(actingUser.getRole())));
            }
        }
        userIds.forEach(this::invalidateUser);
        log.debug("Invalidated cached access decisions for {} user(s) after {} grant change", userIds.size(), scope);
    }

    public void invalidateUser(UUID userId) {
        decisionCache.deletePattern(DecisionCacheKeys.userPattern(userId));
    }

    Set<UUID> roleSubtree(Role root) {
        Set<UUID> ids = new LinkedHashSet<>();
        Deque<UUID> frontier = new ArrayDeque<>();
        frontier.add(root.getId());
        ids.add(root.getId());
        int depth = 0;
        while (!frontier.isEmpty() && depth < maxDepth) {
            Deque<UUID> next = new ArrayDeque<>();
            for (UUID parentId : frontier) {
                List<UUID> children = roleRepository.findChildIds(parentId);
                for (UUID child : children) {
                    if (ids.add(child)) {
                        next.add(child);
                    }
                }
            }
            frontier = next;
            depth++;
        }
        return ids;
    }
}
