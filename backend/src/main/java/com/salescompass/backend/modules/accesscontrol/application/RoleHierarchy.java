package com.salescompass.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.salescompass.backend.modules.accesscontrol.domain.Role;

/**
 * Bounded traversal of the role forest along {@code parent} pointers.
 * Roles are identified by id once persisted and by instance before that.
 */
@Component
public class RoleHierarchy {

    private final int maxDepth;

    public RoleHierarchy(@Value("${crm.access.role-hierarchy.max-depth:32}") int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("max depth must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * The role followed by its ancestors, nearest first. Empty for a {@code null} role.
     *
     * @throws RoleHierarchyException on a cycle or when the chain is deeper than the configured maximum
     */
    public List<Role> leafToRoot(Role role) {
        List<Role> chain = new ArrayList<>();
        Set<Object> visited = new HashSet<>();
        Role current = role;
        while (current != null) {
            if (!visited.add(identityOf(current))) {
                throw new RoleHierarchyException("Role hierarchy cycle detected at role '" + current.getName() + "'");
            }
            if (chain.size() == maxDepth) {
                throw new RoleHierarchyException("Role hierarchy deeper than " + maxDepth + " starting at role '" + role.getName() + "'");
            }
            chain.add(current);
            current = current.getParent();
        }
        return chain;
    }

    /**
     * Root-most ancestor first, the role itself last; the order in which configs are layered.
     */
    public List<Role> rootToLeaf(Role role) {
        List<Role> chain = leafToRoot(role);
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Whether making {@code candidateParent} the parent of {@code role} would close a loop.
     */
    public boolean wouldCreateCycle(Role role, Role candidateParent) {
        if (candidateParent == null) {
            return false;
        }
        Object target = identityOf(role);
        Set<Object> visited = new HashSet<>();
        Role current = candidateParent;
        while (current != null) {
            Object id = identityOf(current);
            if (id.equals(target) || !visited.add(id)) {
                return true;
            }
            current = current.getParent();
        }
        return false;
    }

    private static Object identityOf(Role role) {
        return role.getId() != null ? role.getId() : role;
    }
}
