package com.salescompass.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.global.error.ProblemException;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.salescompass.backend.modules.tenant.domain.Tenant;
import com.salescompass.backend.modules.tenant.infrastructure.persistence.TenantRepository;

@Service
@Transactional
public class RoleAdminService {

    private static final Logger log = LoggerFactory.getLogger(RoleAdminService.class);

    private final RoleRepository roleRepository;
    private final TenantRepository tenantRepository;
    private final RoleHierarchy roleHierarchy;

    public RoleAdminService(RoleRepository roleRepository, TenantRepository tenantRepository, RoleHierarchy roleHierarchy) {
        this.roleRepository = roleRepository;
        this.tenantRepository = tenantRepository;
        this.roleHierarchy = roleHierarchy;
    }

    public RoleView createRole(CreateRoleCommand command) {
        Tenant tenant = command.tenantId() != null ? requireTenant(command.tenantId()) : null;
        if (findByName(command.name(), tenant).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "role.duplicate_name",
                    "Role '" + command.name() + "' already exists");
        }

        Role role = new Role();
        role.setName(command.name());
        role.setDescription(command.description() == null ? "" : command.description());
        role.setTenant(tenant);
        role.setSystemRole(command.systemRole());
        role.setAssignable(command.assignable());
        if (command.parentId() != null) {
            Role parent = requireRole(command.parentId());
            ensureDepth(parent);
            role.setParent(parent);
        }

        Role saved = roleRepository.save(role);
        log.info("Created role {} ({})", saved.getName(), saved.getId());
        return RoleView.from(saved);
    }

    /**
     * Sets or clears ({@code parentId == null}) the parent of a role. Rejects writes that would close a cycle.
     */
    public RoleView assignParent(UUID roleId, UUID parentId) {
        Role role = requireRole(roleId);
        Role parent = parentId != null ? requireRole(parentId) : null;

        if (roleHierarchy.wouldCreateCycle(role, parent)) {
            throw new ProblemException(HttpStatus.CONFLICT, "role.hierarchy_cycle",
                    "Role '" + parent.getName() + "' is already a descendant of '" + role.getName() + "'");
        }
        if (parent != null) {
            ensureDepth(parent);
        }

        role.setParent(parent);
        log.info("Role {} parent set to {}", role.getId(), parentId);
        return RoleView.from(roleRepository.save(role));
    }

    /**
     * Creates the missing default roles for a tenant; existing roles with the same name are left untouched.
     */
    public List<RoleView> provisionDefaultRoles(UUID tenantId) {
        Tenant tenant = requireTenant(tenantId);
        List<RoleView> created = new ArrayList<>();
        for (Role.RoleTemplate template : Role.DEFAULT_ROLES) {
            if (roleRepository.findByNameAndTenantId(template.name(), tenant.getId()).isPresent()) {
                continue;
            }
            Role role = new Role();
            role.setName(template.name());
            role.setDescription(template.description());
            role.setTenant(tenant);
            role.setSystemRole(template.systemRole());
            role.setAssignable(template.assignable());
            created.add(RoleView.from(roleRepository.save(role)));
        }
        log.info("Provisioned {} default role(s) for tenant {}", created.size(), tenantId);
        return created;
    }

    private void ensureDepth(Role parent) {
        try {
            roleHierarchy.leafToRoot(parent);
        } catch (RoleHierarchyException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "role.hierarchy_invalid", ex.getMessage());
        }
    }

    private Optional<Role> findByName(String name, Tenant tenant) {
        return tenant == null
                ? roleRepository.findByNameAndTenantIsNull(name)
                : roleRepository.findByNameAndTenantId(name, tenant.getId());
    }

    private Role requireRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "role.not_found", "Role not found: " + roleId));
    }

    private Tenant requireTenant(UUID tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "tenant.not_found", "Tenant not found: " + tenantId));
    }
}
