package com.salescompass.backend.modules.accesscontrol.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.salescompass.backend.modules.tenant.domain.Tenant;
import com.salescompass.backend.modules.tenant.infrastructure.persistence.TenantRepository;

/**
 * Seeds one entitlement, one feature flag and one permission per registered app.
 * The entitlement and feature flag are enabled for every tenant; the permission is granted to every role.
 * Running it again re-enables existing grants and leaves their config untouched.
 */
@Service
public class AccessSeedService {

    private static final Logger log = LoggerFactory.getLogger(AccessSeedService.class);

    private final AccessGrantService accessGrantService;
    private final TenantRepository tenantRepository;
    private final RoleRepository roleRepository;
    private final Map<String, String> apps;

    public AccessSeedService(
            AccessGrantService accessGrantService,
            TenantRepository tenantRepository,
            RoleRepository roleRepository,
            @Value("${crm.access.apps:}") String[] apps
    ) {
        this.accessGrantService = accessGrantService;
        this.tenantRepository = tenantRepository;
        this.roleRepository = roleRepository;
        this.apps = parseApps(apps);
    }

    public Map<String, String> getApps() {
        return apps;
    }

    @Transactional
    public SeedResult seed() {
        List<Tenant> tenants = tenantRepository.findAll();
        List<Role> roles = roleRepository.findAll();
        int definitionsCreated = 0;
        int grantsCreated = 0;
        int grantsUpdated = 0;

        for (Map.Entry<String, String> app : apps.entrySet()) {
            String key = app.getKey();
            String label = app.getValue();

            AccessGrantService.DefinitionLookup entitlement = accessGrantService.getOrCreateDefinition(
                    key + ".entitlement", AccessType.ENTITLEMENT, label + " Entitlement", "Entitlement to use the " + label + " app");
            AccessGrantService.DefinitionLookup featureFlag = accessGrantService.getOrCreateDefinition(
                    key + ".feature_flag", AccessType.FEATURE_FLAG, label + " Feature", "Feature flag for the " + label + " app");
            AccessGrantService.DefinitionLookup permission = accessGrantService.getOrCreateDefinition(
                    key + ".access", AccessType.PERMISSION, label + " Access", "Permission to open the " + label + " app");
            definitionsCreated += count(entitlement.created()) + count(featureFlag.created()) + count(permission.created());

            for (Tenant tenant : tenants) {
                for (AccessGrantService.DefinitionLookup lookup : List.of(entitlement, featureFlag)) {
                    boolean created = accessGrantService.ensureTenantGrantEnabled(tenant, lookup.definition()).created();
                    grantsCreated += count(created);
                    grantsUpdated += count(!created);
                }
            }
            for (Role role : roles) {
                boolean created = accessGrantService.ensureRoleGrantEnabled(role, permission.definition()).created();
                grantsCreated += count(created);
                grantsUpdated += count(!created);
            }
        }

        log.info("Seeded access for {} app(s): {} definitions created, {} grants created, {} grants updated",
                apps.size(), definitionsCreated, grantsCreated, grantsUpdated);
        return new SeedResult(apps.size(), definitionsCreated, grantsCreated, grantsUpdated);
    }

    /**
     * {@code leads=Leads} entries; a bare {@code leads} gets a title-cased label.
     */
    static Map<String, String> parseApps(String[] entries) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (entries == null) {
            return parsed;
        }
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            int eq = entry.indexOf('=');
            String key = (eq < 0 ? entry : entry.substring(0, eq)).trim();
            String label = eq < 0 ? "" : entry.substring(eq + 1).trim();
            if (key.isEmpty()) {
                continue;
            }
            parsed.put(key, label.isEmpty() ? Character.toUpperCase(key.charAt(0)) + key.substring(1) : label);
        }
        return parsed;
    }

    private static int count(boolean flag) {
        return flag ? 1 : 0;
    }
}
