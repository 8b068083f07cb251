package com.salescompass.backend.support;

import java.util.Map;
import java.util.UUID;

import org.springframework.test.util.ReflectionTestUtils;

import com.salescompass.backend.modules.accesscontrol.domain.AccessDefinition;
import com.salescompass.backend.modules.accesscontrol.domain.AccessType;
import com.salescompass.backend.modules.accesscontrol.domain.Role;
import com.salescompass.backend.modules.auth.domain.CrmUser;
import com.salescompass.backend.modules.tenant.domain.Plan;
import com.salescompass.backend.modules.tenant.domain.Tenant;

/**
 * Detached entities with ids assigned, for unit tests that never touch the database.
 */
public final class AccessFixtures {

    private AccessFixtures() {
    }

    public static <T> T withId(T entity) {
        ReflectionTestUtils.setField(entity, "id", UUID.randomUUID());
        return entity;
    }

    public static Plan plan(String name, Map<String, Object> featuresConfig) {
        Plan plan = new Plan();
        plan.setName(name);
        plan.setFeaturesConfig(featuresConfig);
        return withId(plan);
    }

    public static Tenant tenant(String name, Plan plan) {
        Tenant tenant = new Tenant();
        tenant.setName(name);
        tenant.setSubdomain(name.toLowerCase().replace(' ', '-'));
        tenant.setPlan(plan);
        return withId(tenant);
    }

    public static Role role(String name, Role parent) {
        Role role = new Role();
        role.setName(name);
        role.setParent(parent);
        return withId(role);
    }

    public static CrmUser user(String username, Tenant tenant, Role role) {
        CrmUser user = new CrmUser();
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setTenant(tenant);
        user.setRole(role);
        return withId(user);
    }

    public static AccessDefinition definition(String key, AccessType type) {
        AccessDefinition definition = new AccessDefinition();
        definition.setResourceKey(key);
        definition.setName(key);
        definition.setAccessType(type);
        return withId(definition);
    }
}
