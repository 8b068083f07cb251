package com.salescompass.backend.modules.accesscontrol.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.salescompass.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Scope-independent description of a permission, feature flag or entitlement.
 * Assignments live in the tenant, role and user grant tables.
 */
@Entity
@Table(name = "access_definition")
public class AccessDefinition extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "resource_key", nullable = false, length = 255)
    private String resourceKey;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", nullable = false)
    private String description = "";

    @Enumerated(EnumType.STRING)
    @Column(name = "access_type", nullable = false, length = 20)
    private AccessType accessType;

    @Column(name = "default_enabled", nullable = false)
    private boolean defaultEnabled = true;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config_schema", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> configSchema = new LinkedHashMap<>();

    public UUID getId() {
        return id;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public void setResourceKey(String resourceKey) {
        this.resourceKey = resourceKey;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public AccessType getAccessType() {
        return accessType;
    }

    public void setAccessType(AccessType accessType) {
        this.accessType = accessType;
    }

    public boolean isDefaultEnabled() {
        return defaultEnabled;
    }

    public void setDefaultEnabled(boolean defaultEnabled) {
        this.defaultEnabled = defaultEnabled;
    }

    public Map<String, Object> getConfigSchema() {
        return configSchema;
    }

    public void setConfigSchema(Map<String, Object> configSchema) {
        this.configSchema = configSchema;
    }
}
