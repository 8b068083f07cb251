package com.salescompass.backend.modules.accesscontrol.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.salescompass.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MappedSuperclass;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Columns shared by the tenant, role and user grant tables.
 * {@code enabled = false} only means "not granted at this scope"; it never revokes another scope's grant.
 */
@MappedSuperclass
public abstract class AbstractAccessGrant extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "access_definition_id", nullable = false)
    private AccessDefinition definition;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled = true;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config_data", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> configData = new LinkedHashMap<>();

    public abstract ScopeType getScope();

    public UUID getId() {
        return id;
    }

    public AccessDefinition getDefinition() {
        return definition;
    }

    public void setDefinition(AccessDefinition definition) {
        this.definition = definition;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getConfigData() {
        return configData;
    }

    public void setConfigData(Map<String, Object> configData) {
        this.configData = configData == null ? new LinkedHashMap<>() : new LinkedHashMap<>(configData);
    }
}
