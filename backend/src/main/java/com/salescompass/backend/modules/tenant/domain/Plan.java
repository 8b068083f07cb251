package com.salescompass.backend.modules.tenant.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.salescompass.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Subscription plan. {@code featuresConfig} is the authoritative module/feature matrix:
 * <pre>{"billing": {"enabled": true, "display_name": "Billing", "features": {"invoices": true}}}</pre>
 */
@Entity
@Table(name = "plan")
public class Plan extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "tier", nullable = false, length = 20)
    private String tier = "starter";

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "features_config", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> featuresConfig = new LinkedHashMap<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTier() {
        return tier;
    }

    public void setTier(String tier) {
        this.tier = tier;
    }

    public Map<String, Object> getFeaturesConfig() {
        return featuresConfig;
    }

    public void setFeaturesConfig(Map<String, Object> featuresConfig) {
        this.featuresConfig = featuresConfig;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
