package com.salescompass.backend.modules.accesscontrol.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.salescompass.backend.modules.accesscontrol.domain.AbstractAccessGrant;
import com.salescompass.backend.modules.accesscontrol.domain.ScopeType;

/**
 * Detached view of one grant row: whether it is enabled and its config data.
 */
public record GrantSnapshot(ScopeType scope, boolean enabled, Map<String, Object> configData) {

    public GrantSnapshot {
        configData = configData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(configData));
    }

    public static GrantSnapshot of(AbstractAccessGrant grant) {
        return new GrantSnapshot(grant.getScope(), grant.isEnabled(), grant.getConfigData());
    }

    public boolean hasConfig() {
        return !configData.isEmpty();
    }
}
