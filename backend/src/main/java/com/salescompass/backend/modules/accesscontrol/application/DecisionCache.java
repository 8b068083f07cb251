package com.salescompass.backend.modules.accesscontrol.application;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived store for access decisions.
 * Implementations must tolerate concurrent get/put/deletePattern calls.
 */
public interface DecisionCache {

    Optional<Boolean> get(String key);

    void put(String key, boolean granted, Duration ttl);

    /**
     * Removes every entry whose key matches a glob pattern where {@code *} matches any run of characters.
     */
    void deletePattern(String pattern);
}
