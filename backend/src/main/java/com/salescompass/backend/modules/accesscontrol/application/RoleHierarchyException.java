package com.salescompass.backend.modules.accesscontrol.application;

/**
 * Raised when a role's parent chain loops back on itself or exceeds the configured depth.
 */
public class RoleHierarchyException extends RuntimeException {

    public RoleHierarchyException(String message) {
        super(message);
    }
}
