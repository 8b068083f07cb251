package com.salescompass.backend.modules.accesscontrol.presentation.dto;

import java.util.UUID;

/**
 * A {@code null} parent detaches the role.
 */
public record AssignParentRequest(UUID parentId) {
}
