package com.salescompass.backend.modules.accesscontrol.application;

/**
 * One entry of a user's resource catalog.
 */
public record AvailableResource(String key, String name, String description) {
}
