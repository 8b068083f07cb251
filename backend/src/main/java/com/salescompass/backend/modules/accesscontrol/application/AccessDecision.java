package com.salescompass.backend.modules.accesscontrol.application;

import java.util.List;

/**
 * Outcome of one access check with the rule that decided it and the steps evaluated on the way.
 */
public record AccessDecision(boolean granted, String reason, List<String> trace) {

    public AccessDecision {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }
}
