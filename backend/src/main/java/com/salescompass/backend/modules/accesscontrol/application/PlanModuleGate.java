package com.salescompass.backend.modules.accesscontrol.application;

import com.salescompass.backend.modules.tenant.domain.Plan;

/**
 * Narrow view of the billing plan used by the resolver's {@code billing.} fallback.
 */
public interface PlanModuleGate {

    boolean isModuleEnabled(Plan plan, String moduleName);
}
