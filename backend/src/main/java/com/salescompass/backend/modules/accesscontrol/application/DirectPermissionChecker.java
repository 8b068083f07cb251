package com.salescompass.backend.modules.accesscontrol.application;

import com.salescompass.backend.modules.auth.domain.CrmUser;

/**
 * Conventional application permission check keyed by a codename such as {@code leads.access_view}.
 */
public interface DirectPermissionChecker {

    boolean hasPermission(CrmUser user, String codename);
}
