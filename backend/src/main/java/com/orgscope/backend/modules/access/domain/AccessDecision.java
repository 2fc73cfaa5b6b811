package com.orgscope.backend.modules.access.domain;

import java.util.List;

import com.orgscope.backend.modules.grant.domain.GrantRole;

/**
 * Outcome of a point access check. A denial is a regular result, never an exception.
 *
 * @param grantedThrough paths of the grants that make the target reachable
 */
public record AccessDecision(
        boolean canAccess,
        AccessLevel accessLevel,
        GrantRole effectiveRole,
        List<String> grantedThrough,
        String reason
) {

    public AccessDecision {
        grantedThrough = grantedThrough == null ? List.of() : List.copyOf(grantedThrough);
    }

    public static AccessDecision self() {
        return new AccessDecision(true, AccessLevel.SELF, GrantRole.READ, List.of(), null);
    }

    public static AccessDecision denied(String reason) {
        return new AccessDecision(false, null, null, List.of(), reason);
    }
}
