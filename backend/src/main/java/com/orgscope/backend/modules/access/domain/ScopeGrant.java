package com.orgscope.backend.modules.access.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;

/**
 * Read-only view of an effective grant as used during scope resolution.
 */
public record ScopeGrant(
        UUID grantId,
        UUID nodeId,
        String nodePath,
        GrantRole role,
        boolean inheritToDescendants,
        OffsetDateTime validUntil
) {

    public static ScopeGrant from(AccessGrant grant) {
        return new ScopeGrant(
                grant.getId(),
                grant.getNode().getId(),
                grant.getNodePath(),
                grant.getRole(),
                grant.isInheritToDescendants(),
                grant.getValidUntil()
        );
    }
}
