package com.orgscope.backend.modules.grant.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;

public record GrantResponse(
        UUID id,
        UUID actorId,
        UUID nodeId,
        String nodePath,
        GrantRole role,
        boolean inheritToDescendants,
        OffsetDateTime validFrom,
        OffsetDateTime validUntil,
        boolean active,
        UUID grantedBy,
        UUID revokedBy,
        OffsetDateTime revokedAt,
        OffsetDateTime createdAt
) {

    public static GrantResponse from(AccessGrant grant) {
        return new GrantResponse(
                grant.getId(),
                grant.getActor().getId(),
                grant.getNode().getId(),
                grant.getNodePath(),
                grant.getRole(),
                grant.isInheritToDescendants(),
                grant.getValidFrom(),
                grant.getValidUntil(),
                grant.isActive(),
                grant.getGrantedBy(),
                grant.getRevokedBy(),
                grant.getRevokedAt(),
                grant.getCreatedAt()
        );
    }
}
