package com.orgscope.backend.modules.grant.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.GrantRole;

import jakarta.validation.constraints.NotNull;

public record CreateGrantRequest(
        @NotNull(message = "actorId is required")
        UUID actorId,
        @NotNull(message = "nodeId is required")
        UUID nodeId,
        @NotNull(message = "role is required")
        GrantRole role,
        Boolean inheritToDescendants,
        OffsetDateTime validFrom,
        OffsetDateTime validUntil
) {
}
