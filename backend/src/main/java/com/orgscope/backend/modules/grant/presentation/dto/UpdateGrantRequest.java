package com.orgscope.backend.modules.grant.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.grant.domain.GrantRole;

/**
 * Absent fields are left unchanged; {@code clearValidUntil} removes the expiry.
 */
public record UpdateGrantRequest(
        GrantRole role,
        Boolean inheritToDescendants,
        OffsetDateTime validUntil,
        Boolean clearValidUntil
) {
}
