package com.orgscope.backend.modules.query.application;

import java.util.List;

import com.orgscope.backend.modules.grant.domain.AccessGrant;

/**
 * @param grants the member's effective grants, empty unless requested
 */
public record BulkMemberResult(AccessibleMember item, List<AccessGrant> grants) {

    public BulkMemberResult {
        grants = grants == null ? List.of() : List.copyOf(grants);
    }
}
