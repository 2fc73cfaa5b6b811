package com.orgscope.backend.modules.access.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.orgscope.backend.modules.access.domain.AccessScope;
import com.orgscope.backend.modules.access.domain.ScopeGrant;

public record AccessScopeResponse(
        UUID actorId,
        List<ScopeGrant> directGrants,
        List<String> accessiblePaths,
        long accessibleMemberCount
) {

    public static AccessScopeResponse from(AccessScope scope) {
        return new AccessScopeResponse(
                scope.actorId(),
                scope.directGrants(),
                List.copyOf(scope.accessiblePaths()),
                scope.accessibleMemberCount()
        );
    }
}
