package com.orgscope.backend.modules.query.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.orgscope.backend.modules.access.domain.AccessLevel;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.query.application.AccessibleMember;

public record AccessibleMemberResponse(
        UUID id,
        String email,
        String fullName,
        String basePath,
        Integer baseLevel,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime lastLoginAt,
        AccessLevel accessLevel,
        GrantRole effectiveRole,
        List<String> grantedThrough
) {

    public static AccessibleMemberResponse from(AccessibleMember item) {
        HierarchyNode baseNode = item.member().getBaseNode();
        return new AccessibleMemberResponse(
                item.member().getId(),
                item.member().getEmail(),
                item.member().getFullName(),
                baseNode != null ? baseNode.getPath() : null,
                baseNode != null ? baseNode.getLevel() : null,
                item.member().isActive(),
                item.member().getCreatedAt(),
                item.member().getLastLoginAt(),
                item.access().accessLevel(),
                item.access().effectiveRole(),
                item.access().grantedThrough()
        );
    }
}
