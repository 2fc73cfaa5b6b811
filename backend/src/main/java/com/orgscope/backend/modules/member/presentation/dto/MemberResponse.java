package com.orgscope.backend.modules.member.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.member.domain.OrgMember;

public record MemberResponse(
        UUID id,
        String email,
        String fullName,
        UUID baseNodeId,
        String basePath,
        boolean active,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt
) {

    public static MemberResponse from(OrgMember member) {
        HierarchyNode baseNode = member.getBaseNode();
        return new MemberResponse(
                member.getId(),
                member.getEmail(),
                member.getFullName(),
                baseNode != null ? baseNode.getId() : null,
                baseNode != null ? baseNode.getPath() : null,
                member.isActive(),
                member.getLastLoginAt(),
                member.getCreatedAt()
        );
    }
}
