package com.orgscope.backend.modules.hierarchy.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;

public record HierarchyNodeResponse(
        UUID id,
        String name,
        String code,
        String path,
        int level,
        UUID parentId,
        int sortOrder,
        Map<String, Object> metadata,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static HierarchyNodeResponse from(HierarchyNode node) {
        return new HierarchyNodeResponse(
                node.getId(),
                node.getName(),
                node.getCode(),
                node.getPath(),
                node.getLevel(),
                node.getParentId(),
                node.getSortOrder(),
                node.getMetadata(),
                node.isActive(),
                node.getCreatedAt(),
                node.getUpdatedAt()
        );
    }
}
