package com.orgscope.backend.modules.hierarchy.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.orgscope.backend.modules.hierarchy.domain.HierarchyTreeNode;

public record HierarchyTreeResponse(
        UUID id,
        String name,
        String code,
        String path,
        int level,
        int sortOrder,
        List<HierarchyTreeResponse> children
) {

    public static HierarchyTreeResponse from(HierarchyTreeNode tree) {
        return new HierarchyTreeResponse(
                tree.node().getId(),
                tree.node().getName(),
                tree.node().getCode(),
                tree.node().getPath(),
                tree.node().getLevel(),
                tree.node().getSortOrder(),
                tree.children().stream().map(HierarchyTreeResponse::from).toList()
        );
    }
}
