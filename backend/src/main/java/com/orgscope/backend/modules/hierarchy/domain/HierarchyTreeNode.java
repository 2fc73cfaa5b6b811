package com.orgscope.backend.modules.hierarchy.domain;

import java.util.List;

public record HierarchyTreeNode(HierarchyNode node, List<HierarchyTreeNode> children) {

    public HierarchyTreeNode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
