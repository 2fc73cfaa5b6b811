package com.orgscope.backend.modules.hierarchy.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Assembles a flat node list into nested trees. A node whose parent is not part of the input
 * is surfaced as a root so that nothing silently disappears from the view.
 */
public final class HierarchyTreeBuilder {

    public static final Comparator<HierarchyNode> DISPLAY_ORDER = Comparator
            .comparingInt(HierarchyNode::getSortOrder)
            .thenComparing(HierarchyNode::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(HierarchyNode::getPath, Comparator.nullsLast(Comparator.naturalOrder()));

    private HierarchyTreeBuilder() {
    }

    public static List<HierarchyTreeNode> build(Collection<HierarchyNode> nodes) {
        Map<UUID, HierarchyNode> byId = new LinkedHashMap<>();
        nodes.forEach(node -> byId.put(node.getId(), node));

        Map<UUID, List<HierarchyNode>> childrenByParent = new HashMap<>();
        List<HierarchyNode> roots = new ArrayList<>();
        for (HierarchyNode node : byId.values()) {
            UUID parentId = node.getParentId();
            if (parentId == null || !byId.containsKey(parentId) || parentId.equals(node.getId())) {
                roots.add(node);
            } else {
                childrenByParent.computeIfAbsent(parentId, key -> new ArrayList<>()).add(node);
            }
        }

        roots.sort(DISPLAY_ORDER);
        List<HierarchyTreeNode> result = new ArrayList<>(roots.size());
        for (HierarchyNode root : roots) {
            result.add(assemble(root, childrenByParent, 0, byId.size()));
        }
        return result;
    }

    private static HierarchyTreeNode assemble(
            HierarchyNode node,
            Map<UUID, List<HierarchyNode>> childrenByParent,
            int depth,
            int limit
    ) {
        // a parent cycle can never be reached from a root, but corrupt input must not recurse forever
        if (depth > limit) {
            return new HierarchyTreeNode(node, List.of());
        }
        List<HierarchyNode> children = new ArrayList<>(childrenByParent.getOrDefault(node.getId(), List.of()));
        children.sort(DISPLAY_ORDER);
        List<HierarchyTreeNode> assembled = new ArrayList<>(children.size());
        for (HierarchyNode child : children) {
            assembled.add(assemble(child, childrenByParent, depth + 1, limit));
        }
        return new HierarchyTreeNode(node, assembled);
    }
}
