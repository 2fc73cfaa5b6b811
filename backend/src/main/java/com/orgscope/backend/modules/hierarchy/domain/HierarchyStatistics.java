package com.orgscope.backend.modules.hierarchy.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

public record HierarchyStatistics(
        long totalNodes,
        long rootNodes,
        long leafNodes,
        int maxDepth,
        Map<Integer, Long> nodesByLevel
) {

    public HierarchyStatistics {
        nodesByLevel = Collections.unmodifiableMap(new TreeMap<>(nodesByLevel));
    }

    public static HierarchyStatistics of(Collection<HierarchyNode> activeNodes) {
        Set<UUID> parentIds = new HashSet<>();
        Map<Integer, Long> byLevel = new TreeMap<>();
        long roots = 0;
        int maxDepth = 0;
        for (HierarchyNode node : activeNodes) {
            if (node.getParentId() == null) {
                roots++;
            } else {
                parentIds.add(node.getParentId());
            }
            byLevel.merge(node.getLevel(), 1L, Long::sum);
            maxDepth = Math.max(maxDepth, node.getLevel());
        }
        long leaves = activeNodes.stream().filter(node -> !parentIds.contains(node.getId())).count();
        return new HierarchyStatistics(activeNodes.size(), roots, leaves, maxDepth, byLevel);
    }
}
