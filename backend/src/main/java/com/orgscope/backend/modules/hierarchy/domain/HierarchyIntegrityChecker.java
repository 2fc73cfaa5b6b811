package com.orgscope.backend.modules.hierarchy.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scans persisted nodes for structural anomalies. Findings are reported only; nothing is repaired.
 */
public final class HierarchyIntegrityChecker {

    private HierarchyIntegrityChecker() {
    }

    /**
     * @param nodes every stored node, active or not; only active nodes are checked
     */
    public static List<IntegrityIssue> check(Collection<HierarchyNode> nodes) {
        Map<UUID, HierarchyNode> byId = nodes.stream()
                .collect(Collectors.toMap(HierarchyNode::getId, Function.identity(), (a, b) -> a));
        List<IntegrityIssue> issues = new ArrayList<>();

        for (HierarchyNode node : nodes) {
            if (!node.isActive()) {
                continue;
            }
            if (hasCycle(node, byId)) {
                issues.add(IntegrityIssue.of(node, IntegrityIssueType.CIRCULAR_REFERENCE,
                        "node %s is reachable from its own parent chain".formatted(node.getId())));
                continue;
            }
            if (node.getParentId() == null) {
                checkRoot(node, issues);
                continue;
            }

            HierarchyNode parent = byId.get(node.getParentId());
            if (parent == null || !parent.isActive()) {
                issues.add(IntegrityIssue.of(node, IntegrityIssueType.ORPHANED,
                        "parent %s is %s".formatted(node.getParentId(), parent == null ? "missing" : "inactive")));
                continue;
            }
            if (MaterializedPath.isSelfOrDescendant(parent.getPath(), node.getPath())) {
                issues.add(IntegrityIssue.of(node, IntegrityIssueType.CIRCULAR_REFERENCE,
                        "parent path '%s' lies inside node path '%s'".formatted(parent.getPath(), node.getPath())));
                continue;
            }
            if (node.getLevel() != parent.getLevel() + 1) {
                issues.add(IntegrityIssue.of(node, IntegrityIssueType.LEVEL_MISMATCH,
                        "expected level %d but found %d".formatted(parent.getLevel() + 1, node.getLevel())));
            }
            String expectedPath = parent.getPath() + MaterializedPath.SEPARATOR + node.getCode();
            if (!expectedPath.equals(node.getPath())) {
                issues.add(IntegrityIssue.of(node, IntegrityIssueType.PATH_MISMATCH,
                        "expected path '%s' but found '%s'".formatted(expectedPath, node.getPath())));
            }
        }
        return issues;
    }

    private static void checkRoot(HierarchyNode node, List<IntegrityIssue> issues) {
        if (node.getLevel() != 0) {
            issues.add(IntegrityIssue.of(node, IntegrityIssueType.LEVEL_MISMATCH,
                    "root node must have level 0 but has %d".formatted(node.getLevel())));
        }
        if (!node.getCode().equals(node.getPath())) {
            issues.add(IntegrityIssue.of(node, IntegrityIssueType.PATH_MISMATCH,
                    "root node path '%s' must equal its code '%s'".formatted(node.getPath(), node.getCode())));
        }
    }

    private static boolean hasCycle(HierarchyNode node, Map<UUID, HierarchyNode> byId) {
        Set<UUID> visited = new HashSet<>();
        HierarchyNode current = node;
        while (current != null) {
            if (!visited.add(current.getId())) {
                return true;
            }
            current = current.getParentId() != null ? byId.get(current.getParentId()) : null;
        }
        return false;
    }
}
