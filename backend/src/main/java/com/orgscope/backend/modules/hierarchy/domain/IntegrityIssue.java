package com.orgscope.backend.modules.hierarchy.domain;

import java.util.UUID;

public record IntegrityIssue(
        UUID nodeId,
        String path,
        IntegrityIssueType type,
        IntegritySeverity severity,
        String message
) {

    public static IntegrityIssue of(HierarchyNode node, IntegrityIssueType type, String message) {
        IntegritySeverity severity = type == IntegrityIssueType.CIRCULAR_REFERENCE
                ? IntegritySeverity.ERROR
                : IntegritySeverity.WARNING;
        return new IntegrityIssue(node.getId(), node.getPath(), type, severity, message);
    }
}
