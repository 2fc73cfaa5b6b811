package com.orgscope.backend.modules.hierarchy.domain;

import java.time.OffsetDateTime;
import java.util.List;

public record IntegrityReport(boolean valid, List<IntegrityIssue> issues, long checkedNodes, OffsetDateTime checkedAt) {

    public IntegrityReport {
        issues = List.copyOf(issues);
    }

    public static IntegrityReport of(List<IntegrityIssue> issues, long checkedNodes, OffsetDateTime checkedAt) {
        boolean valid = issues.stream().noneMatch(issue -> issue.severity() == IntegritySeverity.ERROR);
        return new IntegrityReport(valid, issues, checkedNodes, checkedAt);
    }

    public long errorCount() {
        return issues.stream().filter(issue -> issue.severity() == IntegritySeverity.ERROR).count();
    }

    public long warningCount() {
        return issues.size() - errorCount();
    }
}
