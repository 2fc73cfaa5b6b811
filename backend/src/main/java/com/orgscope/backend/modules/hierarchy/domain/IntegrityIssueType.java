package com.orgscope.backend.modules.hierarchy.domain;

public enum IntegrityIssueType {
    ORPHANED,
    LEVEL_MISMATCH,
    PATH_MISMATCH,
    CIRCULAR_REFERENCE
}
