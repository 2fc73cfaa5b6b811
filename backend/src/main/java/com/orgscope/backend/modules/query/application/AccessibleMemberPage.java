package com.orgscope.backend.modules.query.application;

import java.util.List;

public record AccessibleMemberPage(
        List<AccessibleMember> items,
        int page,
        int size,
        long totalElements,
        int totalPages,
        int accessiblePathCount
) {
}
