package com.orgscope.backend.modules.query.presentation.dto;

import java.util.List;

import com.orgscope.backend.modules.query.application.AccessibleMemberPage;

public record AccessibleMemberListResponse(
        List<AccessibleMemberResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages,
        int accessiblePathCount
) {

    public static AccessibleMemberListResponse from(AccessibleMemberPage page) {
        return new AccessibleMemberListResponse(
                page.items().stream().map(AccessibleMemberResponse::from).toList(),
                page.page(),
                page.size(),
                page.totalElements(),
                page.totalPages(),
                page.accessiblePathCount()
        );
    }
}
