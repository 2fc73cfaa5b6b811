package com.orgscope.backend.modules.query.presentation.dto;

import java.util.List;

import com.orgscope.backend.modules.grant.presentation.dto.GrantResponse;
import com.orgscope.backend.modules.query.application.BulkMemberResult;

public record BulkMemberResponse(AccessibleMemberResponse member, List<GrantResponse> grants) {

    public static BulkMemberResponse from(BulkMemberResult result) {
        return new BulkMemberResponse(
                AccessibleMemberResponse.from(result.item()),
                result.grants().stream().map(GrantResponse::from).toList()
        );
    }
}
