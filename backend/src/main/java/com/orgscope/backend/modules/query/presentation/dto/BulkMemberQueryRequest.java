package com.orgscope.backend.modules.query.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record BulkMemberQueryRequest(
        @NotEmpty(message = "memberIds is required")
        @Size(max = 100, message = "at most 100 members per bulk query")
        List<UUID> memberIds,
        Boolean includeGrants
) {
}
