package com.orgscope.backend.modules.member.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record RelocateMemberRequest(
        @NotNull(message = "baseNodeId is required")
        UUID baseNodeId
) {
}
