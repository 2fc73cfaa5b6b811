package com.orgscope.backend.modules.hierarchy.presentation.dto;

import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateNodeRequest(
        @NotBlank(message = "name is required")
        @Size(max = 255, message = "name must be at most 255 characters")
        String name,
        String code,
        UUID parentId,
        Integer sortOrder,
        Map<String, Object> metadata
) {
}
