package com.orgscope.backend.modules.hierarchy.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.Size;

public record UpdateNodeRequest(
        @Size(min = 1, max = 255, message = "name must be 1-255 characters")
        String name,
        Integer sortOrder,
        Map<String, Object> metadata
) {
}
