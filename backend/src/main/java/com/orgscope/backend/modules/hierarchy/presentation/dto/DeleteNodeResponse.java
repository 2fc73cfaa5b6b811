package com.orgscope.backend.modules.hierarchy.presentation.dto;

import java.util.UUID;

public record DeleteNodeResponse(UUID nodeId, int deactivatedCount) {
}
