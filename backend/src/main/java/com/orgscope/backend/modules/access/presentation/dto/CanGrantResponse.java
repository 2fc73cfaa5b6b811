package com.orgscope.backend.modules.access.presentation.dto;

import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.GrantRole;

public record CanGrantResponse(UUID nodeId, String nodePath, GrantRole role, boolean allowed) {
}
