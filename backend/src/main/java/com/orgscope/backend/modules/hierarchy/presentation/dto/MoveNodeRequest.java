package com.orgscope.backend.modules.hierarchy.presentation.dto;

import java.util.UUID;

/**
 * @param newParentId destination parent; null moves the node to the root level
 */
public record MoveNodeRequest(UUID newParentId) {
}
