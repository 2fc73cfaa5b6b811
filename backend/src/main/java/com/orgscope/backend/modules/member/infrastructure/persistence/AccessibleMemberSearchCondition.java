package com.orgscope.backend.modules.member.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * @param accessiblePaths node paths whose members may be returned
 * @param selfId          member always eligible regardless of paths, or null
 * @param excludeId       member never returned, or null
 */
public record AccessibleMemberSearchCondition(
        Set<String> accessiblePaths,
        UUID selfId,
        UUID excludeId,
        String keyword,
        Boolean active,
        OffsetDateTime createdAfter,
        OffsetDateTime createdBefore,
        OffsetDateTime lastLoginAfter,
        OffsetDateTime lastLoginBefore,
        Set<Integer> levels,
        AccessibleMemberSortField sortField,
        boolean ascending
) {

    public AccessibleMemberSearchCondition {
        accessiblePaths = accessiblePaths == null ? Set.of() : Set.copyOf(accessiblePaths);
        levels = levels == null ? Set.of() : Set.copyOf(levels);
        sortField = sortField == null ? AccessibleMemberSortField.NAME : sortField;
    }
}
