package com.orgscope.backend.modules.query.application;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.GrantRole;

/**
 * Filters applied on top of the actor's scope. Null fields do not filter.
 *
 * @param sortBy one of {@code name}, {@code email}, {@code path}, {@code createdAt}
 */
public record AccessibleMemberFilter(
        String search,
        Boolean active,
        OffsetDateTime createdAfter,
        OffsetDateTime createdBefore,
        OffsetDateTime lastLoginAfter,
        OffsetDateTime lastLoginBefore,
        UUID nodeId,
        boolean includeDescendants,
        Set<Integer> levels,
        boolean excludeSelf,
        GrantRole requireMinimumRole,
        Integer page,
        Integer size,
        String sortBy,
        String sortDirection
) {

    public AccessibleMemberFilter {
        levels = levels == null ? Set.of() : Set.copyOf(levels);
    }

    public static AccessibleMemberFilter defaults() {
        return new AccessibleMemberFilter(null, null, null, null, null, null, null, true, Set.of(), false, null,
                null, null, null, null);
    }
}
