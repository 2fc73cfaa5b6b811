package com.orgscope.backend.modules.access.domain;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

public record AccessScope(
        UUID actorId,
        List<ScopeGrant> directGrants,
        SortedSet<String> accessiblePaths,
        long accessibleMemberCount
) {

    public AccessScope {
        directGrants = directGrants == null ? List.of() : List.copyOf(directGrants);
        accessiblePaths = Collections.unmodifiableSortedSet(
                accessiblePaths == null ? new TreeSet<>() : new TreeSet<>(accessiblePaths));
    }

    public static AccessScope empty(UUID actorId) {
        return new AccessScope(actorId, List.of(), new TreeSet<>(), 0);
    }

    public boolean isEmpty() {
        return directGrants.isEmpty();
    }
}
