package com.orgscope.backend.modules.access.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.hierarchy.domain.MaterializedPath;

/**
 * Pure scope arithmetic over a set of effective grants.
 * <p>
 * A grant reaches its own path, and every strict descendant path when it inherits. When several
 * grants reach the same path the highest role wins, regardless of which grant is more specific.
 */
public final class AccessScopeResolver {

    private AccessScopeResolver() {
    }

    /**
     * @param descendantPaths current active descendant paths of a node path
     */
    public static SortedSet<String> accessiblePaths(
            Collection<ScopeGrant> grants,
            Function<String, Collection<String>> descendantPaths
    ) {
        SortedSet<String> paths = new TreeSet<>();
        for (ScopeGrant grant : grants) {
            paths.add(grant.nodePath());
            if (grant.inheritToDescendants()) {
                paths.addAll(descendantPaths.apply(grant.nodePath()));
            }
        }
        return paths;
    }

    public static boolean reaches(ScopeGrant grant, String targetPath) {
        if (targetPath == null || grant.nodePath() == null) {
            return false;
        }
        return grant.nodePath().equals(targetPath)
                || grant.inheritToDescendants() && MaterializedPath.isAncestor(grant.nodePath(), targetPath);
    }

    public static List<ScopeGrant> provenance(String targetPath, AccessScope scope) {
        return scope.directGrants().stream()
                .filter(grant -> reaches(grant, targetPath))
                .toList();
    }

    public static boolean isPathAccessible(String targetPath, AccessScope scope) {
        return scope.directGrants().stream().anyMatch(grant -> reaches(grant, targetPath));
    }

    public static Optional<GrantRole> effectiveRole(String targetPath, AccessScope scope) {
        GrantRole best = null;
        for (ScopeGrant grant : provenance(targetPath, scope)) {
            best = GrantRole.max(best, grant.role());
        }
        return Optional.ofNullable(best);
    }

    public static AccessDecision decide(String targetPath, AccessScope scope) {
        List<ScopeGrant> through = provenance(targetPath, scope);
        if (through.isEmpty()) {
            return AccessDecision.denied("no grant reaches '%s'".formatted(targetPath));
        }
        GrantRole role = null;
        boolean direct = false;
        for (ScopeGrant grant : through) {
            role = GrantRole.max(role, grant.role());
            direct |= grant.nodePath().equals(targetPath);
        }
        return new AccessDecision(
                true,
                direct ? AccessLevel.DIRECT : AccessLevel.INHERITED,
                role,
                through.stream().map(ScopeGrant::nodePath).distinct().toList(),
                null
        );
    }

    /**
     * Decision for an actor looking at their own record, placed at {@code basePath} (null when unplaced).
     * Self-access is at least READ; grants reaching the actor's own node can raise it.
     */
    public static AccessDecision decideSelf(String basePath, AccessScope scope) {
        if (basePath == null) {
            return AccessDecision.self();
        }
        AccessDecision granted = decide(basePath, scope);
        if (!granted.canAccess()) {
            return AccessDecision.self();
        }
        return new AccessDecision(true, AccessLevel.SELF, GrantRole.max(GrantRole.READ, granted.effectiveRole()),
                granted.grantedThrough(), null);
    }

    /**
     * Granting at {@code targetPath} needs MANAGER or ADMIN there, and the requested role may not
     * exceed the granter's own effective role.
     */
    public static boolean canGrant(String targetPath, GrantRole requestedRole, AccessScope scope) {
        return effectiveRole(targetPath, scope)
                .filter(role -> role.atLeast(GrantRole.MANAGER))
                .filter(role -> role.atLeast(requestedRole))
                .isPresent();
    }
}
