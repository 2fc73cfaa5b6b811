package com.orgscope.backend.modules.access.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.domain.AccessDecision;
import com.orgscope.backend.modules.access.domain.AccessScope;
import com.orgscope.backend.modules.access.domain.AccessScopeResolver;
import com.orgscope.backend.modules.access.domain.ScopeGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.grant.infrastructure.persistence.AccessGrantRepository;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.MaterializedPath;
import com.orgscope.backend.modules.hierarchy.infrastructure.persistence.HierarchyNodeRepository;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.modules.member.infrastructure.persistence.OrgMemberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads an actor's effective grants and answers scope and authorization questions over them.
 * Scopes are rebuilt on every call and never cached.
 */
@Service
@Transactional(readOnly = true)
public class AccessScopeService {

    private static final Logger log = LoggerFactory.getLogger(AccessScopeService.class);

    private final AccessGrantRepository accessGrantRepository;
    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final OrgMemberRepository orgMemberRepository;
    private final Clock clock;

    public AccessScopeService(
            AccessGrantRepository accessGrantRepository,
            HierarchyNodeRepository hierarchyNodeRepository,
            OrgMemberRepository orgMemberRepository,
            Clock clock
    ) {
        this.accessGrantRepository = accessGrantRepository;
        this.hierarchyNodeRepository = hierarchyNodeRepository;
        this.orgMemberRepository = orgMemberRepository;
        this.clock = clock;
    }

    public AccessScope computeScope(UUID actorId) {
        List<ScopeGrant> grants = loadEffectiveGrants(actorId);
        if (grants.isEmpty()) {
            return AccessScope.empty(actorId);
        }
        SortedSet<String> paths = AccessScopeResolver.accessiblePaths(grants,
                path -> hierarchyNodeRepository.findActiveDescendantPaths(MaterializedPath.descendantPattern(path)));
        long memberCount = orgMemberRepository.countActiveByBaseNodePathIn(paths);
        log.debug("Computed scope for actor {}: {} grants, {} paths, {} members",
                actorId, grants.size(), paths.size(), memberCount);
        return new AccessScope(actorId, grants, paths, memberCount);
    }

    /**
     * Scope holding only the actor's grants, without expanding descendant paths. Enough for point checks,
     * which test reachability by path prefix.
     */
    public AccessScope grantScope(UUID actorId) {
        return new AccessScope(actorId, loadEffectiveGrants(actorId), new TreeSet<>(), 0);
    }

    public AccessDecision checkNodeAccess(UUID actorId, UUID nodeId) {
        HierarchyNode node = hierarchyNodeRepository.findByIdAndActiveTrue(nodeId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND",
                        "hierarchy node %s not found".formatted(nodeId)));
        return AccessScopeResolver.decide(node.getPath(), grantScope(actorId));
    }

    public AccessDecision checkMemberAccess(UUID actorId, UUID targetMemberId) {
        if (actorId.equals(targetMemberId)) {
            String basePath = orgMemberRepository.findWithBaseNodeById(actorId)
                    .map(OrgMember::getBaseNode)
                    .filter(HierarchyNode::isActive)
                    .map(HierarchyNode::getPath)
                    .orElse(null);
            return AccessScopeResolver.decideSelf(basePath, grantScope(actorId));
        }
        OrgMember target = orgMemberRepository.findWithBaseNodeById(targetMemberId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "MEMBER_NOT_FOUND",
                        "member %s not found".formatted(targetMemberId)));
        if (!target.isActive()) {
            return AccessDecision.denied("target member is inactive");
        }
        HierarchyNode baseNode = target.getBaseNode();
        if (baseNode == null || !baseNode.isActive()) {
            return AccessDecision.denied("target member is not placed in an active node");
        }
        return AccessScopeResolver.decide(baseNode.getPath(), grantScope(actorId));
    }

    public Optional<GrantRole> effectiveRole(UUID actorId, String targetPath) {
        return AccessScopeResolver.effectiveRole(targetPath, grantScope(actorId));
    }

    public boolean canGrant(UUID actorId, String targetNodePath, GrantRole requestedRole) {
        if (isSystemOperator(actorId)) {
            return true;
        }
        return AccessScopeResolver.canGrant(targetNodePath, requestedRole, grantScope(actorId));
    }

    /**
     * Guards a mutation on {@code node}: the actor needs at least {@code minimumRole} there.
     */
    public void requireRole(UUID actorId, HierarchyNode node, GrantRole minimumRole) {
        if (isSystemOperator(actorId)) {
            return;
        }
        GrantRole effective = effectiveRole(actorId, node.getPath()).orElse(null);
        if (effective == null || !effective.atLeast(minimumRole)) {
            log.warn("Actor {} lacks {} at {} (effective: {})", actorId, minimumRole, node.getPath(), effective);
            throw new ProblemException(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_PRIVILEGES",
                    "%s role required at '%s'".formatted(minimumRole, node.getPath()));
        }
    }

    /**
     * Guards handing out {@code requestedRole} at {@code node}. Lacking MANAGER is an authorization failure;
     * holding MANAGER but asking for more than one holds is an escalation attempt.
     */
    public void requireGrantAuthority(UUID actorId, HierarchyNode node, GrantRole requestedRole) {
        if (isSystemOperator(actorId)) {
            return;
        }
        GrantRole effective = effectiveRole(actorId, node.getPath()).orElse(null);
        if (effective == null || !effective.atLeast(GrantRole.MANAGER)) {
            log.warn("Actor {} may not grant at {} (effective: {})", actorId, node.getPath(), effective);
            throw new ProblemException(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_PRIVILEGES",
                    "MANAGER role required at '%s' to grant access".formatted(node.getPath()));
        }
        if (!effective.atLeast(requestedRole)) {
            log.warn("Actor {} attempted to grant {} at {} holding only {}", actorId, requestedRole, node.getPath(), effective);
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "PRIVILEGE_ESCALATION",
                    "cannot grant %s while holding %s at '%s'".formatted(requestedRole, effective, node.getPath()));
        }
    }

    public boolean isSystemOperator(UUID actorId) {
        return actorId != null && orgMemberRepository.findByIdAndActiveTrue(actorId)
                .map(OrgMember::isSystemOperator)
                .orElse(false);
    }

    private List<ScopeGrant> loadEffectiveGrants(UUID actorId) {
        if (actorId == null || orgMemberRepository.findByIdAndActiveTrue(actorId).isEmpty()) {
            return List.of();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return accessGrantRepository.findEffectiveOnActiveNodesByActorId(actorId, now).stream()
                .map(ScopeGrant::from)
                .toList();
    }
}
