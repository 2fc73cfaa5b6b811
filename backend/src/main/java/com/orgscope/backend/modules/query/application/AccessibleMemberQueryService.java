package com.orgscope.backend.modules.query.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.application.AccessScopeService;
import com.orgscope.backend.modules.access.domain.AccessDecision;
import com.orgscope.backend.modules.access.domain.AccessScope;
import com.orgscope.backend.modules.access.domain.AccessScopeResolver;
import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.grant.infrastructure.persistence.AccessGrantRepository;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.MaterializedPath;
import com.orgscope.backend.modules.hierarchy.infrastructure.persistence.HierarchyNodeRepository;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.modules.member.infrastructure.persistence.AccessibleMemberSearchCondition;
import com.orgscope.backend.modules.member.infrastructure.persistence.AccessibleMemberSortField;
import com.orgscope.backend.modules.member.infrastructure.persistence.OrgMemberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Lists the members an actor may see, narrowed by caller filters, each tagged with how it is reached.
 */
@Service
@Transactional(readOnly = true)
public class AccessibleMemberQueryService {

    private static final Logger log = LoggerFactory.getLogger(AccessibleMemberQueryService.class);
    private static final int MAX_BULK_SIZE = 100;
    private static final int DEFAULT_SUGGESTION_LIMIT = 10;
    private static final int MAX_SUGGESTION_LIMIT = 20;
    private static final int RECENT_DAYS = 30;

    private final AccessScopeService accessScopeService;
    private final OrgMemberRepository orgMemberRepository;
    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final AccessGrantRepository accessGrantRepository;
    private final Clock clock;
    private final int defaultPageSize;
    private final int maxPageSize;

    public AccessibleMemberQueryService(
            AccessScopeService accessScopeService,
            OrgMemberRepository orgMemberRepository,
            HierarchyNodeRepository hierarchyNodeRepository,
            AccessGrantRepository accessGrantRepository,
            Clock clock,
            @Value("${app.query.default-page-size:50}") int defaultPageSize,
            @Value("${app.query.max-page-size:100}") int maxPageSize
    ) {
        this.accessScopeService = accessScopeService;
        this.orgMemberRepository = orgMemberRepository;
        this.hierarchyNodeRepository = hierarchyNodeRepository;
        this.accessGrantRepository = accessGrantRepository;
        this.clock = clock;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public AccessibleMemberPage queryAccessibleMembers(UUID actorId, AccessibleMemberFilter filter) {
        AccessibleMemberFilter effective = filter != null ? filter : AccessibleMemberFilter.defaults();
        AccessScope scope = accessScopeService.computeScope(actorId);

        Set<String> paths = scope.accessiblePaths();
        GrantRole minimumRole = effective.requireMinimumRole();
        if (minimumRole != null) {
            paths = paths.stream()
                    .filter(path -> AccessScopeResolver.effectiveRole(path, scope)
                            .map(role -> role.atLeast(minimumRole))
                            .orElse(false))
                    .collect(Collectors.toSet());
        }
        if (effective.nodeId() != null) {
            HierarchyNode node = hierarchyNodeRepository.findByIdAndActiveTrue(effective.nodeId())
                    .orElseThrow(() -> nodeNotFound(effective.nodeId()));
            paths = paths.stream()
                    .filter(path -> path.equals(node.getPath())
                            || effective.includeDescendants() && MaterializedPath.isAncestor(node.getPath(), path))
                    .collect(Collectors.toSet());
        }

        boolean selfEligible = !effective.excludeSelf()
                && (minimumRole == null || minimumRole == GrantRole.READ)
                && effective.nodeId() == null;

        int page = effective.page() == null ? 0 : Math.max(effective.page(), 0);
        int size = effective.size() == null || effective.size() <= 0
                ? defaultPageSize
                : Math.min(effective.size(), maxPageSize);

        AccessibleMemberSearchCondition condition = new AccessibleMemberSearchCondition(
                paths,
                selfEligible ? actorId : null,
                effective.excludeSelf() ? actorId : null,
                effective.search(),
                effective.active(),
                effective.createdAfter(),
                effective.createdBefore(),
                effective.lastLoginAfter(),
                effective.lastLoginBefore(),
                effective.levels(),
                parseSortField(effective.sortBy()),
                !"desc".equalsIgnoreCase(effective.sortDirection())
        );

        Page<OrgMember> result = orgMemberRepository.searchAccessibleMembers(condition, PageRequest.of(page, size));
        return new AccessibleMemberPage(
                result.getContent().stream()
                        .map(member -> new AccessibleMember(member, provenance(actorId, member, scope)))
                        .toList(),
                page,
                size,
                result.getTotalElements(),
                result.getTotalPages(),
                paths.size()
        );
    }

    /**
     * Counts the members on the actor's accessible paths, or on one accessible node (and its accessible
     * descendants when {@code includeDescendants}). A node outside the scope is reported as not found.
     */
    public MemberStatistics memberStatistics(UUID actorId, UUID nodeId, boolean includeDescendants) {
        AccessScope scope = accessScopeService.computeScope(actorId);
        Set<String> paths = scope.accessiblePaths();
        if (nodeId != null) {
            HierarchyNode node = hierarchyNodeRepository.findByIdAndActiveTrue(nodeId)
                    .filter(candidate -> AccessScopeResolver.isPathAccessible(candidate.getPath(), scope))
                    .orElseThrow(() -> nodeNotFound(nodeId));
            paths = paths.stream()
                    .filter(path -> path.equals(node.getPath())
                            || includeDescendants && MaterializedPath.isAncestor(node.getPath(), path))
                    .collect(Collectors.toSet());
        }

        List<OrgMember> members = paths.isEmpty() ? List.of() : orgMemberRepository.findAllByActiveBaseNodePathIn(paths);
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(RECENT_DAYS);

        Map<UUID, List<OrgMember>> byNode = new LinkedHashMap<>();
        for (OrgMember member : members) {
            byNode.computeIfAbsent(member.getBaseNode().getId(), id -> new ArrayList<>()).add(member);
        }
        long total = members.size();
        List<MemberStatistics.NodeCount> nodeCounts = byNode.values().stream()
                .map(group -> {
                    HierarchyNode node = group.get(0).getBaseNode();
                    double share = total == 0 ? 0 : Math.round(group.size() * 10_000.0 / total) / 100.0;
                    return new MemberStatistics.NodeCount(node.getId(), node.getName(), node.getPath(),
                            group.size(), group.stream().filter(OrgMember::isActive).count(), share);
                })
                .toList();

        long active = members.stream().filter(OrgMember::isActive).count();
        MemberStatistics statistics = new MemberStatistics(
                total,
                active,
                total - active,
                nodeCounts,
                roleDistribution(members),
                members.stream().filter(member -> isOnOrAfter(member.getCreatedAt(), since)).count(),
                members.stream().filter(member -> isOnOrAfter(member.getLastLoginAt(), since)).count(),
                paths.size()
        );
        log.debug("Member statistics for actor {}: {} members over {} paths", actorId, total, paths.size());
        return statistics;
    }

    /**
     * Active accessible members whose name or email contains {@code term}, ordered by name.
     */
    public List<MemberSuggestion> suggestMembers(UUID actorId, String term, Integer limit) {
        String keyword = term == null ? "" : term.trim();
        if (keyword.length() < 2) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_SEARCH", "search term must be at least 2 characters");
        }
        int size = limit == null ? DEFAULT_SUGGESTION_LIMIT : Math.min(Math.max(limit, 1), MAX_SUGGESTION_LIMIT);

        AccessScope scope = accessScopeService.computeScope(actorId);
        AccessibleMemberSearchCondition condition = new AccessibleMemberSearchCondition(
                scope.accessiblePaths(),
                actorId,
                null,
                keyword,
                true,
                null,
                null,
                null,
                null,
                Set.of(),
                AccessibleMemberSortField.NAME,
                true
        );
        return orgMemberRepository.searchAccessibleMembers(condition, PageRequest.of(0, size)).getContent().stream()
                .map(member -> new MemberSuggestion(
                        member.getId(),
                        member.getFullName(),
                        member.getEmail(),
                        member.getBaseNode() != null ? member.getBaseNode().getName() : null))
                .toList();
    }

    /**
     * Looks up specific members, keeping only the active ones the actor can reach, in request order.
     * Unknown and unreachable ids are left out rather than reported.
     */
    public List<BulkMemberResult> bulkQuery(UUID actorId, List<UUID> memberIds, boolean includeGrants) {
        if (memberIds == null || memberIds.isEmpty()) {
            throw new ProblemException(ErrorKind.VALIDATION, "MEMBER_IDS_REQUIRED", "at least one member id is required");
        }
        if (memberIds.size() > MAX_BULK_SIZE) {
            throw new ProblemException(ErrorKind.VALIDATION, "TOO_MANY_MEMBERS",
                    "at most %d members per bulk query".formatted(MAX_BULK_SIZE));
        }
        List<UUID> ids = memberIds.stream().filter(Objects::nonNull).distinct().toList();
        AccessScope scope = accessScopeService.grantScope(actorId);
        Map<UUID, OrgMember> found = orgMemberRepository.findAllWithBaseNodeByIdIn(ids).stream()
                .collect(Collectors.toMap(OrgMember::getId, Function.identity()));
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<BulkMemberResult> results = new ArrayList<>();
        for (UUID id : ids) {
            OrgMember member = found.get(id);
            if (member == null || !member.isActive()) {
                continue;
            }
            HierarchyNode baseNode = member.getBaseNode();
            boolean placed = baseNode != null && baseNode.isActive();
            AccessDecision decision;
            if (id.equals(actorId)) {
                decision = AccessScopeResolver.decideSelf(placed ? baseNode.getPath() : null, scope);
            } else if (placed) {
                decision = AccessScopeResolver.decide(baseNode.getPath(), scope);
            } else {
                continue;
            }
            if (!decision.canAccess()) {
                continue;
            }
            List<AccessGrant> grants = includeGrants ? accessGrantRepository.findEffectiveByActorId(id, now) : List.of();
            results.add(new BulkMemberResult(new AccessibleMember(member, decision), grants));
        }
        log.info("Bulk member query by {}: {} requested, {} accessible", actorId, ids.size(), results.size());
        return results;
    }

    private Map<GrantRole, Long> roleDistribution(List<OrgMember> members) {
        Map<GrantRole, Long> byRole = new EnumMap<>(GrantRole.class);
        for (GrantRole role : GrantRole.values()) {
            byRole.put(role, 0L);
        }
        List<UUID> activeIds = members.stream().filter(OrgMember::isActive).map(OrgMember::getId).toList();
        if (!activeIds.isEmpty()) {
            for (AccessGrant grant : accessGrantRepository.findEffectiveByActorIdIn(activeIds, OffsetDateTime.now(clock))) {
                byRole.merge(grant.getRole(), 1L, Long::sum);
            }
        }
        return byRole;
    }

    private static boolean isOnOrAfter(OffsetDateTime value, OffsetDateTime since) {
        return value != null && !value.isBefore(since);
    }

    private static ProblemException nodeNotFound(UUID nodeId) {
        return new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND", "hierarchy node %s not found".formatted(nodeId));
    }

    private static AccessDecision provenance(UUID actorId, OrgMember member, AccessScope scope) {
        if (member.getId().equals(actorId)) {
            HierarchyNode baseNode = member.getBaseNode();
            return AccessScopeResolver.decideSelf(baseNode != null ? baseNode.getPath() : null, scope);
        }
        return AccessScopeResolver.decide(member.getBaseNode().getPath(), scope);
    }

    private static AccessibleMemberSortField parseSortField(String sortBy) {
        if (!StringUtils.hasText(sortBy)) {
            return AccessibleMemberSortField.NAME;
        }
        return switch (sortBy.trim().toLowerCase(Locale.ROOT)) {
            case "name" -> AccessibleMemberSortField.NAME;
            case "email" -> AccessibleMemberSortField.EMAIL;
            case "path" -> AccessibleMemberSortField.PATH;
            case "createdat", "created_at" -> AccessibleMemberSortField.CREATED_AT;
            default -> throw new ProblemException(ErrorKind.VALIDATION, "INVALID_SORT",
                    "cannot sort by '%s'".formatted(sortBy));
        };
    }
}
