package com.orgscope.backend.modules.hierarchy.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.application.AccessScopeService;
import com.orgscope.backend.modules.audit.application.AuditLogService;
import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.grant.infrastructure.persistence.AccessGrantRepository;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyIntegrityChecker;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyStatistics;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyTreeBuilder;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyTreeNode;
import com.orgscope.backend.modules.hierarchy.domain.IntegrityIssue;
import com.orgscope.backend.modules.hierarchy.domain.IntegrityReport;
import com.orgscope.backend.modules.hierarchy.domain.IntegritySeverity;
import com.orgscope.backend.modules.hierarchy.domain.MaterializedPath;
import com.orgscope.backend.modules.hierarchy.infrastructure.persistence.HierarchyNodeRepository;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.modules.member.infrastructure.persistence.OrgMemberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class HierarchyService {

    private static final Logger log = LoggerFactory.getLogger(HierarchyService.class);
    private static final String RESOURCE_TYPE = "HIERARCHY_NODE";

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final AccessGrantRepository accessGrantRepository;
    private final OrgMemberRepository orgMemberRepository;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final int maxDepth;

    public HierarchyService(
            HierarchyNodeRepository hierarchyNodeRepository,
            AccessGrantRepository accessGrantRepository,
            OrgMemberRepository orgMemberRepository,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${app.hierarchy.max-depth:10}") int maxDepth
    ) {
        this.hierarchyNodeRepository = hierarchyNodeRepository;
        this.accessGrantRepository = accessGrantRepository;
        this.orgMemberRepository = orgMemberRepository;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    /**
     * Creates a node under {@code parentId}, or a new root when it is null. The creator of a root
     * receives an inheriting ADMIN grant on it, since nobody else could manage the new tree.
     */
    public HierarchyNode createNode(UUID actorId, CreateNodeCommand command) {
        MaterializedPath.validateCode(command.code());

        HierarchyNode parent = null;
        OrgMember creator = null;
        if (command.parentId() != null) {
            parent = hierarchyNodeRepository.findByIdAndActiveTrue(command.parentId())
                    .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "PARENT_NOT_FOUND",
                            "parent node %s not found".formatted(command.parentId())));
            accessScopeService.requireRole(actorId, parent, GrantRole.MANAGER);
            if (parent.getLevel() + 1 >= maxDepth) {
                throw new ProblemException(ErrorKind.BUSINESS_RULE, "MAX_DEPTH_EXCEEDED",
                        "hierarchy cannot be deeper than %d levels".formatted(maxDepth));
            }
        } else {
            creator = orgMemberRepository.findByIdAndActiveTrue(actorId)
                    .orElseThrow(() -> new ProblemException(ErrorKind.UNAUTHORIZED, "UNKNOWN_ACTOR",
                            "actor %s is not an active member".formatted(actorId)));
        }

        ensureCodeAvailable(parent != null ? parent.getId() : null, command.code());

        HierarchyNode node = new HierarchyNode();
        node.setName(command.name().trim());
        node.setCode(command.code());
        node.setSortOrder(command.sortOrder() != null ? command.sortOrder() : 0);
        node.setMetadata(command.metadata());
        node.placeUnder(parent);

        try {
            node = hierarchyNodeRepository.saveAndFlush(node);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ErrorKind.CONFLICT, "DUPLICATE_CODE",
                    "path '%s' is already in use".formatted(node.getPath()));
        }

        if (creator != null) {
            AccessGrant ownerGrant = new AccessGrant();
            ownerGrant.setActor(creator);
            ownerGrant.setNode(node);
            ownerGrant.setRole(GrantRole.ADMIN);
            ownerGrant.setInheritToDescendants(true);
            ownerGrant.setValidFrom(now());
            ownerGrant.setGrantedBy(actorId);
            accessGrantRepository.save(ownerGrant);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("path", node.getPath());
        detail.put("parentId", node.getParentId());
        auditLogService.record("NODE_CREATED", RESOURCE_TYPE, node.getId(), actorId, detail);
        return node;
    }

    @Transactional(readOnly = true)
    public HierarchyNode getNode(UUID nodeId) {
        return loadActive(nodeId);
    }

    @Transactional(readOnly = true)
    public HierarchyNode getNodeByPath(String path) {
        MaterializedPath.requireValid(path);
        return hierarchyNodeRepository.findByPathAndActiveTrue(path)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND",
                        "no active node at path '%s'".formatted(path)));
    }

    /**
     * Edits display attributes. Path, level and parent only change through {@link #moveNode}.
     */
    public HierarchyNode updateNode(UUID actorId, UUID nodeId, UpdateNodeCommand command) {
        HierarchyNode node = loadActive(nodeId);
        accessScopeService.requireRole(actorId, node, GrantRole.MANAGER);

        Map<String, Object> changes = new LinkedHashMap<>();
        if (command.name() != null) {
            String name = command.name().trim();
            if (name.isEmpty()) {
                throw new ProblemException(ErrorKind.VALIDATION, "INVALID_NAME", "node name must not be blank");
            }
            boolean taken = siblingsOf(node).stream()
                    .anyMatch(sibling -> !sibling.getId().equals(node.getId()) && sibling.getName().equalsIgnoreCase(name));
            if (taken) {
                throw new ProblemException(ErrorKind.CONFLICT, "DUPLICATE_NAME",
                        "a sibling named '%s' already exists".formatted(name));
            }
            changes.put("name", name);
            node.setName(name);
        }
        if (command.sortOrder() != null) {
            changes.put("sortOrder", command.sortOrder());
            node.setSortOrder(command.sortOrder());
        }
        if (command.metadata() != null) {
            changes.put("metadata", command.metadata());
            node.setMetadata(command.metadata());
        }

        if (!changes.isEmpty()) {
            auditLogService.record("NODE_UPDATED", RESOURCE_TYPE, node.getId(), actorId, changes);
        }
        return node;
    }

    /**
     * Moves a node and its whole active subtree under {@code newParentId} (or to the root level when null).
     * The moving node, the destination and every descendant are locked before any row is rewritten, so
     * overlapping moves serialize and readers see either the old or the new tree.
     * <p>
     * Moving to the root level needs ADMIN on the node only; otherwise ADMIN is needed on the destination too.
     */
    public HierarchyNode moveNode(UUID actorId, UUID nodeId, UUID newParentId) {
        if (nodeId.equals(newParentId)) {
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "CIRCULAR_MOVE", "a node cannot become its own parent");
        }

        // Lock both rows before the role checks pull grant nodes into the persistence context.
        HierarchyNode node = hierarchyNodeRepository.findByIdForUpdate(nodeId)
                .filter(HierarchyNode::isActive)
                .orElseThrow(() -> nodeNotFound(nodeId));
        HierarchyNode newParent = null;
        if (newParentId != null) {
            newParent = hierarchyNodeRepository.findByIdForUpdate(newParentId)
                    .filter(HierarchyNode::isActive)
                    .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "PARENT_NOT_FOUND",
                            "target parent %s not found".formatted(newParentId)));
        }

        accessScopeService.requireRole(actorId, node, GrantRole.ADMIN);
        if (newParent != null) {
            if (MaterializedPath.isSelfOrDescendant(newParent.getPath(), node.getPath())) {
                throw new ProblemException(ErrorKind.BUSINESS_RULE, "CIRCULAR_MOVE",
                        "cannot move '%s' under its own descendant '%s'".formatted(node.getPath(), newParent.getPath()));
            }
            accessScopeService.requireRole(actorId, newParent, GrantRole.ADMIN);
        }

        if (Objects.equals(node.getParentId(), newParentId)) {
            return node;
        }

        ensureCodeAvailable(newParentId, node.getCode());

        String oldPath = node.getPath();
        int oldLevel = node.getLevel();
        List<HierarchyNode> descendants = hierarchyNodeRepository.lockActiveDescendants(MaterializedPath.descendantPattern(oldPath));

        int newLevel = newParent != null ? newParent.getLevel() + 1 : 0;
        int subtreeHeight = descendants.stream().mapToInt(HierarchyNode::getLevel).max().orElse(oldLevel) - oldLevel;
        if (newLevel + subtreeHeight >= maxDepth) {
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "MAX_DEPTH_EXCEEDED",
                    "moving '%s' would exceed %d levels".formatted(oldPath, maxDepth));
        }

        node.placeUnder(newParent);
        String newPath = node.getPath();
        int levelDelta = node.getLevel() - oldLevel;
        int cutFrom = oldPath.length() + 1;
        OffsetDateTime now = now();

        int rebased = hierarchyNodeRepository.rebaseActiveDescendants(
                MaterializedPath.descendantPattern(oldPath), cutFrom, newPath, levelDelta, now);

        List<UUID> subtreeIds = new ArrayList<>(descendants.size() + 1);
        subtreeIds.add(nodeId);
        descendants.forEach(descendant -> subtreeIds.add(descendant.getId()));
        int grantsRebased = accessGrantRepository.rebaseNodePaths(subtreeIds, cutFrom, newPath, now);

        log.info("Moved {} -> {} ({} descendants, {} grants)", oldPath, newPath, rebased, grantsRebased);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("oldPath", oldPath);
        detail.put("newPath", newPath);
        detail.put("newParentId", newParentId);
        detail.put("descendantsMoved", rebased);
        auditLogService.record("NODE_MOVED", RESOURCE_TYPE, nodeId, actorId, detail);

        return loadActive(nodeId);
    }

    /**
     * Soft-deletes a node with its whole subtree and returns the number of deactivated nodes.
     * Without {@code force}, a node that still has active children or members is refused.
     */
    public int deleteNode(UUID actorId, UUID nodeId, boolean force) {
        HierarchyNode node = hierarchyNodeRepository.findByIdForUpdate(nodeId)
                .filter(HierarchyNode::isActive)
                .orElseThrow(() -> nodeNotFound(nodeId));
        accessScopeService.requireRole(actorId, node, GrantRole.ADMIN);

        if (!force) {
            boolean hasChildren = hierarchyNodeRepository.existsByParentIdAndActiveTrue(nodeId);
            long members = orgMemberRepository.countActiveByBaseNodeId(nodeId);
            if (hasChildren || members > 0) {
                throw new ProblemException(ErrorKind.BUSINESS_RULE, "NODE_HAS_DEPENDENTS",
                        "'%s' still has %s; pass force=true to delete the subtree".formatted(
                                node.getPath(), hasChildren ? "child nodes" : members + " member(s)"));
            }
        }

        String pattern = MaterializedPath.descendantPattern(node.getPath());
        hierarchyNodeRepository.lockActiveDescendants(pattern);
        int deactivated = hierarchyNodeRepository.softDeleteSubtree(nodeId, pattern, now());

        log.info("Soft-deleted subtree {} ({} nodes, force={})", node.getPath(), deactivated, force);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("path", node.getPath());
        detail.put("force", force);
        detail.put("nodesDeactivated", deactivated);
        auditLogService.record("NODE_DELETED", RESOURCE_TYPE, nodeId, actorId, detail);
        return deactivated;
    }

    @Transactional(readOnly = true)
    public List<HierarchyTreeNode> getTree() {
        return HierarchyTreeBuilder.build(hierarchyNodeRepository.findByActiveTrue());
    }

    @Transactional(readOnly = true)
    public List<HierarchyNode> getChildren(UUID parentId) {
        if (parentId == null) {
            return hierarchyNodeRepository.findByParentIdIsNullAndActiveTrueOrderBySortOrderAscNameAsc();
        }
        loadActive(parentId);
        return hierarchyNodeRepository.findByParentIdAndActiveTrueOrderBySortOrderAscNameAsc(parentId);
    }

    @Transactional(readOnly = true)
    public List<HierarchyNode> getDescendants(UUID nodeId, boolean includeSelf) {
        HierarchyNode node = loadActive(nodeId);
        List<HierarchyNode> result = new ArrayList<>();
        if (includeSelf) {
            result.add(node);
        }
        result.addAll(hierarchyNodeRepository.findActiveDescendants(MaterializedPath.descendantPattern(node.getPath())));
        return result;
    }

    /**
     * Ancestors ordered from the root down.
     */
    @Transactional(readOnly = true)
    public List<HierarchyNode> getAncestors(UUID nodeId, boolean includeSelf) {
        HierarchyNode node = loadActive(nodeId);
        List<String> paths = MaterializedPath.ancestorPaths(node.getPath());
        List<HierarchyNode> result = new ArrayList<>(paths.isEmpty()
                ? List.of()
                : hierarchyNodeRepository.findActiveByPathIn(paths));
        if (includeSelf) {
            result.add(node);
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<HierarchyNode> getSiblings(UUID nodeId, boolean includeSelf) {
        HierarchyNode node = loadActive(nodeId);
        return siblingsOf(node).stream()
                .filter(sibling -> includeSelf || !sibling.getId().equals(nodeId))
                .toList();
    }

    public IntegrityReport validateIntegrity(UUID actorId) {
        List<HierarchyNode> nodes = hierarchyNodeRepository.findAll();
        List<IntegrityIssue> issues = HierarchyIntegrityChecker.check(nodes);
        long checked = nodes.stream().filter(HierarchyNode::isActive).count();
        IntegrityReport report = IntegrityReport.of(issues, checked, now());

        for (IntegrityIssue issue : issues) {
            if (issue.severity() == IntegritySeverity.ERROR) {
                log.error("Hierarchy integrity {} at {}: {}", issue.type(), issue.path(), issue.message());
            } else {
                log.warn("Hierarchy integrity {} at {}: {}", issue.type(), issue.path(), issue.message());
            }
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("checkedNodes", checked);
        detail.put("errors", report.errorCount());
        detail.put("warnings", report.warningCount());
        detail.put("issues", issues.stream()
                .map(issue -> Map.of("nodeId", issue.nodeId().toString(), "type", issue.type().name()))
                .toList());
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "HIERARCHY_INTEGRITY_CHECKED", "HIERARCHY", "integrity", actorId, null, detail));
        return report;
    }

    @Transactional(readOnly = true)
    public HierarchyStatistics getStatistics() {
        return HierarchyStatistics.of(hierarchyNodeRepository.findByActiveTrue());
    }

    private List<HierarchyNode> siblingsOf(HierarchyNode node) {
        return node.getParentId() == null
                ? hierarchyNodeRepository.findByParentIdIsNullAndActiveTrueOrderBySortOrderAscNameAsc()
                : hierarchyNodeRepository.findByParentIdAndActiveTrueOrderBySortOrderAscNameAsc(node.getParentId());
    }

    private void ensureCodeAvailable(UUID parentId, String code) {
        boolean taken = parentId == null
                ? hierarchyNodeRepository.existsByParentIdIsNullAndCodeAndActiveTrue(code)
                : hierarchyNodeRepository.existsByParentIdAndCodeAndActiveTrue(parentId, code);
        if (taken) {
            throw new ProblemException(ErrorKind.CONFLICT, "DUPLICATE_CODE",
                    "code '%s' is already used by a sibling".formatted(code));
        }
    }

    private HierarchyNode loadActive(UUID nodeId) {
        return hierarchyNodeRepository.findByIdAndActiveTrue(nodeId).orElseThrow(() -> nodeNotFound(nodeId));
    }

    private static ProblemException nodeNotFound(UUID nodeId) {
        return new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND", "hierarchy node %s not found".formatted(nodeId));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public record CreateNodeCommand(
            String name,
            String code,
            UUID parentId,
            Integer sortOrder,
            Map<String, Object> metadata
    ) {
    }

    public record UpdateNodeCommand(
            String name,
            Integer sortOrder,
            Map<String, Object> metadata
    ) {
    }
}
