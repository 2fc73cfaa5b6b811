package com.orgscope.backend.modules.grant.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.application.AccessScopeService;
import com.orgscope.backend.modules.audit.application.AuditLogService;
import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.grant.infrastructure.persistence.AccessGrantRepository;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.infrastructure.persistence.HierarchyNodeRepository;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.modules.member.infrastructure.persistence.OrgMemberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class GrantService {

    private static final Logger log = LoggerFactory.getLogger(GrantService.class);
    private static final String RESOURCE_TYPE = "ACCESS_GRANT";

    private final AccessGrantRepository accessGrantRepository;
    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final OrgMemberRepository orgMemberRepository;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public GrantService(
            AccessGrantRepository accessGrantRepository,
            HierarchyNodeRepository hierarchyNodeRepository,
            OrgMemberRepository orgMemberRepository,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.accessGrantRepository = accessGrantRepository;
        this.hierarchyNodeRepository = hierarchyNodeRepository;
        this.orgMemberRepository = orgMemberRepository;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public AccessGrant grant(UUID granterId, GrantCommand command) {
        OffsetDateTime now = now();
        OrgMember actor = orgMemberRepository.findByIdAndActiveTrue(command.actorId())
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "MEMBER_NOT_FOUND",
                        "member %s not found".formatted(command.actorId())));
        HierarchyNode node = hierarchyNodeRepository.findByIdAndActiveTrue(command.nodeId())
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND",
                        "hierarchy node %s not found".formatted(command.nodeId())));
        validateExpiry(command.validUntil(), now);
        if (command.validFrom() != null && command.validUntil() != null && !command.validUntil().isAfter(command.validFrom())) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_EXPIRY", "validUntil must be after validFrom");
        }

        accessScopeService.requireGrantAuthority(granterId, node, command.role());

        if (accessGrantRepository.existsByActor_IdAndNode_IdAndActiveTrue(actor.getId(), node.getId())) {
            throw duplicateGrant(actor.getId(), node);
        }

        AccessGrant grant = new AccessGrant();
        grant.setActor(actor);
        grant.setNode(node);
        grant.setRole(command.role());
        grant.setInheritToDescendants(command.inheritToDescendants() == null || command.inheritToDescendants());
        grant.setValidFrom(command.validFrom() != null ? command.validFrom() : now);
        grant.setValidUntil(command.validUntil());
        grant.setGrantedBy(granterId);

        try {
            grant = accessGrantRepository.saveAndFlush(grant);
        } catch (DataIntegrityViolationException ex) {
            throw duplicateGrant(actor.getId(), node);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("actorId", actor.getId());
        detail.put("nodePath", node.getPath());
        detail.put("role", grant.getRole().name());
        detail.put("inheritToDescendants", grant.isInheritToDescendants());
        detail.put("validUntil", grant.getValidUntil() != null ? grant.getValidUntil().toString() : null);
        auditLogService.record("GRANT_CREATED", RESOURCE_TYPE, grant.getId(), granterId, detail);
        return grant;
    }

    public AccessGrant revoke(UUID revokerId, UUID grantId, String reason) {
        AccessGrant grant = loadGrant(grantId);
        if (!grant.isActive()) {
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "GRANT_ALREADY_INACTIVE",
                    "grant %s is already inactive".formatted(grantId));
        }
        requireManageAuthority(revokerId, grant);

        grant.revoke(revokerId, now());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("actorId", grant.getActor().getId());
        detail.put("nodePath", grant.getNodePath());
        detail.put("role", grant.getRole().name());
        detail.put("reason", reason);
        auditLogService.record("GRANT_REVOKED", RESOURCE_TYPE, grant.getId(), revokerId, detail);
        return grant;
    }

    public AccessGrant update(UUID updaterId, UUID grantId, UpdateGrantCommand command) {
        AccessGrant grant = loadGrant(grantId);
        if (!grant.isActive()) {
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "GRANT_ALREADY_INACTIVE",
                    "grant %s is inactive and cannot be updated".formatted(grantId));
        }
        requireManageAuthority(updaterId, grant);

        Map<String, Object> changes = new LinkedHashMap<>();
        if (command.role() != null && command.role() != grant.getRole()) {
            accessScopeService.requireGrantAuthority(updaterId, grant.getNode(), command.role());
            changes.put("role", Map.of("from", grant.getRole().name(), "to", command.role().name()));
            grant.setRole(command.role());
        }
        if (command.inheritToDescendants() != null && command.inheritToDescendants() != grant.isInheritToDescendants()) {
            changes.put("inheritToDescendants", command.inheritToDescendants());
            grant.setInheritToDescendants(command.inheritToDescendants());
        }
        if (command.clearValidUntil()) {
            changes.put("validUntil", null);
            grant.setValidUntil(null);
        } else if (command.validUntil() != null) {
            validateExpiry(command.validUntil(), now());
            changes.put("validUntil", command.validUntil().toString());
            grant.setValidUntil(command.validUntil());
        }

        if (!changes.isEmpty()) {
            auditLogService.record("GRANT_UPDATED", RESOURCE_TYPE, grant.getId(), updaterId, changes);
        }
        return grant;
    }

    /**
     * Grants held by {@code actorId}. Visible to the holder, to system operators and to anyone whose scope
     * reaches the holder.
     *
     * @param includeExpired also return revoked and expired grants
     */
    @Transactional(readOnly = true)
    public List<AccessGrant> findByActor(UUID callerId, UUID actorId, boolean includeExpired) {
        if (!actorId.equals(callerId)
                && !accessScopeService.isSystemOperator(callerId)
                && !accessScopeService.checkMemberAccess(callerId, actorId).canAccess()) {
            log.warn("Actor {} asked for grants of {} outside their scope", callerId, actorId);
            throw new ProblemException(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_PRIVILEGES",
                    "member %s is outside your scope".formatted(actorId));
        }
        return includeExpired
                ? accessGrantRepository.findAllByActorId(actorId)
                : accessGrantRepository.findEffectiveByActorId(actorId, now());
    }

    /**
     * Active grants placed at a node. Needs MANAGER there.
     */
    @Transactional(readOnly = true)
    public List<AccessGrant> findByNode(UUID callerId, UUID nodeId) {
        HierarchyNode node = hierarchyNodeRepository.findByIdAndActiveTrue(nodeId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND",
                        "hierarchy node %s not found".formatted(nodeId)));
        accessScopeService.requireRole(callerId, node, GrantRole.MANAGER);
        return accessGrantRepository.findActiveByNodeId(nodeId);
    }

    /**
     * Effective grants whose node is still active, with the node loaded.
     */
    @Transactional(readOnly = true)
    public List<AccessGrant> findActiveByActorWithNodeInfo(UUID actorId) {
        return accessGrantRepository.findEffectiveOnActiveNodesByActorId(actorId, now());
    }

    /**
     * The grant holder may always give up their own grant; anyone else needs MANAGER at the grant's node.
     */
    private void requireManageAuthority(UUID callerId, AccessGrant grant) {
        if (grant.getActor().getId().equals(callerId)) {
            return;
        }
        accessScopeService.requireGrantAuthority(callerId, grant.getNode(), GrantRole.MANAGER);
    }

    private void validateExpiry(OffsetDateTime validUntil, OffsetDateTime now) {
        if (validUntil != null && !validUntil.isAfter(now)) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_EXPIRY", "validUntil must be in the future");
        }
    }

    private AccessGrant loadGrant(UUID grantId) {
        return accessGrantRepository.findById(grantId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "GRANT_NOT_FOUND",
                        "grant %s not found".formatted(grantId)));
    }

    private ProblemException duplicateGrant(UUID actorId, HierarchyNode node) {
        log.debug("Duplicate active grant for actor {} at {}", actorId, node.getPath());
        return new ProblemException(ErrorKind.CONFLICT, "DUPLICATE_GRANT",
                "member %s already holds an active grant at '%s'".formatted(actorId, node.getPath()));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public record GrantCommand(
            UUID actorId,
            UUID nodeId,
            GrantRole role,
            Boolean inheritToDescendants,
            OffsetDateTime validFrom,
            OffsetDateTime validUntil
    ) {
    }

    public record UpdateGrantCommand(
            GrantRole role,
            Boolean inheritToDescendants,
            OffsetDateTime validUntil,
            boolean clearValidUntil
    ) {
    }
}
