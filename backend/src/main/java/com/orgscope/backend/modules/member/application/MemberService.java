package com.orgscope.backend.modules.member.application;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.application.AccessScopeService;
import com.orgscope.backend.modules.audit.application.AuditLogService;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.infrastructure.persistence.HierarchyNodeRepository;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.modules.member.infrastructure.persistence.OrgMemberRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MemberService {

    private static final String RESOURCE_TYPE = "ORG_MEMBER";

    private final OrgMemberRepository orgMemberRepository;
    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;

    public MemberService(
            OrgMemberRepository orgMemberRepository,
            HierarchyNodeRepository hierarchyNodeRepository,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService
    ) {
        this.orgMemberRepository = orgMemberRepository;
        this.hierarchyNodeRepository = hierarchyNodeRepository;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
    }

    public OrgMember register(UUID actorId, String email, String fullName, UUID baseNodeId) {
        HierarchyNode baseNode = loadNode(baseNodeId);
        accessScopeService.requireRole(actorId, baseNode, GrantRole.MANAGER);

        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (orgMemberRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw emailTaken(normalizedEmail);
        }

        OrgMember member = new OrgMember();
        member.setEmail(normalizedEmail);
        member.setFullName(fullName.trim());
        member.setBaseNode(baseNode);
        try {
            member = orgMemberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw emailTaken(normalizedEmail);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("email", normalizedEmail);
        detail.put("basePath", baseNode.getPath());
        auditLogService.record("MEMBER_REGISTERED", RESOURCE_TYPE, member.getId(), actorId, detail);
        return member;
    }

    @Transactional(readOnly = true)
    public OrgMember get(UUID memberId) {
        return orgMemberRepository.findWithBaseNodeById(memberId)
                .orElseThrow(() -> memberNotFound(memberId));
    }

    /**
     * Moves a member to another node; the actor needs MANAGER at both the current and the new node.
     */
    public OrgMember relocate(UUID actorId, UUID memberId, UUID baseNodeId) {
        OrgMember member = orgMemberRepository.findWithBaseNodeById(memberId)
                .filter(OrgMember::isActive)
                .orElseThrow(() -> memberNotFound(memberId));
        HierarchyNode target = loadNode(baseNodeId);
        HierarchyNode current = member.getBaseNode();
        if (current != null && current.isActive()) {
            accessScopeService.requireRole(actorId, current, GrantRole.MANAGER);
        }
        accessScopeService.requireRole(actorId, target, GrantRole.MANAGER);

        member.setBaseNode(target);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("fromPath", current != null ? current.getPath() : null);
        detail.put("toPath", target.getPath());
        auditLogService.record("MEMBER_RELOCATED", RESOURCE_TYPE, member.getId(), actorId, detail);
        return member;
    }

    public OrgMember deactivate(UUID actorId, UUID memberId) {
        OrgMember member = orgMemberRepository.findWithBaseNodeById(memberId)
                .filter(OrgMember::isActive)
                .orElseThrow(() -> memberNotFound(memberId));
        requireManagerOver(actorId, member);

        member.setActive(false);
        auditLogService.record("MEMBER_DEACTIVATED", RESOURCE_TYPE, member.getId(), actorId, Map.of("email", member.getEmail()));
        return member;
    }

    /**
     * Changes a member's name or email. Members may edit their own record; anyone else needs MANAGER at
     * the member's node.
     */
    public OrgMember update(UUID actorId, UUID memberId, UpdateMemberCommand command) {
        OrgMember member = orgMemberRepository.findWithBaseNodeById(memberId)
                .filter(OrgMember::isActive)
                .orElseThrow(() -> memberNotFound(memberId));
        if (!memberId.equals(actorId)) {
            requireManagerOver(actorId, member);
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        if (command.fullName() != null) {
            String fullName = command.fullName().trim();
            if (fullName.isEmpty()) {
                throw new ProblemException(ErrorKind.VALIDATION, "INVALID_NAME", "fullName must not be blank");
            }
            if (!fullName.equals(member.getFullName())) {
                changes.put("fullName", fullName);
                member.setFullName(fullName);
            }
        }
        if (command.email() != null) {
            String email = command.email().trim().toLowerCase(Locale.ROOT);
            if (!email.equals(member.getEmail())) {
                if (orgMemberRepository.existsByEmailIgnoreCaseAndIdNot(email, memberId)) {
                    throw emailTaken(email);
                }
                changes.put("email", Map.of("from", member.getEmail(), "to", email));
                member.setEmail(email);
            }
        }

        if (!changes.isEmpty()) {
            try {
                orgMemberRepository.saveAndFlush(member);
            } catch (DataIntegrityViolationException ex) {
                throw emailTaken(member.getEmail());
            }
            auditLogService.record("MEMBER_UPDATED", RESOURCE_TYPE, member.getId(), actorId, changes);
        }
        return member;
    }

    /**
     * Restores a deactivated member at their recorded node, which must still be active.
     */
    public OrgMember reactivate(UUID actorId, UUID memberId) {
        OrgMember member = orgMemberRepository.findWithBaseNodeById(memberId)
                .orElseThrow(() -> memberNotFound(memberId));
        if (member.isActive()) {
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "MEMBER_ALREADY_ACTIVE",
                    "member %s is already active".formatted(memberId));
        }
        HierarchyNode baseNode = member.getBaseNode();
        if (baseNode == null || !baseNode.isActive()) {
            throw new ProblemException(ErrorKind.BUSINESS_RULE, "BASE_NODE_INACTIVE",
                    "member %s is not placed in an active node".formatted(memberId));
        }
        accessScopeService.requireRole(actorId, baseNode, GrantRole.MANAGER);

        member.setActive(true);
        auditLogService.record("MEMBER_REACTIVATED", RESOURCE_TYPE, member.getId(), actorId,
                Map.of("email", member.getEmail(), "basePath", baseNode.getPath()));
        return member;
    }

    private void requireManagerOver(UUID actorId, OrgMember member) {
        HierarchyNode baseNode = member.getBaseNode();
        if (baseNode != null && baseNode.isActive()) {
            accessScopeService.requireRole(actorId, baseNode, GrantRole.MANAGER);
        } else if (!accessScopeService.isSystemOperator(actorId)) {
            throw new ProblemException(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_PRIVILEGES",
                    "only a system operator can change a member outside the active hierarchy");
        }
    }

    private HierarchyNode loadNode(UUID nodeId) {
        return hierarchyNodeRepository.findByIdAndActiveTrue(nodeId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "NODE_NOT_FOUND",
                        "hierarchy node %s not found".formatted(nodeId)));
    }

    private static ProblemException memberNotFound(UUID memberId) {
        return new ProblemException(ErrorKind.NOT_FOUND, "MEMBER_NOT_FOUND", "member %s not found".formatted(memberId));
    }

    private static ProblemException emailTaken(String email) {
        return new ProblemException(ErrorKind.CONFLICT, "EMAIL_TAKEN", "email '%s' is already registered".formatted(email));
    }

    public record UpdateMemberCommand(String fullName, String email) {
    }
}
