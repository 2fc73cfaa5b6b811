package com.orgscope.backend.modules.access.presentation;

import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.modules.access.application.AccessScopeService;
import com.orgscope.backend.modules.access.domain.AccessDecision;
import com.orgscope.backend.modules.access.presentation.dto.AccessScopeResponse;
import com.orgscope.backend.modules.access.presentation.dto.CanGrantResponse;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.hierarchy.application.HierarchyService;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/access")
public class AccessController {

    private final AccessScopeService accessScopeService;
    private final HierarchyService hierarchyService;

    public AccessController(AccessScopeService accessScopeService, HierarchyService hierarchyService) {
        this.accessScopeService = accessScopeService;
        this.hierarchyService = hierarchyService;
    }

    @Operation(summary = "Current actor's access scope", description = "Direct grants, every reachable path and the reachable member count.")
    @GetMapping("/scope")
    public ResponseEntity<AccessScopeResponse> myScope() {
        return ResponseEntity.ok(AccessScopeResponse.from(accessScopeService.computeScope(SecurityUtils.getCurrentActorId())));
    }

    @Operation(summary = "Another member's access scope", description = "Visible only to actors who can access that member.")
    @GetMapping("/scope/{actorId}")
    public ResponseEntity<AccessScopeResponse> scopeOf(@PathVariable("actorId") UUID actorId) {
        UUID caller = SecurityUtils.getCurrentActorId();
        if (!accessScopeService.isSystemOperator(caller)
                && !accessScopeService.checkMemberAccess(caller, actorId).canAccess()) {
            throw new ProblemException(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_PRIVILEGES",
                    "member %s is outside your scope".formatted(actorId));
        }
        return ResponseEntity.ok(AccessScopeResponse.from(accessScopeService.computeScope(actorId)));
    }

    @GetMapping("/check/nodes/{nodeId}")
    public ResponseEntity<AccessDecision> checkNode(@PathVariable("nodeId") UUID nodeId) {
        return ResponseEntity.ok(accessScopeService.checkNodeAccess(SecurityUtils.getCurrentActorId(), nodeId));
    }

    @GetMapping("/check/members/{memberId}")
    public ResponseEntity<AccessDecision> checkMember(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(accessScopeService.checkMemberAccess(SecurityUtils.getCurrentActorId(), memberId));
    }

    @GetMapping("/can-grant")
    public ResponseEntity<CanGrantResponse> canGrant(
            @RequestParam("nodeId") UUID nodeId,
            @RequestParam(name = "role", defaultValue = "READ") GrantRole role
    ) {
        HierarchyNode node = hierarchyService.getNode(nodeId);
        boolean allowed = accessScopeService.canGrant(SecurityUtils.getCurrentActorId(), node.getPath(), role);
        return ResponseEntity.ok(new CanGrantResponse(nodeId, node.getPath(), role, allowed));
    }
}
