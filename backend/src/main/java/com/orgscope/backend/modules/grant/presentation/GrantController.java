package com.orgscope.backend.modules.grant.presentation;

import java.util.List;
import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.modules.grant.application.GrantService;
import com.orgscope.backend.modules.grant.application.GrantService.GrantCommand;
import com.orgscope.backend.modules.grant.application.GrantService.UpdateGrantCommand;
import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.presentation.dto.CreateGrantRequest;
import com.orgscope.backend.modules.grant.presentation.dto.GrantResponse;
import com.orgscope.backend.modules.grant.presentation.dto.UpdateGrantRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/grants")
public class GrantController {

    private final GrantService grantService;

    public GrantController(GrantService grantService) {
        this.grantService = grantService;
    }

    @Operation(
            summary = "Grant access",
            description = """
                    Gives a member a role at a node, inherited by descendants unless `inheritToDescendants` is false. \
                    The granter needs MANAGER or ADMIN there and cannot hand out a role above their own.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Grant created"),
            @ApiResponse(responseCode = "403", description = "`INSUFFICIENT_PRIVILEGES`"),
            @ApiResponse(responseCode = "409", description = "`DUPLICATE_GRANT`"),
            @ApiResponse(responseCode = "422", description = "`PRIVILEGE_ESCALATION`")
    })
    @PostMapping
    public ResponseEntity<GrantResponse> grant(@Valid @RequestBody CreateGrantRequest request) {
        AccessGrant grant = grantService.grant(SecurityUtils.getCurrentActorId(), new GrantCommand(
                request.actorId(),
                request.nodeId(),
                request.role(),
                request.inheritToDescendants(),
                request.validFrom(),
                request.validUntil()
        ));
        return ResponseEntity.status(201).body(GrantResponse.from(grant));
    }

    @PatchMapping("/{grantId}")
    public ResponseEntity<GrantResponse> update(
            @PathVariable("grantId") UUID grantId,
            @RequestBody UpdateGrantRequest request
    ) {
        AccessGrant grant = grantService.update(SecurityUtils.getCurrentActorId(), grantId, new UpdateGrantCommand(
                request.role(),
                request.inheritToDescendants(),
                request.validUntil(),
                Boolean.TRUE.equals(request.clearValidUntil())
        ));
        return ResponseEntity.ok(GrantResponse.from(grant));
    }

    @DeleteMapping("/{grantId}")
    public ResponseEntity<GrantResponse> revoke(
            @PathVariable("grantId") UUID grantId,
            @RequestParam(name = "reason", required = false) String reason
    ) {
        AccessGrant grant = grantService.revoke(SecurityUtils.getCurrentActorId(), grantId, reason);
        return ResponseEntity.ok(GrantResponse.from(grant));
    }

    @Operation(
            summary = "List grants by holder or by node",
            description = "`actorId` needs the holder inside your scope; `nodeId` needs MANAGER at that node."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grants"),
            @ApiResponse(responseCode = "403", description = "`INSUFFICIENT_PRIVILEGES`")
    })
    @GetMapping
    public ResponseEntity<List<GrantResponse>> list(
            @RequestParam(name = "actorId", required = false) UUID actorId,
            @RequestParam(name = "nodeId", required = false) UUID nodeId,
            @RequestParam(name = "includeExpired", defaultValue = "false") boolean includeExpired
    ) {
        if ((actorId == null) == (nodeId == null)) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_REQUEST", "exactly one of actorId or nodeId is required");
        }
        UUID callerId = SecurityUtils.getCurrentActorId();
        List<AccessGrant> grants = actorId != null
                ? grantService.findByActor(callerId, actorId, includeExpired)
                : grantService.findByNode(callerId, nodeId);
        return ResponseEntity.ok(grants.stream().map(GrantResponse::from).toList());
    }

    @GetMapping("/mine")
    public ResponseEntity<List<GrantResponse>> mine() {
        return ResponseEntity.ok(grantService.findActiveByActorWithNodeInfo(SecurityUtils.getCurrentActorId()).stream()
                .map(GrantResponse::from)
                .toList());
    }
}
