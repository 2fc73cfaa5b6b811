package com.orgscope.backend.modules.hierarchy.presentation;

import java.util.List;
import java.util.UUID;

import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.modules.hierarchy.application.HierarchyService;
import com.orgscope.backend.modules.hierarchy.application.HierarchyService.CreateNodeCommand;
import com.orgscope.backend.modules.hierarchy.application.HierarchyService.UpdateNodeCommand;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyStatistics;
import com.orgscope.backend.modules.hierarchy.domain.IntegrityReport;
import com.orgscope.backend.modules.hierarchy.presentation.dto.CreateNodeRequest;
import com.orgscope.backend.modules.hierarchy.presentation.dto.DeleteNodeResponse;
import com.orgscope.backend.modules.hierarchy.presentation.dto.HierarchyNodeResponse;
import com.orgscope.backend.modules.hierarchy.presentation.dto.HierarchyTreeResponse;
import com.orgscope.backend.modules.hierarchy.presentation.dto.MoveNodeRequest;
import com.orgscope.backend.modules.hierarchy.presentation.dto.UpdateNodeRequest;

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
@RequestMapping("/hierarchy")
public class HierarchyController {

    private final HierarchyService hierarchyService;

    public HierarchyController(HierarchyService hierarchyService) {
        this.hierarchyService = hierarchyService;
    }

    @Operation(
            summary = "Create node",
            description = """
                    Creates a node under `parentId`, or a new root when it is omitted. \
                    Path and level are derived from the parent. Creating a child requires MANAGER at the parent.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Node created"),
            @ApiResponse(responseCode = "400", description = "`INVALID_CODE`"),
            @ApiResponse(responseCode = "404", description = "`PARENT_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`DUPLICATE_CODE` among siblings")
    })
    @PostMapping("/nodes")
    public ResponseEntity<HierarchyNodeResponse> createNode(@Valid @RequestBody CreateNodeRequest request) {
        HierarchyNode node = hierarchyService.createNode(SecurityUtils.getCurrentActorId(), new CreateNodeCommand(
                request.name(), request.code(), request.parentId(), request.sortOrder(), request.metadata()));
        return ResponseEntity.status(201).body(HierarchyNodeResponse.from(node));
    }

    @GetMapping("/nodes/{nodeId}")
    public ResponseEntity<HierarchyNodeResponse> getNode(@PathVariable("nodeId") UUID nodeId) {
        return ResponseEntity.ok(HierarchyNodeResponse.from(hierarchyService.getNode(nodeId)));
    }

    @GetMapping("/nodes/by-path")
    public ResponseEntity<HierarchyNodeResponse> getNodeByPath(@RequestParam("path") String path) {
        return ResponseEntity.ok(HierarchyNodeResponse.from(hierarchyService.getNodeByPath(path)));
    }

    @PatchMapping("/nodes/{nodeId}")
    public ResponseEntity<HierarchyNodeResponse> updateNode(
            @PathVariable("nodeId") UUID nodeId,
            @Valid @RequestBody UpdateNodeRequest request
    ) {
        HierarchyNode node = hierarchyService.updateNode(SecurityUtils.getCurrentActorId(), nodeId,
                new UpdateNodeCommand(request.name(), request.sortOrder(), request.metadata()));
        return ResponseEntity.ok(HierarchyNodeResponse.from(node));
    }

    @Operation(
            summary = "Move subtree",
            description = """
                    Re-parents a node; every active descendant's path and level are rewritten in the same transaction. \
                    Requires ADMIN at the node and at the destination.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subtree moved"),
            @ApiResponse(responseCode = "409", description = "`DUPLICATE_CODE` at destination or `CONCURRENT_MODIFICATION` (retry)"),
            @ApiResponse(responseCode = "422", description = "`CIRCULAR_MOVE` or `MAX_DEPTH_EXCEEDED`")
    })
    @PostMapping("/nodes/{nodeId}/move")
    public ResponseEntity<HierarchyNodeResponse> moveNode(
            @PathVariable("nodeId") UUID nodeId,
            @RequestBody MoveNodeRequest request
    ) {
        HierarchyNode node = hierarchyService.moveNode(SecurityUtils.getCurrentActorId(), nodeId, request.newParentId());
        return ResponseEntity.ok(HierarchyNodeResponse.from(node));
    }

    @Operation(summary = "Delete subtree", description = "Soft-deletes the node and all of its descendants. Requires ADMIN.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subtree deactivated"),
            @ApiResponse(responseCode = "422", description = "`NODE_HAS_DEPENDENTS` when force is not set")
    })
    @DeleteMapping("/nodes/{nodeId}")
    public ResponseEntity<DeleteNodeResponse> deleteNode(
            @PathVariable("nodeId") UUID nodeId,
            @RequestParam(name = "force", defaultValue = "false") boolean force
    ) {
        int count = hierarchyService.deleteNode(SecurityUtils.getCurrentActorId(), nodeId, force);
        return ResponseEntity.ok(new DeleteNodeResponse(nodeId, count));
    }

    @GetMapping("/tree")
    public ResponseEntity<List<HierarchyTreeResponse>> getTree() {
        return ResponseEntity.ok(hierarchyService.getTree().stream().map(HierarchyTreeResponse::from).toList());
    }

    @GetMapping("/roots")
    public ResponseEntity<List<HierarchyNodeResponse>> getRoots() {
        return ResponseEntity.ok(toResponses(hierarchyService.getChildren(null)));
    }

    @GetMapping("/nodes/{nodeId}/children")
    public ResponseEntity<List<HierarchyNodeResponse>> getChildren(@PathVariable("nodeId") UUID nodeId) {
        return ResponseEntity.ok(toResponses(hierarchyService.getChildren(nodeId)));
    }

    @GetMapping("/nodes/{nodeId}/descendants")
    public ResponseEntity<List<HierarchyNodeResponse>> getDescendants(
            @PathVariable("nodeId") UUID nodeId,
            @RequestParam(name = "includeSelf", defaultValue = "false") boolean includeSelf
    ) {
        return ResponseEntity.ok(toResponses(hierarchyService.getDescendants(nodeId, includeSelf)));
    }

    @GetMapping("/nodes/{nodeId}/ancestors")
    public ResponseEntity<List<HierarchyNodeResponse>> getAncestors(
            @PathVariable("nodeId") UUID nodeId,
            @RequestParam(name = "includeSelf", defaultValue = "false") boolean includeSelf
    ) {
        return ResponseEntity.ok(toResponses(hierarchyService.getAncestors(nodeId, includeSelf)));
    }

    @GetMapping("/nodes/{nodeId}/siblings")
    public ResponseEntity<List<HierarchyNodeResponse>> getSiblings(
            @PathVariable("nodeId") UUID nodeId,
            @RequestParam(name = "includeSelf", defaultValue = "false") boolean includeSelf
    ) {
        return ResponseEntity.ok(toResponses(hierarchyService.getSiblings(nodeId, includeSelf)));
    }

    @Operation(summary = "Validate hierarchy integrity", description = "Reports orphans, level/path mismatches and cycles. Nothing is repaired.")
    @PostMapping("/integrity")
    public ResponseEntity<IntegrityReport> validateIntegrity() {
        return ResponseEntity.ok(hierarchyService.validateIntegrity(SecurityUtils.getCurrentActorId()));
    }

    @GetMapping("/statistics")
    public ResponseEntity<HierarchyStatistics> getStatistics() {
        return ResponseEntity.ok(hierarchyService.getStatistics());
    }

    private static List<HierarchyNodeResponse> toResponses(List<HierarchyNode> nodes) {
        return nodes.stream().map(HierarchyNodeResponse::from).toList();
    }
}
