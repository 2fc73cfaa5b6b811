package com.orgscope.backend.modules.query.presentation;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.query.application.AccessibleMemberFilter;
import com.orgscope.backend.modules.query.application.AccessibleMemberQueryService;
import com.orgscope.backend.modules.query.application.MemberStatistics;
import com.orgscope.backend.modules.query.application.MemberSuggestion;
import com.orgscope.backend.modules.query.presentation.dto.AccessibleMemberListResponse;
import com.orgscope.backend.modules.query.presentation.dto.BulkMemberQueryRequest;
import com.orgscope.backend.modules.query.presentation.dto.BulkMemberResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/query")
public class AccessibleMemberQueryController {

    private final AccessibleMemberQueryService accessibleMemberQueryService;

    public AccessibleMemberQueryController(AccessibleMemberQueryService accessibleMemberQueryService) {
        this.accessibleMemberQueryService = accessibleMemberQueryService;
    }

    @Operation(
            summary = "List accessible members",
            description = """
                    Members the caller may see, filtered and paged. Each item states whether it is reached directly, \
                    through an inherited grant or as the caller's own record, and through which grant paths.
                    """
    )
    @GetMapping("/members")
    public ResponseEntity<AccessibleMemberListResponse> accessibleMembers(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "createdAfter", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdAfter,
            @RequestParam(name = "createdBefore", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdBefore,
            @RequestParam(name = "lastLoginAfter", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime lastLoginAfter,
            @RequestParam(name = "lastLoginBefore", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime lastLoginBefore,
            @RequestParam(name = "nodeId", required = false) UUID nodeId,
            @RequestParam(name = "includeDescendants", defaultValue = "true") boolean includeDescendants,
            @RequestParam(name = "levels", required = false) Set<Integer> levels,
            @RequestParam(name = "excludeSelf", defaultValue = "false") boolean excludeSelf,
            @RequestParam(name = "requireMinimumRole", required = false) GrantRole requireMinimumRole,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size,
            @RequestParam(name = "sortBy", defaultValue = "name") String sortBy,
            @RequestParam(name = "sortDirection", defaultValue = "asc") String sortDirection
    ) {
        AccessibleMemberFilter filter = new AccessibleMemberFilter(
                search,
                active,
                createdAfter,
                createdBefore,
                lastLoginAfter,
                lastLoginBefore,
                nodeId,
                includeDescendants,
                levels,
                excludeSelf,
                requireMinimumRole,
                page,
                size,
                sortBy,
                sortDirection
        );
        return ResponseEntity.ok(AccessibleMemberListResponse.from(
                accessibleMemberQueryService.queryAccessibleMembers(SecurityUtils.getCurrentActorId(), filter)));
    }

    @Operation(summary = "Member statistics", description = "Counts over the caller's scope, or over one accessible node.")
    @GetMapping("/members/stats")
    public ResponseEntity<MemberStatistics> memberStatistics(
            @RequestParam(name = "nodeId", required = false) UUID nodeId,
            @RequestParam(name = "includeDescendants", defaultValue = "true") boolean includeDescendants
    ) {
        return ResponseEntity.ok(accessibleMemberQueryService.memberStatistics(
                SecurityUtils.getCurrentActorId(), nodeId, includeDescendants));
    }

    @Operation(summary = "Member suggestions", description = "Name or email autocomplete over active accessible members.")
    @GetMapping("/members/suggestions")
    public ResponseEntity<List<MemberSuggestion>> suggestMembers(
            @RequestParam(name = "q") String term,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(accessibleMemberQueryService.suggestMembers(SecurityUtils.getCurrentActorId(), term, limit));
    }

    @Operation(summary = "Bulk member lookup", description = "Returns the requested members the caller can reach; others are left out.")
    @PostMapping("/members/bulk")
    public ResponseEntity<List<BulkMemberResponse>> bulkQuery(@Valid @RequestBody BulkMemberQueryRequest request) {
        return ResponseEntity.ok(accessibleMemberQueryService.bulkQuery(
                        SecurityUtils.getCurrentActorId(), request.memberIds(), Boolean.TRUE.equals(request.includeGrants()))
                .stream()
                .map(BulkMemberResponse::from)
                .toList());
    }
}
