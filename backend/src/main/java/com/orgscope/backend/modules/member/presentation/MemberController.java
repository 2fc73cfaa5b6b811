package com.orgscope.backend.modules.member.presentation;

import java.util.UUID;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.modules.access.application.AccessScopeService;
import com.orgscope.backend.modules.member.application.MemberService;
import com.orgscope.backend.modules.member.application.MemberService.UpdateMemberCommand;
import com.orgscope.backend.modules.member.presentation.dto.MemberResponse;
import com.orgscope.backend.modules.member.presentation.dto.RegisterMemberRequest;
import com.orgscope.backend.modules.member.presentation.dto.RelocateMemberRequest;
import com.orgscope.backend.modules.member.presentation.dto.UpdateMemberRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/members")
public class MemberController {

    private final MemberService memberService;
    private final AccessScopeService accessScopeService;

    public MemberController(MemberService memberService, AccessScopeService accessScopeService) {
        this.memberService = memberService;
        this.accessScopeService = accessScopeService;
    }

    @PostMapping
    public ResponseEntity<MemberResponse> register(@Valid @RequestBody RegisterMemberRequest request) {
        return ResponseEntity.status(201).body(MemberResponse.from(memberService.register(
                SecurityUtils.getCurrentActorId(), request.email(), request.fullName(), request.baseNodeId())));
    }

    @GetMapping("/{memberId}")
    public ResponseEntity<MemberResponse> get(@PathVariable("memberId") UUID memberId) {
        UUID actorId = SecurityUtils.getCurrentActorId();
        MemberResponse member = MemberResponse.from(memberService.get(memberId));
        if (!accessScopeService.isSystemOperator(actorId)
                && !accessScopeService.checkMemberAccess(actorId, memberId).canAccess()) {
            throw new ProblemException(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_PRIVILEGES",
                    "member %s is outside your scope".formatted(memberId));
        }
        return ResponseEntity.ok(member);
    }

    @PostMapping("/{memberId}/relocate")
    public ResponseEntity<MemberResponse> relocate(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody RelocateMemberRequest request
    ) {
        return ResponseEntity.ok(MemberResponse.from(
                memberService.relocate(SecurityUtils.getCurrentActorId(), memberId, request.baseNodeId())));
    }

    @DeleteMapping("/{memberId}")
    public ResponseEntity<MemberResponse> deactivate(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(MemberResponse.from(
                memberService.deactivate(SecurityUtils.getCurrentActorId(), memberId)));
    }

    @PatchMapping("/{memberId}")
    public ResponseEntity<MemberResponse> update(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody UpdateMemberRequest request
    ) {
        return ResponseEntity.ok(MemberResponse.from(memberService.update(
                SecurityUtils.getCurrentActorId(), memberId, new UpdateMemberCommand(request.fullName(), request.email()))));
    }

    @PostMapping("/{memberId}/reactivate")
    public ResponseEntity<MemberResponse> reactivate(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(MemberResponse.from(
                memberService.reactivate(SecurityUtils.getCurrentActorId(), memberId)));
    }
}
