package com.orgscope.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.domain.AccessDecision;
import com.orgscope.backend.modules.access.domain.AccessLevel;
import com.orgscope.backend.modules.access.domain.AccessScope;
import com.orgscope.backend.modules.grant.domain.AccessGrant;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.grant.infrastructure.persistence.AccessGrantRepository;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.infrastructure.persistence.HierarchyNodeRepository;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.modules.member.infrastructure.persistence.OrgMemberRepository;
import com.orgscope.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessScopeServiceTest {

    @Mock
    private AccessGrantRepository accessGrantRepository;

    @Mock
    private HierarchyNodeRepository hierarchyNodeRepository;

    @Mock
    private OrgMemberRepository orgMemberRepository;

    private AccessScopeService accessScopeService;

    private final UUID actorId = UUID.randomUUID();
    private HierarchyNode org;
    private HierarchyNode eng;
    private OrgMember actor;

    @BeforeEach
    void setUp() {
        accessScopeService = new AccessScopeService(
                accessGrantRepository,
                hierarchyNodeRepository,
                orgMemberRepository,
                Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC)
        );
        org = TestEntities.root("org");
        eng = TestEntities.childOf(org, "eng");
        actor = TestEntities.member(actorId, "actor@example.com", org);
    }

    @Test
    @DisplayName("scope expands an inheriting grant to live descendants and counts reachable members")
    void computeScopeExpandsDescendants() {
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.of(actor));
        when(accessGrantRepository.findEffectiveOnActiveNodesByActorId(any(), any()))
                .thenReturn(List.of(grant(org, GrantRole.READ, true)));
        when(hierarchyNodeRepository.findActiveDescendantPaths("org.%")).thenReturn(List.of("org.eng", "org.eng.backend"));
        when(orgMemberRepository.countActiveByBaseNodePathIn(any())).thenReturn(5L);

        AccessScope scope = accessScopeService.computeScope(actorId);

        assertThat(scope.accessiblePaths()).containsExactly("org", "org.eng", "org.eng.backend");
        assertThat(scope.accessibleMemberCount()).isEqualTo(5L);
        assertThat(scope.directGrants()).hasSize(1);
    }

    @Test
    @DisplayName("an unknown or inactive actor has an empty scope")
    void inactiveActorHasEmptyScope() {
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.empty());

        AccessScope scope = accessScopeService.computeScope(actorId);

        assertThat(scope.isEmpty()).isTrue();
        assertThat(scope.accessiblePaths()).isEmpty();
        verify(accessGrantRepository, never()).findEffectiveOnActiveNodesByActorId(any(), any());
        verify(hierarchyNodeRepository, never()).findActiveDescendantPaths(anyString());
    }

    @Test
    @DisplayName("READ is not enough where MANAGER is required")
    void requireRoleRejectsLowerRole() {
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.of(actor));
        when(accessGrantRepository.findEffectiveOnActiveNodesByActorId(any(), any()))
                .thenReturn(List.of(grant(org, GrantRole.READ, true)));

        assertThatThrownBy(() -> accessScopeService.requireRole(actorId, eng, GrantRole.MANAGER))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("INSUFFICIENT_PRIVILEGES");
    }

    @Test
    @DisplayName("system operators pass every role check")
    void systemOperatorBypassesRoleChecks() {
        actor.setSystemOperator(true);
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.of(actor));

        accessScopeService.requireRole(actorId, eng, GrantRole.ADMIN);
        accessScopeService.requireGrantAuthority(actorId, eng, GrantRole.ADMIN);

        verify(accessGrantRepository, never()).findEffectiveOnActiveNodesByActorId(any(), any());
    }

    @Test
    @DisplayName("a MANAGER asking to hand out ADMIN is an escalation, not a missing privilege")
    void managerCannotGrantAdmin() {
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.of(actor));
        when(accessGrantRepository.findEffectiveOnActiveNodesByActorId(any(), any()))
                .thenReturn(List.of(grant(org, GrantRole.MANAGER, true)));

        assertThatThrownBy(() -> accessScopeService.requireGrantAuthority(actorId, eng, GrantRole.ADMIN))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("PRIVILEGE_ESCALATION");
    }

    @Test
    @DisplayName("checking oneself without any grant is SELF access at READ")
    void selfAccessWithoutGrants() {
        when(orgMemberRepository.findWithBaseNodeById(actorId)).thenReturn(Optional.of(actor));
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.of(actor));
        when(accessGrantRepository.findEffectiveOnActiveNodesByActorId(any(), any())).thenReturn(List.of());

        AccessDecision decision = accessScopeService.checkMemberAccess(actorId, actorId);

        assertThat(decision.canAccess()).isTrue();
        assertThat(decision.accessLevel()).isEqualTo(AccessLevel.SELF);
        assertThat(decision.effectiveRole()).isEqualTo(GrantRole.READ);
        assertThat(decision.grantedThrough()).isEmpty();
    }

    @Test
    @DisplayName("self access reports the highest role the actor's grants give on their own node")
    void selfAccessTakesHighestGrantedRole() {
        when(orgMemberRepository.findWithBaseNodeById(actorId)).thenReturn(Optional.of(actor));
        when(orgMemberRepository.findByIdAndActiveTrue(actorId)).thenReturn(Optional.of(actor));
        when(accessGrantRepository.findEffectiveOnActiveNodesByActorId(any(), any()))
                .thenReturn(List.of(grant(org, GrantRole.ADMIN, true)));

        AccessDecision decision = accessScopeService.checkMemberAccess(actorId, actorId);

        assertThat(accessScopeService.effectiveRole(actorId, "org")).contains(GrantRole.ADMIN);
        assertThat(decision.accessLevel()).isEqualTo(AccessLevel.SELF);
        assertThat(decision.effectiveRole()).isEqualTo(GrantRole.ADMIN);
        assertThat(decision.grantedThrough()).containsExactly("org");
    }

    @Test
    @DisplayName("a member whose base node is gone is not reachable")
    void memberOnInactiveNodeIsDenied() {
        eng.setActive(false);
        OrgMember target = TestEntities.member(UUID.randomUUID(), "target@example.com", eng);
        when(orgMemberRepository.findWithBaseNodeById(target.getId())).thenReturn(Optional.of(target));

        AccessDecision decision = accessScopeService.checkMemberAccess(actorId, target.getId());

        assertThat(decision.canAccess()).isFalse();
        verify(accessGrantRepository, never()).findEffectiveOnActiveNodesByActorId(any(), any());
    }

    private AccessGrant grant(HierarchyNode node, GrantRole role, boolean inherit) {
        AccessGrant grant = new AccessGrant();
        TestEntities.setId(grant, UUID.randomUUID());
        grant.setActor(actor);
        grant.setNode(node);
        grant.setRole(role);
        grant.setInheritToDescendants(inherit);
        return grant;
    }
}
