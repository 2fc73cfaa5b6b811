package com.orgscope.backend.modules.hierarchy.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import com.orgscope.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HierarchyIntegrityCheckerTest {

    @Test
    @DisplayName("a consistent tree reports no issues")
    void consistentTree() {
        HierarchyNode org = TestEntities.root("org");
        HierarchyNode eng = TestEntities.childOf(org, "eng");
        HierarchyNode backend = TestEntities.childOf(eng, "backend");

        assertThat(HierarchyIntegrityChecker.check(List.of(org, eng, backend))).isEmpty();
    }

    @Test
    @DisplayName("an active node under a missing or inactive parent is orphaned")
    void orphanedNodes() {
        HierarchyNode org = TestEntities.root("org");
        HierarchyNode eng = TestEntities.childOf(org, "eng");
        eng.setActive(false);
        HierarchyNode backend = TestEntities.childOf(eng, "backend");
        HierarchyNode stray = TestEntities.node(UUID.randomUUID(), UUID.randomUUID(), "stray", "gone.stray", 1);

        List<IntegrityIssue> issues = HierarchyIntegrityChecker.check(List.of(org, eng, backend, stray));

        assertThat(issues).extracting(IntegrityIssue::path).containsExactlyInAnyOrder("org.eng.backend", "gone.stray");
        assertThat(issues).allSatisfy(issue -> {
            assertThat(issue.type()).isEqualTo(IntegrityIssueType.ORPHANED);
            assertThat(issue.severity()).isEqualTo(IntegritySeverity.WARNING);
        });
    }

    @Test
    @DisplayName("wrong level and path are reported separately")
    void levelAndPathMismatch() {
        HierarchyNode org = TestEntities.root("org");
        HierarchyNode eng = TestEntities.node(UUID.randomUUID(), org.getId(), "eng", "org.engineering", 3);

        List<IntegrityIssue> issues = HierarchyIntegrityChecker.check(List.of(org, eng));

        assertThat(issues).extracting(IntegrityIssue::type)
                .containsExactlyInAnyOrder(IntegrityIssueType.LEVEL_MISMATCH, IntegrityIssueType.PATH_MISMATCH);
    }

    @Test
    @DisplayName("roots must sit at level 0 with path equal to code")
    void rootChecks() {
        HierarchyNode root = TestEntities.node(UUID.randomUUID(), null, "org", "x.org", 1);

        List<IntegrityIssue> issues = HierarchyIntegrityChecker.check(List.of(root));

        assertThat(issues).extracting(IntegrityIssue::type)
                .containsExactlyInAnyOrder(IntegrityIssueType.LEVEL_MISMATCH, IntegrityIssueType.PATH_MISMATCH);
    }

    @Test
    @DisplayName("a parent chain loop is an error")
    void parentCycle() {
        UUID aId = UUID.randomUUID();
        UUID bId = UUID.randomUUID();
        HierarchyNode a = TestEntities.node(aId, bId, "a", "b.a", 1);
        HierarchyNode b = TestEntities.node(bId, aId, "b", "a.b", 1);

        List<IntegrityIssue> issues = HierarchyIntegrityChecker.check(List.of(a, b));

        assertThat(issues).hasSize(2).allSatisfy(issue -> {
            assertThat(issue.type()).isEqualTo(IntegrityIssueType.CIRCULAR_REFERENCE);
            assertThat(issue.severity()).isEqualTo(IntegritySeverity.ERROR);
        });
    }

    @Test
    @DisplayName("inactive nodes are skipped")
    void inactiveSkipped() {
        HierarchyNode broken = TestEntities.node(UUID.randomUUID(), null, "org", "wrong", 4);
        broken.setActive(false);

        assertThat(HierarchyIntegrityChecker.check(List.of(broken))).isEmpty();
    }
}
