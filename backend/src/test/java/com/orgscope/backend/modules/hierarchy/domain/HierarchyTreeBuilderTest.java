package com.orgscope.backend.modules.hierarchy.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.orgscope.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HierarchyTreeBuilderTest {

    @Test
    @DisplayName("children are nested under their parent in sort order, then by name")
    void nestsChildrenInDisplayOrder() {
        HierarchyNode org = TestEntities.root("org");
        HierarchyNode sales = TestEntities.childOf(org, "sales");
        HierarchyNode eng = TestEntities.childOf(org, "eng");
        HierarchyNode ops = TestEntities.childOf(org, "ops");
        ops.setSortOrder(-1);
        HierarchyNode backend = TestEntities.childOf(eng, "backend");

        List<HierarchyTreeNode> roots = HierarchyTreeBuilder.build(List.of(backend, sales, org, eng, ops));

        assertThat(roots).hasSize(1);
        HierarchyTreeNode root = roots.get(0);
        assertThat(root.node()).isSameAs(org);
        assertThat(root.children()).extracting(child -> child.node().getCode())
                .containsExactly("ops", "eng", "sales");
        assertThat(root.children().get(1).children()).extracting(child -> child.node().getCode())
                .containsExactly("backend");
    }

    @Test
    @DisplayName("a node whose parent is missing from the input becomes a root")
    void orphanBecomesRoot() {
        HierarchyNode org = TestEntities.root("org");
        HierarchyNode eng = TestEntities.childOf(org, "eng");
        HierarchyNode backend = TestEntities.childOf(eng, "backend");

        List<HierarchyTreeNode> roots = HierarchyTreeBuilder.build(List.of(org, backend));

        assertThat(roots).extracting(tree -> tree.node().getCode()).containsExactly("backend", "org");
        assertThat(roots).allSatisfy(tree -> assertThat(tree.children()).isEmpty());
    }

    @Test
    @DisplayName("empty input yields an empty forest")
    void emptyInput() {
        assertThat(HierarchyTreeBuilder.build(List.of())).isEmpty();
    }
}
