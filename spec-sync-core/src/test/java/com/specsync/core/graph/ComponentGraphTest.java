package com.specsync.core.graph;

import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentType;
import com.specsync.core.model.Dependency;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentGraph}, {@link DependencyGraphBuilder} and {@link HierarchyTreeBuilder}.
 */
class ComponentGraphTest {

    private final Component shop = Component.of("s", "Shop", ComponentType.CONTEXT, null);
    private final Component accounts = Component.of("a", "Shop.Accounts", ComponentType.CONTEXT, "s");
    private final Component user = Component.of("u", "Shop.Accounts.User", ComponentType.SCHEMA, "a");
    private final Component orders = Component.of("o", "Shop.Orders", ComponentType.CONTEXT, "s");

    @Test
    void of_withDuplicateIds_throwsException() {
        assertThatThrownBy(() -> ComponentGraph.of(List.of(shop, shop)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate component id: s");
    }

    @Test
    void hierarchy_answersTreeQueries() {
        ComponentGraph graph = HierarchyTreeBuilder.attach(ComponentGraph.of(List.of(shop, accounts, user, orders)));

        assertThat(graph.hasHierarchy()).isTrue();
        assertThat(graph.roots()).containsExactly(shop);
        assertThat(graph.childrenOf("s")).containsExactly(accounts, orders);
        assertThat(graph.descendantsOf("s")).containsExactly(accounts, orders, user);
        assertThat(graph.pathToRoot("u")).containsExactly(shop, accounts, user);
        assertThat(graph.isAncestor("s", "u")).isTrue();
        assertThat(graph.isAncestor("u", "u")).isFalse();
        assertThat(graph.parentOf("u")).contains(accounts);
    }

    @Test
    void hierarchy_withMissingParent_treatsComponentAsRoot() {
        Component orphan = Component.of("x", "Shop.Legacy.Thing", ComponentType.MODULE, "gone");

        ComponentGraph graph = HierarchyTreeBuilder.attach(ComponentGraph.of(List.of(shop, orphan)));

        assertThat(graph.roots()).containsExactly(shop, orphan);
        assertThat(graph.descendantsOf("s")).isEmpty();
    }

    @Test
    void hierarchy_withParentCycle_terminates() {
        Component first = Component.of("1", "A", ComponentType.MODULE, "2");
        Component second = Component.of("2", "B", ComponentType.MODULE, "1");

        ComponentGraph graph = HierarchyTreeBuilder.attach(ComponentGraph.of(List.of(first, second)));

        assertThat(graph.descendantsOf("1")).doesNotContain(first);
        assertThat(graph.pathToRoot("1")).hasSizeLessThanOrEqualTo(2);
    }

    @Test
    void dependencies_dropUnknownEndpointsAndDuplicates() {
        ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(List.of(accounts, orders)), List.of(
            new Dependency("o", "a"), new Dependency("o", "a"), new Dependency("o", "missing")));

        assertThat(graph.hasDependencyGraph()).isTrue();
        assertThat(graph.dependencyIds("o")).containsExactly("a");
        assertThat(graph.dependentsOf("a")).containsExactly(orders);
        assertThat(graph.dependenciesOf("a")).isEmpty();
    }

    @Test
    void topologicalOrder_putsDependenciesFirst() {
        ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(List.of(orders, user, accounts)), List.of(
            new Dependency("o", "a"), new Dependency("a", "u")));

        assertThat(DependencyGraphBuilder.topologicalOrder(graph)).containsExactly(user, accounts, orders);
    }

    @Test
    void topologicalOrder_withCycle_stillReturnsEveryComponent() {
        ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(List.of(accounts, orders, user)), List.of(
            new Dependency("o", "a"), new Dependency("a", "o")));

        assertThat(DependencyGraphBuilder.topologicalOrder(graph)).containsExactly(user, accounts, orders);
    }

    @Test
    void relationalOrder_putsDependenciesAndDescendantsFirst() {
        // Given
        ComponentGraph graph = HierarchyTreeBuilder.attach(DependencyGraphBuilder.attach(
            ComponentGraph.of(List.of(shop, orders, accounts, user)), List.of(new Dependency("o", "a"))));

        // When
        List<Component> order = DependencyGraphBuilder.relationalOrder(graph);

        // Then
        assertThat(order).containsExactly(user, accounts, orders, shop);
    }

    @Test
    void relationalOrder_withChildDependingOnParent_stillReturnsEveryComponent() {
        ComponentGraph graph = HierarchyTreeBuilder.attach(DependencyGraphBuilder.attach(
            ComponentGraph.of(List.of(accounts, user, orders)), List.of(new Dependency("u", "a"))));

        assertThat(DependencyGraphBuilder.relationalOrder(graph)).containsExactly(orders, accounts, user);
    }

    @Test
    void withComponent_replacesOneComponentAndKeepsLinks() {
        ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(List.of(accounts, orders)),
            List.of(new Dependency("o", "a")));
        Component renamed = new Component("a", "Accts", "Shop.Accounts", ComponentType.CONTEXT, "s", null, null, null);

        ComponentGraph updated = graph.withComponent(renamed);

        assertThat(updated.dependenciesOf("o")).containsExactly(renamed);
        assertThat(graph.dependenciesOf("o")).containsExactly(accounts);
        assertThatThrownBy(() -> graph.withComponent(user))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown component id: u");
    }

    @Test
    void withComponents_keepsLinksAndRequiresSameIds() {
        ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(List.of(accounts, orders)),
            List.of(new Dependency("o", "a")));
        Component renamed = new Component("a", "Accts", "Shop.Accounts", ComponentType.CONTEXT, "s", null, null, null);

        ComponentGraph updated = graph.withComponents(List.of(orders, renamed));

        assertThat(updated.dependenciesOf("o")).containsExactly(renamed);
        assertThat(updated.components()).containsExactly(renamed, orders);
        assertThatThrownBy(() -> graph.withComponents(List.of(orders)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
