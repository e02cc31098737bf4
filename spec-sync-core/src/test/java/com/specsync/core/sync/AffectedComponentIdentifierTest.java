package com.specsync.core.sync;

import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.graph.DependencyGraphBuilder;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentType;
import com.specsync.core.model.Dependency;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AffectedComponentIdentifier}.
 */
class AffectedComponentIdentifierTest {

    // orders -> accounts -> users; accounts owns token
    private final Component users = Component.of("u", "Shop.Users", ComponentType.CONTEXT, null);
    private final Component accounts = Component.of("a", "Shop.Accounts", ComponentType.CONTEXT, null);
    private final Component token = Component.of("t", "Shop.Accounts.Token", ComponentType.SCHEMA, "a");
    private final Component orders = Component.of("o", "Shop.Orders", ComponentType.CONTEXT, null);
    private final Component mailer = Component.of("m", "Shop.Mailer", ComponentType.MODULE, null);

    private final ComponentGraph graph = DependencyGraphBuilder.attach(
        ComponentGraph.of(List.of(users, accounts, token, orders, mailer)),
        List.of(new Dependency("a", "u"), new Dependency("o", "a")));

    @Test
    void identify_singlePass_chainsForwardInListOrder() {
        Set<String> affected = new AffectedComponentIdentifier(PropagationMode.SINGLE_PASS)
            .identify(graph, List.of("u"));

        assertThat(affected).containsExactly("u", "a", "t", "o");
    }

    @Test
    void identify_singlePass_followsChainListedAfterItsDependency() {
        // Given
        ComponentGraph chain = chain("c0", "c1", "c2");

        // When
        Set<String> affected = new AffectedComponentIdentifier(PropagationMode.SINGLE_PASS)
            .identify(chain, List.of("c0"));

        // Then
        assertThat(affected).containsExactly("c0", "c1", "c2");
    }

    @Test
    void identify_singlePass_missesDependentListedBeforeItsDependency() {
        // Given
        ComponentGraph chain = chain("c2", "c1", "c0");

        // When
        Set<String> single = new AffectedComponentIdentifier(PropagationMode.SINGLE_PASS)
            .identify(chain, List.of("c0"));
        Set<String> transitive = new AffectedComponentIdentifier(PropagationMode.TRANSITIVE)
            .identify(chain, List.of("c0"));

        // Then
        assertThat(single).containsExactly("c0", "c1");
        assertThat(transitive).containsExactlyInAnyOrder("c0", "c1", "c2");
    }

    @Test
    void identify_transitive_followsDependentsAndHierarchy() {
        Set<String> affected = new AffectedComponentIdentifier(PropagationMode.TRANSITIVE)
            .identify(graph, List.of("u"));

        assertThat(affected).containsExactlyInAnyOrder("u", "a", "t", "o");
    }

    @Test
    void identify_changedChild_affectsParent() {
        Set<String> affected = new AffectedComponentIdentifier(PropagationMode.SINGLE_PASS)
            .identify(graph, List.of("t"));

        assertThat(affected).contains("t", "a");
    }

    @Test
    void identify_ignoresIdsOutsideGraph() {
        Set<String> affected = new AffectedComponentIdentifier(PropagationMode.TRANSITIVE)
            .identify(graph, List.of("ghost", "m"));

        assertThat(affected).containsExactly("m");
    }

    @Test
    void identify_withNothingChanged_isEmpty() {
        assertThat(new AffectedComponentIdentifier(PropagationMode.TRANSITIVE).identify(graph, List.of())).isEmpty();
    }

    @Test
    void identify_withoutDependencyGraph_throwsException() {
        assertThatThrownBy(() -> new AffectedComponentIdentifier(PropagationMode.TRANSITIVE)
            .identify(ComponentGraph.of(List.of(users)), List.of("u")))
            .isInstanceOf(IllegalStateException.class);
    }

    /** Components listed in the given order, where c1 depends on c0 and c2 on c1. */
    private static ComponentGraph chain(String... order) {
        List<Component> components = new ArrayList<>();
        for (String id : order) {
            components.add(Component.of(id, "Shop.Chain" + id.substring(1), ComponentType.MODULE, null));
        }
        return DependencyGraphBuilder.attach(ComponentGraph.of(components),
            List.of(new Dependency("c1", "c0"), new Dependency("c2", "c1")));
    }
}
