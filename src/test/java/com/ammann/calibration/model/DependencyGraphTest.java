/* (C)2026 */
package com.ammann.calibration.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.calibration.canonical.CanonicalJson;
import com.ammann.calibration.enumeration.DependencyKind;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.exception.CalibrationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DependencyGraphTest {

    @Test
    void rejectsEdgeToUndeclaredNode() {
        List<DependencyNode> nodes = List.of(new DependencyNode("@b", EpistemicTier.EMPIRICAL));

        assertThatThrownBy(() -> new DependencyGraph(nodes, List.of(DependencyEdge.primary("@b", "@chain"))))
                .isInstanceOf(CalibrationException.class)
                .hasMessageContaining("undeclared node '@chain'");
    }

    @Test
    void rejectsDuplicateNodes() {
        List<DependencyNode> nodes = List.of(
                new DependencyNode("@b", EpistemicTier.EMPIRICAL), new DependencyNode("@b", EpistemicTier.AUDIT));

        assertThatThrownBy(() -> new DependencyGraph(nodes, List.of()))
                .isInstanceOf(CalibrationException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    void collapsesDuplicateEdges() {
        DependencyGraph graph = new DependencyGraph(
                List.of(
                        new DependencyNode("@b", EpistemicTier.EMPIRICAL),
                        new DependencyNode("@chain", EpistemicTier.INFERENTIAL)),
                List.of(DependencyEdge.primary("@b", "@chain"), DependencyEdge.primary("@b", "@chain")));

        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.outgoing("@b")).hasSize(1);
        assertThat(graph.tierOf("@chain")).isEqualTo(EpistemicTier.INFERENTIAL);
    }

    @Test
    void edgeKindDefaultsToPrimary() {
        assertThat(new DependencyEdge("a", "b", null).kind()).isEqualTo(DependencyKind.PRIMARY);
        assertThat(DependencyEdge.veto("a", "b").describe()).isEqualTo("a -> b (veto)");
    }

    @Test
    void canonicalFormIgnoresDeclarationOrder() {
        DependencyNode base = new DependencyNode("@b", EpistemicTier.EMPIRICAL);
        DependencyNode chain = new DependencyNode("@chain", EpistemicTier.INFERENTIAL);
        DependencyNode congruence = new DependencyNode("@C", EpistemicTier.AUDIT);
        DependencyEdge feeds = DependencyEdge.primary("@b", "@chain");
        DependencyEdge audits = DependencyEdge.veto("@C", "@b");
        DependencyEdge checks = DependencyEdge.primary("@chain", "@C");

        DependencyGraph declared =
                new DependencyGraph(List.of(base, chain, congruence), List.of(feeds, audits, checks));
        DependencyGraph shuffled =
                new DependencyGraph(List.of(congruence, chain, base), List.of(checks, feeds, audits));

        assertThat(CanonicalJson.write(shuffled)).isEqualTo(CanonicalJson.write(declared));
        assertThat(CanonicalJson.digest(shuffled)).isEqualTo(CanonicalJson.digest(declared));
    }
}
