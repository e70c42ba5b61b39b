/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.exception.CalibrationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of calibration components with their epistemic tiers.
 *
 * <p>Construction checks only structure: node ids are unique and every edge endpoint
 * is a declared node. Acyclicity and tier discipline are enforced by the interaction
 * governor, which is the only place those errors are raised.
 *
 * <p>The canonical form lists nodes by id and edges by {@link DependencyEdge#ORDER}, so
 * the declaration order in the calibration document does not reach the fingerprint.
 */
public final class DependencyGraph implements CanonicalForm {

    private final Map<String, DependencyNode> nodes;
    private final List<DependencyEdge> edges;
    private final Map<String, List<DependencyEdge>> outgoing;

    public DependencyGraph(List<DependencyNode> nodes, List<DependencyEdge> edges) {
        Map<String, DependencyNode> byId = new LinkedHashMap<>();
        for (DependencyNode node : nodes == null ? List.<DependencyNode>of() : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new CalibrationException("Dependency node '" + node.id() + "' is declared more than once");
            }
        }
        Set<DependencyEdge> unique = new LinkedHashSet<>();
        Map<String, List<DependencyEdge>> out = new LinkedHashMap<>();
        byId.keySet().forEach(id -> out.put(id, new ArrayList<>()));
        for (DependencyEdge edge : edges == null ? List.<DependencyEdge>of() : edges) {
            requireDeclared(byId, edge, edge.from());
            requireDeclared(byId, edge, edge.to());
            if (unique.add(edge)) {
                out.get(edge.from()).add(edge);
            }
        }
        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(unique);
        Map<String, List<DependencyEdge>> frozen = new LinkedHashMap<>();
        out.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        this.outgoing = Collections.unmodifiableMap(frozen);
    }

    /** Nodes in declaration order. */
    public List<DependencyNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public EpistemicTier tierOf(String nodeId) {
        DependencyNode node = nodes.get(nodeId);
        if (node == null) {
            throw new CalibrationException("Unknown dependency node '" + nodeId + "'");
        }
        return node.tier();
    }

    /** Outgoing edges of {@code nodeId}, in declaration order. */
    public List<DependencyEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> form = new LinkedHashMap<>();
        List<DependencyNode> sortedNodes = new ArrayList<>(nodes.values());
        sortedNodes.sort(Comparator.comparing(DependencyNode::id));
        List<DependencyEdge> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(DependencyEdge.ORDER);
        form.put("nodes", sortedNodes);
        form.put("edges", sortedEdges);
        return form;
    }

    private static void requireDeclared(Map<String, DependencyNode> byId, DependencyEdge edge, String endpoint) {
        if (!byId.containsKey(endpoint)) {
            throw new CalibrationException(String.format(
                    "Edge %s references undeclared node '%s'", edge.describe(), endpoint));
        }
    }
}
