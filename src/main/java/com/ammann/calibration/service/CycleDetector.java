/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.model.DependencyEdge;
import com.ammann.calibration.model.DependencyGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topological sort (Kahn) of a dependency graph. When some nodes cannot be ordered a
 * concrete cycle among them is extracted by depth-first search.
 *
 * <p>Only reports; raising the error is left to {@link InteractionGovernor}.
 */
final class CycleDetector {

    /** Either a full topological order or one cycle, as a closed path. */
    record Result(List<String> order, List<String> cycle) {

        boolean acyclic() {
            return cycle.isEmpty();
        }
    }

    Result detect(DependencyGraph graph) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        graph.nodeIds().forEach(id -> inDegree.put(id, 0));
        for (DependencyEdge edge : graph.edges()) {
            inDegree.merge(edge.to(), 1, Integer::sum);
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (DependencyEdge edge : graph.outgoing(node)) {
                if (inDegree.merge(edge.to(), -1, Integer::sum) == 0) {
                    ready.add(edge.to());
                }
            }
        }

        if (order.size() == graph.size()) {
            return new Result(List.copyOf(order), List.of());
        }
        Set<String> remaining = new HashSet<>(inDegree.keySet());
        remaining.removeAll(order);
        return new Result(List.copyOf(order), findCycle(graph, remaining));
    }

    private List<String> findCycle(DependencyGraph graph, Set<String> remaining) {
        Map<String, Integer> state = new HashMap<>();
        for (String start : graph.nodeIds()) {
            if (!remaining.contains(start) || state.containsKey(start)) {
                continue;
            }
            List<String> path = new ArrayList<>();
            List<String> cycle = visit(graph, start, remaining, state, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        // Unreachable when Kahn left nodes unordered.
        return new ArrayList<>(remaining);
    }

    // state: 1 = on the current path, 2 = finished
    private List<String> visit(
            DependencyGraph graph,
            String node,
            Set<String> remaining,
            Map<String, Integer> state,
            List<String> path) {
        state.put(node, 1);
        path.add(node);
        for (DependencyEdge edge : graph.outgoing(node)) {
            String next = edge.to();
            if (!remaining.contains(next)) {
                continue;
            }
            Integer seen = state.get(next);
            if (seen == null) {
                List<String> cycle = visit(graph, next, remaining, state, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            } else if (seen == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
        }
        state.put(node, 2);
        path.remove(path.size() - 1);
        return Collections.emptyList();
    }
}
