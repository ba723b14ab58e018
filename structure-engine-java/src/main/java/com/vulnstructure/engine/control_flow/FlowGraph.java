package com.vulnstructure.engine.control_flow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over string node ids. Nodes and edges keep insertion order;
 * adding an edge twice has no effect.
 */
final class FlowGraph {

    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private int edgeCount;

    void addNode(String id) {
        successors.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    boolean addEdge(String source, String target) {
        addNode(source);
        addNode(target);
        boolean added = successors.get(source).add(target);
        if (added) edgeCount++;
        return added;
    }

    List<String> nodes() {
        return new ArrayList<>(successors.keySet());
    }

    Set<String> successors(String id) {
        return successors.getOrDefault(id, Set.of());
    }

    int nodeCount() {
        return successors.size();
    }

    int edgeCount() {
        return edgeCount;
    }

    /** Nodes without outgoing edges, in insertion order. */
    List<String> sinks() {
        List<String> sinks = new ArrayList<>();
        successors.forEach((id, out) -> {
            if (out.isEmpty()) sinks.add(id);
        });
        return sinks;
    }
}
