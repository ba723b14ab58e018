package com.vulnstructure.engine.control_flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the elementary cycles of a {@link FlowGraph} (Johnson's algorithm).
 *
 * Each cycle is reported once, starting at its earliest node in insertion order.
 * A self-loop is a cycle of one node.
 */
final class SimpleCycles {

    private final FlowGraph graph;
    private final List<List<String>> cycles = new ArrayList<>();

    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> blocked = new HashSet<>();
    private final Map<String, Set<String>> blockedBy = new HashMap<>();

    private SimpleCycles(FlowGraph graph) {
        this.graph = graph;
    }

    static List<List<String>> find(FlowGraph graph) {
        SimpleCycles search = new SimpleCycles(graph);
        search.run();
        return search.cycles;
    }

    private void run() {
        List<String> order = graph.nodes();
        for (int i = 0; i < order.size(); i++) {
            String start = order.get(i);
            Set<String> allowed = new HashSet<>(order.subList(i, order.size()));
            Set<String> component = componentOf(start, allowed);
            blocked.clear();
            blockedBy.clear();
            stack.clear();
            circuit(start, start, component);
        }
    }

    private boolean circuit(String node, String start, Set<String> component) {
        boolean found = false;
        stack.addLast(node);
        blocked.add(node);
        for (String next : graph.successors(node)) {
            if (!component.contains(next)) continue;
            if (next.equals(start)) {
                cycles.add(new ArrayList<>(stack));
                found = true;
            } else if (!blocked.contains(next) && circuit(next, start, component)) {
                found = true;
            }
        }
        if (found) {
            unblock(node);
        } else {
            for (String next : graph.successors(node)) {
                if (component.contains(next)) {
                    blockedBy.computeIfAbsent(next, k -> new HashSet<>()).add(node);
                }
            }
        }
        stack.removeLast();
        return found;
    }

    private void unblock(String node) {
        blocked.remove(node);
        Set<String> waiting = blockedBy.remove(node);
        if (waiting == null) return;
        for (String w : waiting) {
            if (blocked.contains(w)) unblock(w);
        }
    }

    // Strongly connected component of start inside the allowed nodes:
    // nodes reachable from start that can also reach it.
    private Set<String> componentOf(String start, Set<String> allowed) {
        Set<String> forward = reach(start, allowed, false);
        Set<String> backward = reach(start, allowed, true);
        forward.retainAll(backward);
        return forward;
    }

    private Set<String> reach(String start, Set<String> allowed, boolean reverse) {
        Map<String, List<String>> predecessors = reverse ? predecessors(allowed) : null;
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        seen.add(start);
        work.add(start);
        while (!work.isEmpty()) {
            String node = work.poll();
            Iterable<String> next = reverse
                    ? predecessors.getOrDefault(node, List.of())
                    : graph.successors(node);
            for (String n : next) {
                if (allowed.contains(n) && seen.add(n)) work.add(n);
            }
        }
        return seen;
    }

    private Map<String, List<String>> predecessors(Set<String> allowed) {
        Map<String, List<String>> predecessors = new HashMap<>();
        for (String source : allowed) {
            for (String target : graph.successors(source)) {
                predecessors.computeIfAbsent(target, k -> new ArrayList<>()).add(source);
            }
        }
        return predecessors;
    }
}
