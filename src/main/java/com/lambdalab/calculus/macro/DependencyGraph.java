package com.lambdalab.calculus.macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topological ordering of macros, dependencies before dependents.
 *
 * Ties are broken by definition order, so the result is stable across calls.
 */
public final class DependencyGraph {

    /** Either a full order or, when the graph has a cycle, one cycle. */
    public static final class Order {
        private final List<String> order;
        private final List<String> cycle;

        private Order(List<String> order, List<String> cycle) {
            this.order = order;
            this.cycle = cycle;
        }

        public boolean hasCycle() { return cycle != null; }

        /** Names in dependency order; null when there is a cycle. */
        public List<String> order() { return order; }

        /** Names on a cycle, first name repeated at the end; null when acyclic. */
        public List<String> cycle() { return cycle; }
    }

    private DependencyGraph() {}

    public static Map<String, Set<String>> edges(Map<String, MacroDefinition> macros) {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (MacroDefinition def : macros.values()) {
            Set<String> deps = new LinkedHashSet<>();
            for (String d : def.dependencies()) {
                if (macros.containsKey(d)) deps.add(d);
            }
            out.put(def.name(), deps);
        }
        return out;
    }

    public static Order sort(Map<String, MacroDefinition> macros) {
        Map<String, Set<String>> edges = edges(macros);
        Set<String> emitted = new LinkedHashSet<>();

        boolean progress = true;
        while (progress && emitted.size() < edges.size()) {
            progress = false;
            for (Map.Entry<String, Set<String>> e : edges.entrySet()) {
                if (emitted.contains(e.getKey())) continue;
                if (emitted.containsAll(e.getValue())) {
                    emitted.add(e.getKey());
                    progress = true;
                }
            }
        }

        if (emitted.size() == edges.size()) {
            return new Order(Collections.unmodifiableList(new ArrayList<>(emitted)), null);
        }
        return new Order(null, Collections.unmodifiableList(findCycle(edges, emitted)));
    }

    // Every node left over has at least one left-over dependency, so walking
    // those dependencies must revisit a node.
    private static List<String> findCycle(Map<String, Set<String>> edges, Set<String> emitted) {
        String start = null;
        for (String n : edges.keySet()) {
            if (!emitted.contains(n)) {
                start = n;
                break;
            }
        }

        List<String> path = new ArrayList<>();
        String cur = start;
        while (!path.contains(cur)) {
            path.add(cur);
            String next = null;
            for (String d : edges.get(cur)) {
                if (!emitted.contains(d)) {
                    next = d;
                    break;
                }
            }
            cur = next;
        }

        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(cur), path.size()));
        cycle.add(cur);
        return cycle;
    }
}
