package com.cloud.topo.engine;

import com.cloud.topo.api.OrderingConstraint;
import com.cloud.topo.api.Resource;

import java.util.*;

/**
 * Derives the dependency edge set of a topology.
 *
 * Resources never record edges as a side effect of wiring. Instead this pass
 * reads each resource's {@link Resource#references()} plus the explicit
 * {@link OrderingConstraint}s and produces "created before" edges keyed by
 * resource name. Duplicate edges collapse to one.
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    /**
     * Forward edges: name of a dependency to the names of its dependents, both in
     * declaration order.
     */
    public static Map<String, Set<String>> deriveEdges(Collection<? extends Resource> resources,
            Collection<OrderingConstraint> constraints) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (Resource r : resources)
            edges.put(r.name(), new LinkedHashSet<>());
        for (Resource r : resources)
            for (Resource dep : r.references())
                edges.computeIfAbsent(dep.name(), k -> new LinkedHashSet<>()).add(r.name());
        for (OrderingConstraint c : constraints)
            edges.computeIfAbsent(c.before().name(), k -> new LinkedHashSet<>()).add(c.after().name());
        return edges;
    }

    /**
     * True if {@code to} can be reached from {@code from} by following edges.
     * A resource reaches itself.
     */
    public static boolean reaches(Map<String, Set<String>> edges, String from, String to) {
        if (from.equals(to))
            return true;
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(from);
        visited.add(from);
        while (!stack.isEmpty()) {
            String curr = stack.pop();
            for (String next : edges.getOrDefault(curr, Set.of())) {
                if (next.equals(to))
                    return true;
                if (visited.add(next))
                    stack.push(next);
            }
        }
        return false;
    }

    /**
     * Sorts the resources into creation order.
     *
     * @throws com.cloud.topo.api.TopologyCycleException if the edges contain a
     *                                                   cycle.
     */
    public static TopologicalOrder resolve(List<? extends Resource> resources,
            Collection<OrderingConstraint> constraints) {
        var topo = TopologicalOrder.builder();
        for (Resource r : resources)
            topo.addNode(r);
        for (var entry : deriveEdges(resources, constraints).entrySet())
            for (String dependent : entry.getValue())
                topo.addEdge(entry.getKey(), dependent);
        return topo.build();
    }
}
