package com.cloud.topo.engine;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.TopologyCycleException;
import com.cloud.topo.api.TopologyConfigException;

import java.util.*;

/**
 * Topology -- CSR-encoded static DAG of resources in creation order.
 *
 * This class represents the immutable structure of the resource graph after it
 * has been finalized. Iterating 0..N visits every resource after everything it
 * depends on, which is the order the provisioning engine is expected to attempt
 * creation in.
 *
 * Data layout:
 * - topoOrder: resources sorted topologically. Among resources with no ordering
 * between them, the one declared first comes first (stable sort).
 * - childrenList: a single flattened int array containing the topological
 * indices of all dependents of all resources.
 * - childrenOffset: childrenOffset[i] points to the start of resource i's
 * dependents in childrenList; they run up to childrenOffset[i+1] exclusive.
 */
public final class TopologicalOrder {
    // The resources in creation order.
    private final Resource[] topoOrder;

    // CSR Index: childrenOffset[i] points to the start of node i's dependents.
    private final int[] childrenOffset;

    // CSR Data: Flattened list of dependent indices.
    private final int[] childrenList;

    // Number of direct dependencies for each node
    private final int[] parentCount;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(Resource[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    /** Returns the resource at the given topological index. */
    public Resource node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a resource name to its topological index. O(1) hash lookup. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown resource: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** True if the resource depends on nothing. */
    public boolean isRoot(int ti) {
        return parentCount[ti] == 0;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Resources in creation order, as an immutable list. */
    public List<Resource> asList() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<Resource> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(Resource node) {
            if (nameToIdx.containsKey(node.name()))
                throw new TopologyConfigException("duplicate-name", node.name(),
                        "Duplicate resource name: " + node.name());
            int idx = nodes.size();
            nodes.add(node);
            nameToIdx.put(node.name(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Adds a "from is created before to" edge. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new TopologyCycleException("Self-edge not allowed: " + from);
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new TopologyConfigException("unknown-resource", name, "Unknown resource: " + name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection. The
         * ready set is a min-heap on declaration index, so independent resources keep
         * their declaration order.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Seed with resources that depend on nothing
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            // 3. Process ready set (Kahn's algorithm)
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (topoIdx != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(nodes.get(i).name());
                throw new TopologyCycleException("Cycle detected! Ordered " + topoIdx + " of " + n
                        + " resources, unresolved: " + stuck);
            }

            // 4. Construct compact arrays
            Resource[] orderedNodes = new Resource[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                orderedNodes[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(orderedNodes[ti].name(), ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(orderedNodes, offsets, flatChildren, parentCounts, newNameToIndex);
        }
    }
}
