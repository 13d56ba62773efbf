package com.cloud.topo.util;

import com.cloud.topo.api.Diagnostic;
import com.cloud.topo.api.Resource;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.engine.TopologicalOrder;

import java.util.List;

/**
 * Diagnostic utility for inspecting a finalized topology.
 *
 * <p>
 * Generates human-readable renderings of the resource graph: a creation-order
 * dump for logs, and a Mermaid diagram for architecture docs.
 */
public final class TopologyExplain {
    private final ResourceGraph graph;
    private final TopologicalOrder topology;

    public TopologyExplain(ResourceGraph graph) {
        this.graph = graph;
        this.topology = graph.topology();
    }

    /**
     * Dumps a single resource with its dependencies and dependents.
     */
    public String explainResource(String name) {
        int idx = topology.topoIndex(name);
        Resource r = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Resource: ").append(name).append('\n')
                .append("  Kind: ").append(r.kind().label()).append('\n')
                .append("  Creation index: ").append(idx).append('\n');
        List<Resource> deps = graph.dependenciesOf(r);
        sb.append("  Depends on (").append(deps.size()).append("): ");
        appendNames(sb, deps);
        int cc = topology.childCount(idx);
        sb.append("\n  Dependents (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.node(topology.child(idx, i)).name());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire topology in creation order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Topology ").append(graph.name()).append(" (").append(topology.nodeCount())
                .append(" resources, ").append(topology.edgeCount()).append(" edges):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            Resource r = topology.node(i);
            sb.append("  [").append(i).append("] ").append(r.name()).append(" (").append(r.kind()).append(')');
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        for (Diagnostic w : graph.warnings())
            sb.append("  ! ").append(w).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Reference edges are solid arrows; edges that exist only because of an
     * ordering constraint are dotted and labelled "after".
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in declaration order
        for (Resource r : graph.resources()) {
            sb.append("  ").append(sanitize(r.name())).append("[\"").append(r.name())
                    .append("<br/><i>").append(r.kind().label()).append("</i>\"];\n");
        }

        // 2. Edges afterwards, dependency -> dependent
        for (Resource r : graph.resources()) {
            String safeName = sanitize(r.name());
            for (Resource dep : r.references())
                sb.append("  ").append(sanitize(dep.name())).append(" --> ").append(safeName).append(";\n");
            for (Resource before : graph.explicitDependenciesOf(r))
                sb.append("  ").append(sanitize(before.name())).append(" -. \"after\" .-> ").append(safeName)
                        .append(";\n");
        }
        return sb.toString();
    }

    private static void appendNames(StringBuilder sb, List<Resource> resources) {
        for (int i = 0; i < resources.size(); i++) {
            sb.append(resources.get(i).name());
            if (i < resources.size() - 1)
                sb.append(", ");
        }
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
