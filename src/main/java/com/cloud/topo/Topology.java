package com.cloud.topo;

import com.cloud.topo.config.StackEnvironment;
import com.cloud.topo.config.TopologyOptions;

/**
 * Resource Topology: declarative model of a cloud deployment.
 *
 * <h2>Philosophy</h2>
 * <p>
 * A deployment is modelled as a Directed Acyclic Graph where:
 * <ul>
 * <li><b>Resources</b> are the declared infrastructure components (network,
 * security groups, secrets, database, container service, load balancer).</li>
 * <li><b>Edges</b> are either references a resource holds in its own fields or
 * explicit ordering constraints.</li>
 * <li><b>Finalization</b> validates the whole graph and fixes the creation
 * order handed to the provisioning engine.</li>
 * </ul>
 *
 * <h3>Key Features</h3>
 * <ul>
 * <li><b>Explicit:</b> every declaration returns a handle; nothing is registered
 * or wired as a side effect.</li>
 * <li><b>Fail fast:</b> invalid references are refused at the call that makes
 * them; a graph with a refused declaration never finalizes.</li>
 * <li><b>Deterministic:</b> the same declarations always produce the same
 * creation order and template. See
 * {@link com.cloud.topo.io.TemplateSynthesizer}.</li>
 * </ul>
 */
public final class Topology {

    private Topology() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new topology builder.
     *
     * @param name A descriptive name for the topology.
     * @return A new {@link TopologyBuilder} instance.
     */
    public static TopologyBuilder builder(String name) {
        return TopologyBuilder.create(name);
    }

    public static TopologyBuilder builder(String name, StackEnvironment environment) {
        return TopologyBuilder.create(name, environment, TopologyOptions.defaults());
    }

    public static TopologyBuilder builder(String name, StackEnvironment environment, TopologyOptions options) {
        return TopologyBuilder.create(name, environment, options);
    }
}
