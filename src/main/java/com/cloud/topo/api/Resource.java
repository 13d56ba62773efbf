package com.cloud.topo.api;

import java.util.List;

/**
 * A node in the resource graph.
 *
 * Every declared infrastructure component (network, filter, secret, cluster,
 * service, load balancer...) implements this interface.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every resource has a unique name within the graph. This is used
 * for lookups, diagnostics and as the seed of the logical id in the synthesized
 * template.
 *
 * 2. References: references() lists the resources this one points at through its
 * own fields. Each reference is an implicit "created before" edge. Resources never
 * register edges as a side effect; the dependency pass reads this list.
 */
public interface Resource {

    /**
     * Returns the unique name of this resource within its graph.
     *
     * @return The graph id.
     */
    String name();

    /** The category of infrastructure this resource declares. */
    ResourceKind kind();

    /**
     * Returns the resources this one refers to, in field order.
     *
     * The returned list is a snapshot. Resources with growing reference sets
     * (listeners gaining targets) return a fresh copy on every call.
     *
     * @return The referenced resources, never null.
     */
    List<Resource> references();
}
