package com.cloud.topo.engine;

import com.cloud.topo.api.Diagnostic;
import com.cloud.topo.api.OrderingConstraint;
import com.cloud.topo.api.Resource;
import com.cloud.topo.config.StackEnvironment;

import java.util.*;

/**
 * A finalized, read-only resource graph.
 *
 * The ResourceGraph is what the TopologyBuilder hands to the synthesis step.
 *
 * Responsibilities:
 * 1. Node set: exactly the declared resources, in declaration order.
 * 2. Creation order: the {@link TopologicalOrder} derived from references plus
 * explicit ordering constraints.
 * 3. Name resolution: typed lookup of resources by graph id.
 * 4. Diagnostics: the lint warnings that did not block finalization.
 *
 * Thread Safety:
 * Immutable after construction. The resource objects themselves are no longer
 * mutated once their builder is finalized.
 */
public final class ResourceGraph {
    private final String name;
    private final StackEnvironment environment;
    private final List<Resource> resources;
    private final Map<String, Resource> resourcesByName;
    private final List<OrderingConstraint> constraints;
    private final TopologicalOrder topology;
    private final List<Diagnostic> warnings;

    public ResourceGraph(String name, StackEnvironment environment, List<Resource> resources,
            List<OrderingConstraint> constraints, TopologicalOrder topology, List<Diagnostic> warnings) {
        this.name = name;
        this.environment = environment;
        this.resources = List.copyOf(resources);
        Map<String, Resource> byName = new LinkedHashMap<>(resources.size() * 2);
        for (Resource r : resources)
            byName.put(r.name(), r);
        this.resourcesByName = Collections.unmodifiableMap(byName);
        this.constraints = List.copyOf(constraints);
        this.topology = topology;
        this.warnings = List.copyOf(warnings);
    }

    public String name() {
        return name;
    }

    public StackEnvironment environment() {
        return environment;
    }

    /** Declared resources in declaration order. */
    public List<Resource> resources() {
        return resources;
    }

    public Map<String, Resource> resourcesByName() {
        return resourcesByName;
    }

    public List<OrderingConstraint> constraints() {
        return constraints;
    }

    public TopologicalOrder topology() {
        return topology;
    }

    /** Resources in the order the provisioning engine should create them. */
    public List<Resource> creationOrder() {
        return topology.asList();
    }

    public List<Diagnostic> warnings() {
        return warnings;
    }

    /**
     * Type-safe lookup of a resource by name.
     *
     * @param name The graph id.
     * @param <T>  Expected resource type.
     * @return The resource, or null if not found.
     */
    @SuppressWarnings("unchecked")
    public <T extends Resource> T resource(String name) {
        return (T) resourcesByName.get(name);
    }

    /** True if this exact resource instance is part of the graph. */
    public boolean contains(Resource resource) {
        return resource != null && resourcesByName.get(resource.name()) == resource;
    }

    /** All resources of the given type, in declaration order. */
    public <T extends Resource> List<T> resources(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Resource r : resources)
            if (type.isInstance(r))
                out.add(type.cast(r));
        return out;
    }

    /** Direct dependencies of a resource: references plus constraint predecessors. */
    public List<Resource> dependenciesOf(Resource resource) {
        Set<Resource> deps = new LinkedHashSet<>(resource.references());
        for (OrderingConstraint c : constraints)
            if (c.after() == resource)
                deps.add(c.before());
        return List.copyOf(deps);
    }

    /** Constraint-only predecessors, i.e. edges no reference already encodes. */
    public List<Resource> explicitDependenciesOf(Resource resource) {
        List<Resource> out = new ArrayList<>();
        for (OrderingConstraint c : constraints)
            if (c.after() == resource && !resource.references().contains(c.before()) && !out.contains(c.before()))
                out.add(c.before());
        return out;
    }
}
