package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;
import com.cloud.topo.api.TopologyConfigException;

import java.util.*;

/**
 * A fabric-scoped access-control boundary (security group).
 *
 * A filter starts with no ingress rules. Rules are separate graph nodes that
 * reference the filter; the filter keeps them in declaration order so they can
 * be listed and synthesized in that order.
 */
public final class TrafficFilter extends AbstractResource {
    private final NetworkFabric fabric;
    private final List<IngressRule> rules = new ArrayList<>();

    public TrafficFilter(String name, NetworkFabric fabric) {
        super(name);
        this.fabric = fabric;
    }

    public NetworkFabric fabric() {
        return fabric;
    }

    /** Ingress rules in the order they were added. */
    public List<IngressRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Appends a rule owned by this filter. Called by the topology builder once the
     * rule has been validated.
     */
    public void appendRule(IngressRule rule) {
        checkNotFrozen();
        if (rule.filter() != this)
            throw new TopologyConfigException("foreign-rule", rule.name(),
                    "Rule belongs to " + rule.filter().name() + ", not " + name());
        rules.add(rule);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TRAFFIC_FILTER;
    }

    @Override
    public List<Resource> references() {
        return List.of(fabric);
    }
}
