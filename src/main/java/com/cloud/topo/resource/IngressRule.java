package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Permits traffic into {@code filter} from either the members of a source filter
 * or an address range. Graph id is {@code <filter>.Ingress<n>}.
 */
public final class IngressRule extends AbstractResource {
    private final TrafficFilter filter;
    private final TrafficFilter sourceFilter;
    private final Cidr sourceCidr;
    private final Port port;
    private final String description;

    public IngressRule(String name, TrafficFilter filter, TrafficFilter sourceFilter, Port port,
            String description) {
        this(name, filter, Objects.requireNonNull(sourceFilter, "sourceFilter"), null, port, description);
    }

    public IngressRule(String name, TrafficFilter filter, Cidr sourceCidr, Port port, String description) {
        this(name, filter, null, Objects.requireNonNull(sourceCidr, "sourceCidr"), port, description);
    }

    private IngressRule(String name, TrafficFilter filter, TrafficFilter sourceFilter, Cidr sourceCidr,
            Port port, String description) {
        super(name);
        this.filter = filter;
        this.sourceFilter = sourceFilter;
        this.sourceCidr = sourceCidr;
        this.port = port;
        this.description = description;
    }

    public TrafficFilter filter() {
        return filter;
    }

    /** Source filter, empty when the rule admits an address range. */
    public Optional<TrafficFilter> sourceFilter() {
        return Optional.ofNullable(sourceFilter);
    }

    /** Source address range, empty when the rule admits a filter. */
    public Optional<Cidr> sourceCidr() {
        return Optional.ofNullable(sourceCidr);
    }

    public Port port() {
        return port;
    }

    public String description() {
        return description;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.INGRESS_RULE;
    }

    @Override
    public List<Resource> references() {
        return sourceFilter == null ? List.of(filter) : List.of(filter, sourceFilter);
    }
}
