package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.*;

/**
 * A port + protocol on a {@link TrafficDistributor}, forwarding to an ordered
 * list of service targets.
 *
 * Targets are kept exactly as appended; duplicates are not collapsed here.
 * Whether a duplicate is tolerated is the builder's lint policy.
 */
public final class Listener extends AbstractResource {
    private final TrafficDistributor distributor;
    private final int port;
    private final ListenerProtocol protocol;
    private final List<ServiceInstance> targets = new ArrayList<>();

    public Listener(String name, TrafficDistributor distributor, int port, ListenerProtocol protocol) {
        super(name);
        this.distributor = distributor;
        this.port = port;
        this.protocol = protocol;
    }

    public TrafficDistributor distributor() {
        return distributor;
    }

    public int port() {
        return port;
    }

    public ListenerProtocol protocol() {
        return protocol;
    }

    /** Targets in append order, duplicates included. */
    public List<ServiceInstance> targets() {
        return Collections.unmodifiableList(targets);
    }

    /**
     * Appends a validated target. Called by the topology builder.
     *
     * @throws com.cloud.topo.api.TopologyStateException once the graph is finalized.
     */
    public void appendTarget(ServiceInstance target) {
        checkNotFrozen();
        targets.add(target);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.LISTENER;
    }

    @Override
    public List<Resource> references() {
        List<Resource> refs = new ArrayList<>(targets.size() + 1);
        refs.add(distributor);
        for (ServiceInstance t : new LinkedHashSet<>(targets))
            refs.add(t);
        return refs;
    }
}
