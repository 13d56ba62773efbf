package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;
import com.cloud.topo.api.TopologyConfigException;

import java.util.*;

/**
 * Load balancer front end. Owns its listeners in declaration order.
 */
public final class TrafficDistributor extends AbstractResource {
    private final NetworkFabric fabric;
    private final TrafficFilter filter;
    private final boolean internetFacing;
    private final List<Listener> listeners = new ArrayList<>();

    /**
     * @param filter Optional filter, may be null.
     */
    public TrafficDistributor(String name, NetworkFabric fabric, TrafficFilter filter, boolean internetFacing) {
        super(name);
        this.fabric = fabric;
        this.filter = filter;
        this.internetFacing = internetFacing;
    }

    public NetworkFabric fabric() {
        return fabric;
    }

    public Optional<TrafficFilter> filter() {
        return Optional.ofNullable(filter);
    }

    public boolean internetFacing() {
        return internetFacing;
    }

    public List<Listener> listeners() {
        return Collections.unmodifiableList(listeners);
    }

    /** Returns the listener bound to {@code port}, if any. */
    public Optional<Listener> listenerOn(int port) {
        return listeners.stream().filter(l -> l.port() == port).findFirst();
    }

    /** Appends a validated listener. Called by the topology builder. */
    public void appendListener(Listener listener) {
        checkNotFrozen();
        if (listener.distributor() != this)
            throw new TopologyConfigException("foreign-listener", listener.name(),
                    "Listener belongs to " + listener.distributor().name() + ", not " + name());
        listeners.add(listener);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TRAFFIC_DISTRIBUTOR;
    }

    @Override
    public List<Resource> references() {
        return filter == null ? List.of(fabric) : List.of(fabric, filter);
    }
}
