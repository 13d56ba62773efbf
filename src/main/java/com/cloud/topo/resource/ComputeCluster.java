package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.List;

/** Logical grouping that service tasks run in. */
public final class ComputeCluster extends AbstractResource {
    private final NetworkFabric fabric;

    public ComputeCluster(String name, NetworkFabric fabric) {
        super(name);
        this.fabric = fabric;
    }

    public NetworkFabric fabric() {
        return fabric;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.COMPUTE_CLUSTER;
    }

    @Override
    public List<Resource> references() {
        return List.of(fabric);
    }
}
