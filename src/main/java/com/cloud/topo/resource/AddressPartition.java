package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.List;

/**
 * A named subdivision of a {@link NetworkFabric}. Its graph id is
 * {@code <fabric>.<partition>}.
 */
public final class AddressPartition extends AbstractResource {
    private final NetworkFabric fabric;
    private final String partitionName;
    private final int cidrMask;
    private final Reachability reachability;
    private final List<Cidr> zoneBlocks;

    AddressPartition(NetworkFabric fabric, PartitionSpec spec, List<Cidr> zoneBlocks) {
        super(fabric.name() + "." + spec.name());
        this.fabric = fabric;
        this.partitionName = spec.name();
        this.cidrMask = spec.cidrMask();
        this.reachability = spec.reachability();
        this.zoneBlocks = List.copyOf(zoneBlocks);
    }

    public NetworkFabric fabric() {
        return fabric;
    }

    public String partitionName() {
        return partitionName;
    }

    public int cidrMask() {
        return cidrMask;
    }

    public Reachability reachability() {
        return reachability;
    }

    /** Blocks reserved for this partition, one per availability zone in zone order. */
    public List<Cidr> zoneBlocks() {
        return zoneBlocks;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.ADDRESS_PARTITION;
    }

    @Override
    public List<Resource> references() {
        return List.of(fabric);
    }
}
