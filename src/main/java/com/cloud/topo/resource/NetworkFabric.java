package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;
import com.cloud.topo.api.TopologyConfigException;

import java.util.*;

/**
 * Isolated virtual network, root of the resource graph.
 *
 * The fabric owns its partitions and creates them from the given specs in
 * order. Each partition reserves one block per availability zone, allocated
 * sequentially from the start of the fabric's range; a layout that does not fit
 * is refused here rather than at deployment. The fabric is never mutated
 * afterwards.
 */
public final class NetworkFabric extends AbstractResource {
    public static final String DEFAULT_CIDR = "10.0.0.0/16";

    /** Smallest partition the provider accepts. */
    public static final int MAX_PARTITION_MASK = 28;

    /** Widest network the provider accepts. */
    public static final int MIN_NETWORK_PREFIX = 16;

    /** Zones a partition may span; every one of them gets a block. */
    public static final int MAX_AVAILABILITY_ZONES = 3;

    private final Cidr cidr;
    private final List<AddressPartition> partitions;

    public NetworkFabric(String name, String cidrBlock, List<PartitionSpec> specs) {
        super(name);
        this.cidr = Cidr.parse(name, cidrBlock);
        if (cidr.prefix() < MIN_NETWORK_PREFIX || cidr.prefix() > MAX_PARTITION_MASK)
            throw new TopologyConfigException("invalid-cidr", name, "Network prefix must be between /"
                    + MIN_NETWORK_PREFIX + " and /" + MAX_PARTITION_MASK + ": " + cidrBlock);

        List<AddressPartition> created = new ArrayList<>(specs.size());
        long offset = 0;
        for (PartitionSpec spec : specs) {
            if (spec.cidrMask() < cidr.prefix() || spec.cidrMask() > MAX_PARTITION_MASK)
                throw new TopologyConfigException("invalid-partition", name + "." + spec.name(),
                        "CIDR mask /" + spec.cidrMask() + " must be between /" + cidr.prefix()
                                + " and /" + MAX_PARTITION_MASK);
            long blockSize = Cidr.size(spec.cidrMask());
            List<Cidr> blocks = new ArrayList<>(MAX_AVAILABILITY_ZONES);
            for (int zone = 0; zone < MAX_AVAILABILITY_ZONES; zone++) {
                offset = (offset + blockSize - 1) / blockSize * blockSize;
                if (offset + blockSize > cidr.size())
                    throw new TopologyConfigException("address-space-exhausted", name + "." + spec.name(),
                            "No room for a /" + spec.cidrMask() + " block in zone " + zone + " of "
                                    + cidr + " after the partitions before it");
                blocks.add(cidr.subBlock(offset, spec.cidrMask()));
                offset += blockSize;
            }
            created.add(new AddressPartition(this, spec, blocks));
        }
        this.partitions = Collections.unmodifiableList(created);
    }

    public String cidrBlock() {
        return cidr.toString();
    }

    public Cidr cidr() {
        return cidr;
    }

    /** Partitions in declaration order. */
    public List<AddressPartition> partitions() {
        return partitions;
    }

    /**
     * Looks up a partition by its short name.
     *
     * @throws TopologyConfigException if the fabric has no such partition.
     */
    public AddressPartition partition(String partitionName) {
        for (AddressPartition p : partitions)
            if (p.partitionName().equals(partitionName))
                return p;
        throw new TopologyConfigException("unknown-partition", name() + "." + partitionName,
                "Network " + name() + " has no partition named " + partitionName);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.NETWORK_FABRIC;
    }

    @Override
    public List<Resource> references() {
        return List.of();
    }
}
