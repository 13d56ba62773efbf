package com.cloud.topo.resource;

import com.cloud.topo.api.TopologyConfigException;

/**
 * Input to {@code declareNetwork}: one address partition to carve out of the fabric.
 *
 * @param name         Partition name, unique within the fabric.
 * @param cidrMask     Prefix length of the partition's address range (e.g. 24).
 * @param reachability Whether the partition is reachable from outside.
 */
public record PartitionSpec(String name, int cidrMask, Reachability reachability) {

    public PartitionSpec {
        if (name == null || name.isBlank())
            throw new TopologyConfigException("invalid-partition", String.valueOf(name),
                    "Partition name must not be blank");
        if (reachability == null)
            throw new TopologyConfigException("invalid-partition", name, "Partition needs a reachability class");
    }

    public static PartitionSpec externallyReachable(String name, int cidrMask) {
        return new PartitionSpec(name, cidrMask, Reachability.EXTERNALLY_REACHABLE);
    }

    public static PartitionSpec isolated(String name, int cidrMask) {
        return new PartitionSpec(name, cidrMask, Reachability.ISOLATED);
    }
}
