package com.cloud.topo.resource;

import com.cloud.topo.api.TopologyConfigException;

/**
 * Instance class/size pair of a managed database instance, e.g. t3 + medium.
 */
public record InstanceType(String instanceClass, String size) {

    public InstanceType {
        if (instanceClass == null || instanceClass.isBlank() || size == null || size.isBlank())
            throw new TopologyConfigException("invalid-instance-type", instanceClass + "." + size,
                    "Instance class and size are required");
    }

    public static InstanceType of(String instanceClass, String size) {
        return new InstanceType(instanceClass.toLowerCase(), size.toLowerCase());
    }

    /** Provider notation for database instances, e.g. {@code db.t3.medium}. */
    public String dbInstanceClass() {
        return "db." + instanceClass + "." + size;
    }

    @Override
    public String toString() {
        return instanceClass + "." + size;
    }
}
