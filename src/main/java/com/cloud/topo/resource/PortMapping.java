package com.cloud.topo.resource;

import com.cloud.topo.api.TopologyConfigException;

/**
 * A container port exposed by a task.
 */
public record PortMapping(int containerPort, IpProtocol protocol) {

    public PortMapping {
        if (containerPort < 1 || containerPort > 65535)
            throw new TopologyConfigException("invalid-port", String.valueOf(containerPort),
                    "Container port must be between 1 and 65535");
        if (protocol == null)
            protocol = IpProtocol.TCP;
    }

    public static PortMapping tcp(int containerPort) {
        return new PortMapping(containerPort, IpProtocol.TCP);
    }
}
