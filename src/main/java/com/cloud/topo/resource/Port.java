package com.cloud.topo.resource;

import com.cloud.topo.api.TopologyConfigException;

/**
 * Protocol and port range admitted by an ingress rule.
 */
public record Port(IpProtocol protocol, int fromPort, int toPort) {

    public Port {
        if (protocol == null)
            throw new TopologyConfigException("invalid-port", "port", "Protocol is required");
        if (fromPort < 1 || toPort > 65535 || fromPort > toPort)
            throw new TopologyConfigException("invalid-port", protocol.wireName(),
                    "Invalid port range " + fromPort + "-" + toPort);
    }

    public static Port tcp(int port) {
        return new Port(IpProtocol.TCP, port, port);
    }

    public static Port tcpRange(int fromPort, int toPort) {
        return new Port(IpProtocol.TCP, fromPort, toPort);
    }

    public static Port udp(int port) {
        return new Port(IpProtocol.UDP, port, port);
    }

    @Override
    public String toString() {
        return fromPort == toPort
                ? protocol.wireName() + "/" + fromPort
                : protocol.wireName() + "/" + fromPort + "-" + toPort;
    }
}
