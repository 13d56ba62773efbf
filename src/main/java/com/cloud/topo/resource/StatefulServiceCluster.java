package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.List;

/**
 * The managed document database cluster.
 *
 * Bound to an isolated partition only. The administrative identity is read from
 * the secret's {@link #USERNAME_FIELD} and {@link #PASSWORD_FIELD} fields.
 */
public final class StatefulServiceCluster extends AbstractResource {
    public static final String USERNAME_FIELD = "username";
    public static final String PASSWORD_FIELD = "password";
    public static final int DEFAULT_PORT = 27017;

    private final NetworkFabric fabric;
    private final AddressPartition partition;
    private final TrafficFilter filter;
    private final SecretMaterial secret;
    private final InstanceType instanceType;
    private final int instanceCount;
    private final RemovalPolicy removalPolicy;

    public StatefulServiceCluster(String name, NetworkFabric fabric, AddressPartition partition,
            TrafficFilter filter, SecretMaterial secret, InstanceType instanceType, int instanceCount,
            RemovalPolicy removalPolicy) {
        super(name);
        this.fabric = fabric;
        this.partition = partition;
        this.filter = filter;
        this.secret = secret;
        this.instanceType = instanceType;
        this.instanceCount = instanceCount;
        this.removalPolicy = removalPolicy;
    }

    public NetworkFabric fabric() {
        return fabric;
    }

    public AddressPartition partition() {
        return partition;
    }

    public TrafficFilter filter() {
        return filter;
    }

    public SecretMaterial secret() {
        return secret;
    }

    public InstanceType instanceType() {
        return instanceType;
    }

    public int instanceCount() {
        return instanceCount;
    }

    public RemovalPolicy removalPolicy() {
        return removalPolicy;
    }

    public int port() {
        return DEFAULT_PORT;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.STATEFUL_CLUSTER;
    }

    @Override
    public List<Resource> references() {
        return List.of(fabric, partition, filter, secret);
    }
}
