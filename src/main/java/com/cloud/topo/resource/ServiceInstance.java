package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.List;

/**
 * A running service: a task template placed on a compute cluster, behind a
 * filter, in a partition. Its execution identity is the principal that
 * permission grants attach to.
 */
public final class ServiceInstance extends AbstractResource {
    private final ComputeCluster cluster;
    private final TaskTemplate taskTemplate;
    private final TrafficFilter filter;
    private final AddressPartition partition;
    private final boolean assignPublicAddress;

    public ServiceInstance(String name, ComputeCluster cluster, TaskTemplate taskTemplate, TrafficFilter filter,
            AddressPartition partition, boolean assignPublicAddress) {
        super(name);
        this.cluster = cluster;
        this.taskTemplate = taskTemplate;
        this.filter = filter;
        this.partition = partition;
        this.assignPublicAddress = assignPublicAddress;
    }

    public ComputeCluster cluster() {
        return cluster;
    }

    public TaskTemplate taskTemplate() {
        return taskTemplate;
    }

    public TrafficFilter filter() {
        return filter;
    }

    public AddressPartition partition() {
        return partition;
    }

    public boolean assignPublicAddress() {
        return assignPublicAddress;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.SERVICE_INSTANCE;
    }

    @Override
    public List<Resource> references() {
        return List.of(cluster, taskTemplate, filter, partition);
    }
}
