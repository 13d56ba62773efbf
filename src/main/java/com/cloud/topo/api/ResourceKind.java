package com.cloud.topo.api;

/**
 * Categories of resources that can appear in a topology.
 */
public enum ResourceKind {
    NETWORK_FABRIC("Network"),
    ADDRESS_PARTITION("Subnet"),
    TRAFFIC_FILTER("Security group"),
    INGRESS_RULE("Ingress rule"),
    SECRET_MATERIAL("Secret"),
    STATEFUL_CLUSTER("Database cluster"),
    COMPUTE_CLUSTER("Compute cluster"),
    TASK_TEMPLATE("Task definition"),
    SERVICE_INSTANCE("Service"),
    TRAFFIC_DISTRIBUTOR("Load balancer"),
    LISTENER("Listener"),
    PERMISSION_GRANT("Permission grant");

    private final String label;

    ResourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ResourceKind fromString(String text) {
        for (ResourceKind k : ResourceKind.values()) {
            if (k.name().equalsIgnoreCase(text)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown ResourceKind: " + text);
    }
}
