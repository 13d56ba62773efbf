package com.cloud.topo.resource;

/**
 * What happens to a stateful resource when its stack is torn down.
 */
public enum RemovalPolicy {
    DESTROY,
    RETAIN,
    SNAPSHOT
}
