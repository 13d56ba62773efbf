package com.cloud.topo.resource;

/**
 * Whether an address partition can be reached from outside the network.
 */
public enum Reachability {
    EXTERNALLY_REACHABLE,
    ISOLATED
}
