package com.cloud.topo.api;

/**
 * An explicit or implicit ordering edge would make the resource graph cyclic.
 */
public class TopologyCycleException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public TopologyCycleException(String message) {
        super(message);
    }
}
