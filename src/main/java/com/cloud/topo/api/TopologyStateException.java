package com.cloud.topo.api;

/**
 * A mutation was attempted on a builder that has already been finalized.
 */
public class TopologyStateException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public TopologyStateException(String message) {
        super(message);
    }
}
