package com.cloud.topo.api;

/**
 * Explicit "create {@code after} once {@code before} exists" edge, for orderings
 * no reference already encodes.
 */
public record OrderingConstraint(Resource before, Resource after) {

    @Override
    public String toString() {
        return before.name() + " -> " + after.name();
    }
}
