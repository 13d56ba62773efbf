package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.TopologyConfigException;
import com.cloud.topo.api.TopologyStateException;

/**
 * Base class for resources: holds the graph id and renders it in toString().
 */
public abstract class AbstractResource implements Resource {
    private final String name;
    private boolean frozen;

    protected AbstractResource(String name) {
        if (name == null || name.isBlank())
            throw new TopologyConfigException("invalid-name", String.valueOf(name),
                    kindLabel() + " name must not be blank");
        this.name = name;
    }

    @Override
    public final String name() {
        return name;
    }

    /**
     * Marks this resource as part of a finalized graph. Every later attempt to
     * append to it throws {@link TopologyStateException}.
     */
    public final void freeze() {
        frozen = true;
    }

    public final boolean isFrozen() {
        return frozen;
    }

    protected final void checkNotFrozen() {
        if (frozen)
            throw new TopologyStateException(toString() + " belongs to a finalized topology");
    }

    private String kindLabel() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return kind().label() + "(" + name + ")";
    }
}
