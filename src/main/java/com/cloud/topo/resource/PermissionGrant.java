package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.*;

/**
 * Allows a service's execution identity to perform a set of actions on a set of
 * resources, e.g. read one secret's value.
 */
public final class PermissionGrant extends AbstractResource {
    private final ServiceInstance identity;
    private final Set<String> actions;
    private final List<Resource> resources;

    public PermissionGrant(String name, ServiceInstance identity, Collection<String> actions,
            Collection<? extends Resource> resources) {
        super(name);
        this.identity = identity;
        this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        this.resources = List.copyOf(new LinkedHashSet<Resource>(resources));
    }

    public ServiceInstance identity() {
        return identity;
    }

    public Set<String> actions() {
        return actions;
    }

    public List<Resource> resources() {
        return resources;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PERMISSION_GRANT;
    }

    @Override
    public List<Resource> references() {
        List<Resource> refs = new ArrayList<>(resources.size() + 1);
        refs.add(identity);
        for (Resource r : resources)
            if (r != identity)
                refs.add(r);
        return refs;
    }
}
