package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;

import java.util.*;

/**
 * One runnable container unit: image, CPU/memory reservation, exposed ports and
 * secret-backed environment variables.
 *
 * Environment variables map to {@link SecretFieldRef}s only, so no credential
 * value is ever part of the template. Each distinct bound secret is a reference.
 */
public final class TaskTemplate extends AbstractResource {
    private final String image;
    private final int cpu;
    private final int memoryMiB;
    private final List<PortMapping> ports;
    private final Map<String, SecretFieldRef> secretEnv;

    public TaskTemplate(String name, String image, int cpu, int memoryMiB, List<PortMapping> ports,
            Map<String, SecretFieldRef> secretEnv) {
        super(name);
        this.image = image;
        this.cpu = cpu;
        this.memoryMiB = memoryMiB;
        this.ports = List.copyOf(ports);
        this.secretEnv = Collections.unmodifiableMap(new LinkedHashMap<>(secretEnv));
    }

    public String image() {
        return image;
    }

    public int cpu() {
        return cpu;
    }

    public int memoryMiB() {
        return memoryMiB;
    }

    public List<PortMapping> ports() {
        return ports;
    }

    /** Environment variable name to secret field, in declaration order. */
    public Map<String, SecretFieldRef> secretEnv() {
        return secretEnv;
    }

    /** Distinct secrets bound into the environment, first-use order. */
    public List<SecretMaterial> boundSecrets() {
        Set<SecretMaterial> seen = new LinkedHashSet<>();
        for (SecretFieldRef ref : secretEnv.values())
            seen.add(ref.secret());
        return List.copyOf(seen);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TASK_TEMPLATE;
    }

    @Override
    public List<Resource> references() {
        return List.copyOf(boundSecrets());
    }
}
