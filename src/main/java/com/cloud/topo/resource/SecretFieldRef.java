package com.cloud.topo.resource;

/**
 * Typed handle to one field of a {@link SecretMaterial}. Used wherever a secret
 * value is consumed; the value itself never enters the graph.
 */
public record SecretFieldRef(SecretMaterial secret, String field) {

    @Override
    public String toString() {
        return secret.name() + ":" + field;
    }
}
