package com.cloud.topo.resource;

import com.cloud.topo.api.Resource;
import com.cloud.topo.api.ResourceKind;
import com.cloud.topo.api.TopologyConfigException;

import java.util.*;

/**
 * Declaration of a credential that an external generator produces at
 * provisioning time.
 *
 * Holds the known, non-sensitive template fields (e.g. a username) and the
 * recipe for the generated field. The generated value is never computed or
 * stored here; consumers get a {@link SecretFieldRef} via {@link #field(String)}.
 */
public final class SecretMaterial extends AbstractResource {
    private final Map<String, String> templateFields;
    private final GeneratedSecretSpec generated;

    public SecretMaterial(String name, Map<String, String> templateFields, GeneratedSecretSpec generated) {
        super(name);
        if (generated == null)
            throw new TopologyConfigException("invalid-secret", name, "A generated field is required");
        if (templateFields.containsKey(generated.fieldName()))
            throw new TopologyConfigException("invalid-secret", name,
                    "Generated field '" + generated.fieldName() + "' clashes with a template field");
        this.templateFields = Collections.unmodifiableMap(new LinkedHashMap<>(templateFields));
        this.generated = generated;
    }

    /** Known fields in declaration order. */
    public Map<String, String> templateFields() {
        return templateFields;
    }

    public GeneratedSecretSpec generated() {
        return generated;
    }

    /** Template fields followed by the generated field. */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(templateFields.keySet());
        names.add(generated.fieldName());
        return names;
    }

    public boolean hasField(String field) {
        return templateFields.containsKey(field) || generated.fieldName().equals(field);
    }

    /**
     * Returns a reference to one field of this secret.
     *
     * @throws TopologyConfigException if the secret has no such field.
     */
    public SecretFieldRef field(String field) {
        if (!hasField(field))
            throw new TopologyConfigException("unknown-secret-field", name(),
                    "Secret has no field '" + field + "', known fields: " + fieldNames());
        return new SecretFieldRef(this, field);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.SECRET_MATERIAL;
    }

    @Override
    public List<Resource> references() {
        return List.of();
    }
}
