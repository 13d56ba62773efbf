package com.cloud.topo.resource;

import com.cloud.topo.api.TopologyConfigException;

/**
 * Recipe for the one field of a secret whose value is generated at provisioning
 * time.
 *
 * @param fieldName          JSON key the generated value is stored under.
 * @param length             Number of characters to generate.
 * @param excludedCharacters Characters the generator must not emit, may be empty.
 * @param excludePunctuation Whether punctuation is excluded as a class.
 */
public record GeneratedSecretSpec(String fieldName, int length, String excludedCharacters,
        boolean excludePunctuation) {

    /** Length used by the secret generator when none is given. */
    public static final int DEFAULT_LENGTH = 32;

    public GeneratedSecretSpec {
        if (fieldName == null || fieldName.isBlank())
            throw new TopologyConfigException("invalid-secret", "generated-field",
                    "Generated field name must not be blank");
        if (length < 1)
            throw new TopologyConfigException("invalid-secret", fieldName,
                    "Generated length must be positive, got " + length);
        excludedCharacters = excludedCharacters == null ? "" : excludedCharacters;
    }

    public static GeneratedSecretSpec of(String fieldName) {
        return new GeneratedSecretSpec(fieldName, DEFAULT_LENGTH, "", false);
    }

    public static GeneratedSecretSpec of(String fieldName, int length) {
        return new GeneratedSecretSpec(fieldName, length, "", false);
    }

    public GeneratedSecretSpec excluding(String characters) {
        return new GeneratedSecretSpec(fieldName, length, characters, excludePunctuation);
    }

    public GeneratedSecretSpec withoutPunctuation() {
        return new GeneratedSecretSpec(fieldName, length, excludedCharacters, true);
    }
}
