package com.cloud.topo.config;

import com.cloud.topo.api.LintPolicy;

/**
 * Tunables for non-structural findings.
 *
 * @param duplicateTargets  The same service attached to one listener twice.
 * @param unusedPartitions  A partition no cluster or service is placed in.
 * @param unreferencedSecrets A secret no cluster, task or grant refers to.
 */
public record TopologyOptions(LintPolicy duplicateTargets, LintPolicy unusedPartitions,
        LintPolicy unreferencedSecrets) {

    private static final TopologyOptions DEFAULTS = new TopologyOptions(LintPolicy.WARN, LintPolicy.WARN,
            LintPolicy.WARN);

    public TopologyOptions {
        if (duplicateTargets == null || unusedPartitions == null || unreferencedSecrets == null)
            throw new IllegalArgumentException("All lint policies must be set");
    }

    /** Every lint at WARN. */
    public static TopologyOptions defaults() {
        return DEFAULTS;
    }

    public TopologyOptions withDuplicateTargets(LintPolicy policy) {
        return new TopologyOptions(policy, unusedPartitions, unreferencedSecrets);
    }

    public TopologyOptions withUnusedPartitions(LintPolicy policy) {
        return new TopologyOptions(duplicateTargets, policy, unreferencedSecrets);
    }

    public TopologyOptions withUnreferencedSecrets(LintPolicy policy) {
        return new TopologyOptions(duplicateTargets, unusedPartitions, policy);
    }
}
