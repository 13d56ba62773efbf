package com.cloud.topo.config;

import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.Optional;

/**
 * Target account and region for a topology.
 *
 * Both are optional. When one is unset the topology stays environment-agnostic
 * and the provisioning engine resolves its own default at deploy time.
 */
@Log4j2
public final class StackEnvironment {
    public static final String ACCOUNT_VARIABLE = "CDK_DEFAULT_ACCOUNT";
    public static final String REGION_VARIABLE = "CDK_DEFAULT_REGION";

    private static final StackEnvironment UNRESOLVED = new StackEnvironment(null, null);

    private final String account;
    private final String region;

    private StackEnvironment(String account, String region) {
        this.account = account;
        this.region = region;
    }

    public static StackEnvironment of(String account, String region) {
        return new StackEnvironment(blankToNull(account), blankToNull(region));
    }

    /** Neither account nor region set. */
    public static StackEnvironment unresolved() {
        return UNRESOLVED;
    }

    /**
     * Reads {@value #ACCOUNT_VARIABLE} and {@value #REGION_VARIABLE} from the given
     * variables. Blank values count as unset.
     */
    public static StackEnvironment fromEnvironment(Map<String, String> variables) {
        StackEnvironment env = of(variables.get(ACCOUNT_VARIABLE), variables.get(REGION_VARIABLE));
        if (env.account == null)
            log.info("{} not set, account is left to the provisioning engine", ACCOUNT_VARIABLE);
        if (env.region == null)
            log.info("{} not set, region is left to the provisioning engine", REGION_VARIABLE);
        return env;
    }

    public static StackEnvironment fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public Optional<String> account() {
        return Optional.ofNullable(account);
    }

    public Optional<String> region() {
        return Optional.ofNullable(region);
    }

    public boolean isResolved() {
        return account != null && region != null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StackEnvironment other))
            return false;
        return account().equals(other.account()) && region().equals(other.region());
    }

    @Override
    public int hashCode() {
        return account().hashCode() * 31 + region().hashCode();
    }

    @Override
    public String toString() {
        return "aws://" + (account == null ? "unknown-account" : account)
                + "/" + (region == null ? "unknown-region" : region);
    }
}
