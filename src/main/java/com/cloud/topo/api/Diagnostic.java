package com.cloud.topo.api;

/**
 * A single finding produced while building or finalizing a topology.
 *
 * @param severity ERROR findings block finalization, WARNING findings do not.
 * @param code     Stable machine-readable identifier, e.g. "orphan-filter".
 * @param resource Name of the resource the finding is about.
 * @param message  Human-readable description.
 */
public record Diagnostic(Severity severity, String code, String resource, String message) {

    public enum Severity {
        ERROR, WARNING
    }

    public static Diagnostic error(String code, String resource, String message) {
        return new Diagnostic(Severity.ERROR, code, resource, message);
    }

    public static Diagnostic warning(String code, String resource, String message) {
        return new Diagnostic(Severity.WARNING, code, resource, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " [" + code + "] " + resource + ": " + message;
    }
}
