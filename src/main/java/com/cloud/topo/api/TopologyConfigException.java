package com.cloud.topo.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A structural or cardinality invariant of the topology is violated.
 *
 * Raised synchronously by the declaration that caused it, or by finalize() with
 * every deferred finding aggregated into {@link #diagnostics()}.
 */
public class TopologyConfigException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final List<Diagnostic> diagnostics;

    public TopologyConfigException(String code, String resource, String message) {
        this(List.of(Diagnostic.error(code, resource, message)));
    }

    public TopologyConfigException(List<Diagnostic> diagnostics) {
        super(format(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    /** The findings behind this failure, in declaration order. */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    private static String format(List<Diagnostic> diagnostics) {
        if (diagnostics.size() == 1)
            return diagnostics.get(0).resource() + ": " + diagnostics.get(0).message();
        return diagnostics.size() + " topology errors:\n" + diagnostics.stream()
                .map(d -> "  " + d)
                .collect(Collectors.joining("\n"));
    }
}
