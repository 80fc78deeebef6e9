package com.quarry.diagnostic;

import java.util.Objects;

/**
 * A compile-time problem attached to a model or to one query's compile result.
 *
 * @param kind the error category
 * @param message human readable description
 * @param location where in the source documents the problem was found
 */
public record Diagnostic(DiagnosticKind kind, String message, Location location) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    @Override
    public String toString() {
        return location + ": " + kind + ": " + message;
    }
}
