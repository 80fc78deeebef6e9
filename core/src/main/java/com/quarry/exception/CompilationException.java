package com.quarry.exception;

import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;

import java.util.Objects;

/**
 * Exception thrown when a model element or query cannot be compiled.
 *
 * <p>Compilation exceptions never escape the public compiler entry points. They
 * are thrown at the failure site and caught at the boundary of the entity being
 * compiled (a statement, a field declaration, a query), where they are converted
 * into a {@link Diagnostic} with {@link #toDiagnostic()}.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       builder.buildSource(statement);
 *   } catch (CompilationException e) {
 *       diagnostics.add(e.toDiagnostic());
 *   }
 * </pre>
 */
public class CompilationException extends RuntimeException {

    private final DiagnosticKind kind;
    private final Location location;

    /**
     * Creates a compilation exception.
     *
     * @param kind the error category
     * @param message the error message
     * @param location the source location of the failing element
     */
    public CompilationException(DiagnosticKind kind, String message, Location location) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.location = location != null ? location : Location.UNKNOWN;
    }

    /**
     * Creates a compilation exception with a cause.
     *
     * @param kind the error category
     * @param message the error message
     * @param location the source location of the failing element
     * @param cause the underlying cause
     */
    public CompilationException(DiagnosticKind kind, String message, Location location, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.location = location != null ? location : Location.UNKNOWN;
    }

    public static CompilationException nameResolution(String message, Location location) {
        return new CompilationException(DiagnosticKind.NAME_RESOLUTION_ERROR, message, location);
    }

    public static CompilationException typeError(String message, Location location) {
        return new CompilationException(DiagnosticKind.TYPE_ERROR, message, location);
    }

    public static CompilationException structural(String message, Location location) {
        return new CompilationException(DiagnosticKind.STRUCTURAL_ERROR, message, location);
    }

    public static CompilationException schemaDependency(String message, Location location) {
        return new CompilationException(DiagnosticKind.SCHEMA_DEPENDENCY_ERROR, message, location);
    }

    /**
     * Returns the error category.
     *
     * @return the diagnostic kind
     */
    public DiagnosticKind kind() {
        return kind;
    }

    /**
     * Returns the source location of the failing element.
     *
     * @return the location, never null
     */
    public Location location() {
        return location;
    }

    /**
     * Converts this exception to a diagnostic.
     *
     * @return the diagnostic describing this failure
     */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(kind, getMessage(), location);
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Compilation failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Location: ").append(location).append("\n");
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
