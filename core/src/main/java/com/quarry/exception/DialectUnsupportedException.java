package com.quarry.exception;

import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;

/**
 * Exception thrown when a dialect is asked for an operation it cannot express.
 *
 * <p>Dialects throw this instead of rendering best-effort SQL. The query compiler
 * attaches the location of the expression or stage that needed the operation.
 */
public class DialectUnsupportedException extends CompilationException {

    private final String dialectName;
    private final String operation;

    /**
     * Creates a dialect-unsupported exception.
     *
     * @param dialectName the name of the dialect
     * @param operation a short description of the unsupported operation
     */
    public DialectUnsupportedException(String dialectName, String operation) {
        this(dialectName, operation, null);
    }

    /**
     * Creates a dialect-unsupported exception with a source location.
     *
     * @param dialectName the name of the dialect
     * @param operation a short description of the unsupported operation
     * @param location where the operation was requested
     */
    public DialectUnsupportedException(String dialectName, String operation, Location location) {
        super(DiagnosticKind.DIALECT_UNSUPPORTED_ERROR,
            "Dialect '" + dialectName + "' does not support " + operation, location);
        this.dialectName = dialectName;
        this.operation = operation;
    }

    /**
     * Returns a copy of this exception located at the given position.
     *
     * @param location the location of the requesting element
     * @return a located exception
     */
    public DialectUnsupportedException at(Location location) {
        return new DialectUnsupportedException(dialectName, operation, location);
    }

    public String dialectName() {
        return dialectName;
    }

    public String operation() {
        return operation;
    }
}
