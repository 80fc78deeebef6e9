package com.quarry.diagnostic;

/**
 * Error taxonomy shared by the translator and the query compiler.
 */
public enum DiagnosticKind {
    /** Passed through from the external parser. */
    SYNTAX_ERROR,
    /** A name (field, source, query, import) could not be found or collides. */
    NAME_RESOLUTION_ERROR,
    /** Operand types do not fit the operator or context. */
    TYPE_ERROR,
    /** Illegal aggregate context, join cycle, ambiguous path, fan-out. */
    STRUCTURAL_ERROR,
    /** The target dialect cannot express a required operation. */
    DIALECT_UNSUPPORTED_ERROR,
    /** A required table or SQL block schema was never supplied. */
    SCHEMA_DEPENDENCY_ERROR,
    /** An unexpected failure inside the compiler. */
    INTERNAL_ERROR
}
