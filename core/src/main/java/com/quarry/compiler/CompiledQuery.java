package com.quarry.compiler;

import com.quarry.diagnostic.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * Result of compiling one query: the SQL statement and the schema of its rows,
 * or the diagnostics that prevented compilation.
 *
 * @param sql the statement, or null when compilation failed
 * @param schema the result schema, empty when compilation failed
 * @param diagnostics problems found, empty on success
 */
public record CompiledQuery(String sql, ResultSchema schema, List<Diagnostic> diagnostics) {

    public CompiledQuery {
        Objects.requireNonNull(schema, "schema must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public static CompiledQuery success(String sql, ResultSchema schema) {
        return new CompiledQuery(Objects.requireNonNull(sql, "sql must not be null"), schema, List.of());
    }

    public static CompiledQuery failure(Diagnostic diagnostic) {
        return new CompiledQuery(null, ResultSchema.EMPTY, List.of(diagnostic));
    }

    public boolean isSuccess() {
        return sql != null;
    }
}
