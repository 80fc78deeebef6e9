package com.quarry.ast;

import com.quarry.diagnostic.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * The parser's output for one document: its statements and any syntax errors.
 *
 * <p>Statements that failed to parse are absent; the remaining statements are
 * still translated.
 */
public record ParsedDocument(String url, List<Statement> statements, List<Diagnostic> syntaxErrors) {

    public ParsedDocument {
        Objects.requireNonNull(url, "url must not be null");
        statements = List.copyOf(statements);
        syntaxErrors = List.copyOf(syntaxErrors);
    }

    public static ParsedDocument of(String url, List<Statement> statements) {
        return new ParsedDocument(url, statements, List.of());
    }
}
