package com.quarry.translator;

import com.quarry.diagnostic.Diagnostic;
import com.quarry.model.ModelDef;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one {@link Translator#translate} call.
 *
 * @param phase what translation is waiting for, or the finished model
 * @param diagnostics the problems found; only reported once translation is final
 */
public record TranslateResult(TranslationPhase phase, List<Diagnostic> diagnostics) {

    public TranslateResult {
        Objects.requireNonNull(phase, "phase must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns whether translation needs no further data.
     *
     * @return true once the model is complete
     */
    public boolean isFinal() {
        return phase instanceof TranslationPhase.Done;
    }

    /**
     * Returns the model.
     *
     * @return the model, or null while data is still needed
     */
    public ModelDef model() {
        return phase instanceof TranslationPhase.Done done ? done.model() : null;
    }

    public Set<String> neededUrls() {
        return phase instanceof TranslationPhase.AwaitingImports imports ? imports.urls() : Set.of();
    }

    public Set<String> neededTables() {
        return phase instanceof TranslationPhase.AwaitingSchemas schemas ? schemas.tables() : Set.of();
    }

    public List<SqlBlockRequest> neededSqlBlocks() {
        return phase instanceof TranslationPhase.AwaitingSchemas schemas ? schemas.sqlBlocks() : List.of();
    }
}
