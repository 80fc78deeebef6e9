package com.quarry.compiler;

import com.quarry.config.CompilerSettings;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;
import com.quarry.dialect.Dialect;
import com.quarry.dialect.Dialects;
import com.quarry.exception.CompilationException;
import com.quarry.exception.SuppressedReferenceException;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryDef;
import com.quarry.model.QueryRef;
import com.quarry.translator.ModelScope;
import com.quarry.translator.QueryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles queries of a model to SQL.
 *
 * <p>Compilation reads the model and never changes it; every call produces its
 * SQL afresh, so compiling the same query twice gives identical text. All
 * failures are returned as diagnostics of the {@link CompiledQuery}.
 *
 * <pre>
 *   CompiledQuery compiled = new QueryCompiler().compileQuery(model, QueryRef.named("by_state"), Dialects.get("duckdb"));
 *   if (compiled.isSuccess()) {
 *       run(compiled.sql());
 *   }
 * </pre>
 */
public final class QueryCompiler {
    private static final Logger logger = LoggerFactory.getLogger(QueryCompiler.class);

    private final CompilerSettings settings;

    public QueryCompiler() {
        this(CompilerSettings.defaults());
    }

    public QueryCompiler(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Compiles a query for the dialect named in the settings.
     *
     * @param model the model
     * @param ref the query
     * @return the SQL and result schema, or the diagnostic that prevents them
     */
    public CompiledQuery compileQuery(ModelDef model, QueryRef ref) {
        return compileQuery(model, ref, Dialects.get(settings.dialect()));
    }

    /**
     * Compiles a query.
     *
     * @param model the model
     * @param ref the query
     * @param dialect the target database
     * @return the SQL and result schema, or the diagnostic that prevents them
     */
    public CompiledQuery compileQuery(ModelDef model, QueryRef ref, Dialect dialect) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(ref, "ref must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        List<Diagnostic> warnings = new ArrayList<>();
        try {
            QueryDef query = resolve(model, ref, warnings);
            String sql = new StageCompiler(new CompilationContext(dialect, settings))
                .compilePipeline(query.pipeline(), NestScope.NONE, false);
            logger.debug("Compiled {} for {}: {} stage(s)", describe(ref), dialect.name(), query.pipeline().size());
            return new CompiledQuery(sql, ResultSchema.of(query.outputs()), warnings);
        } catch (Failed e) {
            return CompiledQuery.failure(e.diagnostic);
        } catch (CompilationException e) {
            logger.debug("Compiling {} failed: {}", describe(ref), e.getMessage());
            return CompiledQuery.failure(e.toDiagnostic());
        } catch (SuppressedReferenceException e) {
            Diagnostic cause = model.invalidReason(e.reference());
            return CompiledQuery.failure(cause != null ? cause : new Diagnostic(
                DiagnosticKind.NAME_RESOLUTION_ERROR,
                "Query depends on '" + e.reference() + "', which has errors", locationOf(model, ref)));
        } catch (RuntimeException e) {
            logger.error("Internal error compiling {}", describe(ref), e);
            return CompiledQuery.failure(new Diagnostic(DiagnosticKind.INTERNAL_ERROR,
                "Internal error while compiling: " + e.getMessage(), locationOf(model, ref)));
        }
    }

    private static QueryDef resolve(ModelDef model, QueryRef ref, List<Diagnostic> warnings) {
        if (ref instanceof QueryRef.Named named) {
            if (model.isInvalid(named.name())) {
                throw new Failed(model.invalidReason(named.name()));
            }
            QueryDef query = model.query(named.name());
            if (query == null) {
                throw CompilationException.nameResolution("Query '" + named.name() + "' is not defined",
                    model.documentStart());
            }
            return query;
        }
        if (ref instanceof QueryRef.Anonymous anonymous) {
            int index = anonymous.index();
            if (index >= model.anonymousQueries().size()) {
                throw CompilationException.nameResolution("There is no anonymous query #" + index
                    + "; the model has " + model.anonymousQueries().size(), model.documentStart());
            }
            Diagnostic failure = model.anonymousFailure(index);
            if (failure != null) {
                throw new Failed(failure);
            }
            return model.anonymousQueries().get(index);
        }
        QueryRef.Inline inline = (QueryRef.Inline) ref;
        return new QueryBuilder(ModelScope.of(model), warnings).build(inline.query(), null);
    }

    private static Location locationOf(ModelDef model, QueryRef ref) {
        return ref instanceof QueryRef.Inline inline ? inline.query().location() : model.documentStart();
    }

    private static String describe(QueryRef ref) {
        if (ref instanceof QueryRef.Named named) {
            return "query '" + named.name() + "'";
        }
        if (ref instanceof QueryRef.Anonymous anonymous) {
            return "anonymous query #" + anonymous.index();
        }
        return "inline query";
    }

    /**
     * A query that is already known to be unusable, with the diagnostic recorded
     * for it when the model was built.
     */
    private static final class Failed extends RuntimeException {
        private final transient Diagnostic diagnostic;

        Failed(Diagnostic diagnostic) {
            super(diagnostic.message(), null, false, false);
            this.diagnostic = diagnostic;
        }
    }
}
