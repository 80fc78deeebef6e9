package com.quarry.translator;

import com.quarry.ast.ParsedDocument;
import com.quarry.ast.Statement;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;
import com.quarry.exception.CompilationException;
import com.quarry.exception.SuppressedReferenceException;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryDef;
import com.quarry.model.SourceDef;
import com.quarry.model.SqlBlockDef;
import com.quarry.model.TableSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the statements of a document and its imports into a {@link ModelDef}.
 *
 * <p>Statements are processed in order, imported documents before the
 * documents importing them. Every top-level statement is one unit of failure:
 * a statement that fails records its diagnostic and its name is marked
 * invalid, so later statements that use it fail silently instead of
 * reporting the same problem again.
 */
final class ModelBuilder implements ModelScope {
    private static final Logger logger = LoggerFactory.getLogger(ModelBuilder.class);

    private final ModelDef.Builder model = ModelDef.builder();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, String> tableFailures;
    private final Map<String, TableSchema> sqlSchemas;
    private final Map<String, String> sqlFailures;
    private final SourceBuilder sources;
    private final QueryBuilder queries;

    ModelBuilder(Map<String, TableSchema> tables, Map<String, String> tableFailures,
                 Map<String, TableSchema> sqlSchemas, Map<String, String> sqlFailures) {
        this.tableFailures = tableFailures;
        this.sqlSchemas = sqlSchemas;
        this.sqlFailures = sqlFailures;
        tables.forEach(model::addTable);
        this.sources = new SourceBuilder(this, diagnostics);
        this.queries = new QueryBuilder(this, sources);
    }

    /**
     * Adds the definitions of a document. Anonymous queries are only taken from
     * the document being translated, not from its imports.
     *
     * @param document the parsed document
     * @param root whether this is the document being translated
     */
    void addDocument(ParsedDocument document, boolean root) {
        if (root) {
            model.url(document.url());
        }
        diagnostics.addAll(document.syntaxErrors());
        for (Statement statement : document.statements()) {
            if (statement instanceof Statement.DefineSource source) {
                defineSource(source);
            } else if (statement instanceof Statement.DefineQuery query) {
                defineQuery(query);
            } else if (statement instanceof Statement.DefineSqlBlock block) {
                defineSqlBlock(block);
            } else if (statement instanceof Statement.RunQuery run && root) {
                runQuery(run);
            }
        }
    }

    void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    ModelDef build() {
        model.addDiagnostics(diagnostics);
        return model.build();
    }

    private void defineSource(Statement.DefineSource statement) {
        String name = statement.name();
        if (!claim(name, statement.location())) {
            return;
        }
        try {
            SourceDef source = sources.define(name, statement.source());
            model.addSource(name, source);
            logger.debug("Defined source '{}' with {} field(s)", name, source.namespace().size());
        } catch (CompilationException e) {
            fail(name, e);
        } catch (SuppressedReferenceException e) {
            suppress(name, e, statement.location());
        }
    }

    private void defineQuery(Statement.DefineQuery statement) {
        String name = statement.name();
        if (!claim(name, statement.location())) {
            return;
        }
        try {
            QueryDef query = queries.build(statement.query(), name);
            model.addQuery(name, query);
            logger.debug("Defined query '{}' with {} stage(s)", name, query.pipeline().size());
        } catch (CompilationException e) {
            fail(name, e);
        } catch (SuppressedReferenceException e) {
            suppress(name, e, statement.location());
        }
    }

    private void defineSqlBlock(Statement.DefineSqlBlock statement) {
        String name = statement.name();
        if (!claim(name, statement.location())) {
            return;
        }
        TableSchema schema = sqlSchemas.get(name);
        if (schema == null) {
            String failure = sqlFailures.get(name);
            fail(name, CompilationException.schemaDependency(failure != null
                ? "Schema of SQL block '" + name + "' could not be read: " + failure
                : "Schema of SQL block '" + name + "' was not supplied", statement.location()));
            return;
        }
        model.addSqlBlock(name, new SqlBlockDef(name, statement.connection(), statement.select(), schema,
            statement.location()));
    }

    private void runQuery(Statement.RunQuery statement) {
        try {
            model.addAnonymousQuery(queries.build(statement.query(), null));
        } catch (CompilationException e) {
            Diagnostic diagnostic = e.toDiagnostic();
            diagnostics.add(diagnostic);
            model.addFailedAnonymousQuery(diagnostic);
        } catch (SuppressedReferenceException e) {
            model.addFailedAnonymousQuery(rootCause(e, statement.location()));
        }
    }

    private boolean claim(String name, Location location) {
        if (model.isDefined(name)) {
            diagnostics.add(new Diagnostic(DiagnosticKind.NAME_RESOLUTION_ERROR,
                "'" + name + "' is already defined", location));
            return false;
        }
        return true;
    }

    private void fail(String name, CompilationException e) {
        Diagnostic diagnostic = e.toDiagnostic();
        logger.debug("'{}' is invalid: {}", name, diagnostic);
        diagnostics.add(diagnostic);
        model.markInvalid(name, diagnostic);
    }

    private void suppress(String name, SuppressedReferenceException e, Location location) {
        logger.debug("'{}' depends on invalid '{}'", name, e.reference());
        model.markInvalid(name, rootCause(e, location));
    }

    /**
     * Returns the diagnostic of the entity that made a dependent fail. Entities
     * below the model level, such as a source's fields, have reported their
     * diagnostic already; the dependent then gets a reason of its own that is
     * not reported again.
     */
    private Diagnostic rootCause(SuppressedReferenceException e, Location location) {
        Diagnostic cause = model.invalidReason(e.reference());
        if (cause != null) {
            return cause;
        }
        return new Diagnostic(DiagnosticKind.NAME_RESOLUTION_ERROR,
            "Depends on '" + e.reference() + "', which has errors", location);
    }

    // ==================== ModelScope ====================

    @Override
    public SourceDef source(String name) {
        return model.source(name);
    }

    @Override
    public QueryDef query(String name) {
        return model.query(name);
    }

    @Override
    public SqlBlockDef sqlBlock(String name) {
        return model.sqlBlock(name);
    }

    @Override
    public TableSchema table(String key) {
        return model.table(key);
    }

    @Override
    public String tableFailure(String key) {
        return tableFailures.get(key);
    }

    @Override
    public boolean isInvalid(String name) {
        return model.isInvalid(name);
    }

    @Override
    public Diagnostic invalidReason(String name) {
        return model.invalidReason(name);
    }
}
