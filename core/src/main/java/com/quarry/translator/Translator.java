package com.quarry.translator;

import com.quarry.ast.DocumentParser;
import com.quarry.ast.ParsedDocument;
import com.quarry.ast.QueryNode;
import com.quarry.ast.SourceNode;
import com.quarry.ast.SourceProperty;
import com.quarry.ast.Statement;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;
import com.quarry.model.ModelDef;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of model translation.
 *
 * <p>Translation advances as far as the supplied data allows. When it needs
 * data it cannot obtain itself (the text of an imported document, the schema
 * of a table or of a SQL block) it says exactly what is missing; the caller
 * fetches it, supplies it with {@link #update} and translates again:
 *
 * <pre>
 *   TranslatorState state = TranslatorState.forUrl(url);
 *   TranslateResult result = translator.translate(state);
 *   while (!result.isFinal()) {
 *       state = translator.update(state, fetch(result));
 *       result = translator.translate(state);
 *   }
 *   ModelDef model = result.model();
 * </pre>
 *
 * <p>{@link #translate} is a function of the state: calling it again without
 * an update gives an identical result. Documents are parsed once, when their
 * text is supplied. No exception escapes either method; failures become
 * diagnostics.
 */
public final class Translator {
    private static final Logger logger = LoggerFactory.getLogger(Translator.class);

    private final DocumentParser parser;

    public Translator(DocumentParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Creates the state of a translation with the root document already supplied.
     *
     * @param url the document URL
     * @param text the document text
     * @return the state
     */
    public TranslatorState start(String url, String text) {
        return update(TranslatorState.forUrl(url), UpdateData.builder().url(url, text).build());
    }

    /**
     * Advances translation.
     *
     * @param state the translation state
     * @return the missing data, or the finished model
     */
    public TranslateResult translate(TranslatorState state) {
        Objects.requireNonNull(state, "state must not be null");
        try {
            return advance(state);
        } catch (RuntimeException e) {
            logger.error("Translation of {} failed", state.rootUrl(), e);
            Diagnostic diagnostic = new Diagnostic(DiagnosticKind.INTERNAL_ERROR,
                "Internal error while translating: " + e.getMessage(), documentStart(state.rootUrl()));
            ModelDef model = ModelDef.builder().url(state.rootUrl()).addDiagnostic(diagnostic).build();
            return new TranslateResult(new TranslationPhase.Done(model), List.of(diagnostic));
        }
    }

    /**
     * Supplies external data. Data for resources that are already known is
     * ignored, and supplied documents are parsed here, once.
     *
     * @param state the current state
     * @param data the new data
     * @return the next state
     */
    public TranslatorState update(TranslatorState state, UpdateData data) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(data, "data must not be null");
        Map<String, ParsedDocument> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : data.urls().entrySet()) {
            String url = entry.getKey();
            if (state.isKnownUrl(url)) {
                logger.debug("Ignoring text for {}, which is already known", url);
                continue;
            }
            parsed.put(url, parse(url, entry.getValue()));
        }
        TranslatorState next = state.with(parsed, data);
        logger.debug("Updated {}", next);
        return next;
    }

    private ParsedDocument parse(String url, String text) {
        try {
            ParsedDocument document = parser.parse(url, text);
            logger.debug("Parsed {}: {} statement(s), {} syntax error(s)", url,
                document.statements().size(), document.syntaxErrors().size());
            return document;
        } catch (RuntimeException e) {
            logger.warn("Parser failed on {}", url, e);
            return new ParsedDocument(url, List.of(), List.of(new Diagnostic(DiagnosticKind.SYNTAX_ERROR,
                "Document could not be parsed: " + e.getMessage(), documentStart(url))));
        }
    }

    private TranslateResult advance(TranslatorState state) {
        String root = state.rootUrl();
        if (!state.isKnownUrl(root)) {
            return awaiting(new TranslationPhase.AwaitingImports(Set.of(root)));
        }
        if (state.document(root) == null) {
            Diagnostic diagnostic = new Diagnostic(DiagnosticKind.SCHEMA_DEPENDENCY_ERROR,
                "Could not read '" + root + "': " + state.urlErrors().get(root), documentStart(root));
            ModelDef model = ModelDef.builder().url(root).addDiagnostic(diagnostic).build();
            return new TranslateResult(new TranslationPhase.Done(model), model.diagnostics());
        }

        ImportWalk imports = new ImportWalk(state);
        imports.visit(root);
        if (!imports.needed.isEmpty()) {
            logger.debug("{} needs imports {}", root, imports.needed);
            return awaiting(new TranslationPhase.AwaitingImports(imports.needed));
        }

        SchemaRequests schemas = new SchemaRequests(state);
        for (String url : imports.ordered) {
            schemas.collect(state.document(url), url.equals(root));
        }
        if (!schemas.tables.isEmpty() || !schemas.sqlBlocks.isEmpty()) {
            logger.debug("{} needs tables {} and SQL blocks {}", root, schemas.tables, schemas.sqlBlocks.size());
            return awaiting(new TranslationPhase.AwaitingSchemas(schemas.tables, schemas.sqlBlocks));
        }

        ModelBuilder builder = new ModelBuilder(state.tables(), state.tableErrors(), state.sqlSchemas(),
            state.sqlErrors());
        for (Diagnostic diagnostic : imports.diagnostics) {
            builder.addDiagnostic(diagnostic);
        }
        for (String url : imports.ordered) {
            builder.addDocument(state.document(url), url.equals(root));
        }
        ModelDef model = builder.build();
        logger.info("Translated {}: {} source(s), {} query(s), {} anonymous query(s)", root,
            model.sources().size(), model.queries().size(), model.anonymousQueries().size());
        if (model.hasErrors()) {
            logger.warn("{} has {} diagnostic(s)", root, model.diagnostics().size());
        }
        return new TranslateResult(new TranslationPhase.Done(model), model.diagnostics());
    }

    private static TranslateResult awaiting(TranslationPhase phase) {
        return new TranslateResult(phase, List.of());
    }

    private static Location documentStart(String url) {
        return new Location(url, 1, 1);
    }

    /**
     * Resolves an import URL relative to the importing document.
     */
    static String resolveImport(String base, String target) {
        try {
            return URI.create(base).resolve(target).toString();
        } catch (IllegalArgumentException e) {
            logger.debug("Cannot resolve '{}' against '{}', using it as is: {}", target, base, e.getMessage());
            return target;
        }
    }

    /**
     * Depth-first walk of the import graph. Documents end up in
     * {@link #ordered} after everything they import.
     */
    private static final class ImportWalk {
        private final TranslatorState state;
        private final Set<String> needed = new LinkedHashSet<>();
        private final List<String> ordered = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Set<String> visiting = new HashSet<>();
        private final Set<String> visited = new HashSet<>();

        ImportWalk(TranslatorState state) {
            this.state = state;
        }

        void visit(String url) {
            visiting.add(url);
            for (Statement statement : state.document(url).statements()) {
                if (!(statement instanceof Statement.Import anImport)) {
                    continue;
                }
                String target = resolveImport(url, anImport.url());
                if (visiting.contains(target)) {
                    diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL_ERROR,
                        "Import cycle: '" + target + "' imports itself", anImport.location()));
                } else if (visited.contains(target)) {
                    continue;
                } else if (state.urlErrors().containsKey(target)) {
                    visited.add(target);
                    diagnostics.add(new Diagnostic(DiagnosticKind.SCHEMA_DEPENDENCY_ERROR,
                        "Could not read import '" + target + "': " + state.urlErrors().get(target),
                        anImport.location()));
                } else if (state.document(target) == null) {
                    needed.add(target);
                } else {
                    visit(target);
                }
            }
            visiting.remove(url);
            visited.add(url);
            ordered.add(url);
        }
    }

    /**
     * Collects the tables and SQL blocks whose schemas are still unknown.
     */
    private static final class SchemaRequests {
        private final TranslatorState state;
        private final Set<String> tables = new LinkedHashSet<>();
        private final List<SqlBlockRequest> sqlBlocks = new ArrayList<>();

        SchemaRequests(TranslatorState state) {
            this.state = state;
        }

        void collect(ParsedDocument document, boolean root) {
            for (Statement statement : document.statements()) {
                if (statement instanceof Statement.DefineSource source) {
                    collect(source.source());
                } else if (statement instanceof Statement.DefineQuery query) {
                    collect(query.query());
                } else if (statement instanceof Statement.RunQuery run && root) {
                    collect(run.query());
                } else if (statement instanceof Statement.DefineSqlBlock block
                    && !state.isKnownSqlBlock(block.name())) {
                    sqlBlocks.add(new SqlBlockRequest(block.name(), block.connection(), block.select()));
                }
            }
        }

        private void collect(QueryNode query) {
            if (query.head() instanceof QueryNode.Head.FromSource fromSource) {
                collect(fromSource.source());
            }
        }

        private void collect(SourceNode node) {
            if (node instanceof SourceNode.Table table) {
                if (!state.isKnownTable(table.key())) {
                    tables.add(table.key());
                }
            } else if (node instanceof SourceNode.FromQuery fromQuery) {
                collect(fromQuery.query());
            } else if (node instanceof SourceNode.Refined refined) {
                collect(refined.base());
                for (SourceProperty property : refined.properties()) {
                    if (property instanceof SourceProperty.Join join) {
                        collect(join.source());
                    }
                }
            }
        }
    }
}
