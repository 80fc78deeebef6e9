package com.quarry.translator;

import com.quarry.ast.QueryNode;
import com.quarry.compiler.PipelineResolver;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.exception.CompilationException;
import com.quarry.exception.SuppressedReferenceException;
import com.quarry.model.QueryDef;
import com.quarry.model.SourceDef;
import com.quarry.model.Stage;

import java.util.List;
import java.util.Objects;

/**
 * Builds {@link QueryDef}s from query syntax against a model.
 *
 * <p>A query either starts at a source and runs its stages against it, or
 * starts at a named query and appends its stages to that query's pipeline.
 */
public final class QueryBuilder {

    private final ModelScope scope;
    private final SourceBuilder sources;

    /**
     * Creates a builder that resolves names in {@code scope}.
     *
     * @param scope the model names
     * @param diagnostics receives non-blocking diagnostics, such as a failed
     *        field in a source refined inline
     */
    public QueryBuilder(ModelScope scope, List<Diagnostic> diagnostics) {
        this(scope, new SourceBuilder(scope, diagnostics));
    }

    QueryBuilder(ModelScope scope, SourceBuilder sources) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.sources = Objects.requireNonNull(sources, "sources must not be null");
    }

    /**
     * Builds and resolves a query.
     *
     * @param node the query syntax
     * @param name the name of the query, or null for an anonymous query
     * @return the query
     * @throws CompilationException if the query is unusable
     * @throws SuppressedReferenceException if it depends on an invalid entity
     */
    public QueryDef build(QueryNode node, String name) {
        if (node.head() instanceof QueryNode.Head.FromQuery fromQuery) {
            String baseName = fromQuery.queryName();
            if (scope.isInvalid(baseName)) {
                throw new SuppressedReferenceException(baseName);
            }
            QueryDef base = scope.query(baseName);
            if (base == null) {
                throw CompilationException.nameResolution("Query '" + baseName + "' is not defined",
                    fromQuery.location());
            }
            if (node.stages().isEmpty()) {
                return new QueryDef(name, base.source(), base.pipeline(), node.location());
            }
            List<Stage> pipeline = new PipelineResolver().append(base, node.stages());
            return new QueryDef(name, base.source(), pipeline, node.location());
        }
        QueryNode.Head.FromSource fromSource = (QueryNode.Head.FromSource) node.head();
        SourceDef source = sources.build(fromSource.source());
        if (node.stages().isEmpty()) {
            throw CompilationException.structural("A query needs at least one stage", node.location());
        }
        return new QueryDef(name, source, new PipelineResolver().resolve(source, node.stages()), node.location());
    }
}
