package com.quarry.translator;

import com.quarry.ast.ExprNode;
import com.quarry.ast.FieldDeclaration;
import com.quarry.ast.SourceNode;
import com.quarry.ast.SourceProperty;
import com.quarry.compiler.PipelineResolver;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.Location;
import com.quarry.exception.CompilationException;
import com.quarry.exception.SuppressedReferenceException;
import com.quarry.expression.Expr;
import com.quarry.expression.ExpressionTranslator;
import com.quarry.expression.FieldSpace;
import com.quarry.expression.SourceSpace;
import com.quarry.model.ColumnSchema;
import com.quarry.model.DimensionDef;
import com.quarry.model.FieldDef;
import com.quarry.model.JoinCondition;
import com.quarry.model.JoinDef;
import com.quarry.model.MeasureDef;
import com.quarry.model.Namespace;
import com.quarry.model.QueryDef;
import com.quarry.model.Relationship;
import com.quarry.model.SourceDef;
import com.quarry.model.SourceOrigin;
import com.quarry.model.SqlBlockDef;
import com.quarry.model.TableSchema;
import com.quarry.model.ViewDef;
import com.quarry.types.ArrayType;
import com.quarry.types.DataType;
import com.quarry.types.StructField;
import com.quarry.types.StructType;
import com.quarry.types.UnsupportedType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link SourceDef}s from source syntax.
 *
 * <p>The fields of a source body may refer to each other in any order. Names are
 * collected first and each definition is resolved the first time something
 * reads it; a definition that reads itself, directly or through other fields,
 * is reported once as a circular reference.
 *
 * <p>Each field declaration, join and view is its own unit of failure: its
 * diagnostic is recorded, the name is marked invalid in the namespace and the
 * rest of the source is still built. Fields that read an invalid name become
 * invalid without a diagnostic of their own.
 */
final class SourceBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SourceBuilder.class);

    private final ModelScope scope;
    private final List<Diagnostic> diagnostics;
    private final Deque<String> sourcesInProgress;

    SourceBuilder(ModelScope scope, List<Diagnostic> diagnostics) {
        this(scope, diagnostics, new ArrayDeque<>());
    }

    private SourceBuilder(ModelScope scope, List<Diagnostic> diagnostics, Deque<String> sourcesInProgress) {
        this.scope = scope;
        this.diagnostics = diagnostics;
        this.sourcesInProgress = sourcesInProgress;
    }

    /**
     * Builds a named source definition.
     *
     * @param name the name the source is defined under
     * @param node the source syntax
     * @return the source
     * @throws CompilationException if the source as a whole is unusable
     * @throws SuppressedReferenceException if it depends on an invalid entity
     */
    SourceDef define(String name, SourceNode node) {
        sourcesInProgress.push(name);
        try {
            return build(node).withName(name);
        } finally {
            sourcesInProgress.pop();
        }
    }

    SourceDef build(SourceNode node) {
        if (node instanceof SourceNode.Table table) {
            return tableSource(table);
        }
        if (node instanceof SourceNode.Named named) {
            return namedSource(named);
        }
        if (node instanceof SourceNode.FromQuery fromQuery) {
            QueryDef query = new QueryBuilder(scope, this).build(fromQuery.query(), null);
            Namespace namespace = PipelineResolver.nextInput(query.lastStage()).namespace();
            return new SourceDef(null, new SourceOrigin.Query(query), namespace, null, List.of(),
                fromQuery.location());
        }
        if (node instanceof SourceNode.FromSql fromSql) {
            return sqlSource(fromSql);
        }
        SourceNode.Refined refined = (SourceNode.Refined) node;
        return refine(build(refined.base()), refined.properties());
    }

    private SourceDef tableSource(SourceNode.Table table) {
        TableSchema schema = scope.table(table.key());
        if (schema == null) {
            String failure = scope.tableFailure(table.key());
            throw CompilationException.schemaDependency(failure != null
                ? "Schema of table '" + table.key() + "' could not be read: " + failure
                : "Schema of table '" + table.key() + "' was not supplied", table.location());
        }
        return new SourceDef(null, new SourceOrigin.Table(table.connection(), table.tablePath()),
            columns(schema.columns(), table.location()), null, List.of(), table.location());
    }

    private SourceDef namedSource(SourceNode.Named named) {
        if (sourcesInProgress.contains(named.name())) {
            throw CompilationException.structural(
                "Source '" + named.name() + "' refers to itself through its joins", named.location());
        }
        if (scope.isInvalid(named.name())) {
            throw new SuppressedReferenceException(named.name());
        }
        SourceDef source = scope.source(named.name());
        if (source == null) {
            if (scope.query(named.name()) != null) {
                throw CompilationException.typeError(
                    "'" + named.name() + "' is a query; use from(" + named.name() + ") to read its output",
                    named.location());
            }
            throw CompilationException.nameResolution(
                "Source '" + named.name() + "' is not defined", named.location());
        }
        return source;
    }

    private SourceDef sqlSource(SourceNode.FromSql fromSql) {
        String name = fromSql.sqlBlockName();
        if (scope.isInvalid(name)) {
            throw new SuppressedReferenceException(name);
        }
        SqlBlockDef block = scope.sqlBlock(name);
        if (block == null) {
            throw CompilationException.nameResolution("SQL block '" + name + "' is not defined",
                fromSql.location());
        }
        return new SourceDef(null, new SourceOrigin.SqlBlock(block), columns(block.schema().columns(),
            fromSql.location()), null, List.of(), fromSql.location());
    }

    /**
     * Converts schema columns to fields. Repeated records become joins that
     * unnest them; records become struct-typed columns.
     */
    static Namespace columns(List<ColumnSchema> columns, Location location) {
        Namespace namespace = Namespace.EMPTY;
        for (ColumnSchema column : columns) {
            if (column.isRepeatedRecord()) {
                namespace = namespace.with(column.name(),
                    JoinDef.repeated(column.name(), new ArrayType(structOf(column.children())), location));
            } else {
                namespace = namespace.with(column.name(), DimensionDef.column(column.name(), columnType(column)));
            }
        }
        return namespace;
    }

    private static DataType columnType(ColumnSchema column) {
        if (column.repeated()) {
            return new UnsupportedType(column.sqlType());
        }
        if (!column.children().isEmpty()) {
            return structOf(column.children());
        }
        return column.dataType();
    }

    private static StructType structOf(List<ColumnSchema> children) {
        List<StructField> fields = new ArrayList<>();
        for (ColumnSchema child : children) {
            DataType type = child.isRepeatedRecord()
                ? new ArrayType(structOf(child.children()))
                : columnType(child);
            fields.add(new StructField(child.name(), type));
        }
        return new StructType(fields);
    }

    // ==================== Refinement ====================

    /**
     * Applies a source body to a base source.
     */
    private SourceDef refine(SourceDef base, List<SourceProperty> properties) {
        Namespace namespace = base.namespace();
        String primaryKey = base.primaryKey();
        for (SourceProperty property : properties) {
            if (property instanceof SourceProperty.Accept accept) {
                requireKnown(namespace, accept.names(), accept.location());
                namespace = namespace.keeping(accept.names());
            } else if (property instanceof SourceProperty.Except except) {
                requireKnown(namespace, except.names(), except.location());
                namespace = namespace.without(except.names());
            } else if (property instanceof SourceProperty.Rename rename) {
                requireKnown(namespace, List.of(rename.oldName()), rename.location());
                if (namespace.contains(rename.newName())) {
                    throw CompilationException.nameResolution(
                        "Cannot rename to '" + rename.newName() + "': the name is already defined",
                        rename.location());
                }
                namespace = namespace.renamed(rename.newName(), rename.oldName());
                if (rename.oldName().equals(primaryKey)) {
                    primaryKey = rename.newName();
                }
            }
        }

        Definitions definitions = new Definitions(namespace);
        for (SourceProperty property : properties) {
            if (property instanceof SourceProperty.Dimensions dimensions) {
                for (FieldDeclaration field : dimensions.fields()) {
                    definitions.declare(field.name(), new PendingField(field, FieldKind.DIMENSION), field.location());
                }
            } else if (property instanceof SourceProperty.Measures measures) {
                for (FieldDeclaration field : measures.fields()) {
                    definitions.declare(field.name(), new PendingField(field, FieldKind.MEASURE), field.location());
                }
            } else if (property instanceof SourceProperty.Declare declare) {
                for (FieldDeclaration field : declare.fields()) {
                    definitions.declare(field.name(), new PendingField(field, FieldKind.EITHER), field.location());
                }
            } else if (property instanceof SourceProperty.Join join) {
                declareJoin(definitions, join);
            } else if (property instanceof SourceProperty.Views views) {
                for (SourceProperty.ViewDeclaration view : views.views()) {
                    definitions.declare(view.name(), new ViewDef(view.name(), view.pipeline(), view.location()),
                        view.location());
                }
            }
        }
        definitions.resolveAll();

        SourceDef refined = base.withNamespace(definitions.namespace()).withPrimaryKey(primaryKey);
        for (SourceProperty property : properties) {
            if (property instanceof SourceProperty.PrimaryKey key) {
                refined = withPrimaryKey(refined, key);
            }
        }
        List<Expr> filters = new ArrayList<>();
        ExpressionTranslator translator = new ExpressionTranslator(new SourceSpace(refined));
        for (SourceProperty property : properties) {
            if (property instanceof SourceProperty.Where where) {
                for (ExprNode filter : where.filters()) {
                    filters.add(translator.translateFilter(filter, "source where"));
                }
            }
        }
        if (!filters.isEmpty()) {
            refined = refined.withFilters(filters);
        }
        return validateViews(refined, definitions.views());
    }

    private static void requireKnown(Namespace namespace, List<String> names, Location location) {
        for (String name : names) {
            if (!namespace.contains(name)) {
                throw CompilationException.nameResolution("'" + name + "' is not defined", location);
            }
        }
    }

    private SourceDef withPrimaryKey(SourceDef source, SourceProperty.PrimaryKey key) {
        FieldDef field = source.namespace().lookup(key.field());
        if (!(field instanceof DimensionDef)) {
            CompilationException error = field == null
                ? CompilationException.nameResolution(
                    "Primary key '" + key.field() + "' is not defined", key.location())
                : CompilationException.typeError(
                    "Primary key '" + key.field() + "' must be a dimension", key.location());
            report(error);
            return source;
        }
        return source.withPrimaryKey(key.field());
    }

    private void declareJoin(Definitions definitions, SourceProperty.Join join) {
        SourceDef joined;
        try {
            joined = build(join.source()).withName(join.name());
        } catch (CompilationException e) {
            report(e);
            definitions.declareInvalid(join.name(), join.location());
            return;
        } catch (SuppressedReferenceException e) {
            logger.debug("Join '{}' reads invalid '{}'", join.name(), e.reference());
            definitions.declareInvalid(join.name(), join.location());
            return;
        }
        JoinDef def = JoinDef.declared(join.name(), join.relationship(), joined, join.location());
        definitions.declare(join.name(), new PendingJoin(def, join), join.location());
    }

    /**
     * Resolves every view against the finished source. A view that fails is
     * removed, and the remaining views are checked again since they may nest it.
     */
    private SourceDef validateViews(SourceDef source, List<String> views) {
        SourceDef current = source;
        Set<String> pending = new LinkedHashSet<>(views);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String name : new ArrayList<>(pending)) {
                if (!(current.namespace().lookup(name) instanceof ViewDef view)) {
                    pending.remove(name);
                    continue;
                }
                try {
                    new PipelineResolver().resolve(current, view.pipeline());
                } catch (CompilationException e) {
                    report(e);
                    current = current.withNamespace(current.namespace().withInvalid(name));
                    pending.remove(name);
                    changed = true;
                } catch (SuppressedReferenceException e) {
                    logger.debug("View '{}' reads invalid '{}'", name, e.reference());
                    current = current.withNamespace(current.namespace().withInvalid(name));
                    pending.remove(name);
                    changed = true;
                }
            }
        }
        return current;
    }

    private void report(CompilationException e) {
        Diagnostic diagnostic = e.toDiagnostic();
        logger.debug("Field error: {}", diagnostic);
        diagnostics.add(diagnostic);
    }

    // ==================== Two-pass field resolution ====================

    private enum FieldKind {
        DIMENSION,
        MEASURE,
        EITHER
    }

    private record PendingField(FieldDeclaration declaration, FieldKind kind) {
    }

    private record PendingJoin(JoinDef join, SourceProperty.Join syntax) {
    }

    /**
     * The fields of one source body: the base namespace plus declarations that
     * are resolved on first use.
     */
    private final class Definitions implements FieldSpace {
        private final Namespace base;
        private final Map<String, Object> declared = new LinkedHashMap<>();
        private final Map<String, FieldDef> resolved = new HashMap<>();
        private final Set<String> invalid = new LinkedHashSet<>();
        private final Deque<String> resolving = new ArrayDeque<>();
        private final List<String> views = new ArrayList<>();

        Definitions(Namespace base) {
            this.base = base;
        }

        void declare(String name, Object pending, Location location) {
            if (base.contains(name) || declared.containsKey(name)) {
                report(CompilationException.nameResolution("'" + name + "' is already defined", location));
                return;
            }
            declared.put(name, pending);
            if (pending instanceof ViewDef view) {
                resolved.put(name, view);
                views.add(name);
            }
        }

        void declareInvalid(String name, Location location) {
            if (base.contains(name) || declared.containsKey(name)) {
                report(CompilationException.nameResolution("'" + name + "' is already defined", location));
                return;
            }
            declared.put(name, null);
            invalid.add(name);
        }

        List<String> views() {
            return views;
        }

        @Override
        public FieldDef lookup(String name) {
            if (invalid.contains(name)) {
                throw new SuppressedReferenceException(name);
            }
            FieldDef done = resolved.get(name);
            if (done != null) {
                return done;
            }
            Object pending = declared.get(name);
            if (pending instanceof PendingJoin join) {
                if (!resolving.contains(name)) {
                    return resolveJoin(name, join);
                }
                // a join condition may read the join it belongs to, but no other unfinished join
                if (name.equals(resolving.peek())) {
                    return join.join();
                }
                throw CompilationException.structural(
                    "Join cycle between '" + name + "' and '" + resolving.peek() + "'", join.syntax().location());
            }
            if (pending instanceof PendingField field) {
                if (resolving.contains(name)) {
                    throw CompilationException.structural(
                        "'" + name + "' is defined in terms of itself", field.declaration().location());
                }
                return resolveField(name, field);
            }
            if (base.isInvalid(name)) {
                throw new SuppressedReferenceException(name);
            }
            return base.lookup(name);
        }

        void resolveAll() {
            for (String name : declared.keySet()) {
                try {
                    lookup(name);
                } catch (SuppressedReferenceException e) {
                    logger.trace("'{}' is invalid: {}", name, e.getMessage());
                }
            }
        }

        Namespace namespace() {
            Namespace namespace = base;
            for (String name : declared.keySet()) {
                FieldDef def = resolved.get(name);
                namespace = def != null && !invalid.contains(name)
                    ? namespace.with(name, def)
                    : namespace.withInvalid(name);
            }
            return namespace;
        }

        private FieldDef resolveField(String name, PendingField pending) {
            resolving.push(name);
            try {
                FieldDeclaration declaration = pending.declaration();
                ExpressionTranslator translator = new ExpressionTranslator(this);
                FieldDef def;
                switch (pending.kind()) {
                    case DIMENSION:
                        def = new DimensionDef(name, translator.translateScalar(declaration.expression(),
                            "dimension '" + name + "'"), declaration.location());
                        break;
                    case MEASURE:
                        def = new MeasureDef(name, translator.translateAggregate(declaration.expression(),
                            "measure '" + name + "'"), declaration.location());
                        break;
                    default:
                        Expr expr = translator.translate(declaration.expression());
                        def = expr.isAggregate()
                            ? new MeasureDef(name, translator.translateAggregate(declaration.expression(),
                                "measure '" + name + "'"), declaration.location())
                            : new DimensionDef(name, expr, declaration.location());
                        break;
                }
                resolved.put(name, def);
                return def;
            } catch (CompilationException e) {
                report(e);
                invalid.add(name);
                throw new SuppressedReferenceException(name);
            } catch (SuppressedReferenceException e) {
                invalid.add(name);
                throw new SuppressedReferenceException(name);
            } finally {
                resolving.pop();
            }
        }

        private FieldDef resolveJoin(String name, PendingJoin pending) {
            resolving.push(name);
            try {
                pending.join().resolveCondition(condition(pending));
                resolved.put(name, pending.join());
                return pending.join();
            } catch (CompilationException e) {
                report(e);
                invalid.add(name);
                throw new SuppressedReferenceException(name);
            } catch (SuppressedReferenceException e) {
                invalid.add(name);
                throw new SuppressedReferenceException(name);
            } finally {
                resolving.pop();
            }
        }

        private JoinCondition condition(PendingJoin pending) {
            SourceProperty.Join syntax = pending.syntax();
            JoinDef join = pending.join();
            ExpressionTranslator translator = new ExpressionTranslator(this);
            if (syntax.with() != null && syntax.on() != null) {
                throw CompilationException.structural(
                    "Join '" + syntax.name() + "' cannot have both with and on", syntax.location());
            }
            if (syntax.on() != null) {
                return new JoinCondition.OnCondition(translator.translateFilter(syntax.on(),
                    "join '" + syntax.name() + "'"));
            }
            if (syntax.relationship() == Relationship.CROSS) {
                if (syntax.with() != null) {
                    throw CompilationException.structural(
                        "join_cross '" + syntax.name() + "' takes on, not with", syntax.location());
                }
                return new JoinCondition.CrossProduct();
            }
            String key = join.source().primaryKey();
            if (key == null || join.source().primaryKeyField() == null) {
                throw CompilationException.structural("Join '" + syntax.name() + "' needs a primary_key on the "
                    + "joined source to match against", syntax.location());
            }
            if (syntax.with() != null) {
                return new JoinCondition.KeyMatch(translator.translateScalar(syntax.with(),
                    "join '" + syntax.name() + "'"), false);
            }
            if (lookup(key) == null) {
                throw CompilationException.nameResolution("Join '" + syntax.name() + "' has no with or on, and "
                    + "there is no field '" + key + "' to match its primary key", syntax.location());
            }
            Expr parentValue = translator.translateScalar(
                new ExprNode.FieldRef(List.of(key), syntax.location()), "join '" + syntax.name() + "'");
            return new JoinCondition.KeyMatch(parentValue, true);
        }
    }
}
