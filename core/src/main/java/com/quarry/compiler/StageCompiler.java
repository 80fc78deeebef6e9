package com.quarry.compiler;

import com.quarry.dialect.Dialect;
import com.quarry.exception.CompilationException;
import com.quarry.exception.DialectUnsupportedException;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.Expr;
import com.quarry.expression.ScalarFunction;
import com.quarry.model.DimensionDef;
import com.quarry.model.JoinCondition;
import com.quarry.model.JoinDef;
import com.quarry.model.OrderSpec;
import com.quarry.model.SourceDef;
import com.quarry.model.SourceOrigin;
import com.quarry.model.Stage;
import com.quarry.model.StageOutput;
import com.quarry.types.BooleanType;
import com.quarry.types.StringType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the SQL of resolved pipeline stages.
 *
 * <p>Each stage becomes one SELECT over the previous stage's SQL, or over the
 * source's relation for the first stage. A grouping stage with nests or
 * ungrouped aggregates becomes two SELECTs: the grouping SELECT, and a wrapper
 * around it that adds the nested columns and ungrouped values as correlated
 * subqueries keyed by the grouping columns of the row.
 *
 * <p>Generated structure for a grouping stage with a nest:
 * <pre>
 *   SELECT g."state", g."n", (nested array) AS "by_city"
 *   FROM (SELECT ... GROUP BY 1) AS g
 *   ORDER BY "n" DESC
 * </pre>
 */
final class StageCompiler {
    private static final Logger logger = LoggerFactory.getLogger(StageCompiler.class);

    private static final String HIDDEN_PREFIX = "__h";
    private static final String KEYED_ALIAS = "__keyed";
    private static final String INDEX_ALIAS = "__index";

    private final CompilationContext context;
    private final Dialect dialect;

    StageCompiler(CompilationContext context) {
        this.context = context;
        this.dialect = context.dialect();
    }

    /**
     * Compiles a pipeline into one SELECT statement.
     *
     * @param pipeline the stages, first to last
     * @param scope what the first stage inherits from enclosing stages
     * @param nested whether the pipeline is the body of a {@code nest:}
     * @return the SQL of the last stage, with earlier stages as subqueries
     */
    String compilePipeline(List<Stage> pipeline, NestScope scope, boolean nested) {
        String sql = null;
        for (int i = 0; i < pipeline.size(); i++) {
            NestScope stageScope = i == 0 ? scope : new NestScope(sql, List.of(), List.of());
            sql = compileStage(pipeline.get(i), stageScope, nested);
            logger.debug("Compiled stage {} of {}", i + 1, pipeline.size());
        }
        return sql;
    }

    private String compileStage(Stage stage, NestScope scope, boolean nested) {
        if (stage instanceof Stage.Reduce reduce) {
            return reduce(reduce, scope, nested);
        }
        if (stage instanceof Stage.Project project) {
            return project(project, scope, nested);
        }
        if (stage instanceof Stage.Index index) {
            return index(index, scope, nested);
        }
        throw new IllegalStateException("Unhandled stage: " + stage.getClass().getSimpleName());
    }

    // ==================== Reduce ====================

    private String reduce(Stage.Reduce stage, NestScope scope, boolean nested) {
        JoinTree tree = newTree(stage, scope);
        for (StageOutput output : stage.outputs()) {
            if (output instanceof StageOutput.Field field) {
                tree.requireExpr(field.expression(), List.of());
            }
        }
        for (Expr condition : stage.having()) {
            tree.requireExpr(condition, List.of());
        }
        ExpressionCompiler compiler = new ExpressionCompiler(dialect, tree);

        boolean wrapped = !stage.nests().isEmpty();
        List<String> select = new ArrayList<>();
        List<String> groupBy = new ArrayList<>();
        for (StageOutput.Field dimension : stage.groupBy()) {
            select.add(compiler.compile(dimension.expression()) + " AS " + context.quote(dimension.name()));
            groupBy.add(Integer.toString(select.size()));
        }
        for (StageOutput.Field aggregate : stage.aggregates()) {
            if (ExpressionCompiler.containsUngroup(aggregate.expression())) {
                wrapped = true;
            } else {
                select.add(compiler.compile(aggregate.expression()) + " AS " + context.quote(aggregate.name()));
            }
        }
        List<String> where = whereTerms(stage, scope, compiler);
        List<String> having = new ArrayList<>();
        for (Expr condition : stage.having()) {
            having.add(compiler.compile(condition));
        }

        if (!wrapped) {
            if (select.isEmpty()) {
                select.add(dialect.aggregate(AggregateFunction.COUNT, null) + " AS " + context.quote(HIDDEN_PREFIX + "0"));
            }
            String grouped = selectStatement(select, from(tree, compiler, rootRelation(stage, scope, nested)),
                where, groupBy, having);
            return grouped + orderAndLimit(stage);
        }

        String groupAlias = context.aliases().allocate("g");
        Map<String, String> hidden = new LinkedHashMap<>();
        List<NestScope.GroupingDim> stageDimensions = new ArrayList<>();
        for (StageOutput.Field dimension : stage.groupBy()) {
            stageDimensions.add(new NestScope.GroupingDim(dimension.name(), dimension.expression(),
                context.qualified(groupAlias, dimension.name())));
        }
        ExpressionCompiler.Interceptor hoist = (expr, prefix, filters) -> {
            if (expr instanceof Expr.Ungroup ungroup) {
                return ungroupSubquery(stage, scope, stageDimensions, ungroup, prefix, filters);
            }
            if (expr.isAggregate() && !ExpressionCompiler.containsUngroup(expr)) {
                String sql = compiler.compile(expr, prefix, filters);
                String column = hidden.computeIfAbsent(sql, s -> HIDDEN_PREFIX + (hidden.size() + 1));
                return context.qualified(groupAlias, column);
            }
            return null;
        };
        ExpressionCompiler wrapperCompiler = new ExpressionCompiler(dialect, tree, hoist);

        NestScope childScope = scope.child(scope.previousSql(), stage.filters(), stageDimensions);
        List<String> outer = new ArrayList<>();
        for (StageOutput output : stage.outputs()) {
            String name = context.quote(output.name());
            if (output instanceof StageOutput.Nest nest) {
                outer.add(nest(nest, childScope) + " AS " + name);
            } else if (output instanceof StageOutput.Field field
                && field.role() == StageOutput.Role.AGGREGATE && ExpressionCompiler.containsUngroup(field.expression())) {
                outer.add(wrapperCompiler.compile(field.expression()) + " AS " + name);
            } else {
                outer.add(context.qualified(groupAlias, output.name()) + " AS " + name);
            }
        }
        for (Map.Entry<String, String> column : hidden.entrySet()) {
            select.add(column.getKey() + " AS " + context.quote(column.getValue()));
        }
        if (select.isEmpty()) {
            select.add(dialect.aggregate(AggregateFunction.COUNT, null) + " AS " + context.quote(HIDDEN_PREFIX + "0"));
        }
        String grouped = selectStatement(select, from(tree, compiler, rootRelation(stage, scope, nested)),
            where, groupBy, having);
        return "SELECT " + String.join(", ", outer) + " FROM (" + grouped + ") AS " + context.quote(groupAlias)
            + orderAndLimit(stage);
    }

    /**
     * Renders an {@code all()} or {@code exclude()} aggregate as a scalar subquery
     * over the stage's input rows, correlated only on the grouping columns it keeps.
     */
    private String ungroupSubquery(Stage.Reduce stage, NestScope scope, List<NestScope.GroupingDim> stageDimensions,
                                   Expr.Ungroup ungroup, List<JoinDef> prefix,
                                   List<ExpressionCompiler.ScopedFilter> filters) {
        List<NestScope.GroupingDim> kept = new ArrayList<>();
        List<NestScope.GroupingDim> candidates = new ArrayList<>(scope.dimensions());
        candidates.addAll(stageDimensions);
        for (NestScope.GroupingDim dimension : candidates) {
            boolean named = ungroup.fields().contains(dimension.name());
            boolean enclosing = scope.dimensions().contains(dimension);
            if (ungroup.exclude() ? !named : (enclosing || named)) {
                kept.add(dimension);
            }
        }

        JoinTree tree = new JoinTree(stage.input(), context.aliases());
        tree.requireExpr(ungroup.expression(), prefix);
        for (ExpressionCompiler.ScopedFilter filter : filters) {
            tree.requireExpr(filter.condition(), filter.prefix());
        }
        for (Expr condition : stage.filters()) {
            tree.requireExpr(condition, List.of());
        }
        for (Expr condition : scope.filters()) {
            tree.requireExpr(condition, List.of());
        }
        for (NestScope.GroupingDim dimension : kept) {
            tree.requireExpr(dimension.expression(), List.of());
        }
        ExpressionCompiler compiler = new ExpressionCompiler(dialect, tree);
        String value = compiler.compile(ungroup.expression(), prefix, filters);

        List<String> where = new ArrayList<>();
        for (Expr condition : stage.input().filters()) {
            where.add(compiler.compile(condition));
        }
        for (Expr condition : stage.filters()) {
            where.add(compiler.compile(condition));
        }
        for (Expr condition : scope.filters()) {
            where.add(compiler.compile(condition));
        }
        for (NestScope.GroupingDim dimension : kept) {
            where.add(dialect.nullSafeEquals(compiler.compile(dimension.expression()), dimension.outerSql()));
        }
        String relation = relation(stage.input(), scope.previousSql());
        return "(" + selectStatement(List.of(value), from(tree, compiler, relation), where, List.of(), List.of()) + ")";
    }

    private String nest(StageOutput.Nest nest, NestScope scope) {
        String innerSql = compilePipeline(nest.pipeline(), scope, true);
        Stage last = nest.pipeline().get(nest.pipeline().size() - 1);
        List<String> columns = new ArrayList<>();
        for (StageOutput output : last.outputs()) {
            columns.add(output.name());
        }
        String alias = context.aliases().allocate(nest.name());
        List<String> order = new ArrayList<>();
        for (OrderSpec spec : last.orderBy()) {
            order.add(dialect.orderTerm(context.qualified(alias, spec.field()), spec.direction()));
        }
        try {
            return dialect.nest(innerSql, alias, columns, order.isEmpty() ? null : String.join(", ", order));
        } catch (DialectUnsupportedException e) {
            throw e.at(nest.location());
        }
    }

    // ==================== Project ====================

    private String project(Stage.Project stage, NestScope scope, boolean nested) {
        JoinTree tree = newTree(stage, scope);
        for (StageOutput output : stage.outputs()) {
            if (output instanceof StageOutput.Field field) {
                tree.requireExpr(field.expression(), List.of());
            }
        }
        ExpressionCompiler compiler = new ExpressionCompiler(dialect, tree);
        List<String> select = new ArrayList<>();
        for (StageOutput output : stage.outputs()) {
            StageOutput.Field field = (StageOutput.Field) output;
            select.add(compiler.compile(field.expression()) + " AS " + context.quote(field.name()));
        }
        List<String> where = whereTerms(stage, scope, compiler);
        return selectStatement(select, from(tree, compiler, rootRelation(stage, scope, nested)), where,
            List.of(), List.of()) + orderAndLimit(stage);
    }

    // ==================== Index ====================

    private String index(Stage.Index stage, NestScope scope, boolean nested) {
        Expr weight = stage.weight() != null
            ? stage.weight()
            : new Expr.Aggregate(AggregateFunction.COUNT, null, null, stage.location());
        List<String> branches = new ArrayList<>();
        for (Stage.IndexField field : stage.fields()) {
            JoinTree tree = newTree(stage, scope);
            tree.requireExpr(field.expression(), List.of());
            tree.requireExpr(weight, List.of());
            ExpressionCompiler compiler = new ExpressionCompiler(dialect, tree);

            String value = compiler.compile(field.expression());
            boolean grouped = field.expression().type() instanceof StringType
                || field.expression().type() instanceof BooleanType;
            String fieldValue;
            if (grouped) {
                fieldValue = dialect.cast(value, StringType.get(), false);
            } else {
                fieldValue = dialect.function(ScalarFunction.CONCAT, List.of(
                    dialect.cast(dialect.aggregate(AggregateFunction.MIN, value), StringType.get(), false),
                    dialect.stringLiteral(" to "),
                    dialect.cast(dialect.aggregate(AggregateFunction.MAX, value), StringType.get(), false)));
            }
            List<String> select = List.of(
                dialect.stringLiteral(field.path()) + " AS " + context.quote(Stage.Index.FIELD_PATH),
                fieldValue + " AS " + context.quote(Stage.Index.FIELD_VALUE),
                compiler.compile(weight) + " AS " + context.quote(Stage.Index.WEIGHT));
            List<String> where = whereTerms(stage, scope, compiler);
            where.add("(" + value + " IS NOT NULL)");
            branches.add(selectStatement(select, from(tree, compiler, rootRelation(stage, scope, nested)), where,
                grouped ? List.of("2") : List.of(), List.of()));
        }
        return "SELECT * FROM (" + String.join(" UNION ALL ", branches) + ") AS " + context.quote(INDEX_ALIAS)
            + orderAndLimit(stage);
    }

    // ==================== Shared clauses ====================

    private JoinTree newTree(Stage stage, NestScope scope) {
        JoinTree tree = new JoinTree(stage.input(), context.aliases());
        for (Expr condition : stage.filters()) {
            tree.requireExpr(condition, List.of());
        }
        for (Expr condition : scope.filters()) {
            tree.requireExpr(condition, List.of());
        }
        for (NestScope.GroupingDim dimension : scope.dimensions()) {
            tree.requireExpr(dimension.expression(), List.of());
        }
        return tree;
    }

    /**
     * Collects the row filters of a stage: the source's own filters, the stage's
     * {@code where}, the filters of enclosing stages and the correlation to the
     * enclosing row.
     */
    private List<String> whereTerms(Stage stage, NestScope scope, ExpressionCompiler compiler) {
        List<String> terms = new ArrayList<>();
        for (Expr condition : stage.input().filters()) {
            terms.add(compiler.compile(condition));
        }
        for (Expr condition : stage.filters()) {
            terms.add(compiler.compile(condition));
        }
        for (Expr condition : scope.filters()) {
            terms.add(compiler.compile(condition));
        }
        for (NestScope.GroupingDim dimension : scope.dimensions()) {
            terms.add(dialect.nullSafeEquals(compiler.compile(dimension.expression()), dimension.outerSql()));
        }
        return terms;
    }

    private String selectStatement(List<String> select, String from, List<String> where,
                                   List<String> groupBy, List<String> having) {
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(String.join(", ", select));
        sql.append(" ").append(from);
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        if (!having.isEmpty()) {
            sql.append(" HAVING ").append(String.join(" AND ", having));
        }
        return sql.toString();
    }

    private String orderAndLimit(Stage stage) {
        StringBuilder sql = new StringBuilder();
        if (!stage.orderBy().isEmpty()) {
            List<String> terms = new ArrayList<>();
            for (OrderSpec spec : stage.orderBy()) {
                terms.add(dialect.orderTerm(context.quote(spec.field()), spec.direction()));
            }
            sql.append(" ORDER BY ").append(String.join(", ", terms));
        }
        if (stage.limit() != null) {
            sql.append(" ").append(dialect.limit(stage.limit()));
        }
        return sql.toString();
    }

    // ==================== Relations and joins ====================

    private String rootRelation(Stage stage, NestScope scope, boolean nested) {
        String relation = relation(stage.input(), scope.previousSql());
        if (!nested && stage.sample() != null) {
            try {
                relation = dialect.sample(relation, stage.sample(), context.settings().sampleDefaultRows());
            } catch (DialectUnsupportedException e) {
                throw e.at(stage.location());
            }
        }
        return relation;
    }

    /**
     * Renders the relation a source reads its rows from.
     *
     * @param source the source
     * @param previousSql the SQL of the previous stage, for sources built from it
     * @return a table path or parenthesized subquery
     */
    private String relation(SourceDef source, String previousSql) {
        SourceOrigin origin = source.origin();
        if (origin instanceof SourceOrigin.Table table) {
            return dialect.quoteTablePath(table.tablePath());
        }
        if (origin instanceof SourceOrigin.SqlBlock block) {
            return "(" + block.block().select() + ")";
        }
        if (origin instanceof SourceOrigin.Query query) {
            return "(" + compilePipeline(query.query().pipeline(), NestScope.NONE, false) + ")";
        }
        if (origin instanceof SourceOrigin.PreviousStage) {
            if (previousSql == null) {
                throw new IllegalStateException("stage input reads a previous stage, but there is none");
            }
            return "(" + previousSql + ")";
        }
        throw new IllegalStateException("repeated records are only read through their join");
    }

    private String from(JoinTree tree, ExpressionCompiler compiler, String rootRelation) {
        JoinTree.Instance root = tree.root();
        StringBuilder sql = new StringBuilder("FROM ");
        sql.append(keyed(root, rootRelation)).append(" AS ").append(context.quote(root.alias()));
        for (JoinTree.Instance instance : tree.joinOrder()) {
            sql.append(" ").append(join(instance, compiler));
        }
        return sql.toString();
    }

    /**
     * Adds a row number column to a relation whose rows must be counted once each
     * but that has no primary key.
     */
    private String keyed(JoinTree.Instance instance, String relation) {
        if (!instance.needsRowKey() || instance.source().origin() instanceof SourceOrigin.Nested) {
            return relation;
        }
        String alias = context.quote(KEYED_ALIAS);
        return "(SELECT " + alias + ".*, " + dialect.rowNumber() + " AS "
            + context.quote(ExpressionCompiler.DISTINCT_KEY_COLUMN) + " FROM " + relation + " AS " + alias + ")";
    }

    private String join(JoinTree.Instance instance, ExpressionCompiler compiler) {
        JoinDef join = instance.join();
        List<JoinDef> parentPath = instance.parent().path();
        JoinCondition condition = join.condition();
        if (condition instanceof JoinCondition.Unnest unnest) {
            String array = compiler.compile(unnest.arrayValue(), parentPath, List.of());
            try {
                return dialect.unnestJoin(array, instance.alias(), instance.needsRowKey());
            } catch (DialectUnsupportedException e) {
                throw e.at(join.location());
            }
        }

        List<String> on = new ArrayList<>();
        if (condition instanceof JoinCondition.KeyMatch match) {
            DimensionDef primaryKey = instance.source().primaryKeyField();
            if (primaryKey == null) {
                throw CompilationException.structural(
                    "'" + join.name() + "' is joined on its primary key, but its source has no primary_key",
                    join.location());
            }
            on.add("(" + compiler.compile(primaryKey.expression(), instance.path(), List.of()) + " = "
                + compiler.compile(match.parentValue(), parentPath, List.of()) + ")");
        } else if (condition instanceof JoinCondition.OnCondition onCondition) {
            on.add(compiler.compile(onCondition.condition(), parentPath, List.of()));
        }
        for (Expr filter : instance.source().filters()) {
            on.add(compiler.compile(filter, instance.path(), List.of()));
        }
        String relation = keyed(instance, relation(instance.source(), null));
        return "LEFT JOIN " + relation + " AS " + context.quote(instance.alias()) + " ON "
            + (on.isEmpty() ? dialect.booleanLiteral(true) : String.join(" AND ", on));
    }
}
