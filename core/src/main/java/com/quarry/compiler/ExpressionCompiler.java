package com.quarry.compiler;

import com.quarry.diagnostic.Location;
import com.quarry.dialect.Dialect;
import com.quarry.exception.CompilationException;
import com.quarry.exception.DialectUnsupportedException;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.BinaryOperator;
import com.quarry.expression.Expr;
import com.quarry.expression.ExprPaths;
import com.quarry.expression.ScalarFunction;
import com.quarry.model.DimensionDef;
import com.quarry.model.JoinDef;
import com.quarry.model.SourceOrigin;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NullType;
import com.quarry.types.StringType;
import com.quarry.types.TimestampType;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders resolved expressions as SQL fragments for one SELECT.
 *
 * <p>Expressions are anchored at a join path of the SELECT's {@link JoinTree};
 * a field reached through joins is compiled at the path of the instance that
 * holds it. Aggregates pick their distinct-row strategy from the fan-out of the
 * instance whose rows they aggregate: plain SQL aggregates when rows are not
 * repeated, distinct counts and symmetric sums when they are.
 *
 * <p>Filters of {@code {? }} shortcuts are carried down as a stack and applied
 * to every aggregate beneath them.
 */
final class ExpressionCompiler {

    /** Column holding the synthesized distinct key of a relation without primary key. */
    static final String DISTINCT_KEY_COLUMN = "__distinct_key";

    /**
     * A filter from a {@code {? }} shortcut, anchored where it was written.
     */
    record ScopedFilter(Expr condition, List<JoinDef> prefix) {
    }

    /**
     * Takes over the compilation of selected sub-expressions, such as aggregates
     * that are read from an inner SELECT.
     */
    @FunctionalInterface
    interface Interceptor {
        /**
         * Compiles an expression, or declines.
         *
         * @param expr the expression
         * @param prefix the path the expression is anchored at
         * @param filters the shortcut filters in effect
         * @return the SQL, or null to compile the expression normally
         */
        String intercept(Expr expr, List<JoinDef> prefix, List<ScopedFilter> filters);
    }

    private final Dialect dialect;
    private final JoinTree tree;
    private final Interceptor interceptor;

    ExpressionCompiler(Dialect dialect, JoinTree tree) {
        this(dialect, tree, null);
    }

    ExpressionCompiler(Dialect dialect, JoinTree tree, Interceptor interceptor) {
        this.dialect = dialect;
        this.tree = tree;
        this.interceptor = interceptor;
    }

    Dialect dialect() {
        return dialect;
    }

    /**
     * Compiles an expression anchored at the root of the tree.
     *
     * @param expr the expression
     * @return the SQL fragment
     */
    String compile(Expr expr) {
        return compile(expr, List.of(), List.of());
    }

    String compile(Expr expr, List<JoinDef> prefix, List<ScopedFilter> filters) {
        try {
            return compileNode(expr, prefix, filters);
        } catch (DialectUnsupportedException e) {
            if (Location.UNKNOWN.equals(e.location())) {
                throw e.at(expr.location());
            }
            throw e;
        }
    }

    private String compileNode(Expr expr, List<JoinDef> prefix, List<ScopedFilter> filters) {
        if (interceptor != null) {
            String intercepted = interceptor.intercept(expr, prefix, filters);
            if (intercepted != null) {
                return intercepted;
            }
        }
        if (expr instanceof Expr.Literal literal) {
            return literal(literal);
        }
        if (expr instanceof Expr.TimeLiteral time) {
            return time.type() instanceof DateType
                ? dialect.dateLiteral(time.text())
                : dialect.timestampLiteral(time.text());
        }
        if (expr instanceof Expr.Now) {
            return dialect.now();
        }
        if (expr instanceof Expr.FieldRef ref) {
            return compile(ref.definition(), ExprPaths.concat(prefix, ref.joinPath()), filters);
        }
        if (expr instanceof Expr.Column column) {
            return column(tree.require(prefix), column.column(), column.type());
        }
        if (expr instanceof Expr.OutputRef output) {
            return compile(output.definition(), prefix, filters);
        }
        if (expr instanceof Expr.Binary binary) {
            return binary(binary, prefix, filters);
        }
        if (expr instanceof Expr.Not not) {
            return "(NOT " + compile(not.operand(), prefix, filters) + ")";
        }
        if (expr instanceof Expr.Negate negate) {
            return "(-" + compile(negate.operand(), prefix, filters) + ")";
        }
        if (expr instanceof Expr.IsNull isNull) {
            return "(" + compile(isNull.operand(), prefix, filters) + (isNull.negated() ? " IS NOT NULL)" : " IS NULL)");
        }
        if (expr instanceof Expr.Case caseExpr) {
            StringBuilder sb = new StringBuilder("CASE");
            for (Expr.When when : caseExpr.whens()) {
                sb.append(" WHEN ").append(compile(when.condition(), prefix, filters))
                    .append(" THEN ").append(compile(when.value(), prefix, filters));
            }
            if (caseExpr.otherwise() != null) {
                sb.append(" ELSE ").append(compile(caseExpr.otherwise(), prefix, filters));
            }
            return sb.append(" END").toString();
        }
        if (expr instanceof Expr.Aggregate aggregate) {
            return aggregate(aggregate, prefix, filters);
        }
        if (expr instanceof Expr.Filtered filtered) {
            List<ScopedFilter> scoped = new ArrayList<>(filters);
            for (Expr condition : filtered.filters()) {
                scoped.add(new ScopedFilter(condition, prefix));
            }
            return compile(filtered.expression(), prefix, scoped);
        }
        if (expr instanceof Expr.Ungroup ungroup) {
            throw CompilationException.structural(
                (ungroup.exclude() ? "exclude()" : "all()") +
                " can only be used in the aggregate outputs of a grouping stage", ungroup.location());
        }
        if (expr instanceof Expr.TimeTrunc trunc) {
            return dialect.timeTrunc(compile(trunc.operand(), prefix, filters), trunc.unit(), trunc.operand().type());
        }
        if (expr instanceof Expr.TimeExtract extract) {
            return dialect.timeExtract(compile(extract.operand(), prefix, filters), extract.unit());
        }
        if (expr instanceof Expr.TimeOffset offset) {
            return dialect.timeOffset(compile(offset.base(), prefix, filters), offset.base().type(),
                offset.subtract(), compile(offset.amount(), prefix, filters), offset.unit());
        }
        if (expr instanceof Expr.Cast cast) {
            return dialect.cast(compile(cast.operand(), prefix, filters), cast.target(), cast.safe());
        }
        if (expr instanceof Expr.FunctionCall call) {
            List<String> arguments = new ArrayList<>();
            for (Expr argument : call.arguments()) {
                arguments.add(compile(argument, prefix, filters));
            }
            return dialect.function(call.function(), arguments);
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    private String literal(Expr.Literal literal) {
        if (literal.text() == null || literal.type() instanceof NullType) {
            return dialect.nullLiteral();
        }
        if (literal.type() instanceof StringType) {
            return dialect.stringLiteral(literal.text());
        }
        if (literal.type() instanceof BooleanType) {
            return dialect.booleanLiteral(Boolean.parseBoolean(literal.text()));
        }
        return dialect.numberLiteral(literal.text());
    }

    /**
     * Reads a physical column of an instance.
     */
    String column(JoinTree.Instance instance, String column, DataType type) {
        if (instance.source().origin() instanceof SourceOrigin.Nested) {
            return dialect.nestedField(instance.alias(), column, type);
        }
        return dialect.quoteIdentifier(instance.alias()) + "." + dialect.quoteIdentifier(column);
    }

    private String binary(Expr.Binary binary, List<JoinDef> prefix, List<ScopedFilter> filters) {
        String left = compile(binary.left(), prefix, filters);
        String right = compile(binary.right(), prefix, filters);
        BinaryOperator op = binary.operator();
        if (op.isComparison()) {
            // a date compared with a timestamp is compared as a timestamp
            DataType leftType = binary.left().type();
            DataType rightType = binary.right().type();
            if (leftType instanceof DateType && rightType instanceof TimestampType) {
                left = dialect.cast(left, TimestampType.get(), false);
            } else if (leftType instanceof TimestampType && rightType instanceof DateType) {
                right = dialect.cast(right, TimestampType.get(), false);
            }
        }
        switch (op) {
            case DIVIDE:
                return dialect.divide(left, right);
            case MODULO:
                return dialect.modulo(left, right);
            case MATCHES:
                return dialect.like(left, right, false);
            case NOT_MATCHES:
                return dialect.like(left, right, true);
            case COALESCE:
                return dialect.function(ScalarFunction.COALESCE, List.of(left, right));
            case NOT_EQUAL:
                return "(" + left + " <> " + right + ")";
            default:
                return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }

    // ==================== Aggregates ====================

    private String aggregate(Expr.Aggregate aggregate, List<JoinDef> prefix, List<ScopedFilter> filters) {
        JoinTree.Instance level = tree.require(aggregateLevel(aggregate, prefix));
        AggregateFunction function = aggregate.function();
        String condition = filterCondition(filters);
        boolean fanned = function.isSensitiveToFanOut() && tree.isFanned(level);

        if (aggregate.argument() == null) {
            if (fanned) {
                return dialect.aggregate(AggregateFunction.COUNT_DISTINCT, when(condition, distinctKey(level)));
            }
            if (!level.isRoot()) {
                // a left join leaves one null row for a parent without matches
                return dialect.aggregate(AggregateFunction.COUNT, when(condition, presenceKey(level)));
            }
            return condition == null
                ? dialect.aggregate(AggregateFunction.COUNT, null)
                : "COUNT(" + when(condition, "1") + ")";
        }

        String value = compile(aggregate.argument(), prefix, filters);
        switch (function) {
            case COUNT:
                if (!fanned) {
                    return dialect.aggregate(AggregateFunction.COUNT, when(condition, value));
                }
                String present = condition == null ? value + " IS NOT NULL" : condition + " AND " + value + " IS NOT NULL";
                return dialect.aggregate(AggregateFunction.COUNT_DISTINCT, when(present, distinctKey(level)));
            case COUNT_DISTINCT:
                return dialect.aggregate(AggregateFunction.COUNT_DISTINCT, when(condition, value));
            case SUM:
                String sum = fanned
                    ? dialect.sumDistinct(distinctKey(level), when(condition, value))
                    : dialect.aggregate(AggregateFunction.SUM, when(condition, value));
                return dialect.function(ScalarFunction.COALESCE, List.of(sum, "0"));
            case AVG:
                return fanned
                    ? dialect.avgDistinct(distinctKey(level), when(condition, value))
                    : dialect.aggregate(AggregateFunction.AVG, when(condition, value));
            default:
                return dialect.aggregate(function, when(condition, value));
        }
    }

    /**
     * Returns the path of the rows an aggregate is computed over.
     *
     * @param aggregate the aggregate
     * @param prefix the path the aggregate is anchored at
     * @return the level path
     */
    static List<JoinDef> aggregateLevel(Expr.Aggregate aggregate, List<JoinDef> prefix) {
        if (aggregate.level() != null) {
            return ExprPaths.concat(prefix, aggregate.level());
        }
        if (aggregate.argument() == null) {
            return prefix;
        }
        return ExprPaths.concat(prefix, ExprPaths.deepestPath(aggregate.argument()));
    }

    private String filterCondition(List<ScopedFilter> filters) {
        if (filters.isEmpty()) {
            return null;
        }
        List<String> terms = new ArrayList<>();
        for (ScopedFilter filter : filters) {
            terms.add(compile(filter.condition(), filter.prefix(), List.of()));
        }
        return String.join(" AND ", terms);
    }

    private static String when(String condition, String value) {
        return condition == null ? value : "CASE WHEN " + condition + " THEN " + value + " END";
    }

    /**
     * Returns an expression that is unique per underlying row of an instance.
     *
     * <p>The primary key is used when the source declares one. Elements of a
     * repeated record are keyed by their parent's key and their ordinal; other
     * relations get a row number column.
     *
     * @param instance the instance
     * @return the key expression
     */
    String distinctKey(JoinTree.Instance instance) {
        DimensionDef primaryKey = instance.source().primaryKeyField();
        if (primaryKey != null) {
            return compile(primaryKey.expression(), instance.path(), List.of());
        }
        instance.markNeedsRowKey();
        if (instance.source().origin() instanceof SourceOrigin.Nested) {
            String rowId = dialect.unnestRowId(instance.alias());
            String parentKey = distinctKey(instance.parent());
            return "CASE WHEN " + rowId + " IS NOT NULL THEN " + dialect.function(ScalarFunction.CONCAT, List.of(
                dialect.cast(parentKey, StringType.get(), false),
                dialect.stringLiteral("."),
                dialect.cast(rowId, StringType.get(), false))) + " END";
        }
        return dialect.quoteIdentifier(instance.alias()) + "." + dialect.quoteIdentifier(DISTINCT_KEY_COLUMN);
    }

    /**
     * Returns an expression that is null exactly when a joined instance has no
     * row, for counting the rows of a join that does not repeat them.
     */
    private String presenceKey(JoinTree.Instance instance) {
        if (instance.source().primaryKeyField() == null && instance.source().origin() instanceof SourceOrigin.Nested) {
            instance.markNeedsRowKey();
            return dialect.unnestRowId(instance.alias());
        }
        return distinctKey(instance);
    }

    /**
     * Returns whether an expression contains an {@code all()} or {@code exclude()},
     * looking through measure and output references.
     *
     * @param expr the expression
     * @return true if some part ungroups
     */
    static boolean containsUngroup(Expr expr) {
        if (expr instanceof Expr.Ungroup) {
            return true;
        }
        if (expr instanceof Expr.FieldRef ref) {
            return ref.isAggregate() && containsUngroup(ref.definition());
        }
        if (expr instanceof Expr.OutputRef output) {
            return containsUngroup(output.definition());
        }
        for (Expr child : expr.children()) {
            if (containsUngroup(child)) {
                return true;
            }
        }
        return false;
    }
}
