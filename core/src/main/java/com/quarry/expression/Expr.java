package com.quarry.expression;

import com.quarry.diagnostic.Location;
import com.quarry.model.DimensionDef;
import com.quarry.model.FieldDef;
import com.quarry.model.JoinDef;
import com.quarry.model.MeasureDef;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.NullType;
import com.quarry.types.NumberType;
import com.quarry.types.TimeUnit;
import com.quarry.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, resolved expression tree.
 *
 * <p>Field references point at their {@link FieldDef} by identity, together with
 * the joins walked to reach it, relative to the source the expression was
 * resolved in. The query compiler turns an expression into SQL by anchoring that
 * relative path at a join instance.
 */
public sealed interface Expr {

    /**
     * Returns the data type of this expression.
     *
     * @return the type
     */
    DataType type();

    /**
     * Returns the direct sub-expressions.
     *
     * @return the children, possibly empty
     */
    List<Expr> children();

    Location location();

    /**
     * Returns whether this expression computes an aggregate, either directly or by
     * referencing a measure.
     *
     * @return true for aggregate expressions
     */
    default boolean isAggregate() {
        for (Expr child : children()) {
            if (child.isAggregate()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A literal value. {@code text} is the number as written, the unquoted string,
     * {@code true}/{@code false}, or null for the null literal.
     */
    record Literal(String text, DataType type, Location location) implements Expr {
        public Literal {
            Objects.requireNonNull(type, "type must not be null");
        }

        public static Literal nullValue(Location location) {
            return new Literal(null, NullType.get(), location);
        }

        public static Literal number(long value, Location location) {
            return new Literal(Long.toString(value), NumberType.get(), location);
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    /**
     * A time literal truncated to its granularity; {@code text} is
     * {@code yyyy-MM-dd} for dates and {@code yyyy-MM-dd HH:mm:ss} for timestamps.
     */
    record TimeLiteral(String text, DataType type, TimeUnit granularity, Location location) implements Expr {
        public TimeLiteral {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(granularity, "granularity must not be null");
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    record Now(Location location) implements Expr {
        @Override
        public DataType type() {
            return TimestampType.get();
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    /**
     * A reference to a dimension or measure, reached by walking {@code joinPath}
     * from the resolving source.
     */
    record FieldRef(List<JoinDef> joinPath, FieldDef field, String name, Location location) implements Expr {
        public FieldRef {
            joinPath = List.copyOf(joinPath);
            Objects.requireNonNull(field, "field must not be null");
            if (!(field instanceof DimensionDef) && !(field instanceof MeasureDef)) {
                throw new IllegalArgumentException("only dimensions and measures are values: " + field);
            }
        }

        @Override
        public DataType type() {
            return field instanceof DimensionDef
                ? ((DimensionDef) field).type()
                : ((MeasureDef) field).type();
        }

        /**
         * Returns the definition of the referenced field.
         *
         * @return the referenced expression
         */
        public Expr definition() {
            return field instanceof DimensionDef
                ? ((DimensionDef) field).expression()
                : ((MeasureDef) field).expression();
        }

        @Override
        public boolean isAggregate() {
            return field instanceof MeasureDef;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    /** A physical column of the row the expression is evaluated on. */
    record Column(String column, DataType type) implements Expr {
        public Column {
            Objects.requireNonNull(column, "column must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public Location location() {
            return Location.UNKNOWN;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    /**
     * A reference, from {@code having} or {@code order_by}, to an output column of
     * the current stage.
     */
    record OutputRef(String name, Expr definition, Location location) implements Expr {
        public OutputRef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public DataType type() {
            return definition.type();
        }

        @Override
        public boolean isAggregate() {
            return definition.isAggregate();
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    record Binary(Expr left, BinaryOperator operator, Expr right, DataType type, Location location) implements Expr {
        public Binary {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public List<Expr> children() {
            return List.of(left, right);
        }
    }

    record Not(Expr operand, Location location) implements Expr {
        @Override
        public DataType type() {
            return BooleanType.get();
        }

        @Override
        public List<Expr> children() {
            return List.of(operand);
        }
    }

    record Negate(Expr operand, Location location) implements Expr {
        @Override
        public DataType type() {
            return NumberType.get();
        }

        @Override
        public List<Expr> children() {
            return List.of(operand);
        }
    }

    /** {@code x = null} / {@code x != null} */
    record IsNull(Expr operand, boolean negated, Location location) implements Expr {
        @Override
        public DataType type() {
            return BooleanType.get();
        }

        @Override
        public List<Expr> children() {
            return List.of(operand);
        }
    }

    /** {@code CASE WHEN … THEN … ELSE … END}; {@code otherwise} may be null. */
    record Case(List<When> whens, Expr otherwise, DataType type, Location location) implements Expr {
        public Case {
            whens = List.copyOf(whens);
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            for (When when : whens) {
                children.add(when.condition());
                children.add(when.value());
            }
            if (otherwise != null) {
                children.add(otherwise);
            }
            return children;
        }
    }

    record When(Expr condition, Expr value) {
        public When {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * An aggregate function call. {@code argument} is null for {@code count()}.
     * {@code level} is the join path of the rows being aggregated, or null when it
     * is derived from the fields the argument uses.
     */
    record Aggregate(AggregateFunction function, Expr argument, List<JoinDef> level, Location location)
        implements Expr {
        public Aggregate {
            Objects.requireNonNull(function, "function must not be null");
            level = level == null ? null : List.copyOf(level);
        }

        @Override
        public DataType type() {
            if (function == AggregateFunction.MIN || function == AggregateFunction.MAX) {
                return argument.type();
            }
            return NumberType.get();
        }

        @Override
        public boolean isAggregate() {
            return true;
        }

        @Override
        public List<Expr> children() {
            return argument == null ? List.of() : List.of(argument);
        }
    }

    /** {@code aggregate {? filters}}: the filters restrict the aggregate's input rows. */
    record Filtered(Expr expression, List<Expr> filters, Location location) implements Expr {
        public Filtered {
            Objects.requireNonNull(expression, "expression must not be null");
            filters = List.copyOf(filters);
        }

        @Override
        public DataType type() {
            return expression.type();
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            children.add(expression);
            children.addAll(filters);
            return children;
        }
    }

    /**
     * {@code all(…)} / {@code exclude(…)}: an aggregate computed while ignoring some
     * or all grouping columns of the stage. For {@code all}, {@code fields} are the
     * grouping columns to keep; for {@code exclude}, the ones to ignore.
     */
    record Ungroup(Expr expression, boolean exclude, List<String> fields, Location location) implements Expr {
        public Ungroup {
            Objects.requireNonNull(expression, "expression must not be null");
            fields = List.copyOf(fields);
        }

        @Override
        public DataType type() {
            return expression.type();
        }

        @Override
        public boolean isAggregate() {
            return true;
        }

        @Override
        public List<Expr> children() {
            return List.of(expression);
        }
    }

    record TimeTrunc(Expr operand, TimeUnit unit, Location location) implements Expr {
        @Override
        public DataType type() {
            return operand.type();
        }

        @Override
        public List<Expr> children() {
            return List.of(operand);
        }
    }

    record TimeExtract(TimeUnit unit, Expr operand, Location location) implements Expr {
        @Override
        public DataType type() {
            return NumberType.get();
        }

        @Override
        public List<Expr> children() {
            return List.of(operand);
        }
    }

    record TimeOffset(Expr base, boolean subtract, Expr amount, TimeUnit unit, Location location) implements Expr {
        @Override
        public DataType type() {
            return base.type();
        }

        @Override
        public List<Expr> children() {
            return List.of(base, amount);
        }
    }

    record Cast(Expr operand, DataType target, boolean safe, Location location) implements Expr {
        @Override
        public DataType type() {
            return target;
        }

        @Override
        public List<Expr> children() {
            return List.of(operand);
        }
    }

    record FunctionCall(ScalarFunction function, List<Expr> arguments, DataType type, Location location)
        implements Expr {
        public FunctionCall {
            Objects.requireNonNull(function, "function must not be null");
            arguments = List.copyOf(arguments);
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public List<Expr> children() {
            return arguments;
        }
    }
}
