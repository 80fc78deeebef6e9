package com.quarry.ast;

import com.quarry.diagnostic.Location;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.BinaryOperator;
import com.quarry.types.TimeUnit;

import java.util.List;
import java.util.Objects;

/**
 * Expression syntax, as handed over by the parser.
 *
 * <p>Nodes are untyped: names are unresolved paths and operators have not been
 * checked against their operands. The translator turns them into typed
 * {@link com.quarry.expression.Expr} trees.
 */
public sealed interface ExprNode {

    Location location();

    /** {@code a}, {@code j.a}, {@code j.k.a} */
    record FieldRef(List<String> path, Location location) implements ExprNode {
        public FieldRef {
            path = List.copyOf(path);
            if (path.isEmpty()) {
                throw new IllegalArgumentException("path must not be empty");
            }
        }
    }

    /** A numeric literal kept as written. */
    record NumberLiteral(String text, Location location) implements ExprNode {
        public NumberLiteral {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record StringLiteral(String value, Location location) implements ExprNode {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record BooleanLiteral(boolean value, Location location) implements ExprNode {
    }

    record NullLiteral(Location location) implements ExprNode {
    }

    /**
     * A time literal without its {@code @}: {@code 2003}, {@code 2003-Q2}, {@code 2003-01},
     * {@code 2003-01-02}, {@code 2003-01-02 10}, {@code 2003-01-02 10:30} or
     * {@code 2003-01-02 10:30:45}. The granularity is the precision written.
     */
    record TimeLiteral(String text, Location location) implements ExprNode {
        public TimeLiteral {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record Now(Location location) implements ExprNode {
    }

    record Binary(ExprNode left, BinaryOperator operator, ExprNode right, Location location) implements ExprNode {
        public Binary {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Not(ExprNode operand, Location location) implements ExprNode {
    }

    record Negate(ExprNode operand, Location location) implements ExprNode {
    }

    /**
     * A comparison missing its left operand ({@code > 5}), used as a {@code pick}
     * condition against a subject or as the right side of {@code ?}.
     */
    record Partial(BinaryOperator operator, ExprNode right, Location location) implements ExprNode {
        public Partial {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /**
     * {@code pick v when c … else e}. With a subject ({@code subject ? pick …}) the
     * conditions are applied to the subject, and a branch without a value picks the
     * subject itself. {@code otherwise} may be null.
     */
    record Pick(ExprNode subject, List<PickBranch> branches, ExprNode otherwise, Location location) implements ExprNode {
        public Pick {
            branches = List.copyOf(branches);
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("pick needs at least one branch");
            }
        }
    }

    /** One {@code pick value when condition}; value may be null inside an applied pick. */
    record PickBranch(ExprNode value, ExprNode when) {
        public PickBranch {
            Objects.requireNonNull(when, "when must not be null");
        }
    }

    /** {@code value ? pattern}: apply a partial comparison, range or value. */
    record Apply(ExprNode value, ExprNode pattern, Location location) implements ExprNode {
        public Apply {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(pattern, "pattern must not be null");
        }
    }

    /** {@code start to end}: half open range. */
    record Range(ExprNode start, ExprNode end, Location location) implements ExprNode {
        public Range {
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(end, "end must not be null");
        }
    }

    /** {@code start for N units}: half open range of a duration. */
    record Duration(ExprNode start, ExprNode amount, TimeUnit unit, Location location) implements ExprNode {
        public Duration {
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(amount, "amount must not be null");
            Objects.requireNonNull(unit, "unit must not be null");
        }
    }

    /** {@code t + 3 days}, {@code t - 1 month} */
    record TimeOffset(ExprNode base, boolean subtract, ExprNode amount, TimeUnit unit, Location location)
        implements ExprNode {
        public TimeOffset {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(amount, "amount must not be null");
            Objects.requireNonNull(unit, "unit must not be null");
        }
    }

    /**
     * {@code count()}, {@code count(distinct x)}, {@code sum(x)}, {@code j.count()},
     * {@code j.sum(j.x)}. {@code sourcePath} names the level the aggregate is
     * computed at and may be empty; {@code argument} is null for {@code count()}.
     */
    record Aggregate(AggregateFunction function, List<String> sourcePath, ExprNode argument, Location location)
        implements ExprNode {
        public Aggregate {
            Objects.requireNonNull(function, "function must not be null");
            sourcePath = List.copyOf(sourcePath);
        }
    }

    /** {@code expression {? filter, …}} */
    record Filtered(ExprNode expression, List<ExprNode> filters, Location location) implements ExprNode {
        public Filtered {
            Objects.requireNonNull(expression, "expression must not be null");
            filters = List.copyOf(filters);
        }
    }

    /**
     * {@code all(expr)}, {@code all(expr, a, b)} or {@code exclude(expr, a, b)}.
     */
    record Ungroup(boolean exclude, ExprNode expression, List<String> fields, Location location) implements ExprNode {
        public Ungroup {
            Objects.requireNonNull(expression, "expression must not be null");
            fields = List.copyOf(fields);
        }
    }

    /** {@code expr.month} */
    record TimeTrunc(ExprNode expression, TimeUnit unit, Location location) implements ExprNode {
        public TimeTrunc {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(unit, "unit must not be null");
        }
    }

    /** {@code month(expr)} */
    record TimeExtract(TimeUnit unit, ExprNode expression, Location location) implements ExprNode {
        public TimeExtract {
            Objects.requireNonNull(unit, "unit must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /** {@code expr::type}, or {@code expr:::type} for a safe cast. */
    record Cast(ExprNode expression, String typeName, boolean safe, Location location) implements ExprNode {
        public Cast {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(typeName, "typeName must not be null");
        }
    }

    /** A scalar function call. */
    record Function(String name, List<ExprNode> arguments, Location location) implements ExprNode {
        public Function {
            Objects.requireNonNull(name, "name must not be null");
            arguments = List.copyOf(arguments);
        }
    }
}
