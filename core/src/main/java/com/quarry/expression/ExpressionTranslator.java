package com.quarry.expression;

import com.quarry.ast.ExprNode;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;
import com.quarry.exception.CompilationException;
import com.quarry.model.FieldDef;
import com.quarry.model.JoinDef;
import com.quarry.model.MeasureDef;
import com.quarry.model.ViewDef;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NullType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimeUnit;
import com.quarry.types.TimestampType;
import com.quarry.types.TypeMapper;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates expression syntax into typed {@link Expr} trees.
 *
 * <p>Names are resolved against a {@link FieldSpace}. Operators are checked
 * against the types of their operands, and the context checks
 * ({@link #translateScalar}, {@link #translateAggregate}, {@link #translateHaving})
 * enforce where aggregates may and may not appear.
 *
 * <p>Several surface forms are lowered here:
 * <ul>
 *   <li>{@code x = null} becomes {@link Expr.IsNull}</li>
 *   <li>{@code t = @2003-01} becomes {@code t >= @2003-01 AND t < @2003-01 + 1 month}</li>
 *   <li>{@code t ? @2003 for 3 days} and {@code t ? a to b} become half open ranges</li>
 *   <li>{@code pick} becomes {@link Expr.Case}</li>
 * </ul>
 *
 * <p>All failures are thrown as {@link CompilationException}s located at the
 * offending node.
 */
public class ExpressionTranslator {

    private static final Pattern YEAR = Pattern.compile("(\\d{4})");
    private static final Pattern QUARTER = Pattern.compile("(\\d{4})-[Qq]([1-4])");
    private static final Pattern MONTH = Pattern.compile("(\\d{4})-(\\d{2})");
    private static final Pattern DAY = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern TIME = Pattern.compile(
        "(\\d{4})-(\\d{2})-(\\d{2})[ T](\\d{2})(?::(\\d{2})(?::(\\d{2}))?)?");

    private final FieldSpace space;

    public ExpressionTranslator(FieldSpace space) {
        this.space = Objects.requireNonNull(space, "space must not be null");
    }

    /**
     * Translates an expression used where only per-row values are allowed
     * (dimensions, {@code group_by}, {@code project}).
     *
     * @param node the expression syntax
     * @param context what the expression is used for, for messages
     * @return the typed expression
     */
    public Expr translateScalar(ExprNode node, String context) {
        Expr expr = translate(node);
        if (expr.isAggregate()) {
            throw CompilationException.structural(
                "Aggregate expression is not allowed in " + context, node.location());
        }
        return expr;
    }

    /**
     * Translates a row filter.
     *
     * @param node the filter syntax
     * @param context what the filter belongs to, for messages
     * @return the typed boolean expression
     */
    public Expr translateFilter(ExprNode node, String context) {
        Expr expr = translateScalar(node, context);
        requireBoolean(expr, context, node.location());
        return expr;
    }

    /**
     * Translates an expression that must compute an aggregate (measures,
     * {@code aggregate}). Dimensions may only be read inside aggregate functions.
     *
     * @param node the expression syntax
     * @param context what the expression is used for, for messages
     * @return the typed aggregate expression
     */
    public Expr translateAggregate(ExprNode node, String context) {
        Expr expr = translate(node);
        if (!expr.isAggregate()) {
            throw CompilationException.structural(
                "Expression in " + context + " must be an aggregate", node.location());
        }
        checkUngroupedReferences(expr, context);
        return expr;
    }

    /**
     * Translates a {@code having} condition. Besides aggregates it may read the
     * output columns of the stage, which are already grouped.
     *
     * @param node the condition syntax
     * @return the typed boolean expression
     */
    public Expr translateHaving(ExprNode node) {
        Expr expr = translate(node);
        requireBoolean(expr, "having", node.location());
        checkUngroupedReferences(expr, "having");
        return expr;
    }

    /**
     * Resolves a dotted path that must name joins only.
     *
     * @param path the names
     * @param location where the path was written
     * @return the joins walked, in order
     */
    public List<JoinDef> resolveJoinPath(List<String> path, Location location) {
        List<JoinDef> joins = new ArrayList<>();
        FieldSpace current = space;
        for (int i = 0; i < path.size(); i++) {
            FieldDef field = current.lookup(path.get(i));
            if (field == null) {
                throw CompilationException.nameResolution(
                    "'" + dotted(path, i) + "' is not defined", location);
            }
            if (!(field instanceof JoinDef join)) {
                throw CompilationException.typeError(
                    "'" + dotted(path, i) + "' is not a join", location);
            }
            joins.add(join);
            current = new SourceSpace(join.source());
        }
        return joins;
    }

    /**
     * Translates any expression without context checks.
     *
     * @param node the expression syntax
     * @return the typed expression
     */
    public Expr translate(ExprNode node) {
        Objects.requireNonNull(node, "node must not be null");
        Location at = node.location();

        if (node instanceof ExprNode.FieldRef ref) {
            return resolveReference(ref.path(), at);
        }
        if (node instanceof ExprNode.NumberLiteral num) {
            return new Expr.Literal(num.text(), NumberType.get(), at);
        }
        if (node instanceof ExprNode.StringLiteral str) {
            return new Expr.Literal(str.value(), StringType.get(), at);
        }
        if (node instanceof ExprNode.BooleanLiteral bool) {
            return new Expr.Literal(Boolean.toString(bool.value()), BooleanType.get(), at);
        }
        if (node instanceof ExprNode.NullLiteral) {
            return Expr.Literal.nullValue(at);
        }
        if (node instanceof ExprNode.TimeLiteral time) {
            return parseTimeLiteral(time.text(), at);
        }
        if (node instanceof ExprNode.Now) {
            return new Expr.Now(at);
        }
        if (node instanceof ExprNode.Binary binary) {
            return translateBinary(binary);
        }
        if (node instanceof ExprNode.Not not) {
            Expr operand = translate(not.operand());
            requireBoolean(operand, "not", at);
            return new Expr.Not(operand, at);
        }
        if (node instanceof ExprNode.Negate negate) {
            Expr operand = translate(negate.operand());
            requireNumber(operand, "unary minus", at);
            return new Expr.Negate(operand, at);
        }
        if (node instanceof ExprNode.Pick pick) {
            Expr subject = pick.subject() == null ? null : translate(pick.subject());
            return translatePick(subject, pick);
        }
        if (node instanceof ExprNode.Apply apply) {
            return translateApply(translate(apply.value()), apply.pattern(), at);
        }
        if (node instanceof ExprNode.Partial) {
            throw CompilationException.structural(
                "Partial comparison needs a value to apply to (use '?')", at);
        }
        if (node instanceof ExprNode.Range || node instanceof ExprNode.Duration) {
            throw CompilationException.structural(
                "Range needs a value to apply to (use '?')", at);
        }
        if (node instanceof ExprNode.TimeOffset offset) {
            return translateTimeOffset(offset);
        }
        if (node instanceof ExprNode.Aggregate aggregate) {
            return translateAggregateCall(aggregate);
        }
        if (node instanceof ExprNode.Filtered filtered) {
            return translateFiltered(filtered);
        }
        if (node instanceof ExprNode.Ungroup ungroup) {
            Expr inner = translate(ungroup.expression());
            if (!inner.isAggregate()) {
                throw CompilationException.structural(
                    (ungroup.exclude() ? "exclude()" : "all()") + " requires an aggregate expression", at);
            }
            return new Expr.Ungroup(inner, ungroup.exclude(), ungroup.fields(), at);
        }
        if (node instanceof ExprNode.TimeTrunc trunc) {
            Expr operand = translate(trunc.expression());
            requireTemporal(operand, "truncation to " + trunc.unit().keyword(), at);
            requireUnitFits(operand.type(), trunc.unit(), at);
            return new Expr.TimeTrunc(operand, trunc.unit(), at);
        }
        if (node instanceof ExprNode.TimeExtract extract) {
            Expr operand = translate(extract.expression());
            requireTemporal(operand, extract.unit().keyword() + "()", at);
            requireUnitFits(operand.type(), extract.unit(), at);
            return new Expr.TimeExtract(extract.unit(), operand, at);
        }
        if (node instanceof ExprNode.Cast cast) {
            Expr operand = translate(cast.expression());
            DataType target = TypeMapper.fromTypeName(cast.typeName());
            if (target == null) {
                throw CompilationException.typeError("Unknown type '" + cast.typeName() + "' in cast", at);
            }
            return new Expr.Cast(operand, target, cast.safe(), at);
        }
        if (node instanceof ExprNode.Function function) {
            return translateFunction(function);
        }
        throw new CompilationException(DiagnosticKind.INTERNAL_ERROR,
            "Unhandled expression node: " + node.getClass().getSimpleName(), at);
    }

    private Expr resolveReference(List<String> path, Location location) {
        if (path.size() == 1) {
            Expr output = space.output(path.get(0));
            if (output != null) {
                return new Expr.OutputRef(path.get(0), output, location);
            }
        }
        FieldSpace current = space;
        List<JoinDef> joins = new ArrayList<>();
        for (int i = 0; i < path.size(); i++) {
            FieldDef field = current.lookup(path.get(i));
            if (field == null) {
                throw CompilationException.nameResolution(
                    "'" + dotted(path, i) + "' is not defined", location);
            }
            boolean last = i == path.size() - 1;
            if (!last) {
                if (!(field instanceof JoinDef join)) {
                    throw CompilationException.nameResolution(
                        "'" + dotted(path, i) + "' is not a join, so '" + path.get(i + 1) +
                        "' cannot be reached through it", location);
                }
                joins.add(join);
                current = new SourceSpace(join.source());
            } else if (field instanceof JoinDef) {
                throw CompilationException.typeError(
                    "'" + dotted(path, i) + "' is a join and cannot be used as a value", location);
            } else if (field instanceof ViewDef) {
                throw CompilationException.typeError(
                    "'" + dotted(path, i) + "' is a view and cannot be used as a value", location);
            } else {
                return new Expr.FieldRef(joins, field, String.join(".", path), location);
            }
        }
        throw new IllegalStateException("unreachable");
    }

    private Expr translateBinary(ExprNode.Binary binary) {
        Location at = binary.location();
        BinaryOperator op = binary.operator();
        Expr left = translate(binary.left());
        Expr right = translate(binary.right());

        if (op.isArithmetic()) {
            requireNumber(left, "'" + op.symbol() + "'", at);
            requireNumber(right, "'" + op.symbol() + "'", at);
            return new Expr.Binary(left, op, right, NumberType.get(), at);
        }
        if (op.isLogical()) {
            requireBoolean(left, "'" + op.symbol() + "'", at);
            requireBoolean(right, "'" + op.symbol() + "'", at);
            return new Expr.Binary(left, op, right, BooleanType.get(), at);
        }
        if (op == BinaryOperator.COALESCE) {
            DataType type = unify(left.type(), right.type());
            if (type == null) {
                throw mismatch(op, left, right, at);
            }
            return new Expr.Binary(left, op, right, type, at);
        }
        return compare(left, op, right, at);
    }

    /**
     * Builds a comparison, lowering null tests and granular time equality.
     */
    private Expr compare(Expr left, BinaryOperator op, Expr right, Location at) {
        if (op == BinaryOperator.EQUAL || op == BinaryOperator.NOT_EQUAL) {
            boolean negated = op == BinaryOperator.NOT_EQUAL;
            if (right.type() instanceof NullType) {
                return new Expr.IsNull(left, negated, at);
            }
            if (left.type() instanceof NullType) {
                return new Expr.IsNull(right, negated, at);
            }
            if (right instanceof Expr.TimeLiteral literal && literal.granularity() != TimeUnit.SECOND) {
                requireTemporal(left, "comparison with a time literal", at);
                Expr range = inRange(left, literal, endOf(literal), at);
                return negated ? new Expr.Not(range, at) : range;
            }
        }
        if (op.isMatch()) {
            requireType(left, StringType.get(), "'" + op.symbol() + "'", at);
            requireType(right, StringType.get(), "'" + op.symbol() + "'", at);
            return new Expr.Binary(left, op, right, BooleanType.get(), at);
        }
        if (!op.isComparison()) {
            throw CompilationException.typeError("'" + op.symbol() + "' is not a comparison", at);
        }
        if (unify(left.type(), right.type()) == null || left.type().isNested()) {
            throw mismatch(op, left, right, at);
        }
        return new Expr.Binary(left, op, right, BooleanType.get(), at);
    }

    private Expr inRange(Expr value, Expr start, Expr end, Location at) {
        if (unify(value.type(), start.type()) == null) {
            throw CompilationException.typeError(
                "Cannot compare " + value.type().typeName() + " with a range of " + start.type().typeName(), at);
        }
        Expr lower = new Expr.Binary(value, BinaryOperator.GREATER_THAN_OR_EQUAL, start, BooleanType.get(), at);
        Expr upper = new Expr.Binary(value, BinaryOperator.LESS_THAN, end, BooleanType.get(), at);
        return new Expr.Binary(lower, BinaryOperator.AND, upper, BooleanType.get(), at);
    }

    private static Expr endOf(Expr.TimeLiteral literal) {
        return new Expr.TimeOffset(literal, false, Expr.Literal.number(1, literal.location()),
            literal.granularity(), literal.location());
    }

    private Expr translateApply(Expr value, ExprNode pattern, Location at) {
        if (pattern instanceof ExprNode.Partial partial) {
            return compare(value, partial.operator(), translate(partial.right()), at);
        }
        if (pattern instanceof ExprNode.Range range) {
            return inRange(value, translate(range.start()), translate(range.end()), at);
        }
        if (pattern instanceof ExprNode.Duration duration) {
            Expr start = translate(duration.start());
            requireTemporal(start, "'for'", at);
            Expr amount = translate(duration.amount());
            requireNumber(amount, "'for'", at);
            requireUnitFits(start.type(), duration.unit(), at);
            Expr end = new Expr.TimeOffset(start, false, amount, duration.unit(), at);
            return inRange(value, start, end, at);
        }
        if (pattern instanceof ExprNode.Pick pick) {
            return translatePick(value, pick);
        }
        if (pattern instanceof ExprNode.Binary binary && binary.operator().isLogical()) {
            Expr left = translateApply(value, binary.left(), at);
            Expr right = translateApply(value, binary.right(), at);
            return new Expr.Binary(left, binary.operator(), right, BooleanType.get(), at);
        }
        if (pattern instanceof ExprNode.Not not) {
            return new Expr.Not(translateApply(value, not.operand(), at), at);
        }
        return compare(value, BinaryOperator.EQUAL, translate(pattern), at);
    }

    private Expr translatePick(Expr subject, ExprNode.Pick pick) {
        Location at = pick.location();
        List<Expr.When> whens = new ArrayList<>();
        DataType type = NullType.get();
        for (ExprNode.PickBranch branch : pick.branches()) {
            Expr condition;
            if (subject == null) {
                condition = translate(branch.when());
                requireBoolean(condition, "pick condition", branch.when().location());
            } else {
                condition = translateApply(subject, branch.when(), branch.when().location());
            }
            Expr value;
            if (branch.value() != null) {
                value = translate(branch.value());
            } else if (subject != null) {
                value = subject;
            } else {
                throw CompilationException.structural("pick without a value needs a subject", at);
            }
            type = unifyOrFail(type, value, "pick", at);
            whens.add(new Expr.When(condition, value));
        }
        Expr otherwise = null;
        if (pick.otherwise() != null) {
            otherwise = translate(pick.otherwise());
            type = unifyOrFail(type, otherwise, "pick", at);
        }
        return new Expr.Case(whens, otherwise, type, at);
    }

    private Expr translateTimeOffset(ExprNode.TimeOffset offset) {
        Location at = offset.location();
        Expr base = translate(offset.base());
        requireTemporal(base, "time offset", at);
        Expr amount = translate(offset.amount());
        requireNumber(amount, "time offset", at);
        requireUnitFits(base.type(), offset.unit(), at);
        return new Expr.TimeOffset(base, offset.subtract(), amount, offset.unit(), at);
    }

    private Expr translateAggregateCall(ExprNode.Aggregate node) {
        Location at = node.location();
        AggregateFunction function = node.function();
        List<JoinDef> level = node.sourcePath().isEmpty() ? null : resolveJoinPath(node.sourcePath(), at);

        Expr argument = null;
        if (node.argument() != null) {
            argument = translate(node.argument());
            if (argument.isAggregate()) {
                throw CompilationException.structural("Aggregate functions cannot be nested", at);
            }
            if (argument.type().isNested()) {
                throw CompilationException.typeError(
                    function.keyword() + "() cannot aggregate a " + argument.type().typeName(), at);
            }
            if (function == AggregateFunction.SUM || function == AggregateFunction.AVG) {
                requireNumber(argument, function.keyword() + "()", at);
            }
            if (level == null) {
                try {
                    ExprPaths.deepestPath(argument);
                } catch (IllegalArgumentException e) {
                    throw CompilationException.structural(
                        function.keyword() + "() argument reads fields from unrelated joins", at);
                }
            }
        } else if (function != AggregateFunction.COUNT) {
            throw CompilationException.typeError(function.keyword() + "() requires an argument", at);
        }
        return new Expr.Aggregate(function, argument, level, at);
    }

    private Expr translateFiltered(ExprNode.Filtered node) {
        Location at = node.location();
        Expr inner = translate(node.expression());
        if (!inner.isAggregate()) {
            throw CompilationException.structural(
                "Filter shortcut '{? }' can only be applied to an aggregate", at);
        }
        List<Expr> filters = new ArrayList<>();
        for (ExprNode filter : node.filters()) {
            filters.add(translateFilter(filter, "an aggregate filter"));
        }
        return new Expr.Filtered(inner, filters, at);
    }

    private Expr translateFunction(ExprNode.Function node) {
        Location at = node.location();
        ScalarFunction function = ScalarFunction.fromKeyword(node.name());
        if (function == null) {
            throw CompilationException.nameResolution("Unknown function '" + node.name() + "'", at);
        }
        int count = node.arguments().size();
        if (count < function.minArgs() || count > function.maxArgs()) {
            throw CompilationException.typeError(
                function.keyword() + "() does not accept " + count + " argument(s)", at);
        }
        List<Expr> arguments = new ArrayList<>();
        for (ExprNode argument : node.arguments()) {
            arguments.add(translate(argument));
        }
        String name = function.keyword() + "()";
        DataType type = function.resultType();
        switch (function) {
            case LOWER:
            case UPPER:
            case LENGTH:
            case TRIM:
                requireType(arguments.get(0), StringType.get(), name, at);
                break;
            case SUBSTR:
                requireType(arguments.get(0), StringType.get(), name, at);
                for (int i = 1; i < arguments.size(); i++) {
                    requireNumber(arguments.get(i), name, at);
                }
                break;
            case ROUND:
            case FLOOR:
            case CEIL:
            case ABS:
                for (Expr argument : arguments) {
                    requireNumber(argument, name, at);
                }
                break;
            case CONCAT:
                for (Expr argument : arguments) {
                    if (argument.type().isNested()) {
                        throw CompilationException.typeError(name + " cannot concatenate nested data", at);
                    }
                }
                break;
            case COALESCE:
                type = NullType.get();
                for (Expr argument : arguments) {
                    type = unifyOrFail(type, argument, name, at);
                }
                break;
            default:
                break;
        }
        return new Expr.FunctionCall(function, arguments, type, at);
    }

    /**
     * Rejects dimension reads that are not under an aggregate function. A dimension
     * reached through a {@code join_many} is reported as a fan-out, because its
     * value is repeated once per joined row.
     */
    private void checkUngroupedReferences(Expr expr, String context) {
        if (expr instanceof Expr.Aggregate || expr instanceof Expr.Filtered || expr instanceof Expr.Ungroup
            || expr instanceof Expr.OutputRef) {
            return;
        }
        if (expr instanceof Expr.FieldRef ref) {
            if (ref.field() instanceof MeasureDef) {
                return;
            }
            List<List<JoinDef>> paths = new ArrayList<>();
            ExprPaths.collectScalarPaths(ref, List.of(), paths);
            for (List<JoinDef> path : paths) {
                JoinDef fanOut = ExprPaths.firstFanOut(path);
                if (fanOut != null) {
                    throw CompilationException.structural(
                        "'" + ref.name() + "' is reached through " + fanOut.relationship().keyword() + " '" +
                        fanOut.name() + "' and can only be used inside an aggregate function", ref.location());
                }
            }
            throw CompilationException.structural(
                "'" + ref.name() + "' is not an aggregate and cannot be used outside an aggregate function in " +
                context, ref.location());
        }
        for (Expr child : expr.children()) {
            checkUngroupedReferences(child, context);
        }
    }

    /**
     * Parses a time literal into its start instant and granularity.
     *
     * @param text the literal without {@code @}
     * @param at where the literal was written
     * @return the literal
     */
    public static Expr.TimeLiteral parseTimeLiteral(String text, Location at) {
        String literal = text.trim();
        try {
            Matcher m = YEAR.matcher(literal);
            if (m.matches()) {
                return date(LocalDate.of(Integer.parseInt(m.group(1)), 1, 1), TimeUnit.YEAR, at);
            }
            m = QUARTER.matcher(literal);
            if (m.matches()) {
                int month = (Integer.parseInt(m.group(2)) - 1) * 3 + 1;
                return date(LocalDate.of(Integer.parseInt(m.group(1)), month, 1), TimeUnit.QUARTER, at);
            }
            m = MONTH.matcher(literal);
            if (m.matches()) {
                LocalDate start = LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1);
                return date(start, TimeUnit.MONTH, at);
            }
            m = DAY.matcher(literal);
            if (m.matches()) {
                LocalDate day = LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)));
                return date(day, TimeUnit.DAY, at);
            }
            m = TIME.matcher(literal);
            if (m.matches()) {
                int minute = m.group(5) == null ? 0 : Integer.parseInt(m.group(5));
                int second = m.group(6) == null ? 0 : Integer.parseInt(m.group(6));
                TimeUnit unit = m.group(5) == null ? TimeUnit.HOUR
                    : m.group(6) == null ? TimeUnit.MINUTE : TimeUnit.SECOND;
                LocalDateTime time = LocalDateTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)), minute, second);
                String formatted = String.format("%s %02d:%02d:%02d",
                    time.toLocalDate(), time.getHour(), time.getMinute(), time.getSecond());
                return new Expr.TimeLiteral(formatted, TimestampType.get(), unit, at);
            }
        } catch (DateTimeException e) {
            throw new CompilationException(DiagnosticKind.TYPE_ERROR,
                "Invalid time literal '@" + text + "': " + e.getMessage(), at, e);
        }
        throw CompilationException.typeError("Invalid time literal '@" + text + "'", at);
    }

    private static Expr.TimeLiteral date(LocalDate date, TimeUnit unit, Location at) {
        return new Expr.TimeLiteral(date.toString(), DateType.get(), unit, at);
    }

    /**
     * Returns the common type of two operand types, or null if they are not
     * compatible. Null is compatible with everything; dates and timestamps combine
     * to timestamp.
     *
     * @param a the first type
     * @param b the second type
     * @return the combined type or null
     */
    public static DataType unify(DataType a, DataType b) {
        if (a instanceof NullType) {
            return b;
        }
        if (b instanceof NullType) {
            return a;
        }
        if (a.equals(b)) {
            return a;
        }
        if (a.isTemporal() && b.isTemporal()) {
            return TimestampType.get();
        }
        return null;
    }

    private static DataType unifyOrFail(DataType current, Expr next, String what, Location at) {
        DataType unified = unify(current, next.type());
        if (unified == null) {
            throw CompilationException.typeError(
                what + " mixes " + current.typeName() + " and " + next.type().typeName() + " values", at);
        }
        return unified;
    }

    private static CompilationException mismatch(BinaryOperator op, Expr left, Expr right, Location at) {
        return CompilationException.typeError(
            "Cannot apply '" + op.symbol() + "' to " + left.type().typeName() + " and " +
            right.type().typeName(), at);
    }

    private static void requireBoolean(Expr expr, String what, Location at) {
        requireType(expr, BooleanType.get(), what, at);
    }

    private static void requireNumber(Expr expr, String what, Location at) {
        requireType(expr, NumberType.get(), what, at);
    }

    private static void requireType(Expr expr, DataType expected, String what, Location at) {
        DataType actual = expr.type();
        if (!(actual instanceof NullType) && !actual.equals(expected)) {
            throw CompilationException.typeError(
                what + " requires " + expected.typeName() + ", got " + actual.typeName(), at);
        }
    }

    private static void requireTemporal(Expr expr, String what, Location at) {
        if (!expr.type().isTemporal()) {
            throw CompilationException.typeError(
                what + " requires a date or timestamp, got " + expr.type().typeName(), at);
        }
    }

    private static void requireUnitFits(DataType type, TimeUnit unit, Location at) {
        if (type instanceof DateType && !unit.isDateUnit()) {
            throw CompilationException.typeError("'" + unit.keyword() + "' does not apply to a date", at);
        }
    }

    private static String dotted(List<String> path, int lastIndex) {
        return String.join(".", path.subList(0, lastIndex + 1));
    }
}
