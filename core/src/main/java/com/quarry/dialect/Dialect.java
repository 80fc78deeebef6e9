package com.quarry.dialect;

import com.quarry.expression.AggregateFunction;
import com.quarry.expression.ScalarFunction;
import com.quarry.model.OrderDirection;
import com.quarry.model.SampleSpec;
import com.quarry.types.DataType;
import com.quarry.types.TimeUnit;

import java.util.List;

/**
 * Database-specific rendering of abstract SQL operations.
 *
 * <p>The query compiler never branches on which database it targets; every
 * construct whose spelling differs between databases goes through this
 * interface. An operation a database cannot express throws
 * {@link com.quarry.exception.DialectUnsupportedException} instead of returning
 * SQL that would fail at execution time.
 *
 * <p>All methods take and return SQL fragments. Fragments passed in are already
 * valid expressions in the target dialect. Aliases are passed unquoted.
 */
public interface Dialect {

    /**
     * Returns the registry name of this dialect.
     *
     * @return the dialect name
     */
    String name();

    // ==================== Identifiers and literals ====================

    String quoteIdentifier(String identifier);

    /**
     * Quotes a possibly qualified table path ({@code schema.table}).
     *
     * @param tablePath the dotted table path
     * @return the quoted path
     */
    String quoteTablePath(String tablePath);

    String stringLiteral(String value);

    String numberLiteral(String text);

    String booleanLiteral(boolean value);

    String nullLiteral();

    /**
     * Renders a date literal.
     *
     * @param isoDate {@code yyyy-MM-dd}
     * @return the literal
     */
    String dateLiteral(String isoDate);

    /**
     * Renders a timestamp literal.
     *
     * @param isoTimestamp {@code yyyy-MM-dd HH:mm:ss}
     * @return the literal
     */
    String timestampLiteral(String isoTimestamp);

    String now();

    // ==================== Scalar operations ====================

    /**
     * Renders a cast.
     *
     * @param expression the value
     * @param target the target type
     * @param safe whether failed conversions yield null instead of an error
     * @return the cast expression
     */
    String cast(String expression, DataType target, boolean safe);

    String divide(String left, String right);

    String modulo(String left, String right);

    String like(String expression, String pattern, boolean negated);

    /**
     * Renders an equality test that treats two nulls as equal.
     *
     * @param left the first value
     * @param right the second value
     * @return the comparison
     */
    String nullSafeEquals(String left, String right);

    String function(ScalarFunction function, List<String> arguments);

    // ==================== Time ====================

    String timeTrunc(String expression, TimeUnit unit, DataType type);

    String timeExtract(String expression, TimeUnit unit);

    /**
     * Adds or subtracts a number of units.
     *
     * @param expression the date or timestamp
     * @param type the type of the expression
     * @param subtract whether to subtract
     * @param amount the number of units
     * @param unit the unit
     * @return an expression of the same type
     */
    String timeOffset(String expression, DataType type, boolean subtract, String amount, TimeUnit unit);

    // ==================== Aggregation ====================

    /**
     * Renders a plain aggregate.
     *
     * @param function the function
     * @param argument the argument, or null for {@code count()}
     * @return the aggregate expression
     */
    String aggregate(AggregateFunction function, String argument);

    /**
     * Renders a sum that counts each distinct key once, for rows repeated by a join.
     *
     * @param distinctKey a value unique per underlying row
     * @param value the value to sum
     * @return the symmetric sum
     */
    String sumDistinct(String distinctKey, String value);

    /**
     * Renders an average that counts each distinct key once.
     *
     * @param distinctKey a value unique per underlying row
     * @param value the value to average
     * @return the symmetric average
     */
    String avgDistinct(String distinctKey, String value);

    /**
     * Returns an expression numbering the rows of a relation, used as a synthetic
     * distinct key.
     *
     * @return the row number expression
     */
    String rowNumber();

    // ==================== Nested data ====================

    /**
     * Renders a nested output column: the rows of {@code innerSql}, aliased
     * {@code alias}, packed into one repeated record value.
     *
     * @param innerSql the SELECT producing the nested rows
     * @param alias the alias for the inner rows
     * @param columns the output columns of the inner rows, in order
     * @param orderBy the ordering of the nested rows, already rendered against
     *        {@code quoteIdentifier(alias)}, or null
     * @return a scalar subquery producing the nested value
     */
    String nest(String innerSql, String alias, List<String> columns, String orderBy);

    /**
     * Renders a join clause that produces one row per element of a repeated record.
     *
     * @param arrayExpression the repeated record value on the parent row
     * @param alias the alias of the element rows
     * @param withRowId whether each element row needs an ordinal
     * @return the join clause
     */
    String unnestJoin(String arrayExpression, String alias, boolean withRowId);

    /**
     * Reads one field of an element row produced by {@link #unnestJoin}.
     *
     * @param alias the element alias
     * @param field the field name
     * @param type the field type
     * @return the field expression
     */
    String nestedField(String alias, String field, DataType type);

    /**
     * Reads the ordinal of an element row produced by {@link #unnestJoin} with
     * {@code withRowId}.
     *
     * @param alias the element alias
     * @return the ordinal expression
     */
    String unnestRowId(String alias);

    // ==================== Query clauses ====================

    /**
     * Renders a relation holding a sample of another relation's rows.
     *
     * @param relation a table path or parenthesized subquery
     * @param sample the requested sample
     * @param defaultRows the row count used for {@link SampleSpec.Default}
     * @return a parenthesized subquery
     */
    String sample(String relation, SampleSpec sample, long defaultRows);

    String orderTerm(String expression, OrderDirection direction);

    String limit(int rows);
}
