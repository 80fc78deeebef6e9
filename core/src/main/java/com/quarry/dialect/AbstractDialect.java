package com.quarry.dialect;

import com.quarry.exception.DialectUnsupportedException;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.ScalarFunction;
import com.quarry.model.OrderDirection;
import com.quarry.model.SampleSpec;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.TimeUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Base class for dialects whose SQL is close to the ANSI standard.
 *
 * <p>Implements every operation with the standard spelling and exposes
 * protected hooks for the points where databases usually differ: identifier
 * quoting, type names, interval arithmetic, safe casts and the hashed key used
 * by symmetric aggregates. Subclasses override the hooks first and whole
 * operations only when the standard form does not exist in their database.
 *
 * <p>Aliases passed to the nested-data operations are unquoted names; this
 * class quotes them.
 */
public abstract class AbstractDialect implements Dialect {

    /** Column holding the element value of an unnested repeated record. */
    protected static final String ROW_COLUMN = "__row";

    /** Column holding the ordinal of an unnested element. */
    protected static final String ROW_ID_COLUMN = "__row_id";

    private final String name;

    protected AbstractDialect(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    // ==================== Hooks ====================

    /**
     * Returns the character that opens and closes a quoted identifier.
     *
     * @return the quote character
     */
    protected char identifierQuote() {
        return '"';
    }

    /**
     * Returns the SQL type name used when casting to the given type.
     *
     * @param type a scalar type
     * @return the SQL type name
     * @throws DialectUnsupportedException if the type has no scalar SQL counterpart
     */
    protected abstract String sqlType(DataType type);

    /**
     * Renders a cast that yields null on failure.
     *
     * @param expression the value
     * @param sqlType the target SQL type name
     * @return the safe cast
     */
    protected String safeCast(String expression, String sqlType) {
        throw unsupported("safe cast");
    }

    /**
     * Renders an interval of {@code amount} units, for use with {@code +} and {@code -}.
     *
     * @param amount a numeric SQL expression
     * @param unit the unit, never week or quarter
     * @return the interval expression
     */
    protected String interval(String amount, TimeUnit unit) {
        return "INTERVAL (" + amount + ") " + unit.keyword().toUpperCase(Locale.ROOT);
    }

    /**
     * Maps a distinct key to a large number that is unique per key with
     * overwhelming probability, used by the hashed form of {@link #sumDistinct}.
     *
     * @param distinctKey the key expression
     * @return the hashed key
     */
    protected String hashedKey(String distinctKey) {
        throw unsupported("symmetric aggregates over fanned-out rows");
    }

    /**
     * Prepares a value for the hashed form of {@link #sumDistinct}.
     *
     * @param value the value to sum
     * @return the value in a type with exact addition
     */
    protected String distinctValue(String value) {
        return "CAST(ROUND(COALESCE(" + value + ", 0), 9) AS NUMERIC)";
    }

    protected String randomFunction() {
        return "RANDOM()";
    }

    protected boolean supportsNullsLast() {
        return true;
    }

    /**
     * Creates the exception for an operation this dialect cannot express.
     *
     * @param operation what was requested
     * @return the exception, to be thrown by the caller
     */
    protected DialectUnsupportedException unsupported(String operation) {
        return new DialectUnsupportedException(name, operation);
    }

    // ==================== Identifiers and literals ====================

    @Override
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String quote = String.valueOf(identifierQuote());
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    @Override
    public String quoteTablePath(String tablePath) {
        if (tablePath == null || tablePath.isEmpty()) {
            throw new IllegalArgumentException("Table path cannot be null or empty");
        }
        List<String> parts = new ArrayList<>();
        for (String part : tablePath.split("\\.")) {
            parts.add(quoteIdentifier(part));
        }
        return String.join(".", parts);
    }

    @Override
    public String stringLiteral(String value) {
        if (value == null) {
            return nullLiteral();
        }
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String numberLiteral(String text) {
        return text;
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public String nullLiteral() {
        return "NULL";
    }

    @Override
    public String dateLiteral(String isoDate) {
        return "DATE " + stringLiteral(isoDate);
    }

    @Override
    public String timestampLiteral(String isoTimestamp) {
        return "TIMESTAMP " + stringLiteral(isoTimestamp);
    }

    @Override
    public String now() {
        return "CURRENT_TIMESTAMP";
    }

    // ==================== Scalar operations ====================

    @Override
    public String cast(String expression, DataType target, boolean safe) {
        String type = sqlType(target);
        if (safe) {
            return safeCast(expression, type);
        }
        return "CAST(" + expression + " AS " + type + ")";
    }

    @Override
    public String divide(String left, String right) {
        return "(" + left + " / " + right + ")";
    }

    @Override
    public String modulo(String left, String right) {
        return "(" + left + " % " + right + ")";
    }

    @Override
    public String like(String expression, String pattern, boolean negated) {
        return "(" + expression + (negated ? " NOT LIKE " : " LIKE ") + pattern + ")";
    }

    @Override
    public String nullSafeEquals(String left, String right) {
        return "(" + left + " IS NOT DISTINCT FROM " + right + ")";
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        return function.keyword().toUpperCase(Locale.ROOT) + "(" + String.join(", ", arguments) + ")";
    }

    // ==================== Time ====================

    @Override
    public String timeTrunc(String expression, TimeUnit unit, DataType type) {
        String truncated;
        if (unit == TimeUnit.WEEK) {
            // weeks start on Sunday
            truncated = "(DATE_TRUNC('week', " + expression + " + " + interval("1", TimeUnit.DAY) + ") - "
                + interval("1", TimeUnit.DAY) + ")";
        } else {
            truncated = "DATE_TRUNC('" + unit.keyword() + "', " + expression + ")";
        }
        if (type instanceof DateType) {
            return "CAST(" + truncated + " AS " + sqlType(type) + ")";
        }
        return truncated;
    }

    @Override
    public String timeExtract(String expression, TimeUnit unit) {
        return "EXTRACT(" + unit.keyword().toUpperCase(Locale.ROOT) + " FROM " + expression + ")";
    }

    @Override
    public String timeOffset(String expression, DataType type, boolean subtract, String amount, TimeUnit unit) {
        String offset;
        if (unit == TimeUnit.QUARTER) {
            offset = interval("(" + amount + ") * 3", TimeUnit.MONTH);
        } else if (unit == TimeUnit.WEEK) {
            offset = interval("(" + amount + ") * 7", TimeUnit.DAY);
        } else {
            offset = interval(amount, unit);
        }
        String result = "(" + expression + (subtract ? " - " : " + ") + offset + ")";
        if (type instanceof DateType) {
            return "CAST(" + result + " AS " + sqlType(type) + ")";
        }
        return result;
    }

    // ==================== Aggregation ====================

    @Override
    public String aggregate(AggregateFunction function, String argument) {
        if (function == AggregateFunction.COUNT && argument == null) {
            return "COUNT(1)";
        }
        Objects.requireNonNull(argument, () -> function.keyword() + " requires an argument");
        if (function == AggregateFunction.COUNT_DISTINCT) {
            return "COUNT(DISTINCT " + argument + ")";
        }
        return function.keyword().toUpperCase(Locale.ROOT) + "(" + argument + ")";
    }

    @Override
    public String sumDistinct(String distinctKey, String value) {
        String hash = hashedKey(distinctKey);
        return "CAST((SUM(DISTINCT " + distinctValue(value) + " + " + hash + ") - SUM(DISTINCT " + hash + "))"
            + " AS " + sqlType(NumberType.get()) + ")";
    }

    @Override
    public String avgDistinct(String distinctKey, String value) {
        return "(" + sumDistinct(distinctKey, value) + " / NULLIF(COUNT(DISTINCT CASE WHEN " + value
            + " IS NOT NULL THEN " + distinctKey + " END), 0))";
    }

    @Override
    public String rowNumber() {
        return "ROW_NUMBER() OVER ()";
    }

    // ==================== Nested data ====================

    @Override
    public String unnestJoin(String arrayExpression, String alias, boolean withRowId) {
        throw unsupported("reading repeated records");
    }

    @Override
    public String nestedField(String alias, String field, DataType type) {
        throw unsupported("reading repeated records");
    }

    @Override
    public String unnestRowId(String alias) {
        throw unsupported("reading repeated records");
    }

    // ==================== Query clauses ====================

    @Override
    public String sample(String relation, SampleSpec sample, long defaultRows) {
        String source = relation + " AS " + quoteIdentifier("__sampled");
        if (sample instanceof SampleSpec.Percent percent) {
            return "(SELECT * FROM " + source + " WHERE " + randomFunction() + " < "
                + (percent.percent() / 100.0) + ")";
        }
        long rows = sample instanceof SampleSpec.Rows r ? r.rows() : defaultRows;
        return "(SELECT * FROM " + source + " ORDER BY " + randomFunction() + " LIMIT " + rows + ")";
    }

    @Override
    public String orderTerm(String expression, OrderDirection direction) {
        String term = expression + (direction == OrderDirection.DESC ? " DESC" : " ASC");
        return supportsNullsLast() ? term + " NULLS LAST" : term;
    }

    @Override
    public String limit(int rows) {
        return "LIMIT " + rows;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
