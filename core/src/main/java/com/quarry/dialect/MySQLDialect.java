package com.quarry.dialect;

import com.quarry.expression.ScalarFunction;
import com.quarry.model.OrderDirection;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimeUnit;
import com.quarry.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * MySQL 8 dialect.
 *
 * <p>Nested output is a JSON array. MySQL has no lateral unnest of JSON
 * without a declared column list, so repeated records cannot be read back and
 * safe casts are not available.
 */
public class MySQLDialect extends AbstractDialect {

    public static final String NAME = "mysql";

    public MySQLDialect() {
        super(NAME);
    }

    @Override
    protected char identifierQuote() {
        return '`';
    }

    @Override
    public String stringLiteral(String value) {
        if (value == null) {
            return nullLiteral();
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    @Override
    protected String sqlType(DataType type) {
        if (type instanceof StringType) {
            return "CHAR";
        } else if (type instanceof NumberType) {
            return "DOUBLE";
        } else if (type instanceof BooleanType) {
            return "SIGNED";
        } else if (type instanceof DateType) {
            return "DATE";
        } else if (type instanceof TimestampType) {
            return "DATETIME";
        }
        throw unsupported("casting to " + type.typeName());
    }

    @Override
    protected String hashedKey(String distinctKey) {
        String md5 = "MD5(CONCAT(" + distinctKey + ", ''))";
        return "(CAST(CONV(SUBSTRING(" + md5 + ", 1, 16), 16, 10) AS DECIMAL(55, 10)) * 4294967296"
            + " + CAST(CONV(SUBSTRING(" + md5 + ", 17, 8), 16, 10) AS DECIMAL(55, 10)))";
    }

    @Override
    protected String distinctValue(String value) {
        return "CAST(COALESCE(" + value + ", 0) AS DECIMAL(55, 10))";
    }

    @Override
    protected String randomFunction() {
        return "RAND()";
    }

    @Override
    protected boolean supportsNullsLast() {
        return false;
    }

    @Override
    public String now() {
        return "LOCALTIMESTAMP";
    }

    @Override
    public String nullSafeEquals(String left, String right) {
        return "(" + left + " <=> " + right + ")";
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        if (function == ScalarFunction.LENGTH) {
            return "CHAR_LENGTH(" + arguments.get(0) + ")";
        }
        return super.function(function, arguments);
    }

    @Override
    public String timeTrunc(String expression, TimeUnit unit, DataType type) {
        String subject = unit == TimeUnit.WEEK
            ? "DATE_SUB(" + expression + ", INTERVAL DAYOFWEEK(" + expression + ") - 1 DAY)"
            : expression;
        String format;
        switch (unit) {
            case SECOND:
                format = "'%Y-%m-%d %H:%i:%s'";
                break;
            case MINUTE:
                format = "'%Y-%m-%d %H:%i:00'";
                break;
            case HOUR:
                format = "'%Y-%m-%d %H:00:00'";
                break;
            case DAY:
            case WEEK:
                format = "'%Y-%m-%d 00:00:00'";
                break;
            case MONTH:
                format = "'%Y-%m-01 00:00:00'";
                break;
            case QUARTER:
                format = "CASE WHEN MONTH(" + subject + ") > 9 THEN '%Y-10-01 00:00:00'"
                    + " WHEN MONTH(" + subject + ") > 6 THEN '%Y-07-01 00:00:00'"
                    + " WHEN MONTH(" + subject + ") > 3 THEN '%Y-04-01 00:00:00'"
                    + " ELSE '%Y-01-01 00:00:00' END";
                break;
            case YEAR:
                format = "'%Y-01-01 00:00:00'";
                break;
            default:
                throw new IllegalArgumentException("Unknown time unit: " + unit);
        }
        String truncated = "TIMESTAMP(DATE_FORMAT(" + subject + ", " + format + "))";
        if (type instanceof DateType) {
            return "CAST(" + truncated + " AS DATE)";
        }
        return truncated;
    }

    @Override
    public String timeExtract(String expression, TimeUnit unit) {
        String function = unit == TimeUnit.DAY ? "DAYOFMONTH" : unit.keyword().toUpperCase(Locale.ROOT);
        return function + "(" + expression + ")";
    }

    @Override
    public String nest(String innerSql, String alias, List<String> columns, String orderBy) {
        // JSON_ARRAYAGG has no ORDER BY; element order follows the inner rows
        String quotedAlias = quoteIdentifier(alias);
        List<String> pairs = new ArrayList<>();
        for (String column : columns) {
            pairs.add(stringLiteral(column));
            pairs.add(quotedAlias + "." + quoteIdentifier(column));
        }
        return "(SELECT COALESCE(JSON_ARRAYAGG(JSON_OBJECT(" + String.join(", ", pairs) + ")), JSON_ARRAY())"
            + " FROM (" + innerSql + ") AS " + quotedAlias + ")";
    }

    @Override
    public String orderTerm(String expression, OrderDirection direction) {
        return expression + " IS NULL, " + expression + (direction == OrderDirection.DESC ? " DESC" : " ASC");
    }
}
