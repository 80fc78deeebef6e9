package com.quarry.dialect;

import com.quarry.model.SampleSpec;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimeUnit;
import com.quarry.types.TimestampType;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * BigQuery Standard SQL dialect.
 *
 * <p>Nested output is an {@code ARRAY} of {@code STRUCT}s built with
 * {@code ARRAY(SELECT AS STRUCT ...)}; repeated records are read with a
 * correlated {@code UNNEST}.
 */
public class StandardSQLDialect extends AbstractDialect {

    public static final String NAME = "standardsql";

    public StandardSQLDialect() {
        super(NAME);
    }

    @Override
    protected char identifierQuote() {
        return '`';
    }

    @Override
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }

    /**
     * Quotes a {@code project.dataset.table} path as one identifier.
     */
    @Override
    public String quoteTablePath(String tablePath) {
        return quoteIdentifier(tablePath);
    }

    @Override
    public String stringLiteral(String value) {
        if (value == null) {
            return nullLiteral();
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    protected String sqlType(DataType type) {
        if (type instanceof StringType) {
            return "STRING";
        } else if (type instanceof NumberType) {
            return "FLOAT64";
        } else if (type instanceof BooleanType) {
            return "BOOL";
        } else if (type instanceof DateType) {
            return "DATE";
        } else if (type instanceof TimestampType) {
            return "TIMESTAMP";
        }
        throw unsupported("casting to " + type.typeName());
    }

    @Override
    protected String safeCast(String expression, String sqlType) {
        return "SAFE_CAST(" + expression + " AS " + sqlType + ")";
    }

    @Override
    protected String interval(String amount, TimeUnit unit) {
        return "INTERVAL " + amount + " " + unit.keyword().toUpperCase(Locale.ROOT);
    }

    @Override
    protected String hashedKey(String distinctKey) {
        String hex = "TO_HEX(MD5(CAST(" + distinctKey + " AS STRING)))";
        return "(CAST(CAST(CONCAT('0x', SUBSTR(" + hex + ", 1, 15)) AS INT64) AS NUMERIC) * 4294967296"
            + " + CAST(CAST(CONCAT('0x', SUBSTR(" + hex + ", 16, 8)) AS INT64) AS NUMERIC)) * 0.000000001";
    }

    @Override
    protected String distinctValue(String value) {
        return "CAST(ROUND(COALESCE(" + value + ", 0) * 1.0, 9) AS NUMERIC)";
    }

    @Override
    protected String randomFunction() {
        return "RAND()";
    }

    @Override
    public String now() {
        return "CURRENT_TIMESTAMP()";
    }

    @Override
    public String modulo(String left, String right) {
        return "MOD(" + left + ", " + right + ")";
    }

    @Override
    public String timeTrunc(String expression, TimeUnit unit, DataType type) {
        String part = unit.keyword().toUpperCase(Locale.ROOT);
        if (type instanceof DateType) {
            return "DATE_TRUNC(" + expression + ", " + part + ")";
        }
        return "TIMESTAMP_TRUNC(" + expression + ", " + part + ")";
    }

    @Override
    public String timeOffset(String expression, DataType type, boolean subtract, String amount, TimeUnit unit) {
        String interval = interval("(" + amount + ")", unit);
        if (type instanceof DateType) {
            return (subtract ? "DATE_SUB(" : "DATE_ADD(") + expression + ", " + interval + ")";
        }
        // TIMESTAMP_ADD stops at DAY, DATETIME_ADD covers every unit
        return "TIMESTAMP(" + (subtract ? "DATETIME_SUB(" : "DATETIME_ADD(") + "DATETIME(" + expression + "), "
            + interval + "))";
    }

    @Override
    public String nest(String innerSql, String alias, List<String> columns, String orderBy) {
        String quotedAlias = quoteIdentifier(alias);
        String fields = columns.stream()
            .map(column -> quotedAlias + "." + quoteIdentifier(column) + " AS " + quoteIdentifier(column))
            .collect(Collectors.joining(", "));
        String order = orderBy == null ? "" : " ORDER BY " + orderBy;
        return "ARRAY(SELECT AS STRUCT " + fields + " FROM (" + innerSql + ") AS " + quotedAlias + order + ")";
    }

    @Override
    public String unnestJoin(String arrayExpression, String alias, boolean withRowId) {
        String join = "LEFT JOIN UNNEST(" + arrayExpression + ") AS " + quoteIdentifier(alias);
        if (withRowId) {
            join += " WITH OFFSET AS " + quoteIdentifier(alias + ROW_ID_COLUMN);
        }
        return join;
    }

    @Override
    public String nestedField(String alias, String field, DataType type) {
        return quoteIdentifier(alias) + "." + quoteIdentifier(field);
    }

    @Override
    public String unnestRowId(String alias) {
        return quoteIdentifier(alias + ROW_ID_COLUMN);
    }

    @Override
    public String sample(String relation, SampleSpec sample, long defaultRows) {
        if (!(sample instanceof SampleSpec.Percent)) {
            throw unsupported("sampling by row count");
        }
        return super.sample(relation, sample, defaultRows);
    }
}
