package com.quarry.dialect;

import com.quarry.expression.ScalarFunction;
import com.quarry.model.SampleSpec;
import com.quarry.types.ArrayType;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimeUnit;
import com.quarry.types.TimestampType;

import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>Nested output is a {@code JSONB} array built with {@code JSONB_AGG} and read
 * back with {@code JSONB_ARRAY_ELEMENTS}. Symmetric aggregates hash the distinct
 * key with {@code MD5} into a 128-bit decimal.
 */
public class PostgresDialect extends AbstractDialect {

    public static final String NAME = "postgres";

    public PostgresDialect() {
        super(NAME);
    }

    @Override
    protected String sqlType(DataType type) {
        if (type instanceof StringType) {
            return "VARCHAR";
        } else if (type instanceof NumberType) {
            return "DOUBLE PRECISION";
        } else if (type instanceof BooleanType) {
            return "BOOLEAN";
        } else if (type instanceof DateType) {
            return "DATE";
        } else if (type instanceof TimestampType) {
            return "TIMESTAMP";
        }
        throw unsupported("casting to " + type.typeName());
    }

    @Override
    protected String interval(String amount, TimeUnit unit) {
        return "(" + amount + ") * INTERVAL '1 " + unit.keyword() + "'";
    }

    @Override
    protected String hashedKey(String distinctKey) {
        String md5 = "MD5(CAST(" + distinctKey + " AS VARCHAR))";
        return "(CAST(CAST(CAST(('x' || SUBSTR(" + md5 + ", 1, 16)) AS BIT(64)) AS BIGINT) AS DECIMAL(65, 0))"
            + " * 18446744073709551616"
            + " + CAST(CAST(CAST(('x' || SUBSTR(" + md5 + ", 17)) AS BIT(64)) AS BIGINT) AS DECIMAL(65, 0)))";
    }

    @Override
    protected String distinctValue(String value) {
        return "ROUND(CAST(COALESCE(" + value + ", 0) AS NUMERIC), 9)";
    }

    @Override
    public String now() {
        return "LOCALTIMESTAMP";
    }

    @Override
    public String divide(String left, String right) {
        // integer division truncates in postgres
        return "(CAST(" + left + " AS DOUBLE PRECISION) / " + right + ")";
    }

    @Override
    public String modulo(String left, String right) {
        return "MOD(CAST(" + left + " AS NUMERIC), CAST(" + right + " AS NUMERIC))";
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        if (function == ScalarFunction.ROUND && arguments.size() == 2) {
            return "ROUND(CAST(" + arguments.get(0) + " AS NUMERIC), " + arguments.get(1) + ")";
        }
        return super.function(function, arguments);
    }

    @Override
    public String nest(String innerSql, String alias, List<String> columns, String orderBy) {
        String quotedAlias = quoteIdentifier(alias);
        List<String> pairs = new ArrayList<>();
        for (String column : columns) {
            pairs.add(stringLiteral(column));
            pairs.add(quotedAlias + "." + quoteIdentifier(column));
        }
        String order = orderBy == null ? "" : " ORDER BY " + orderBy;
        return "(SELECT COALESCE(JSONB_AGG(JSONB_BUILD_OBJECT(" + String.join(", ", pairs) + ")" + order
            + "), '[]'::JSONB) FROM (" + innerSql + ") AS " + quotedAlias + ")";
    }

    @Override
    public String unnestJoin(String arrayExpression, String alias, boolean withRowId) {
        return "LEFT JOIN LATERAL JSONB_ARRAY_ELEMENTS(" + arrayExpression + ") WITH ORDINALITY AS "
            + quoteIdentifier(alias) + "(" + quoteIdentifier(ROW_COLUMN) + ", " + quoteIdentifier(ROW_ID_COLUMN)
            + ") ON TRUE";
    }

    @Override
    public String nestedField(String alias, String field, DataType type) {
        String element = quoteIdentifier(alias) + "." + quoteIdentifier(ROW_COLUMN);
        if (type instanceof ArrayType) {
            return "(" + element + " -> " + stringLiteral(field) + ")";
        }
        String text = "(" + element + " ->> " + stringLiteral(field) + ")";
        if (type instanceof StringType) {
            return text;
        }
        return "CAST(" + text + " AS " + sqlType(type) + ")";
    }

    @Override
    public String unnestRowId(String alias) {
        return quoteIdentifier(alias) + "." + quoteIdentifier(ROW_ID_COLUMN);
    }

    @Override
    public String sample(String relation, SampleSpec sample, long defaultRows) {
        if (sample instanceof SampleSpec.Percent percent && !relation.startsWith("(")) {
            // TABLESAMPLE applies to base tables only
            return "(SELECT * FROM " + relation + " AS " + quoteIdentifier("__sampled")
                + " TABLESAMPLE BERNOULLI (" + percent.percent() + "))";
        }
        return super.sample(relation, sample, defaultRows);
    }
}
