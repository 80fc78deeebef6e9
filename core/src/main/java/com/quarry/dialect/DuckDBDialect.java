package com.quarry.dialect;

import com.quarry.model.SampleSpec;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimestampType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * DuckDB dialect.
 *
 * <p>Nested output is a {@code LIST} of {@code STRUCT}s, read back with a
 * lateral {@code UNNEST}. Symmetric aggregates use {@code LIST(DISTINCT ...)}
 * over key/value structs instead of hashing.
 */
public class DuckDBDialect extends AbstractDialect {

    public static final String NAME = "duckdb";

    public DuckDBDialect() {
        super(NAME);
    }

    @Override
    protected String sqlType(DataType type) {
        if (type instanceof StringType) {
            return "VARCHAR";
        } else if (type instanceof NumberType) {
            return "DOUBLE";
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
    protected String safeCast(String expression, String sqlType) {
        return "TRY_CAST(" + expression + " AS " + sqlType + ")";
    }

    @Override
    public String now() {
        return "CAST(CURRENT_TIMESTAMP AS TIMESTAMP)";
    }

    @Override
    public String sumDistinct(String distinctKey, String value) {
        return distinctAggregate("SUM", distinctKey, value);
    }

    @Override
    public String avgDistinct(String distinctKey, String value) {
        return distinctAggregate("AVG", distinctKey, value);
    }

    private String distinctAggregate(String function, String distinctKey, String value) {
        return "(SELECT " + function + "(a.val) FROM (SELECT UNNEST(LIST(DISTINCT {key: " + distinctKey
            + ", val: " + value + "})) AS a))";
    }

    @Override
    public String nest(String innerSql, String alias, List<String> columns, String orderBy) {
        String quotedAlias = quoteIdentifier(alias);
        String fields = columns.stream()
            .map(column -> quoteIdentifier(column) + ": " + quotedAlias + "." + quoteIdentifier(column))
            .collect(Collectors.joining(", "));
        String order = orderBy == null ? "" : " ORDER BY " + orderBy;
        return "(SELECT COALESCE(LIST({" + fields + "}" + order + "), []) FROM (" + innerSql + ") AS "
            + quotedAlias + ")";
    }

    @Override
    public String unnestJoin(String arrayExpression, String alias, boolean withRowId) {
        StringBuilder sb = new StringBuilder();
        sb.append("LEFT JOIN LATERAL (SELECT UNNEST(").append(arrayExpression).append(") AS ")
            .append(quoteIdentifier(ROW_COLUMN));
        if (withRowId) {
            // two UNNESTs in one SELECT list are zipped element by element
            sb.append(", UNNEST(RANGE(1, LEN(").append(arrayExpression).append(") + 1)) AS ")
                .append(quoteIdentifier(ROW_ID_COLUMN));
        }
        sb.append(") AS ").append(quoteIdentifier(alias)).append(" ON TRUE");
        return sb.toString();
    }

    @Override
    public String nestedField(String alias, String field, DataType type) {
        return quoteIdentifier(alias) + "." + quoteIdentifier(ROW_COLUMN) + "." + quoteIdentifier(field);
    }

    @Override
    public String unnestRowId(String alias) {
        return quoteIdentifier(alias) + "." + quoteIdentifier(ROW_ID_COLUMN);
    }

    @Override
    public String sample(String relation, SampleSpec sample, long defaultRows) {
        String source = relation + " AS " + quoteIdentifier("__sampled");
        if (sample instanceof SampleSpec.Percent percent) {
            return "(SELECT * FROM " + source + " USING SAMPLE " + percent.percent() + " PERCENT (bernoulli))";
        }
        long rows = sample instanceof SampleSpec.Rows r ? r.rows() : defaultRows;
        return "(SELECT * FROM " + source + " USING SAMPLE " + rows + " ROWS)";
    }
}
