package com.quarry.dialect;

import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.exception.DialectUnsupportedException;
import com.quarry.expression.AggregateFunction;
import com.quarry.model.OrderDirection;
import com.quarry.model.SampleSpec;
import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Dialect
@DisplayName("Dialect backends")
public class DialectsTest extends TestBase {

    private final Dialect duckdb = Dialects.get("duckdb");
    private final Dialect postgres = Dialects.get("postgres");
    private final Dialect standardSql = Dialects.get("standardsql");
    private final Dialect mysql = Dialects.get("mysql");

    // ==================== Registry ====================

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("TC-DIA-001: lookup is case-insensitive")
        void testCaseInsensitiveLookup() {
            assertThat(Dialects.get("DuckDB")).isSameAs(duckdb);
            assertThat(Dialects.isKnown("POSTGRES")).isTrue();
        }

        @Test
        @DisplayName("TC-DIA-002: bigquery is the standard SQL dialect")
        void testBigQueryAlias() {
            assertThat(Dialects.get("bigquery")).isSameAs(standardSql);
            assertThat(Dialects.names()).contains("duckdb", "postgres", "standardsql", "bigquery", "mysql");
        }

        @Test
        @DisplayName("TC-DIA-003: unknown dialects are rejected with the known names")
        void testUnknownDialect() {
            assertThat(Dialects.isKnown("oracle")).isFalse();
            assertThat(Dialects.isKnown(null)).isFalse();
            assertThatThrownBy(() -> Dialects.get("oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("oracle")
                .hasMessageContaining("duckdb");
        }
    }

    // ==================== Identifiers and literals ====================

    @Nested
    @DisplayName("Identifiers and literals")
    class Literals {

        @Test
        @DisplayName("TC-DIA-010: identifier quoting doubles or escapes the quote")
        void testQuoteIdentifier() {
            assertThat(duckdb.quoteIdentifier("weird\"name")).isEqualTo("\"weird\"\"name\"");
            assertThat(postgres.quoteIdentifier("state")).isEqualTo("\"state\"");
            assertThat(mysql.quoteIdentifier("state")).isEqualTo("`state`");
            assertThat(standardSql.quoteIdentifier("a`b")).isEqualTo("`a\\`b`");
        }

        @Test
        @DisplayName("TC-DIA-011: table paths are quoted per part")
        void testQuoteTablePath() {
            assertThat(duckdb.quoteTablePath("main.flights")).isEqualTo("\"main\".\"flights\"");
            assertThat(standardSql.quoteTablePath("project.dataset.t")).isEqualTo("`project`.`dataset`.`t`");
        }

        @Test
        @DisplayName("TC-DIA-012: empty identifiers are rejected")
        void testEmptyIdentifier() {
            assertThatThrownBy(() -> duckdb.quoteIdentifier(""))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-DIA-013: string literals escape quotes per dialect")
        void testStringLiteral() {
            assertThat(duckdb.stringLiteral("O'Hare")).isEqualTo("'O''Hare'");
            assertThat(standardSql.stringLiteral("O'Hare")).isEqualTo("'O\\'Hare'");
            assertThat(duckdb.stringLiteral(null)).isEqualTo("NULL");
        }

        @Test
        @DisplayName("TC-DIA-014: date and timestamp literals")
        void testTimeLiterals() {
            assertThat(duckdb.dateLiteral("2023-01-01")).isEqualTo("DATE '2023-01-01'");
            assertThat(postgres.timestampLiteral("2023-01-01 10:00:00"))
                .isEqualTo("TIMESTAMP '2023-01-01 10:00:00'");
        }
    }

    // ==================== Operations ====================

    @Nested
    @DisplayName("Operations")
    class Operations {

        @Test
        @DisplayName("TC-DIA-020: casts use the dialect's type names")
        void testCast() {
            assertThat(duckdb.cast("x", StringType.get(), false)).isEqualTo("CAST(x AS VARCHAR)");
            assertThat(duckdb.cast("x", NumberType.get(), true)).isEqualTo("TRY_CAST(x AS DOUBLE)");
            assertThat(standardSql.cast("x", NumberType.get(), true)).isEqualTo("SAFE_CAST(x AS FLOAT64)");
            assertThat(postgres.cast("x", DateType.get(), false)).isEqualTo("CAST(x AS DATE)");
        }

        @Test
        @DisplayName("TC-DIA-021: postgres division avoids integer division")
        void testDivide() {
            assertThat(duckdb.divide("a", "b")).isEqualTo("(a / b)");
            assertThat(postgres.divide("a", "b")).isEqualTo("(CAST(a AS DOUBLE PRECISION) / b)");
        }

        @Test
        @DisplayName("TC-DIA-022: mysql null-safe equality")
        void testNullSafeEquals() {
            assertThat(duckdb.nullSafeEquals("a", "b")).isEqualTo("(a IS NOT DISTINCT FROM b)");
            assertThat(mysql.nullSafeEquals("a", "b")).isEqualTo("(a <=> b)");
        }

        @Test
        @DisplayName("TC-DIA-023: aggregates")
        void testAggregates() {
            assertThat(duckdb.aggregate(AggregateFunction.COUNT, null)).isEqualTo("COUNT(1)");
            assertThat(duckdb.aggregate(AggregateFunction.COUNT_DISTINCT, "x")).isEqualTo("COUNT(DISTINCT x)");
            assertThat(duckdb.aggregate(AggregateFunction.SUM, "x")).isEqualTo("SUM(x)");
        }

        @Test
        @DisplayName("TC-DIA-024: duckdb sums distinct rows through a list of keyed values")
        void testDuckDBSumDistinct() {
            String sql = duckdb.sumDistinct("k", "v");
            assertThat(sql).contains("LIST(DISTINCT {key: k, val: v})").contains("SUM(a.val)");
        }

        @Test
        @DisplayName("TC-DIA-025: hashed symmetric sums for the other dialects")
        void testHashedSumDistinct() {
            assertThat(postgres.sumDistinct("k", "v")).contains("SUM(DISTINCT").contains("MD5");
            assertThat(mysql.sumDistinct("k", "v")).contains("SUM(DISTINCT").contains("CONV(");
        }

        @Test
        @DisplayName("TC-DIA-027: the mysql hash key reads two disjoint slices of the digest")
        void testMySQLHashSlices() {
            String sql = mysql.sumDistinct("k", "v");

            assertThat(sql).contains("SUBSTRING(MD5(CONCAT(k, '')), 1, 16)")
                .contains("SUBSTRING(MD5(CONCAT(k, '')), 17, 8)")
                .doesNotContain(", 16, 8)");
        }

        @Test
        @DisplayName("TC-DIA-026: ordering puts nulls last where supported")
        void testOrderTerm() {
            assertThat(duckdb.orderTerm("x", OrderDirection.DESC)).isEqualTo("x DESC NULLS LAST");
            assertThat(duckdb.orderTerm("x", OrderDirection.ASC)).isEqualTo("x ASC NULLS LAST");
            assertThat(duckdb.limit(10)).isEqualTo("LIMIT 10");
        }

        @Test
        @DisplayName("TC-DIA-028: week truncation starts weeks on Sunday")
        void testWeekTruncation() {
            assertThat(duckdb.timeTrunc("d", TimeUnit.MONTH, DateType.get()))
                .isEqualTo("CAST(DATE_TRUNC('month', d) AS DATE)");
            assertThat(duckdb.timeTrunc("d", TimeUnit.WEEK, DateType.get())).contains("DATE_TRUNC('week'");
        }

        @Test
        @DisplayName("TC-DIA-029: nests aggregate rows into a list of records")
        void testNest() {
            String sql = duckdb.nest("SELECT 1 AS c", "n", List.of("c"), null);
            assertThat(sql).startsWith("(SELECT COALESCE(LIST({").contains("FROM (SELECT 1 AS c) AS \"n\"");
            assertThat(postgres.nest("SELECT 1 AS c", "n", List.of("c"), null)).contains("JSONB_AGG");
            assertThat(mysql.nest("SELECT 1 AS c", "n", List.of("c"), null)).contains("JSON_ARRAYAGG");
        }
    }

    // ==================== Sampling ====================

    @Nested
    @DisplayName("Sampling")
    class Sampling {

        @Test
        @DisplayName("TC-DIA-030: duckdb samples rows and percentages")
        void testDuckDBSample() {
            assertThat(duckdb.sample("\"t\"", new SampleSpec.Rows(5), 1000))
                .isEqualTo("(SELECT * FROM \"t\" AS \"__sampled\" USING SAMPLE 5 ROWS)");
            assertThat(duckdb.sample("\"t\"", new SampleSpec.Percent(10), 1000))
                .contains("USING SAMPLE 10.0 PERCENT (bernoulli)");
            assertThat(duckdb.sample("\"t\"", new SampleSpec.Default(), 1000)).contains("USING SAMPLE 1000 ROWS");
        }

        @Test
        @DisplayName("TC-DIA-031: standard SQL samples percentages only")
        void testStandardSqlSample() {
            assertThat(standardSql.sample("`t`", new SampleSpec.Percent(10), 1000)).contains("RAND()");
            assertThatThrownBy(() -> standardSql.sample("`t`", new SampleSpec.Rows(5), 1000))
                .isInstanceOf(DialectUnsupportedException.class)
                .hasMessageContaining("sampling by row count");
        }
    }

    // ==================== Unsupported ====================

    @Nested
    @DisplayName("Unsupported operations")
    class Unsupported {

        @Test
        @DisplayName("TC-DIA-040: mysql has no safe cast")
        void testMySqlSafeCast() {
            assertThatThrownBy(() -> mysql.cast("x", NumberType.get(), true))
                .isInstanceOfSatisfying(DialectUnsupportedException.class, e -> {
                    assertThat(e.kind()).isEqualTo(DiagnosticKind.DIALECT_UNSUPPORTED_ERROR);
                    assertThat(e.dialectName()).isEqualTo("mysql");
                });
        }

        @Test
        @DisplayName("TC-DIA-041: mysql cannot read repeated records")
        void testMySqlUnnest() {
            assertThatThrownBy(() -> mysql.unnestJoin("x", "r", false))
                .isInstanceOf(DialectUnsupportedException.class)
                .hasMessageContaining("repeated records");
        }
    }
}
