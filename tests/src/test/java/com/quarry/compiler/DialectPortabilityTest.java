package com.quarry.compiler;

import com.quarry.ast.ExprNode;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.dialect.Dialects;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryRef;
import com.quarry.model.SampleSpec;
import com.quarry.test.DuckDBTestBase;
import com.quarry.test.TestCategories;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.SQLException;
import java.util.List;

import static com.quarry.test.Ast.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compiles the same queries for several dialects. DuckDB accepts the PostgreSQL
 * rendering of plain queries, so both are run and must agree.
 */
@TestCategories.Tier2
@TestCategories.Integration
@TestCategories.Dialect
@DisplayName("Dialect portability")
public class DialectPortabilityTest extends DuckDBTestBase {

    private final QueryCompiler compiler = new QueryCompiler();
    private ModelDef model;

    @BeforeEach
    void loadAviation() throws SQLException {
        createAviationTables();
        model = loadModel(
            source("carriers", refine(table("carriers"), primaryKey("code"))),
            source("flights", refine(table("flights"),
                primaryKey("id"),
                joinOne("carrier_info", named("carriers"), ref("carrier")),
                measure(decl("flight_count", count()), decl("total_distance", sum(ref("distance")))))),
            defineQuery("by_carrier", query(named("flights"),
                stage(groupBy(field("carrier_info.name")),
                    aggregate(field("flight_count"), field("total_distance"))))),
            defineQuery("long_haul", query(named("flights"),
                stage(groupBy(field("origin")),
                    aggregate(field("long", filtered(count(), gt(ref("distance"), num(1000))))),
                    orderBy(asc("origin"))))),
            defineQuery("chained", query(named("flights"),
                stage(groupBy(field("origin"), field("carrier")), aggregate(field("flight_count"))),
                stage(groupBy(field("origin")), aggregate(field("carrier_count", count())), orderBy(asc("origin"))))),
            defineQuery("listing", query(named("flights"),
                stage(project(field("id"), field("origin"), field("miles", divide(ref("distance"), num(100)))),
                    orderBy(desc("miles"), asc("id")), limit(3)))));
        assertThat(model.diagnostics()).isEmpty();
    }

    private String sql(String queryName, String dialect) {
        CompiledQuery compiled = compiler.compileQuery(model, QueryRef.named(queryName), Dialects.get(dialect));
        assertThat(compiled.isSuccess()).as("%s for %s: %s", queryName, dialect, compiled.diagnostics()).isTrue();
        logData(dialect, compiled.sql());
        return compiled.sql();
    }

    @ParameterizedTest(name = "TC-PORT-001: {0} gives the same rows in duckdb and postgres")
    @ValueSource(strings = {"by_carrier", "long_haul", "chained", "listing"})
    void testPostgresMatchesDuckDB(String queryName) throws SQLException {
        List<List<Object>> expected = rows(sql(queryName, "duckdb"));

        assertThat(expected).isNotEmpty();
        assertThat(rows(sql(queryName, "postgres"))).isEqualTo(expected);
    }

    @Test
    @DisplayName("TC-PORT-002: identifier quoting follows the dialect")
    void testQuoting() {
        assertThat(sql("by_carrier", "standardsql")).contains("`flights`").doesNotContain("\"flights\"");
        assertThat(sql("by_carrier", "mysql")).contains("`flights`");
        assertThat(sql("by_carrier", "postgres")).contains("\"flights\"");
    }

    @Test
    @DisplayName("TC-PORT-003: compilation is independent of the dialect used before")
    void testDialectIsolation() {
        String before = sql("listing", "duckdb");
        sql("listing", "mysql");
        sql("listing", "standardsql");

        assertThat(sql("listing", "duckdb")).isEqualTo(before);
    }

    @Test
    @DisplayName("TC-PORT-004: a safe cast is reported for mysql at the cast")
    void testUnsupportedSafeCast() {
        ExprNode cast = new ExprNode.Cast(ref("origin"), "number", true, at(9));
        QueryRef ref = QueryRef.inline(query(named("flights"), stage(project(field("code_number", cast)))));

        CompiledQuery mysql = compiler.compileQuery(model, ref, Dialects.get("mysql"));
        CompiledQuery duckdb = compiler.compileQuery(model, ref, Dialects.get("duckdb"));

        assertThat(mysql.isSuccess()).isFalse();
        Diagnostic diagnostic = mysql.diagnostics().get(0);
        assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.DIALECT_UNSUPPORTED_ERROR);
        assertThat(diagnostic.message()).contains("mysql").contains("safe cast");
        assertThat(diagnostic.location()).isEqualTo(at(9));
        assertThat(duckdb.isSuccess()).isTrue();
        assertThat(duckdb.sql()).contains("TRY_CAST");
    }

    @Test
    @DisplayName("TC-PORT-005: row sampling is reported for standardsql at the stage")
    void testUnsupportedSampling() {
        QueryRef ref = QueryRef.inline(query(named("flights"),
            stage(at(4), project(field("id")), sample(new SampleSpec.Rows(3)))));

        CompiledQuery standard = compiler.compileQuery(model, ref, Dialects.get("standardsql"));

        assertThat(standard.diagnostics()).extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.DIALECT_UNSUPPORTED_ERROR);
        assertThat(standard.diagnostics().get(0).location()).isEqualTo(at(4));
        assertThat(compiler.compileQuery(model, ref, Dialects.get("postgres")).isSuccess()).isTrue();
    }
}
