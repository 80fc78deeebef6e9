package com.quarry.runtime;

import com.quarry.compiler.CompiledQuery;
import com.quarry.config.CompilerSettings;
import com.quarry.dialect.Dialects;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;
import com.quarry.model.ColumnSchema;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryRef;
import com.quarry.model.TableSchema;
import com.quarry.test.DuckDBTestBase;
import com.quarry.test.TestCategories;
import com.quarry.translator.SqlBlockRequest;
import com.quarry.translator.TranslateResult;
import com.quarry.translator.Translator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static com.quarry.test.Ast.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for loading models from documents and a live DuckDB catalog.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Model loader")
public class ModelLoaderTest extends DuckDBTestBase {

    private static final String LIB = "file:///models/lib.malloy";

    @BeforeEach
    void createTables() throws SQLException {
        createAviationTables();
    }

    // ==================== Schema provider ====================

    @Nested
    @DisplayName("JDBC schema provider")
    class Schemas {

        @Test
        @DisplayName("TC-LOAD-001: tables are described by key, missing tables carry the driver's message")
        void testDescribeTables() throws IOException {
            JdbcSchemaProvider provider = new JdbcSchemaProvider(connection);

            TableSchemas found = provider.getSchemaForTables(
                new LinkedHashSet<>(List.of("airports", "duckdb:flights", "nope")));

            Map<String, TableSchema> schemas = found.schemas();
            assertThat(schemas).containsOnlyKeys("airports", "duckdb:flights");
            assertThat(schemas.get("airports").columns()).extracting(ColumnSchema::name)
                .containsExactly("code", "state", "city", "elevation");
            assertThat(schemas.get("airports").columns().get(3).sqlType()).isEqualTo("INTEGER");
            assertThat(schemas.get("duckdb:flights").name()).isEqualTo("duckdb:flights");
            assertThat(found.errors()).containsOnlyKeys("nope");
            assertThat(found.errors().get("nope")).contains("nope").contains("does not exist");
        }

        @Test
        @DisplayName("TC-LOAD-004: each part of a table path is quoted")
        void testQuotedTablePath() throws IOException, SQLException {
            execute("CREATE TABLE \"flight log\" (entry INTEGER, note VARCHAR)");
            JdbcSchemaProvider provider = new JdbcSchemaProvider(connection, Dialects.get("duckdb"));

            TableSchemas found = provider.getSchemaForTables(
                new LinkedHashSet<>(List.of("flight log", "main.flight log", "main.airports")));

            assertThat(found.errors()).isEmpty();
            assertThat(found.schemas().get("flight log").columns()).extracting(ColumnSchema::name)
                .containsExactly("entry", "note");
            assertThat(found.schemas().get("main.flight log").columns()).hasSize(2);
            assertThat(found.schemas().get("main.airports").columns()).hasSize(4);
        }

        @Test
        @DisplayName("TC-LOAD-002: SQL blocks are described by running them without rows")
        void testDescribeSqlBlock() throws IOException {
            JdbcSchemaProvider provider = new JdbcSchemaProvider(connection);

            TableSchema schema = provider.getSchemaForSqlBlock(
                new SqlBlockRequest("recent", null, "SELECT id, dep_date AS day FROM flights"));

            assertThat(schema.name()).isEqualTo("recent");
            assertThat(schema.columns()).extracting(ColumnSchema::name).containsExactly("id", "day");
            assertThat(schema.columns().get(1).sqlType()).isEqualTo("DATE");
        }

        @Test
        @DisplayName("TC-LOAD-003: a SQL block that does not run")
        void testBrokenSqlBlock() {
            JdbcSchemaProvider provider = new JdbcSchemaProvider(connection);

            assertThatThrownBy(() -> provider.getSchemaForSqlBlock(
                new SqlBlockRequest("broken", null, "SELECT nothing FROM nowhere")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Cannot describe SQL block 'broken'");
        }
    }

    // ==================== Loading ====================

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("TC-LOAD-010: documents, imports, tables and SQL blocks are fetched until the model is done")
        void testLoad() {
            parser.document(LIB, source("airports", refine(table("airports"), primaryKey("code"))));
            parser.document(URL, importUrl("lib.malloy"),
                sql("recent", "SELECT id, origin FROM flights WHERE dep_date >= DATE '2023-03-01'"),
                source("recent_flights", fromSql("recent")));

            TranslateResult result = loader().load(URL);

            assertThat(result.isFinal()).isTrue();
            assertThat(result.diagnostics()).isEmpty();
            ModelDef model = result.model();
            assertThat(model.sources()).containsOnlyKeys("airports", "recent_flights");
            assertThat(model.source("recent_flights").namespace().names()).containsExactly("id", "origin");
        }

        @Test
        @DisplayName("TC-LOAD-011: missing tables and failing SQL blocks become diagnostics")
        void testFetchFailures() {
            parser.document(URL,
                source("ghosts", table("ghost_town")),
                sql("broken", "SELECT nothing FROM nowhere"),
                source("airports", table("airports")));

            TranslateResult result = loader().load(URL);

            assertThat(result.isFinal()).isTrue();
            assertThat(result.diagnostics()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.SCHEMA_DEPENDENCY_ERROR, DiagnosticKind.SCHEMA_DEPENDENCY_ERROR);
            assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .anySatisfy(message -> assertThat(message).contains("ghost_town").contains("does not exist"))
                .anySatisfy(message -> assertThat(message).contains("Cannot describe SQL block 'broken'"));
            assertThat(result.model().source("airports")).isNotNull();
        }

        @Test
        @DisplayName("TC-LOAD-012: loading stops after the configured number of rounds")
        void testRoundLimit() {
            parser.document(LIB, source("airports", table("airports")));
            parser.document(URL, importUrl("lib.malloy"));
            ModelLoader loader = new ModelLoader(new Translator(parser), parser.reader(),
                new JdbcSchemaProvider(connection), CompilerSettings.defaults().withMaxTranslateRounds(1));

            TranslateResult result = loader.load(URL);

            assertThat(result.isFinal()).isFalse();
            assertThat(result.model()).isNull();
            Diagnostic last = result.diagnostics().get(result.diagnostics().size() - 1);
            assertThat(last.kind()).isEqualTo(DiagnosticKind.INTERNAL_ERROR);
            assertThat(last.message()).contains("1 rounds");

            logStep("Then: compiling through the same loader reports the same failure");
            CompiledQuery compiled = loader.compile(URL, QueryRef.named("anything"));
            assertThat(compiled.isSuccess()).isFalse();
            assertThat(compiled.diagnostics()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.INTERNAL_ERROR);
        }
    }

    // ==================== Compiling ====================

    @Nested
    @DisplayName("Compiling")
    class Compiling {

        @Test
        @DisplayName("TC-LOAD-020: compile loads the document and compiles with the configured dialect")
        void testCompile() throws SQLException {
            parser.document(URL,
                source("airports", refine(table("airports"), measure(decl("airport_count", count())))),
                defineQuery("by_state", query(named("airports"),
                    stage(groupBy(field("state")), aggregate(field("airport_count")), orderBy(asc("state"))))));

            CompiledQuery compiled = loader().compile(URL, QueryRef.named("by_state"));

            assertThat(compiled.isSuccess()).as("%s", compiled.diagnostics()).isTrue();
            assertThat(compiled.schema().names()).containsExactly("state", "airport_count");
            assertThat(rows(compiled.sql())).containsExactly(row("CA", 3L), row("NY", 2L), row("WA", 1L));
        }

        @Test
        @DisplayName("TC-LOAD-021: compiling an unknown query is reported at the start of the document")
        void testCompileUnknownQuery() {
            parser.document(URL, source("airports", table("airports")));

            CompiledQuery compiled = loader().compile(URL, QueryRef.named("missing"));

            assertThat(compiled.diagnostics()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(compiled.diagnostics().get(0).message()).contains("'missing'");
            assertThat(compiled.diagnostics().get(0).location()).isEqualTo(new Location(URL, 1, 1));

            logStep("Then: a missing anonymous query is reported at the start of the document too");
            CompiledQuery anonymous = loader().compile(URL, QueryRef.anonymous(2));
            assertThat(anonymous.diagnostics()).extracting(Diagnostic::location)
                .containsExactly(new Location(URL, 1, 1));
        }
    }
}
