package com.quarry.translator;

import com.quarry.ast.SourceProperty;
import com.quarry.ast.Statement;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.model.ColumnSchema;
import com.quarry.model.DimensionDef;
import com.quarry.model.JoinCondition;
import com.quarry.model.JoinDef;
import com.quarry.model.MeasureDef;
import com.quarry.model.ModelDef;
import com.quarry.model.Relationship;
import com.quarry.model.SourceDef;
import com.quarry.model.SourceOrigin;
import com.quarry.model.TableSchema;
import com.quarry.model.ViewDef;
import com.quarry.test.FixtureParser;
import com.quarry.test.ModelFixtures;
import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;
import com.quarry.types.ArrayType;
import com.quarry.types.DataType;
import com.quarry.types.NumberType;
import com.quarry.types.UnsupportedType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.quarry.test.Ast.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for building sources, joins and views from source statements.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Translator
@DisplayName("Model builder")
public class ModelBuilderTest extends TestBase {

    private ModelDef translate(Statement... statements) {
        FixtureParser parser = new FixtureParser().document(URL, statements);
        ModelDef model = ModelFixtures.model(parser);
        logData("Diagnostics", model.diagnostics());
        return model;
    }

    private static DiagnosticKind onlyKind(ModelDef model) {
        assertThat(model.diagnostics()).hasSize(1);
        return model.diagnostics().get(0).kind();
    }

    // ==================== Table sources ====================

    @Nested
    @DisplayName("Table sources")
    class TableSources {

        @Test
        @DisplayName("TC-MB-001: columns become dimensions in schema order")
        void testColumns() {
            ModelDef model = translate(source("airports", table("airports")));

            SourceDef airports = model.source("airports");
            assertThat(airports.namespace().names()).containsExactly("code", "state", "city", "elevation");
            assertThat(airports.namespace().lookup("elevation")).isInstanceOf(DimensionDef.class);
            assertThat(((DimensionDef) airports.namespace().lookup("elevation")).type())
                .isEqualTo(NumberType.get());
            assertThat(model.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("TC-MB-002: repeated records become joins, unknown types stay unsupported")
        void testRepeatedAndUnsupportedColumns() {
            ModelDef model = translate(source("orders", table("orders")));

            SourceDef orders = model.source("orders");
            assertThat(orders.namespace().lookup("items")).isInstanceOfSatisfying(JoinDef.class, join -> {
                assertThat(join.isUnnest()).isTrue();
                assertThat(join.relationship()).isEqualTo(Relationship.MANY);
            });
            assertThat(((DimensionDef) orders.namespace().lookup("shape")).type())
                .isInstanceOf(UnsupportedType.class);
        }

        @Test
        @DisplayName("TC-MB-003: a missing table is a schema dependency error reported once")
        void testMissingTable() {
            ModelDef model = translate(
                source("ghosts", table("ghosts"), at(3)),
                source("more_ghosts", refine(named("ghosts"), dimension(decl("x", num(1))))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.SCHEMA_DEPENDENCY_ERROR);
            assertThat(model.diagnostics().get(0).message()).contains("ghosts").contains("table not found");
            assertThat(model.isInvalid("ghosts")).isTrue();
            assertThat(model.isInvalid("more_ghosts")).isTrue();
            assertThat(model.invalidReason("more_ghosts")).isEqualTo(model.diagnostics().get(0));
        }

        @Test
        @DisplayName("TC-MB-004: SQL block sources use the supplied schema")
        void testSqlBlockSource() {
            FixtureParser parser = new FixtureParser().document(URL,
                sql("recent", "SELECT id, distance FROM flights"),
                source("recent_flights", fromSql("recent")));
            Map<String, TableSchema> sqlSchemas = Map.of("recent", TableSchema.of("recent",
                ColumnSchema.of("id", "INTEGER"),
                ColumnSchema.of("distance", "INTEGER")));

            ModelDef model = ModelFixtures.translate(parser, ModelFixtures.aviationTables(), sqlSchemas).model();

            assertThat(model.diagnostics()).isEmpty();
            assertThat(model.sqlBlock("recent")).isNotNull();
            assertThat(model.source("recent_flights").namespace().names()).containsExactly("id", "distance");
        }

        @Test
        @DisplayName("TC-MB-005: a SQL block whose schema cannot be read")
        void testFailedSqlBlock() {
            ModelDef model = translate(
                sql("broken", "SELEC nonsense"),
                source("from_broken", fromSql("broken")));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.SCHEMA_DEPENDENCY_ERROR);
            assertThat(model.isInvalid("from_broken")).isTrue();
        }
    }

    // ==================== Fields ====================

    @Nested
    @DisplayName("Field declarations")
    class Fields {

        @Test
        @DisplayName("TC-MB-010: fields may refer to fields declared later")
        void testForwardReference() {
            ModelDef model = translate(source("airports", refine(table("airports"),
                dimension(decl("double_height", times(ref("height"), num(2))),
                    decl("height", plus(ref("elevation"), num(1)))))));

            assertThat(model.diagnostics()).isEmpty();
            assertThat(model.source("airports").namespace().names())
                .containsExactly("code", "state", "city", "elevation", "double_height", "height");
        }

        @Test
        @DisplayName("TC-MB-011: a circular definition is reported once and the rest survives")
        void testCircularFields() {
            ModelDef model = translate(source("airports", refine(table("airports"),
                dimension(decl("a", plus(ref("b"), num(1)), at(4)),
                    decl("b", plus(ref("a"), num(1)), at(5)),
                    decl("c", plus(ref("elevation"), num(1)))))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.STRUCTURAL_ERROR);
            SourceDef airports = model.source("airports");
            assertThat(airports).isNotNull();
            assertThat(airports.namespace().isInvalid("a")).isTrue();
            assertThat(airports.namespace().isInvalid("b")).isTrue();
            assertThat(airports.namespace().lookup("c")).isNotNull();
        }

        @Test
        @DisplayName("TC-MB-012: fields that read an invalid field are suppressed silently")
        void testSuppressedDependents() {
            ModelDef model = translate(
                source("airports", refine(table("airports"),
                    dimension(decl("bad", ref("nope")), decl("worse", plus(ref("bad"), num(1)))))),
                defineQuery("uses_bad", query(named("airports"), stage(groupBy(field("worse"))))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(model.source("airports").namespace().isInvalid("worse")).isTrue();
            assertThat(model.isInvalid("uses_bad")).isTrue();
        }

        @Test
        @DisplayName("TC-MB-013: measures must aggregate; declare picks the kind")
        void testMeasureKinds() {
            ModelDef model = translate(source("airports", refine(table("airports"),
                measure(decl("not_a_measure", ref("elevation"))),
                declare(decl("total", sum(ref("elevation"))), decl("high", gt(ref("elevation"), num(100)))))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.STRUCTURAL_ERROR);
            SourceDef airports = model.source("airports");
            assertThat(airports.namespace().lookup("total")).isInstanceOf(MeasureDef.class);
            assertThat(airports.namespace().lookup("high")).isInstanceOf(DimensionDef.class);
        }

        @Test
        @DisplayName("TC-MB-014: a field name may only be defined once")
        void testDuplicateField() {
            ModelDef model = translate(source("airports", refine(table("airports"),
                dimension(decl("state", str("x"), at(6))))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(model.diagnostics().get(0).location().line()).isEqualTo(6);
        }
    }

    // ==================== Refinement ====================

    @Nested
    @DisplayName("Refinement")
    class Refinement {

        @Test
        @DisplayName("TC-MB-020: refining a source leaves the base unchanged")
        void testIsolation() {
            ModelDef model = translate(
                source("airports", refine(table("airports"), primaryKey("code"))),
                source("tall", refine(named("airports"), dimension(decl("tall", gt(ref("elevation"), num(100)))))));

            assertThat(model.source("tall").namespace().contains("tall")).isTrue();
            assertThat(model.source("airports").namespace().contains("tall")).isFalse();
            assertThat(model.source("tall").primaryKey()).isEqualTo("code");
        }

        @Test
        @DisplayName("TC-MB-021: accept, except and rename")
        void testAcceptExceptRename() {
            ModelDef model = translate(
                source("base", refine(table("airports"), primaryKey("code"))),
                source("accepted", refine(named("base"), accept("code", "state"))),
                source("excepted", refine(named("base"), except("city"))),
                source("renamed", refine(named("base"), rename("airport_code", "code"))));

            assertThat(model.diagnostics()).isEmpty();
            assertThat(model.source("accepted").namespace().names()).containsExactly("code", "state");
            assertThat(model.source("excepted").namespace().names()).containsExactly("code", "state", "elevation");
            assertThat(model.source("renamed").namespace().names())
                .containsExactly("airport_code", "state", "city", "elevation");
            assertThat(model.source("renamed").primaryKey()).isEqualTo("airport_code");
        }

        @Test
        @DisplayName("TC-MB-022: except of an unknown name")
        void testExceptUnknown() {
            ModelDef model = translate(source("base", refine(table("airports"), except("altitude"))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(model.isInvalid("base")).isTrue();
        }

        @Test
        @DisplayName("TC-MB-023: a primary key must be a dimension")
        void testPrimaryKeyMustExist() {
            ModelDef model = translate(source("base", refine(table("airports"), primaryKey("altitude"))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(model.source("base").primaryKey()).isNull();
        }

        @Test
        @DisplayName("TC-MB-024: a source name may only be defined once")
        void testDuplicateSource() {
            ModelDef model = translate(
                source("airports", table("airports")),
                source("airports", table("flights"), at(9)));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(model.source("airports").namespace().contains("state")).isTrue();
        }
    }

    // ==================== Joins ====================

    @Nested
    @DisplayName("Joins")
    class Joins {

        @Test
        @DisplayName("TC-MB-030: join conditions by kind")
        void testJoinConditions() {
            ModelDef model = translate(
                source("carriers", refine(table("carriers"), primaryKey("code"))),
                source("flights", refine(table("flights"),
                    joinOne("by_with", named("carriers"), ref("carrier")),
                    joinOneOn("by_on", named("carriers"), eq(ref("by_on.code"), ref("carrier"))),
                    joinCross("everything", named("carriers"), null))));

            assertThat(model.diagnostics()).isEmpty();
            SourceDef flights = model.source("flights");
            assertThat(((JoinDef) flights.namespace().lookup("by_with")).condition())
                .isInstanceOf(JoinCondition.KeyMatch.class);
            assertThat(((JoinDef) flights.namespace().lookup("by_on")).condition())
                .isInstanceOf(JoinCondition.OnCondition.class);
            assertThat(((JoinDef) flights.namespace().lookup("everything")).condition())
                .isInstanceOf(JoinCondition.CrossProduct.class);
        }

        @Test
        @DisplayName("TC-MB-031: with needs a primary key on the joined source")
        void testWithWithoutPrimaryKey() {
            ModelDef model = translate(source("flights", refine(table("flights"),
                joinOne("carrier_info", table("carriers"), ref("carrier")))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.STRUCTURAL_ERROR);
            assertThat(model.diagnostics().get(0).message()).contains("primary_key");
            assertThat(model.source("flights").namespace().isInvalid("carrier_info")).isTrue();
        }

        @Test
        @DisplayName("TC-MB-032: an implicit join needs a field named like the primary key")
        void testImplicitJoinWithoutMatchingField() {
            ModelDef model = translate(
                source("carriers", refine(table("carriers"), primaryKey("code"))),
                source("airports", refine(table("airports"), joinOne("carriers", named("carriers"), null))));

            // airports has a code column, so this one matches
            assertThat(model.diagnostics()).isEmpty();

            ModelDef missing = translate(
                source("flights", refine(table("flights"), primaryKey("id"))),
                source("carriers", refine(table("carriers"), joinOne("flights", named("flights"), null))));
            assertThat(onlyKind(missing)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
        }

        @Test
        @DisplayName("TC-MB-033: a source cannot join itself while being defined")
        void testSelfJoin() {
            ModelDef model = translate(source("airports", refine(table("airports"), primaryKey("code"),
                joinOne("again", named("airports"), ref("code")))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.STRUCTURAL_ERROR);
            assertThat(model.diagnostics().get(0).message()).contains("refers to itself");
            assertThat(model.source("airports")).isNotNull();
        }

        @Test
        @DisplayName("TC-MB-035: join conditions that read each other are a join cycle")
        void testJoinCycle() {
            ModelDef model = translate(
                source("carriers", refine(table("carriers"), primaryKey("code"))),
                source("flights", table("flights")),
                source("airports", refine(table("airports"),
                    new SourceProperty.Join("c", Relationship.ONE, named("carriers"), null,
                        eq(ref("c.code"), ref("f.carrier")), at(11)),
                    new SourceProperty.Join("f", Relationship.ONE, named("flights"), null,
                        and(eq(ref("f.origin"), ref("code")), eq(ref("f.carrier"), ref("c.code"))), at(12)))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.STRUCTURAL_ERROR);
            assertThat(model.diagnostics().get(0).message()).contains("Join cycle between 'c' and 'f'");
            assertThat(model.diagnostics().get(0).location()).isEqualTo(at(11));
            SourceDef airports = model.source("airports");
            assertThat(airports.namespace().isInvalid("c")).isTrue();
            assertThat(airports.namespace().isInvalid("f")).isTrue();
        }

        @Test
        @DisplayName("TC-MB-036: a join condition may read an earlier join and the join itself")
        void testJoinReadsOtherJoin() {
            ModelDef model = translate(
                source("carriers", refine(table("carriers"), primaryKey("code"))),
                source("flights", table("flights")),
                source("airports", refine(table("airports"),
                    joinOneOn("f", named("flights"), eq(ref("f.origin"), ref("code"))),
                    joinOneOn("c", named("carriers"), eq(ref("c.code"), ref("f.carrier"))))));

            assertThat(model.diagnostics()).isEmpty();
            assertThat(((JoinDef) model.source("airports").namespace().lookup("c")).condition())
                .isInstanceOf(JoinCondition.OnCondition.class);
        }

        @Test
        @DisplayName("TC-MB-034: a query name is not a source")
        void testQueryAsSource() {
            ModelDef model = translate(
                source("airports", table("airports")),
                defineQuery("by_state", query(named("airports"), stage(groupBy(field("state"))))),
                source("wrong", named("by_state")));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.TYPE_ERROR);
            assertThat(model.diagnostics().get(0).message()).contains("from(by_state)");
        }
    }

    // ==================== Views and query sources ====================

    @Nested
    @DisplayName("Views and query sources")
    class Views {

        @Test
        @DisplayName("TC-MB-040: views are fields of the source")
        void testViews() {
            ModelDef model = translate(source("airports", refine(table("airports"),
                measure(decl("airport_count", count())),
                views(view("by_state", stage(groupBy(field("state")), aggregate(field("airport_count"))))))));

            assertThat(model.source("airports").namespace().lookup("by_state")).isInstanceOf(ViewDef.class);
        }

        @Test
        @DisplayName("TC-MB-041: an invalid view is dropped and reported")
        void testInvalidView() {
            ModelDef model = translate(source("airports", refine(table("airports"),
                views(view("broken", stage(groupBy(field("altitude"))))))));

            assertThat(onlyKind(model)).isEqualTo(DiagnosticKind.NAME_RESOLUTION_ERROR);
            assertThat(model.source("airports").namespace().isInvalid("broken")).isTrue();
        }

        @Test
        @DisplayName("TC-MB-042: a source over a query exposes its outputs")
        void testSourceFromQuery() {
            ModelDef model = translate(
                source("airports", refine(table("airports"), measure(decl("airport_count", count())))),
                source("states", fromQuery(query(named("airports"),
                    stage(groupBy(field("state")), aggregate(field("airport_count")),
                        nest(nested("cities", stage(groupBy(field("city"))))))))));

            SourceDef states = model.source("states");
            assertThat(states.namespace().names()).containsExactly("state", "airport_count", "cities");
            assertThat(states.namespace().lookup("cities")).isInstanceOfSatisfying(JoinDef.class,
                join -> assertThat(join.isUnnest()).isTrue());
            assertThat(model.diagnostics()).isEmpty();

            SourceOrigin.Query origin = (SourceOrigin.Query) states.origin();
            DataType cities = origin.query().lastStage().outputs().get(2).type();
            assertThat(((ArrayType) cities).elementType().fieldByName("city")).isNotNull();
        }
    }
}
