package com.quarry.expression;

import com.quarry.ast.ExprNode;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.exception.CompilationException;
import com.quarry.model.ModelDef;
import com.quarry.test.Ast;
import com.quarry.test.FixtureParser;
import com.quarry.test.ModelFixtures;
import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;
import com.quarry.types.BooleanType;
import com.quarry.types.DateType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;
import com.quarry.types.TimeUnit;
import com.quarry.types.TimestampType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.quarry.test.Ast.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression translator")
public class ExpressionTranslatorTest extends TestBase {

    private ExpressionTranslator airports;
    private ExpressionTranslator flights;

    @BeforeEach
    void setUp() {
        FixtureParser parser = new FixtureParser().document(URL,
            source("flights", refine(table("flights"), primaryKey("id"),
                measure(decl("flight_count", count())))),
            source("airports", refine(table("airports"), primaryKey("code"),
                joinMany("departures", named("flights"), eq(ref("departures.origin"), ref("code"))),
                measure(decl("airport_count", count())))));
        ModelDef model = ModelFixtures.model(parser);
        assertThat(model.diagnostics()).isEmpty();
        airports = new ExpressionTranslator(new SourceSpace(model.source("airports")));
        flights = new ExpressionTranslator(new SourceSpace(model.source("flights")));
    }

    private static void assertFails(Runnable translation, DiagnosticKind kind, String messagePart) {
        assertThatThrownBy(translation::run)
            .isInstanceOfSatisfying(CompilationException.class, e -> {
                assertThat(e.kind()).isEqualTo(kind);
                assertThat(e.getMessage()).contains(messagePart);
                assertThat(e.location()).isEqualTo(Ast.LOC);
            });
    }

    // ==================== Types ====================

    @Nested
    @DisplayName("Types and operators")
    class Types {

        @Test
        @DisplayName("TC-EXP-001: arithmetic requires numbers")
        void testArithmeticTypes() {
            assertThat(airports.translate(plus(ref("elevation"), num(1))).type()).isEqualTo(NumberType.get());
            assertFails(() -> airports.translate(plus(ref("state"), num(1))),
                DiagnosticKind.TYPE_ERROR, "requires number, got string");
        }

        @Test
        @DisplayName("TC-EXP-002: comparing incompatible types")
        void testComparisonMismatch() {
            assertFails(() -> airports.translate(gt(ref("state"), num(3))),
                DiagnosticKind.TYPE_ERROR, "Cannot apply '>' to string and number");
        }

        @Test
        @DisplayName("TC-EXP-003: equality with null becomes a null test")
        void testNullComparison() {
            Expr expr = airports.translate(ne(ref("city"), nul()));

            assertThat(expr).isInstanceOfSatisfying(Expr.IsNull.class,
                isNull -> assertThat(isNull.negated()).isTrue());
        }

        @Test
        @DisplayName("TC-EXP-004: logical operators require booleans")
        void testLogicalTypes() {
            assertThat(airports.translate(and(gt(ref("elevation"), num(1)), bool(true))).type())
                .isEqualTo(BooleanType.get());
            assertFails(() -> airports.translate(not(ref("elevation"))),
                DiagnosticKind.TYPE_ERROR, "requires boolean");
        }

        @Test
        @DisplayName("TC-EXP-005: functions check arity and argument types")
        void testFunctions() {
            assertThat(airports.translate(call("upper", ref("state"))).type()).isEqualTo(StringType.get());
            assertFails(() -> airports.translate(call("upper", ref("state"), ref("city"))),
                DiagnosticKind.TYPE_ERROR, "does not accept 2");
            assertFails(() -> airports.translate(call("soundex", ref("state"))),
                DiagnosticKind.NAME_RESOLUTION_ERROR, "Unknown function 'soundex'");
        }

        @Test
        @DisplayName("TC-EXP-006: casts to known type names only")
        void testCast() {
            assertThat(airports.translate(cast(ref("elevation"), "string", false)).type())
                .isEqualTo(StringType.get());
            assertFails(() -> airports.translate(cast(ref("elevation"), "json", true)),
                DiagnosticKind.TYPE_ERROR, "Unknown type 'json'");
        }
    }

    // ==================== References ====================

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("TC-EXP-010: unknown names")
        void testUnknownName() {
            assertFails(() -> airports.translate(ref("altitude")),
                DiagnosticKind.NAME_RESOLUTION_ERROR, "'altitude' is not defined");
            assertFails(() -> airports.translate(ref("departures.altitude")),
                DiagnosticKind.NAME_RESOLUTION_ERROR, "'departures.altitude' is not defined");
        }

        @Test
        @DisplayName("TC-EXP-011: paths only go through joins")
        void testPathThroughDimension() {
            assertFails(() -> airports.translate(ref("state.name")),
                DiagnosticKind.NAME_RESOLUTION_ERROR, "'state' is not a join");
        }

        @Test
        @DisplayName("TC-EXP-012: a join is not a value")
        void testJoinAsValue() {
            assertFails(() -> airports.translate(ref("departures")),
                DiagnosticKind.TYPE_ERROR, "is a join");
        }

        @Test
        @DisplayName("TC-EXP-013: references through a join carry the join path")
        void testJoinedReference() {
            Expr expr = airports.translate(ref("departures.distance"));

            assertThat(expr).isInstanceOfSatisfying(Expr.FieldRef.class, fieldRef -> {
                assertThat(fieldRef.joinPath()).hasSize(1);
                assertThat(fieldRef.name()).isEqualTo("departures.distance");
            });
        }
    }

    // ==================== Time ====================

    @Nested
    @DisplayName("Time")
    class Time {

        @Test
        @DisplayName("TC-EXP-020: time literals carry their granularity")
        void testTimeLiterals() {
            Expr.TimeLiteral quarter = ExpressionTranslator.parseTimeLiteral("2023-Q2", LOC);
            assertThat(quarter.text()).isEqualTo("2023-04-01");
            assertThat(quarter.type()).isEqualTo(DateType.get());
            assertThat(quarter.granularity()).isEqualTo(TimeUnit.QUARTER);

            Expr.TimeLiteral minute = ExpressionTranslator.parseTimeLiteral("2023-02-14 10:30", LOC);
            assertThat(minute.text()).isEqualTo("2023-02-14 10:30:00");
            assertThat(minute.type()).isEqualTo(TimestampType.get());
            assertThat(minute.granularity()).isEqualTo(TimeUnit.MINUTE);
        }

        @Test
        @DisplayName("TC-EXP-021: invalid time literals")
        void testInvalidTimeLiteral() {
            assertFails(() -> ExpressionTranslator.parseTimeLiteral("2023-13", LOC),
                DiagnosticKind.TYPE_ERROR, "Invalid time literal '@2023-13'");
            assertFails(() -> ExpressionTranslator.parseTimeLiteral("yesterday", LOC),
                DiagnosticKind.TYPE_ERROR, "Invalid time literal");
        }

        @Test
        @DisplayName("TC-EXP-022: equality with a granular literal is a half open range")
        void testGranularEquality() {
            Expr expr = flights.translate(eq(ref("dep_date"), time("2023-02")));

            assertThat(expr).isInstanceOfSatisfying(Expr.Binary.class, binary -> {
                assertThat(binary.operator()).isEqualTo(BinaryOperator.AND);
                assertThat(binary.right()).isInstanceOfSatisfying(Expr.Binary.class,
                    upper -> assertThat(upper.right()).isInstanceOf(Expr.TimeOffset.class));
            });
        }

        @Test
        @DisplayName("TC-EXP-023: truncation units must fit the operand")
        void testTruncationUnits() {
            assertThat(flights.translate(trunc(ref("dep_time"), TimeUnit.HOUR)).type())
                .isEqualTo(TimestampType.get());
            assertFails(() -> flights.translate(trunc(ref("dep_date"), TimeUnit.HOUR)),
                DiagnosticKind.TYPE_ERROR, "'hour' does not apply to a date");
            assertFails(() -> flights.translate(trunc(ref("carrier"), TimeUnit.MONTH)),
                DiagnosticKind.TYPE_ERROR, "requires a date or timestamp");
        }

        @Test
        @DisplayName("TC-EXP-024: time offsets need a number of units")
        void testTimeOffset() {
            assertThat(flights.translate(offset(ref("dep_date"), false, num(3), TimeUnit.DAY)).type())
                .isEqualTo(DateType.get());
            assertFails(() -> flights.translate(offset(ref("dep_date"), true, str("3"), TimeUnit.DAY)),
                DiagnosticKind.TYPE_ERROR, "time offset requires number");
        }
    }

    // ==================== Patterns ====================

    @Nested
    @DisplayName("Apply and pick")
    class Patterns {

        @Test
        @DisplayName("TC-EXP-030: apply with a partial comparison and a range")
        void testApply() {
            Expr partial = airports.translate(apply(ref("elevation"),
                partial(BinaryOperator.GREATER_THAN, num(100))));
            Expr range = airports.translate(apply(ref("elevation"), range(num(10), num(100))));

            assertThat(partial).isInstanceOfSatisfying(Expr.Binary.class,
                b -> assertThat(b.operator()).isEqualTo(BinaryOperator.GREATER_THAN));
            assertThat(range).isInstanceOfSatisfying(Expr.Binary.class,
                b -> assertThat(b.operator()).isEqualTo(BinaryOperator.AND));
        }

        @Test
        @DisplayName("TC-EXP-031: a partial comparison needs a value")
        void testBarePartial() {
            assertFails(() -> airports.translate(partial(BinaryOperator.GREATER_THAN, num(1))),
                DiagnosticKind.STRUCTURAL_ERROR, "use '?'");
        }

        @Test
        @DisplayName("TC-EXP-032: pick becomes a case with a unified type")
        void testPick() {
            ExprNode pick = apply(ref("elevation"), pick(null, str("high"),
                when(str("low"), partial(BinaryOperator.LESS_THAN, num(100)))));

            Expr expr = airports.translate(pick);

            assertThat(expr).isInstanceOfSatisfying(Expr.Case.class, c -> {
                assertThat(c.whens()).hasSize(1);
                assertThat(c.type()).isEqualTo(StringType.get());
            });
        }

        @Test
        @DisplayName("TC-EXP-033: pick branches must agree on a type")
        void testPickMixedTypes() {
            ExprNode pick = pick(null, num(0), when(str("low"), lt(ref("elevation"), num(100))));

            assertFails(() -> airports.translate(pick), DiagnosticKind.TYPE_ERROR, "mixes string and number");
        }
    }

    // ==================== Aggregates ====================

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @Test
        @DisplayName("TC-EXP-040: aggregates cannot be nested")
        void testNestedAggregate() {
            assertFails(() -> airports.translate(sum(aggregate(AggregateFunction.MAX, ref("elevation")))),
                DiagnosticKind.STRUCTURAL_ERROR, "cannot be nested");
        }

        @Test
        @DisplayName("TC-EXP-041: sum and avg require numbers")
        void testSumOfString() {
            assertFails(() -> airports.translate(sum(ref("state"))), DiagnosticKind.TYPE_ERROR, "sum()");
            assertThat(airports.translate(max(ref("state"))).type()).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("TC-EXP-042: scalar contexts reject aggregates")
        void testAggregateInScalarContext() {
            assertFails(() -> airports.translateScalar(count(), "group_by"),
                DiagnosticKind.STRUCTURAL_ERROR, "not allowed in group_by");
        }

        @Test
        @DisplayName("TC-EXP-043: aggregate contexts reject bare dimensions")
        void testDimensionInAggregateContext() {
            assertFails(() -> airports.translateAggregate(ref("elevation"), "aggregate"),
                DiagnosticKind.STRUCTURAL_ERROR, "must be an aggregate");
            assertFails(() -> airports.translateAggregate(plus(sum(ref("elevation")), ref("elevation")), "aggregate"),
                DiagnosticKind.STRUCTURAL_ERROR, "cannot be used outside an aggregate function");
        }

        @Test
        @DisplayName("TC-EXP-044: a join_many value outside an aggregate is a fan-out")
        void testFanOutReference() {
            assertFails(() -> airports.translateAggregate(
                    plus(count(), ref("departures.distance")), "aggregate"),
                DiagnosticKind.STRUCTURAL_ERROR, "reached through join_many 'departures'");
        }

        @Test
        @DisplayName("TC-EXP-045: measures combine freely in aggregate contexts")
        void testMeasureArithmetic() {
            Expr expr = airports.translateAggregate(
                divide(ref("airport_count"), count("departures")), "aggregate");

            assertThat(expr.isAggregate()).isTrue();
            assertThat(expr.type()).isEqualTo(NumberType.get());
        }

        @Test
        @DisplayName("TC-EXP-046: aggregate locality through a join path")
        void testAggregateLevel() {
            Expr expr = airports.translate(sum("departures", ref("departures.distance")));

            assertThat(expr).isInstanceOfSatisfying(Expr.Aggregate.class,
                a -> assertThat(a.level()).hasSize(1));
            assertFails(() -> airports.translate(count("state")), DiagnosticKind.TYPE_ERROR, "is not a join");
        }

        @Test
        @DisplayName("TC-EXP-047: filters on aggregates only")
        void testFilteredAggregate() {
            Expr expr = airports.translate(filtered(ref("airport_count"), eq(ref("state"), str("CA"))));

            assertThat(expr).isInstanceOf(Expr.Filtered.class);
            assertFails(() -> airports.translate(filtered(ref("elevation"), eq(ref("state"), str("CA")))),
                DiagnosticKind.STRUCTURAL_ERROR, "can only be applied to an aggregate");
        }

        @Test
        @DisplayName("TC-EXP-048: all() and exclude() wrap aggregates")
        void testUngroup() {
            assertThat(airports.translate(all(ref("airport_count")))).isInstanceOf(Expr.Ungroup.class);
            assertFails(() -> airports.translate(exclude(ref("elevation"), "state")),
                DiagnosticKind.STRUCTURAL_ERROR, "exclude() requires an aggregate");
        }
    }
}
