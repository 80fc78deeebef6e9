package com.quarry.model;

import com.quarry.diagnostic.Location;
import com.quarry.expression.Expr;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A resolved pipeline stage.
 *
 * <p>All expressions of a stage are typed and resolved against {@link #input()},
 * the source the stage reads (including the stage's own declarations).
 */
public sealed interface Stage {

    SourceDef input();

    /** Row filters, applied before any aggregation. */
    List<Expr> filters();

    List<OrderSpec> orderBy();

    /** Row limit, or null. */
    Integer limit();

    /** Sampling of the input rows, or null. */
    SampleSpec sample();

    /** Output columns in output order. */
    List<StageOutput> outputs();

    Location location();

    /**
     * {@code group_by} / {@code aggregate} / {@code nest}.
     */
    record Reduce(SourceDef input, List<StageOutput> outputs, List<Expr> filters, List<Expr> having,
                  List<OrderSpec> orderBy, Integer limit, SampleSpec sample, Location location) implements Stage {
        public Reduce {
            Objects.requireNonNull(input, "input must not be null");
            outputs = List.copyOf(outputs);
            filters = List.copyOf(filters);
            having = List.copyOf(having);
            orderBy = List.copyOf(orderBy);
        }

        public List<StageOutput.Field> groupBy() {
            return fields(StageOutput.Role.GROUP_BY);
        }

        public List<StageOutput.Field> aggregates() {
            return fields(StageOutput.Role.AGGREGATE);
        }

        public List<StageOutput.Nest> nests() {
            List<StageOutput.Nest> result = new ArrayList<>();
            for (StageOutput output : outputs) {
                if (output instanceof StageOutput.Nest) {
                    result.add((StageOutput.Nest) output);
                }
            }
            return result;
        }

        private List<StageOutput.Field> fields(StageOutput.Role role) {
            List<StageOutput.Field> result = new ArrayList<>();
            for (StageOutput output : outputs) {
                if (output instanceof StageOutput.Field && ((StageOutput.Field) output).role() == role) {
                    result.add((StageOutput.Field) output);
                }
            }
            return result;
        }
    }

    /**
     * {@code project}: one output row per input row.
     */
    record Project(SourceDef input, List<StageOutput> outputs, List<Expr> filters, List<OrderSpec> orderBy,
                   Integer limit, SampleSpec sample, Location location) implements Stage {
        public Project {
            Objects.requireNonNull(input, "input must not be null");
            outputs = List.copyOf(outputs);
            filters = List.copyOf(filters);
            orderBy = List.copyOf(orderBy);
        }
    }

    /**
     * {@code index}: a search index over field values. The weight is {@code count()}
     * when {@code weight} is null.
     */
    record Index(SourceDef input, List<IndexField> fields, Expr weight, List<Expr> filters,
                 List<OrderSpec> orderBy, Integer limit, SampleSpec sample, Location location) implements Stage {

        public static final String FIELD_PATH = "fieldPath";
        public static final String FIELD_VALUE = "fieldValue";
        public static final String WEIGHT = "weight";

        public Index {
            Objects.requireNonNull(input, "input must not be null");
            fields = List.copyOf(fields);
            filters = List.copyOf(filters);
            orderBy = List.copyOf(orderBy);
        }

        @Override
        public List<StageOutput> outputs() {
            return List.of(
                new StageOutput.Fixed(FIELD_PATH, StringType.get(), location),
                new StageOutput.Fixed(FIELD_VALUE, StringType.get(), location),
                new StageOutput.Fixed(WEIGHT, NumberType.get(), location));
        }
    }

    /** One indexed field: its dotted path and resolved expression. */
    record IndexField(String path, Expr expression) {
        public IndexField {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }
}
