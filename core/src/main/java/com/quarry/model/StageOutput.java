package com.quarry.model;

import com.quarry.diagnostic.Location;
import com.quarry.expression.Expr;
import com.quarry.types.ArrayType;
import com.quarry.types.DataType;
import com.quarry.types.StructField;
import com.quarry.types.StructType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One output column of a stage, in output order.
 */
public sealed interface StageOutput {

    String name();

    DataType type();

    Location location();

    /** Role of a computed output column. */
    enum Role {
        GROUP_BY,
        AGGREGATE,
        PROJECT
    }

    /** A computed column. */
    record Field(String name, Expr expression, Role role, Location location) implements StageOutput {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(role, "role must not be null");
        }

        @Override
        public DataType type() {
            return expression.type();
        }
    }

    /** A column with a fixed shape, such as the columns of an index stage. */
    record Fixed(String name, DataType type, Location location) implements StageOutput {
        public Fixed {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /**
     * A {@code nest:} column: one repeated record per parent row, produced by a
     * pipeline whose first stage reads the parent stage's input rows.
     */
    record Nest(String name, List<Stage> pipeline, Location location) implements StageOutput {
        public Nest {
            Objects.requireNonNull(name, "name must not be null");
            pipeline = List.copyOf(pipeline);
        }

        @Override
        public DataType type() {
            return new ArrayType(rowType(pipeline.get(pipeline.size() - 1).outputs()));
        }
    }

    /**
     * Builds the record type of a list of outputs.
     *
     * @param outputs the outputs of a stage
     * @return one struct field per output
     */
    static StructType rowType(List<StageOutput> outputs) {
        List<StructField> fields = new ArrayList<>();
        for (StageOutput output : outputs) {
            fields.add(new StructField(output.name(), output.type()));
        }
        return new StructType(fields);
    }
}
