package com.quarry.compiler;

import com.quarry.model.StageOutput;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered columns of a compiled query's result, used by a runtime to decode rows.
 */
public record ResultSchema(List<ResultField> fields) {

    public static final ResultSchema EMPTY = new ResultSchema(List.of());

    public ResultSchema {
        fields = List.copyOf(fields);
    }

    /**
     * Builds the schema of a stage's outputs.
     *
     * @param outputs the outputs of the last stage
     * @return the schema
     */
    public static ResultSchema of(List<StageOutput> outputs) {
        List<ResultField> fields = new ArrayList<>();
        for (StageOutput output : outputs) {
            fields.add(ResultField.of(output.name(), output.type()));
        }
        return new ResultSchema(fields);
    }

    public ResultField field(String name) {
        for (ResultField field : fields) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        return null;
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (ResultField field : fields) {
            names.add(field.name());
        }
        return names;
    }

    public int size() {
        return fields.size();
    }
}
