package com.quarry.compiler;

import com.quarry.types.ArrayType;
import com.quarry.types.DataType;

import java.util.Objects;

/**
 * One column of a compiled query's result.
 *
 * @param name the column name
 * @param type the column type; repeated columns carry their record type
 * @param repeated whether the column holds a list of records
 */
public record ResultField(String name, DataType type, boolean repeated) {

    public ResultField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ResultField of(String name, DataType type) {
        return new ResultField(name, type, type instanceof ArrayType);
    }
}
