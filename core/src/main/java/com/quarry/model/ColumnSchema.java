package com.quarry.model;

import com.quarry.types.DataType;
import com.quarry.types.TypeMapper;

import java.util.List;
import java.util.Objects;

/**
 * One column reported by a schema provider.
 *
 * <p>A column with children is a record; if it is also repeated, it is an array
 * of records and is navigated like a {@code join_many}.
 */
public record ColumnSchema(String name, String sqlType, List<ColumnSchema> children, boolean repeated) {

    public ColumnSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sqlType, "sqlType must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ColumnSchema of(String name, String sqlType) {
        return new ColumnSchema(name, sqlType, List.of(), false);
    }

    public static ColumnSchema repeatedRecord(String name, List<ColumnSchema> children) {
        return new ColumnSchema(name, "STRUCT[]", children, true);
    }

    public boolean isRepeatedRecord() {
        return repeated && !children.isEmpty();
    }

    /**
     * Returns the language type of a scalar column.
     *
     * @return the mapped data type
     */
    public DataType dataType() {
        return TypeMapper.fromSqlType(sqlType);
    }
}
