package com.quarry.model;

import java.util.List;
import java.util.Objects;

/**
 * Schema of a table or of the result of a SQL block.
 */
public record TableSchema(String name, List<ColumnSchema> columns) {

    public TableSchema {
        Objects.requireNonNull(name, "name must not be null");
        columns = List.copyOf(columns);
    }

    public static TableSchema of(String name, ColumnSchema... columns) {
        return new TableSchema(name, List.of(columns));
    }
}
