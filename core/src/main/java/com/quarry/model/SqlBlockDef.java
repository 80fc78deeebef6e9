package com.quarry.model;

import com.quarry.diagnostic.Location;

import java.util.Objects;

/**
 * A named SQL block: a SELECT statement whose result is usable as a source.
 */
public record SqlBlockDef(String name, String connection, String select, TableSchema schema, Location location) {

    public SqlBlockDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(select, "select must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
    }
}
