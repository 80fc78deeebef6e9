package com.quarry.translator;

import java.util.Objects;

/**
 * A SQL block whose result schema the translator needs.
 *
 * @param name the block name, the key its schema is supplied under
 * @param connection the connection the SELECT runs on, or null for the default
 * @param select the SELECT statement
 */
public record SqlBlockRequest(String name, String connection, String select) {

    public SqlBlockRequest {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(select, "select must not be null");
    }
}
