package com.quarry.runtime;

import com.quarry.model.TableSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of reading a set of tables: the schemas that were found, and a
 * message for each table that could not be read.
 */
public record TableSchemas(Map<String, TableSchema> schemas, Map<String, String> errors) {

    public TableSchemas {
        schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }
}
