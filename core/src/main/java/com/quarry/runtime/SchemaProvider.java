package com.quarry.runtime;

import com.quarry.model.TableSchema;
import com.quarry.translator.SqlBlockRequest;

import java.io.IOException;
import java.util.Set;

/**
 * Supplies the schemas of tables and SQL blocks.
 */
public interface SchemaProvider {

    /**
     * Reads table schemas.
     *
     * @param tableKeys {@code connection:path} keys, or paths for the default connection
     * @return the schemas found by key, and the reason for each table that was not found
     * @throws IOException if the schemas cannot be read at all
     */
    TableSchemas getSchemaForTables(Set<String> tableKeys) throws IOException;

    /**
     * Reads the result schema of a SQL block's SELECT.
     *
     * @param block the SQL block
     * @return the schema
     * @throws IOException if the SELECT cannot be described
     */
    TableSchema getSchemaForSqlBlock(SqlBlockRequest block) throws IOException;
}
