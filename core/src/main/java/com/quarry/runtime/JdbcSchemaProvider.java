package com.quarry.runtime;

import com.quarry.dialect.Dialect;
import com.quarry.dialect.Dialects;
import com.quarry.model.ColumnSchema;
import com.quarry.model.TableSchema;
import com.quarry.translator.SqlBlockRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads schemas through a JDBC connection by describing an empty result of
 * {@code SELECT *}. Connection names in table keys are ignored: every table is
 * read from the one connection. Table paths are split on dots and each part is
 * quoted for the connection's dialect.
 */
public class JdbcSchemaProvider implements SchemaProvider {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaProvider.class);

    private final Connection connection;
    private final Dialect dialect;

    public JdbcSchemaProvider(Connection connection) {
        this(connection, Dialects.get("duckdb"));
    }

    public JdbcSchemaProvider(Connection connection, Dialect dialect) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    @Override
    public TableSchemas getSchemaForTables(Set<String> tableKeys) throws IOException {
        Map<String, TableSchema> schemas = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (String key : tableKeys) {
            String path = key.contains(":") ? key.substring(key.indexOf(':') + 1) : key;
            try {
                schemas.put(key, new TableSchema(key, describe("SELECT * FROM " + quotePath(path))));
            } catch (SQLException e) {
                logger.debug("Table {} cannot be described: {}", key, e.getMessage());
                errors.put(key, e.getMessage());
            }
        }
        return new TableSchemas(schemas, errors);
    }

    @Override
    public TableSchema getSchemaForSqlBlock(SqlBlockRequest block) throws IOException {
        try {
            return new TableSchema(block.name(), describe("SELECT * FROM (" + block.select() + ") AS q"));
        } catch (SQLException e) {
            throw new IOException("Cannot describe SQL block '" + block.name() + "': " + e.getMessage(), e);
        }
    }

    private String quotePath(String path) {
        List<String> parts = new ArrayList<>();
        for (String part : path.split("\\.")) {
            parts.add(dialect.quoteIdentifier(part));
        }
        return String.join(".", parts);
    }

    private List<ColumnSchema> describe(String select) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(select + " LIMIT 0")) {
            ResultSetMetaData metaData = rs.getMetaData();
            List<ColumnSchema> columns = new ArrayList<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                columns.add(ColumnSchema.of(metaData.getColumnLabel(i), metaData.getColumnTypeName(i)));
            }
            return columns;
        }
    }
}
