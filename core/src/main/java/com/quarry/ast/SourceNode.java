package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * A source expression: where the rows of an explore come from.
 */
public sealed interface SourceNode {

    Location location();

    /** {@code table('connection:path')}; connection may be null for the default connection. */
    record Table(String connection, String tablePath, Location location) implements SourceNode {
        public Table {
            Objects.requireNonNull(tablePath, "tablePath must not be null");
        }

        /**
         * Returns the key under which the schema of this table is requested.
         *
         * @return {@code connection:path}, or just the path for the default connection
         */
        public String key() {
            return connection == null ? tablePath : connection + ":" + tablePath;
        }
    }

    /** A reference to a named source. */
    record Named(String name, Location location) implements SourceNode {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** {@code from(<query>)}: the output of a query. */
    record FromQuery(QueryNode query, Location location) implements SourceNode {
        public FromQuery {
            Objects.requireNonNull(query, "query must not be null");
        }
    }

    /** {@code from_sql(name)}: the result of a named SQL block. */
    record FromSql(String sqlBlockName, Location location) implements SourceNode {
        public FromSql {
            Objects.requireNonNull(sqlBlockName, "sqlBlockName must not be null");
        }
    }

    /** {@code <source> { properties }} */
    record Refined(SourceNode base, List<SourceProperty> properties, Location location) implements SourceNode {
        public Refined {
            Objects.requireNonNull(base, "base must not be null");
            properties = List.copyOf(properties);
        }
    }
}
