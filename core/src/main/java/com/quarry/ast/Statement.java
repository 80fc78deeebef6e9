package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.Objects;

/**
 * A top-level statement of a document.
 */
public sealed interface Statement {

    Location location();

    /** {@code source: name is <source>} */
    record DefineSource(String name, SourceNode source, Location location) implements Statement {
        public DefineSource {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(source, "source must not be null");
        }
    }

    /** {@code query: name is <query>} */
    record DefineQuery(String name, QueryNode query, Location location) implements Statement {
        public DefineQuery {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(query, "query must not be null");
        }
    }

    /** An anonymous query: {@code run: <query>} */
    record RunQuery(QueryNode query, Location location) implements Statement {
        public RunQuery {
            Objects.requireNonNull(query, "query must not be null");
        }
    }

    /** {@code sql: name is { connection: "c" select: """…""" }} */
    record DefineSqlBlock(String name, String connection, String select, Location location) implements Statement {
        public DefineSqlBlock {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(select, "select must not be null");
        }
    }

    /** {@code import "url"} */
    record Import(String url, Location location) implements Statement {
        public Import {
            Objects.requireNonNull(url, "url must not be null");
        }
    }
}
