package com.quarry.model;

import java.util.Objects;

/**
 * Where the rows of a source come from.
 */
public sealed interface SourceOrigin {

    /** A database table. */
    record Table(String connection, String tablePath) implements SourceOrigin {
        public Table {
            Objects.requireNonNull(tablePath, "tablePath must not be null");
        }
    }

    /** The result of a named SQL block. */
    record SqlBlock(SqlBlockDef block) implements SourceOrigin {
        public SqlBlock {
            Objects.requireNonNull(block, "block must not be null");
        }
    }

    /** The output of a query ({@code from(…)}). */
    record Query(QueryDef query) implements SourceOrigin {
        public Query {
            Objects.requireNonNull(query, "query must not be null");
        }
    }

    /** The output of the previous stage of the same pipeline. */
    record PreviousStage() implements SourceOrigin {
    }

    /** The elements of a repeated record; only reachable through an unnest join. */
    record Nested() implements SourceOrigin {
    }
}
