package com.quarry.model;

import com.quarry.ast.QueryNode;

import java.util.Objects;

/**
 * Identifies the query to compile against a model.
 */
public sealed interface QueryRef {

    /** A named query ({@code query: name is …}). */
    record Named(String name) implements QueryRef {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** The n-th anonymous query ({@code run: …}) of the document, 0-based. */
    record Anonymous(int index) implements QueryRef {
        public Anonymous {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        }
    }

    /** A query that is not part of the model, resolved against it on demand. */
    record Inline(QueryNode query) implements QueryRef {
        public Inline {
            Objects.requireNonNull(query, "query must not be null");
        }
    }

    static QueryRef named(String name) {
        return new Named(name);
    }

    static QueryRef anonymous(int index) {
        return new Anonymous(index);
    }

    static QueryRef inline(QueryNode query) {
        return new Inline(query);
    }
}
