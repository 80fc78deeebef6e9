package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * A query: a head followed by a pipeline of stages ({@code head -> {…} -> {…}}).
 */
public record QueryNode(Head head, List<StageNode> stages, Location location) {

    public QueryNode {
        Objects.requireNonNull(head, "head must not be null");
        stages = List.copyOf(stages);
    }

    /**
     * Where a query starts.
     */
    public sealed interface Head {

        /** Start from a source; the pipeline runs against its fields. */
        record FromSource(SourceNode source) implements Head {
            public FromSource {
                Objects.requireNonNull(source, "source must not be null");
            }
        }

        /** Start from a named query; the stages are appended to its pipeline. */
        record FromQuery(String queryName, Location location) implements Head {
            public FromQuery {
                Objects.requireNonNull(queryName, "queryName must not be null");
            }
        }
    }
}
