package com.quarry.ast;

import com.quarry.diagnostic.Location;
import com.quarry.model.SampleSpec;

import java.util.List;
import java.util.Objects;

/**
 * One property inside a query stage body.
 */
public sealed interface StageProperty {

    Location location();

    record GroupBy(List<QueryItem> items, Location location) implements StageProperty {
        public GroupBy {
            items = List.copyOf(items);
        }
    }

    record Aggregate(List<QueryItem> items, Location location) implements StageProperty {
        public Aggregate {
            items = List.copyOf(items);
        }
    }

    record Project(List<QueryItem> items, Location location) implements StageProperty {
        public Project {
            items = List.copyOf(items);
        }
    }

    /** {@code index: a, b, j.* by weightField}; {@code by} may be null. */
    record Index(List<QueryItem> items, List<String> by, Location location) implements StageProperty {
        public Index {
            items = List.copyOf(items);
            by = by == null ? null : List.copyOf(by);
        }
    }

    record Nest(List<NestItem> items, Location location) implements StageProperty {
        public Nest {
            items = List.copyOf(items);
        }
    }

    /** Stage-local field declarations, visible to the rest of the stage. */
    record Declare(List<FieldDeclaration> fields, Location location) implements StageProperty {
        public Declare {
            fields = List.copyOf(fields);
        }
    }

    /** Row filter applied before aggregation. */
    record Where(List<ExprNode> filters, Location location) implements StageProperty {
        public Where {
            filters = List.copyOf(filters);
        }
    }

    /** Group filter applied after aggregation. */
    record Having(List<ExprNode> filters, Location location) implements StageProperty {
        public Having {
            filters = List.copyOf(filters);
        }
    }

    record OrderBy(List<OrderItem> items, Location location) implements StageProperty {
        public OrderBy {
            items = List.copyOf(items);
        }
    }

    record Limit(int rows, Location location) implements StageProperty {
    }

    /** {@code top: N}; same as {@code limit} but also keeps the default ordering. */
    record Top(int rows, Location location) implements StageProperty {
    }

    record Sample(SampleSpec spec, Location location) implements StageProperty {
        public Sample {
            Objects.requireNonNull(spec, "spec must not be null");
        }
    }
}
