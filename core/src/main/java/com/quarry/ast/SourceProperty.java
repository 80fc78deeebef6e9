package com.quarry.ast;

import com.quarry.diagnostic.Location;
import com.quarry.model.Relationship;

import java.util.List;
import java.util.Objects;

/**
 * One property inside an explore body.
 */
public sealed interface SourceProperty {

    Location location();

    /** {@code dimension: a is …, b is …} */
    record Dimensions(List<FieldDeclaration> fields, Location location) implements SourceProperty {
        public Dimensions {
            fields = List.copyOf(fields);
        }
    }

    /** {@code measure: m is …} */
    record Measures(List<FieldDeclaration> fields, Location location) implements SourceProperty {
        public Measures {
            fields = List.copyOf(fields);
        }
    }

    /** {@code declare: x is …}; dimension or measure is decided by the expression. */
    record Declare(List<FieldDeclaration> fields, Location location) implements SourceProperty {
        public Declare {
            fields = List.copyOf(fields);
        }
    }

    /**
     * {@code join_one|join_many|join_cross: name is <source> with <expr> | on <expr>}.
     *
     * <p>At most one of {@code with} and {@code on} is set; when neither is set the
     * join matches the joined source's primary key against the parent field of the
     * same name.
     */
    record Join(String name, Relationship relationship, SourceNode source,
                ExprNode with, ExprNode on, Location location) implements SourceProperty {
        public Join {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(relationship, "relationship must not be null");
            Objects.requireNonNull(source, "source must not be null");
        }
    }

    /** {@code where: filter, …} applied to every query against the source. */
    record Where(List<ExprNode> filters, Location location) implements SourceProperty {
        public Where {
            filters = List.copyOf(filters);
        }
    }

    /** {@code primary_key: field} */
    record PrimaryKey(String field, Location location) implements SourceProperty {
        public PrimaryKey {
            Objects.requireNonNull(field, "field must not be null");
        }
    }

    /** {@code accept: a, b} */
    record Accept(List<String> names, Location location) implements SourceProperty {
        public Accept {
            names = List.copyOf(names);
        }
    }

    /** {@code except: a, b} */
    record Except(List<String> names, Location location) implements SourceProperty {
        public Except {
            names = List.copyOf(names);
        }
    }

    /** {@code rename: newName is oldName} */
    record Rename(String newName, String oldName, Location location) implements SourceProperty {
        public Rename {
            Objects.requireNonNull(newName, "newName must not be null");
            Objects.requireNonNull(oldName, "oldName must not be null");
        }
    }

    /** {@code query: name is { … } -> { … }}: named views of the source. */
    record Views(List<ViewDeclaration> views, Location location) implements SourceProperty {
        public Views {
            views = List.copyOf(views);
        }
    }

    /** One named view. */
    record ViewDeclaration(String name, List<StageNode> pipeline, Location location) {
        public ViewDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            pipeline = List.copyOf(pipeline);
        }
    }
}
