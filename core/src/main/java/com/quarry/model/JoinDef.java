package com.quarry.model;

import com.quarry.diagnostic.Location;
import com.quarry.expression.Expr;
import com.quarry.types.ArrayType;
import com.quarry.types.StructField;

import java.util.List;
import java.util.Objects;

/**
 * A named, nested source reachable from its parent through a join.
 *
 * <p>A join declared in a source body is created before its condition is
 * resolved, because an {@code on} condition reaches the joined fields through the
 * join itself. The builder binds the condition once with
 * {@link #resolveCondition(JoinCondition)}; after that the join never changes.
 */
public final class JoinDef implements FieldDef {

    private final String name;
    private final Relationship relationship;
    private final SourceDef source;
    private final Location location;
    private JoinCondition condition;

    public JoinDef(String name, Relationship relationship, SourceDef source,
                   JoinCondition condition, Location location) {
        this(name, relationship, source, location);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    private JoinDef(String name, Relationship relationship, SourceDef source, Location location) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.relationship = Objects.requireNonNull(relationship, "relationship must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.location = location != null ? location : Location.UNKNOWN;
    }

    /**
     * Creates a join whose condition is resolved later.
     *
     * @param name the join name
     * @param relationship the join cardinality
     * @param source the joined source
     * @param location the declaration
     * @return a join without condition
     */
    public static JoinDef declared(String name, Relationship relationship, SourceDef source, Location location) {
        return new JoinDef(name, relationship, source, location);
    }

    /**
     * Binds the condition of a join created with {@link #declared}.
     *
     * @param resolved the condition
     * @throws IllegalStateException if the condition is already bound
     */
    public void resolveCondition(JoinCondition resolved) {
        if (condition != null) {
            throw new IllegalStateException("condition of join '" + name + "' is already resolved");
        }
        this.condition = Objects.requireNonNull(resolved, "resolved must not be null");
    }

    /**
     * Creates the join through which the elements of a repeated record column are
     * read. Each element row belongs to exactly one parent row, so the join is a
     * {@code join_many}. Repeated fields of the element become joins themselves;
     * plain record fields are not navigable.
     *
     * @param name the column name
     * @param type the column type
     * @param location where the column was introduced
     * @return the join
     */
    public static JoinDef repeated(String name, ArrayType type, Location location) {
        Namespace namespace = Namespace.EMPTY;
        for (StructField field : type.elementType().fields()) {
            if (field.dataType() instanceof ArrayType nested) {
                namespace = namespace.with(field.name(), repeated(field.name(), nested, location));
            } else if (!field.dataType().isNested()) {
                namespace = namespace.with(field.name(), DimensionDef.column(field.name(), field.dataType()));
            }
        }
        SourceDef element = new SourceDef(name, new SourceOrigin.Nested(), namespace, null, List.of(), location);
        return new JoinDef(name, Relationship.MANY, element,
            new JoinCondition.Unnest(new Expr.Column(name, type)), location);
    }

    @Override
    public String name() {
        return name;
    }

    public Relationship relationship() {
        return relationship;
    }

    public SourceDef source() {
        return source;
    }

    public JoinCondition condition() {
        if (condition == null) {
            throw new IllegalStateException("condition of join '" + name + "' is not resolved");
        }
        return condition;
    }

    /**
     * Returns whether the joined rows are the elements of a repeated record.
     *
     * @return true for unnest joins
     */
    public boolean isUnnest() {
        return condition instanceof JoinCondition.Unnest;
    }

    @Override
    public Location location() {
        return location;
    }

    @Override
    public String toString() {
        return "Join(" + name + ", " + relationship.keyword() + ")";
    }
}
