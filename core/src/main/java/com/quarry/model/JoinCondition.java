package com.quarry.model;

import com.quarry.expression.Expr;

import java.util.Objects;

/**
 * How the rows of a joined source are correlated to the rows of its parent.
 *
 * <p>Expressions in a condition are relative to the parent source, except the
 * joined side of a key match, which is the joined source's primary key.
 */
public sealed interface JoinCondition {

    /**
     * {@code with parentValue}: the joined source's primary key equals
     * {@code parentValue}. Implicit joins name no value and match the parent field
     * that has the primary key's name.
     */
    record KeyMatch(Expr parentValue, boolean implicit) implements JoinCondition {
        public KeyMatch {
            Objects.requireNonNull(parentValue, "parentValue must not be null");
        }
    }

    /** {@code on condition}; the condition reaches the joined fields through the join's name. */
    record OnCondition(Expr condition) implements JoinCondition {
        public OnCondition {
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }

    /** {@code join_cross} without a condition. */
    record CrossProduct() implements JoinCondition {
    }

    /** The rows of a repeated record held by {@code arrayValue} on each parent row. */
    record Unnest(Expr arrayValue) implements JoinCondition {
        public Unnest {
            Objects.requireNonNull(arrayValue, "arrayValue must not be null");
        }
    }
}
