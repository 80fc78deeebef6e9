package com.quarry.model;

/**
 * Cardinality of a join from the parent source's point of view.
 */
public enum Relationship {
    /** Each parent row matches at most one joined row ({@code join_one}). */
    ONE("join_one"),
    /** Each parent row may match many joined rows ({@code join_many}). */
    MANY("join_many"),
    /** Every parent row is paired with every joined row ({@code join_cross}). */
    CROSS("join_cross");

    private final String keyword;

    Relationship(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns whether traversing a join of this kind can repeat parent rows.
     *
     * @return true for many and cross joins
     */
    public boolean fansOut() {
        return this != ONE;
    }
}
