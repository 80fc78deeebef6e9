package com.quarry.expression;

import java.util.Locale;

/**
 * Aggregate functions of the modeling language.
 */
public enum AggregateFunction {
    COUNT("count", true),
    COUNT_DISTINCT("count", false),
    SUM("sum", true),
    AVG("avg", true),
    MIN("min", true),
    MAX("max", true);

    private final String keyword;
    private final boolean decomposable;

    AggregateFunction(String keyword, boolean decomposable) {
        this.keyword = keyword;
        this.decomposable = decomposable;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns whether partial results of this function can be combined with a
     * second aggregation (a sum of counts is a count; a count of distinct values
     * cannot be rebuilt from partial counts).
     *
     * @return true when the function can be re-aggregated
     */
    public boolean isDecomposable() {
        return decomposable;
    }

    /**
     * Returns whether the value of this function depends on how often a row is
     * repeated, and therefore needs symmetric computation over fanned-out rows.
     *
     * @return true for count, sum and avg
     */
    public boolean isSensitiveToFanOut() {
        return this == COUNT || this == SUM || this == AVG;
    }

    /**
     * Looks up an aggregate function by keyword.
     *
     * @param name the function name
     * @return the function, or null if the name is not an aggregate
     */
    public static AggregateFunction fromKeyword(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (AggregateFunction function : values()) {
            if (function != COUNT_DISTINCT && function.keyword.equals(normalized)) {
                return function;
            }
        }
        return null;
    }
}
