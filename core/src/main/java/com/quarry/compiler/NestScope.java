package com.quarry.compiler;

import com.quarry.expression.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What a nested pipeline inherits from the stages it is nested in.
 *
 * <p>The first stage of a nested pipeline reads the same input rows as its
 * parent stage, restricted by the filters of every enclosing stage and
 * correlated to the parent row through the grouping columns of every enclosing
 * stage.
 *
 * @param previousSql the SQL of the stage before the parent stage, or null when
 *        the parent stage reads a source
 * @param filters row filters of the enclosing stages
 * @param dimensions grouping columns of the enclosing stages
 */
record NestScope(String previousSql, List<Expr> filters, List<GroupingDim> dimensions) {

    /**
     * A grouping column of an enclosing stage and the SQL that reads its value on
     * the enclosing row.
     */
    record GroupingDim(String name, Expr expression, String outerSql) {
        GroupingDim {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(outerSql, "outerSql must not be null");
        }
    }

    /** Scope of a stage that has no enclosing stage. */
    static final NestScope NONE = new NestScope(null, List.of(), List.of());

    NestScope {
        filters = List.copyOf(filters);
        dimensions = List.copyOf(dimensions);
    }

    /**
     * Returns the scope for pipelines nested in a stage.
     *
     * @param stagePreviousSql the previous-stage SQL the stage reads, or null
     * @param stageFilters the stage's row filters
     * @param stageDimensions the stage's grouping columns
     * @return the child scope
     */
    NestScope child(String stagePreviousSql, List<Expr> stageFilters, List<GroupingDim> stageDimensions) {
        List<Expr> childFilters = new ArrayList<>(filters);
        childFilters.addAll(stageFilters);
        List<GroupingDim> childDimensions = new ArrayList<>(dimensions);
        childDimensions.addAll(stageDimensions);
        return new NestScope(stagePreviousSql, childFilters, childDimensions);
    }
}
