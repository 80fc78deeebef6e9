package com.quarry.expression;

import com.quarry.model.DimensionDef;
import com.quarry.model.JoinDef;
import com.quarry.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * Join-path analysis of resolved expressions.
 *
 * <p>A dimension defined on the root source may itself read joined fields, so the
 * joins an expression really touches are found by expanding dimension
 * definitions down to physical columns.
 */
public final class ExprPaths {

    private ExprPaths() {}

    /**
     * Collects the join path of every physical column read by the scalar parts of
     * an expression. Aggregates are not entered.
     *
     * @param expr the expression
     * @param prefix the path the expression is anchored at
     * @param out receives one path per column read
     */
    public static void collectScalarPaths(Expr expr, List<JoinDef> prefix, List<List<JoinDef>> out) {
        if (expr instanceof Expr.Column) {
            out.add(prefix);
        } else if (expr instanceof Expr.FieldRef) {
            Expr.FieldRef ref = (Expr.FieldRef) expr;
            if (ref.field() instanceof DimensionDef) {
                collectScalarPaths(((DimensionDef) ref.field()).expression(), concat(prefix, ref.joinPath()), out);
            }
        } else if (expr instanceof Expr.OutputRef) {
            collectScalarPaths(((Expr.OutputRef) expr).definition(), prefix, out);
        } else if (expr instanceof Expr.Aggregate || expr instanceof Expr.Filtered || expr instanceof Expr.Ungroup) {
            return;
        } else {
            for (Expr child : expr.children()) {
                collectScalarPaths(child, prefix, out);
            }
        }
    }

    /**
     * Returns the deepest join path read by a scalar expression, which is the level
     * an aggregate of that expression is computed at.
     *
     * @param expr the aggregate argument
     * @return the deepest path, empty for root-level expressions
     * @throws IllegalArgumentException if the expression reads joins on unrelated branches
     */
    public static List<JoinDef> deepestPath(Expr expr) {
        List<List<JoinDef>> paths = new ArrayList<>();
        collectScalarPaths(expr, List.of(), paths);
        List<JoinDef> deepest = List.of();
        for (List<JoinDef> path : paths) {
            if (isPrefix(deepest, path)) {
                deepest = path;
            } else if (!isPrefix(path, deepest)) {
                throw new IllegalArgumentException("expression reads fields from unrelated joins");
            }
        }
        return deepest;
    }

    /**
     * Returns the first join on the path that can repeat the rows above it, or null.
     *
     * @param path a join path
     * @return the first fanning join, or null
     */
    public static JoinDef firstFanOut(List<JoinDef> path) {
        for (JoinDef join : path) {
            if (join.relationship() == Relationship.MANY) {
                return join;
            }
        }
        return null;
    }

    public static boolean isPrefix(List<JoinDef> prefix, List<JoinDef> path) {
        if (prefix.size() > path.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (prefix.get(i) != path.get(i)) {
                return false;
            }
        }
        return true;
    }

    public static List<JoinDef> concat(List<JoinDef> prefix, List<JoinDef> suffix) {
        if (suffix.isEmpty()) {
            return prefix;
        }
        if (prefix.isEmpty()) {
            return suffix;
        }
        List<JoinDef> result = new ArrayList<>(prefix.size() + suffix.size());
        result.addAll(prefix);
        result.addAll(suffix);
        return List.copyOf(result);
    }

    /**
     * Renders a join path for messages.
     *
     * @param path the path
     * @return dotted join names
     */
    public static String describe(List<JoinDef> path) {
        List<String> names = new ArrayList<>();
        for (JoinDef join : path) {
            names.add(join.name());
        }
        return String.join(".", names);
    }
}
