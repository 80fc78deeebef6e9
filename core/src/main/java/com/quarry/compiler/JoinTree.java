package com.quarry.compiler;

import com.quarry.exception.CompilationException;
import com.quarry.expression.Expr;
import com.quarry.expression.ExprPaths;
import com.quarry.model.DimensionDef;
import com.quarry.model.JoinCondition;
import com.quarry.model.JoinDef;
import com.quarry.model.Relationship;
import com.quarry.model.SourceDef;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The joins one SELECT reads, as instances keyed by their path from the root
 * source.
 *
 * <p>Only joins that an expression of the SELECT actually touches are added, so
 * an unused {@code join_many} never multiplies the rows being aggregated. Adding
 * a join also adds whatever its {@code on} condition, primary key and source
 * filters read.
 *
 * <p>The tree answers the fan-out question: whether the rows of a given
 * instance can appear more than once in the joined relation.
 */
final class JoinTree {
    private static final Logger logger = LoggerFactory.getLogger(JoinTree.class);

    /**
     * One occurrence of a source in the FROM clause.
     */
    static final class Instance {
        private final List<JoinDef> path;
        private final JoinDef join;
        private final SourceDef source;
        private final Instance parent;
        private final String alias;
        private final Set<Instance> dependencies = new LinkedHashSet<>();
        private boolean needsRowKey;

        private Instance(List<JoinDef> path, JoinDef join, SourceDef source, Instance parent, String alias) {
            this.path = path;
            this.join = join;
            this.source = source;
            this.parent = parent;
            this.alias = alias;
        }

        List<JoinDef> path() {
            return path;
        }

        /** The join that introduced this instance, null for the root. */
        JoinDef join() {
            return join;
        }

        SourceDef source() {
            return source;
        }

        Instance parent() {
            return parent;
        }

        String alias() {
            return alias;
        }

        boolean isRoot() {
            return parent == null;
        }

        boolean needsRowKey() {
            return needsRowKey;
        }

        void markNeedsRowKey() {
            needsRowKey = true;
        }

        /**
         * Returns whether this instance is the given one or one of its ancestors.
         */
        boolean isAncestorOrSelf(Instance other) {
            for (Instance i = other; i != null; i = i.parent) {
                if (i == this) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return "Instance(" + alias + (join != null ? ", " + join.relationship().keyword() : "") + ")";
        }
    }

    private final Instance root;
    private final Map<List<JoinDef>, Instance> instances = new LinkedHashMap<>();
    private final AliasAllocator aliases;

    JoinTree(SourceDef rootSource, AliasAllocator aliases) {
        this.aliases = aliases;
        String hint = rootSource.name() != null ? rootSource.name() : "base";
        this.root = new Instance(List.of(), null, rootSource, null, aliases.allocate(hint));
        instances.put(List.of(), root);
        requireSourceInternals(root);
    }

    Instance root() {
        return root;
    }

    /**
     * Returns the instance at a path, adding it and its ancestors if needed.
     *
     * @param path joins walked from the root source
     * @return the instance
     */
    Instance require(List<JoinDef> path) {
        Instance existing = instances.get(path);
        if (existing != null) {
            return existing;
        }
        Instance parent = require(path.subList(0, path.size() - 1));
        JoinDef join = path.get(path.size() - 1);
        List<JoinDef> key = List.copyOf(path);
        Instance instance = new Instance(key, join, join.source(), parent, aliases.allocate(join.name()));
        instances.put(key, instance);
        logger.debug("Added join instance {} at {}", instance, ExprPaths.describe(key));

        Set<Instance> touched = new LinkedHashSet<>();
        JoinCondition condition = join.condition();
        if (condition instanceof JoinCondition.KeyMatch match) {
            collect(match.parentValue(), parent.path, touched);
        } else if (condition instanceof JoinCondition.OnCondition on) {
            collect(on.condition(), parent.path, touched);
        } else if (condition instanceof JoinCondition.Unnest unnest) {
            collect(unnest.arrayValue(), parent.path, touched);
        }
        for (Instance dependency : touched) {
            if (!instance.isAncestorOrSelf(dependency)) {
                instance.dependencies.add(dependency);
            }
        }
        requireSourceInternals(instance);
        return instance;
    }

    private void requireSourceInternals(Instance instance) {
        Set<Instance> ignored = new LinkedHashSet<>();
        DimensionDef primaryKey = instance.source.primaryKeyField();
        if (primaryKey != null) {
            collect(primaryKey.expression(), instance.path, ignored);
        }
        for (Expr filter : instance.source.filters()) {
            collect(filter, instance.path, ignored);
        }
    }

    /**
     * Adds every instance an expression reads.
     *
     * @param expr the expression
     * @param prefix the path the expression is anchored at
     */
    void requireExpr(Expr expr, List<JoinDef> prefix) {
        collect(expr, prefix, new LinkedHashSet<>());
    }

    private void collect(Expr expr, List<JoinDef> prefix, Set<Instance> touched) {
        if (expr == null || expr instanceof Expr.Ungroup) {
            // ungrouped aggregates are computed by their own subquery
            return;
        }
        if (expr instanceof Expr.FieldRef ref) {
            List<JoinDef> path = ExprPaths.concat(prefix, ref.joinPath());
            touched.add(require(path));
            collect(ref.definition(), path, touched);
            return;
        }
        if (expr instanceof Expr.Column) {
            touched.add(require(prefix));
            return;
        }
        if (expr instanceof Expr.OutputRef output) {
            collect(output.definition(), prefix, touched);
            return;
        }
        if (expr instanceof Expr.Aggregate aggregate && aggregate.level() != null) {
            touched.add(require(ExprPaths.concat(prefix, aggregate.level())));
        }
        for (Expr child : expr.children()) {
            collect(child, prefix, touched);
        }
    }

    /**
     * Returns whether rows of the given instance can be repeated by the joins of
     * this tree.
     *
     * <p>The root is repeated by any {@code join_many} or {@code join_cross}. A
     * joined instance is repeated when a join on its path from the root is not a
     * {@code join_many} (a {@code join_one} row can match many parents), or when a
     * fanning join hangs off that path.
     *
     * @param level the instance whose rows are aggregated
     * @return true if aggregates at that level must count distinct rows
     */
    boolean isFanned(Instance level) {
        for (Instance i = level; !i.isRoot(); i = i.parent) {
            if (i.join.relationship() != Relationship.MANY) {
                return true;
            }
        }
        for (Instance instance : instances.values()) {
            if (!instance.isRoot() && !instance.isAncestorOrSelf(level) && instance.join.relationship().fansOut()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the joined instances in an order where each comes after its parent
     * and after the instances its condition reads.
     *
     * @return the non-root instances in emission order
     * @throws CompilationException if two conditions read each other
     */
    List<Instance> joinOrder() {
        List<Instance> ordered = new ArrayList<>();
        Set<Instance> visited = new LinkedHashSet<>();
        Set<Instance> visiting = new LinkedHashSet<>();
        visited.add(root);
        for (Instance instance : instances.values()) {
            visit(instance, visited, visiting, ordered);
        }
        return Collections.unmodifiableList(ordered);
    }

    private void visit(Instance instance, Set<Instance> visited, Set<Instance> visiting, List<Instance> ordered) {
        if (visited.contains(instance)) {
            return;
        }
        if (!visiting.add(instance)) {
            throw CompilationException.structural("Join cycle through '" + instance.alias() + "'",
                instance.join().location());
        }
        visit(instance.parent, visited, visiting, ordered);
        for (Instance dependency : instance.dependencies) {
            visit(dependency, visited, visiting, ordered);
        }
        visiting.remove(instance);
        visited.add(instance);
        ordered.add(instance);
    }

    int size() {
        return instances.size();
    }
}
