package com.quarry.compiler;

import com.quarry.ast.ExprNode;
import com.quarry.ast.FieldDeclaration;
import com.quarry.ast.NestItem;
import com.quarry.ast.OrderItem;
import com.quarry.ast.QueryItem;
import com.quarry.ast.StageNode;
import com.quarry.ast.StageProperty;
import com.quarry.diagnostic.Location;
import com.quarry.exception.CompilationException;
import com.quarry.exception.SuppressedReferenceException;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.Expr;
import com.quarry.expression.ExpressionTranslator;
import com.quarry.expression.FieldSpace;
import com.quarry.expression.SourceSpace;
import com.quarry.model.DimensionDef;
import com.quarry.model.FieldDef;
import com.quarry.model.JoinDef;
import com.quarry.model.MeasureDef;
import com.quarry.model.Namespace;
import com.quarry.model.OrderDirection;
import com.quarry.model.OrderSpec;
import com.quarry.model.QueryDef;
import com.quarry.model.SampleSpec;
import com.quarry.model.SourceDef;
import com.quarry.model.SourceOrigin;
import com.quarry.model.Stage;
import com.quarry.model.StageOutput;
import com.quarry.model.ViewDef;
import com.quarry.types.ArrayType;
import com.quarry.types.NumberType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the stages of a pipeline against the source they read.
 *
 * <p>The first stage reads the query's source; every later stage reads the
 * output of the stage before it, exposed as a source whose fields are the
 * previous outputs. View references ({@code -> name}, {@code nest: name}) are
 * expanded into the stages of the view, with refinements merged into its only
 * stage.
 *
 * <p>The result is a list of {@link Stage}s whose expressions are fully typed.
 * All failures are thrown as {@link CompilationException}s located at the
 * offending element; a reference to an invalid field surfaces as
 * {@link SuppressedReferenceException}.
 */
public final class PipelineResolver {
    private static final Logger logger = LoggerFactory.getLogger(PipelineResolver.class);

    private final Deque<ViewDef> viewsInProgress = new ArrayDeque<>();

    /**
     * Resolves a pipeline that starts at a source.
     *
     * @param source the source the first stage reads
     * @param stages the stage syntax
     * @return the resolved stages
     */
    public List<Stage> resolve(SourceDef source, List<StageNode> stages) {
        List<Stage> resolved = new ArrayList<>();
        resolveInto(source, stages, List.of(), resolved);
        return resolved;
    }

    /**
     * Resolves stages appended to an existing query ({@code query -> {...}}).
     *
     * @param base the query being extended
     * @param stages the appended stage syntax
     * @return the stages of the base query followed by the resolved new ones
     */
    public List<Stage> append(QueryDef base, List<StageNode> stages) {
        List<Stage> resolved = new ArrayList<>(base.pipeline());
        resolveInto(nextInput(base.lastStage()), stages, List.of(), resolved);
        return resolved;
    }

    /**
     * Returns the source the stage after the given one reads: one column per
     * output, with nested outputs readable as repeated records.
     *
     * @param stage the stage
     * @return the output source
     */
    public static SourceDef nextInput(Stage stage) {
        Namespace namespace = Namespace.EMPTY;
        for (StageOutput output : stage.outputs()) {
            if (output.type() instanceof ArrayType array) {
                namespace = namespace.with(output.name(), JoinDef.repeated(output.name(), array, output.location()));
            } else {
                namespace = namespace.with(output.name(), DimensionDef.column(output.name(), output.type()));
            }
        }
        return new SourceDef(null, new SourceOrigin.PreviousStage(), namespace, null, List.of(), stage.location());
    }

    private void resolveInto(SourceDef source, List<StageNode> stages, List<String> enclosingGroups,
                             List<Stage> resolved) {
        SourceDef input = source;
        boolean first = resolved.isEmpty();
        for (StageNode node : stages) {
            if (node instanceof StageNode.ViewReference reference) {
                if (!first) {
                    throw CompilationException.nameResolution(
                        "'" + reference.viewName() + "' is not a view of the previous stage's output",
                        reference.location());
                }
                ViewDef view = lookupView(input, reference.viewName(), reference.location());
                List<StageNode> expanded = refine(view, reference.refinements(), reference.location());
                enterView(view, reference.location());
                try {
                    resolveInto(input, expanded, enclosingGroups, resolved);
                } finally {
                    viewsInProgress.pop();
                }
            } else {
                StageNode.Inline inline = (StageNode.Inline) node;
                List<String> groups = resolved.isEmpty() ? enclosingGroups : List.of();
                resolved.add(resolveStage(input, inline.properties(), groups, inline.location()));
            }
            input = nextInput(resolved.get(resolved.size() - 1));
            first = false;
        }
    }

    private void enterView(ViewDef view, Location location) {
        for (ViewDef active : viewsInProgress) {
            if (active == view) {
                throw CompilationException.structural("View '" + view.name() + "' refers to itself", location);
            }
        }
        viewsInProgress.push(view);
    }

    private static ViewDef lookupView(SourceDef source, String name, Location location) {
        FieldDef field = new SourceSpace(source).lookup(name);
        if (field == null) {
            throw CompilationException.nameResolution("'" + name + "' is not defined", location);
        }
        if (!(field instanceof ViewDef view)) {
            throw CompilationException.typeError("'" + name + "' is not a view", location);
        }
        return view;
    }

    /**
     * Returns the stages of a view with refinements merged into its single stage.
     */
    private static List<StageNode> refine(ViewDef view, List<StageProperty> refinements, Location location) {
        if (refinements.isEmpty()) {
            return view.pipeline();
        }
        if (view.pipeline().size() != 1) {
            throw CompilationException.structural(
                "View '" + view.name() + "' has " + view.pipeline().size() + " stages and cannot be refined", location);
        }
        StageNode only = view.pipeline().get(0);
        if (only instanceof StageNode.ViewReference inner) {
            List<StageProperty> merged = new ArrayList<>(inner.refinements());
            merged.addAll(refinements);
            return List.of(new StageNode.ViewReference(inner.viewName(), merged, inner.location()));
        }
        StageNode.Inline inline = (StageNode.Inline) only;
        List<StageProperty> merged = new ArrayList<>(inline.properties());
        merged.addAll(refinements);
        return List.of(new StageNode.Inline(merged, inline.location()));
    }

    // ==================== One stage ====================

    private enum Kind {
        REDUCE("group_by/aggregate/nest"),
        PROJECT("project"),
        INDEX("index");

        private final String keywords;

        Kind(String keywords) {
            this.keywords = keywords;
        }
    }

    private Stage resolveStage(SourceDef source, List<StageProperty> properties, List<String> enclosingGroups,
                               Location location) {
        Kind kind = kindOf(properties, location);
        SourceDef input = declare(source, properties);
        FieldSpace space = new SourceSpace(input);
        ExpressionTranslator translator = new ExpressionTranslator(space);

        List<Expr> filters = new ArrayList<>();
        Integer limit = null;
        SampleSpec sample = null;
        List<OrderItem> orderItems = new ArrayList<>();
        for (StageProperty property : properties) {
            if (property instanceof StageProperty.Where where) {
                for (ExprNode filter : where.filters()) {
                    filters.add(translator.translateFilter(filter, "where"));
                }
            } else if (property instanceof StageProperty.Limit l) {
                limit = l.rows();
            } else if (property instanceof StageProperty.Top top) {
                limit = top.rows();
            } else if (property instanceof StageProperty.Sample s) {
                sample = s.spec();
            } else if (property instanceof StageProperty.OrderBy orderBy) {
                orderItems.addAll(orderBy.items());
            }
        }

        switch (kind) {
            case INDEX:
                return resolveIndex(input, properties, filters, orderItems, limit, sample, location);
            case PROJECT:
                return resolveProject(input, properties, filters, orderItems, limit, sample, location);
            default:
                return resolveReduce(input, properties, filters, orderItems, limit, sample, enclosingGroups, location);
        }
    }

    private static Kind kindOf(List<StageProperty> properties, Location location) {
        Set<Kind> kinds = new LinkedHashSet<>();
        for (StageProperty property : properties) {
            if (property instanceof StageProperty.GroupBy || property instanceof StageProperty.Aggregate
                || property instanceof StageProperty.Nest) {
                kinds.add(Kind.REDUCE);
            } else if (property instanceof StageProperty.Project) {
                kinds.add(Kind.PROJECT);
            } else if (property instanceof StageProperty.Index) {
                kinds.add(Kind.INDEX);
            }
        }
        if (kinds.isEmpty()) {
            throw CompilationException.structural(
                "A query stage needs group_by, aggregate, nest, project or index", location);
        }
        if (kinds.size() > 1) {
            List<String> names = new ArrayList<>();
            for (Kind kind : kinds) {
                names.add(kind.keywords);
            }
            throw CompilationException.structural(
                "A query stage cannot mix " + String.join(" and ", names), location);
        }
        Kind kind = kinds.iterator().next();
        if (kind != Kind.REDUCE) {
            for (StageProperty property : properties) {
                if (property instanceof StageProperty.Having) {
                    throw CompilationException.structural(
                        "having can only be used in a stage with group_by or aggregate", property.location());
                }
            }
        }
        return kind;
    }

    /**
     * Adds the stage's {@code declare:} fields to the source it reads.
     */
    private static SourceDef declare(SourceDef source, List<StageProperty> properties) {
        SourceDef input = source;
        for (StageProperty property : properties) {
            if (!(property instanceof StageProperty.Declare declare)) {
                continue;
            }
            for (FieldDeclaration field : declare.fields()) {
                if (input.namespace().contains(field.name())) {
                    throw CompilationException.nameResolution(
                        "'" + field.name() + "' is already defined", field.location());
                }
                Expr expr = new ExpressionTranslator(new SourceSpace(input)).translate(field.expression());
                FieldDef def = expr.isAggregate()
                    ? new MeasureDef(field.name(), expr, field.location())
                    : new DimensionDef(field.name(), expr, field.location());
                input = input.withNamespace(input.namespace().with(field.name(), def));
            }
        }
        return input;
    }

    // ==================== Reduce ====================

    private Stage resolveReduce(SourceDef input, List<StageProperty> properties, List<Expr> filters,
                                List<OrderItem> orderItems, Integer limit, SampleSpec sample,
                                List<String> enclosingGroups, Location location) {
        ExpressionTranslator translator = new ExpressionTranslator(new SourceSpace(input));
        Map<String, StageOutput> outputs = new LinkedHashMap<>();
        List<String> groupNames = new ArrayList<>();
        for (StageProperty property : properties) {
            if (property instanceof StageProperty.GroupBy groupBy) {
                for (QueryItem item : groupBy.items()) {
                    StageOutput.Field field = resolveItem(translator, item, StageOutput.Role.GROUP_BY, "group_by");
                    addOutput(outputs, field);
                    groupNames.add(field.name());
                }
            }
        }

        List<String> visibleGroups = new ArrayList<>(enclosingGroups);
        visibleGroups.addAll(groupNames);
        for (StageProperty property : properties) {
            if (property instanceof StageProperty.Aggregate aggregate) {
                for (QueryItem item : aggregate.items()) {
                    StageOutput.Field field = resolveItem(translator, item, StageOutput.Role.AGGREGATE, "aggregate");
                    checkUngroupFields(field.expression(), visibleGroups);
                    addOutput(outputs, field);
                }
            } else if (property instanceof StageProperty.Nest nest) {
                for (NestItem item : nest.items()) {
                    addOutput(outputs, resolveNest(input, item, visibleGroups));
                }
            }
        }
        List<StageOutput> ordered = reorder(properties, outputs);

        FieldSpace havingSpace = new OutputSpace(new SourceSpace(input), outputs);
        ExpressionTranslator havingTranslator = new ExpressionTranslator(havingSpace);
        List<Expr> having = new ArrayList<>();
        for (StageProperty property : properties) {
            if (property instanceof StageProperty.Having h) {
                for (ExprNode condition : h.filters()) {
                    Expr expr = havingTranslator.translateHaving(condition);
                    if (ExpressionCompiler.containsUngroup(expr)) {
                        throw CompilationException.structural(
                            "all() and exclude() cannot be used in having", condition.location());
                    }
                    having.add(expr);
                }
            }
        }

        List<OrderSpec> orderBy = orderItems.isEmpty()
            ? defaultOrder(ordered)
            : resolveOrder(orderItems, ordered);
        return new Stage.Reduce(input, ordered, filters, having, orderBy, limit, sample, location);
    }

    /**
     * Puts outputs back in the order they were written, since group_by entries are
     * resolved before the aggregates that may name them.
     */
    private static List<StageOutput> reorder(List<StageProperty> properties, Map<String, StageOutput> outputs) {
        List<StageOutput> ordered = new ArrayList<>();
        for (StageProperty property : properties) {
            List<String> names = new ArrayList<>();
            if (property instanceof StageProperty.GroupBy groupBy) {
                names = itemNames(groupBy.items());
            } else if (property instanceof StageProperty.Aggregate aggregate) {
                names = itemNames(aggregate.items());
            } else if (property instanceof StageProperty.Nest nest) {
                for (NestItem item : nest.items()) {
                    names.add(item.outputName());
                }
            }
            for (String name : names) {
                StageOutput output = outputs.get(name);
                if (output != null && !ordered.contains(output)) {
                    ordered.add(output);
                }
            }
        }
        return ordered;
    }

    private static List<String> itemNames(List<QueryItem> items) {
        List<String> names = new ArrayList<>();
        for (QueryItem item : items) {
            if (item instanceof QueryItem.Reference reference) {
                names.add(reference.outputName());
            } else if (item instanceof QueryItem.Definition definition) {
                names.add(definition.field().name());
            }
        }
        return names;
    }

    private StageOutput.Nest resolveNest(SourceDef input, NestItem item, List<String> enclosingGroups) {
        List<Stage> pipeline = new ArrayList<>();
        if (item instanceof NestItem.ViewReference reference) {
            ViewDef view = lookupView(input, reference.viewName(), reference.location());
            List<StageNode> expanded = refine(view, reference.refinements(), reference.location());
            enterView(view, reference.location());
            try {
                resolveInto(input, expanded, enclosingGroups, pipeline);
            } finally {
                viewsInProgress.pop();
            }
        } else {
            NestItem.Definition definition = (NestItem.Definition) item;
            resolveInto(input, definition.pipeline(), enclosingGroups, pipeline);
        }
        logger.debug("Resolved nest '{}' with {} stage(s)", item.outputName(), pipeline.size());
        return new StageOutput.Nest(item.outputName(), pipeline, item.location());
    }

    /**
     * Checks that {@code all()} and {@code exclude()} only name grouping columns
     * of this stage or of a stage it is nested in.
     */
    private static void checkUngroupFields(Expr expr, List<String> visibleGroups) {
        if (expr instanceof Expr.Ungroup ungroup) {
            for (String name : ungroup.fields()) {
                if (!visibleGroups.contains(name)) {
                    throw CompilationException.nameResolution(
                        "'" + name + "' is not a group_by field of this query", ungroup.location());
                }
            }
        }
        if (expr instanceof Expr.FieldRef ref && ref.isAggregate()) {
            checkUngroupFields(ref.definition(), visibleGroups);
        }
        for (Expr child : expr.children()) {
            checkUngroupFields(child, visibleGroups);
        }
    }

    // ==================== Project ====================

    private Stage resolveProject(SourceDef input, List<StageProperty> properties, List<Expr> filters,
                                 List<OrderItem> orderItems, Integer limit, SampleSpec sample, Location location) {
        ExpressionTranslator translator = new ExpressionTranslator(new SourceSpace(input));
        Map<String, StageOutput> outputs = new LinkedHashMap<>();
        for (StageProperty property : properties) {
            if (!(property instanceof StageProperty.Project project)) {
                continue;
            }
            for (QueryItem item : project.items()) {
                if (item instanceof QueryItem.Wildcard wildcard) {
                    for (Map.Entry<String, String> entry : expandWildcard(input, wildcard).entrySet()) {
                        List<String> path = List.of(entry.getValue().split("\\."));
                        Expr expr = translator.translateScalar(new ExprNode.FieldRef(path, wildcard.location()),
                            "project");
                        addOutput(outputs, new StageOutput.Field(entry.getKey(), expr, StageOutput.Role.PROJECT,
                            wildcard.location()));
                    }
                } else {
                    addOutput(outputs, resolveItem(translator, item, StageOutput.Role.PROJECT, "project"));
                }
            }
        }
        List<StageOutput> ordered = new ArrayList<>(outputs.values());
        List<OrderSpec> orderBy = orderItems.isEmpty() ? List.of() : resolveOrder(orderItems, ordered);
        return new Stage.Project(input, ordered, filters, orderBy, limit, sample, location);
    }

    // ==================== Index ====================

    private Stage resolveIndex(SourceDef input, List<StageProperty> properties, List<Expr> filters,
                               List<OrderItem> orderItems, Integer limit, SampleSpec sample, Location location) {
        ExpressionTranslator translator = new ExpressionTranslator(new SourceSpace(input));
        Map<String, Stage.IndexField> fields = new LinkedHashMap<>();
        Expr weight = null;
        for (StageProperty property : properties) {
            if (!(property instanceof StageProperty.Index index)) {
                continue;
            }
            for (QueryItem item : index.items()) {
                if (item instanceof QueryItem.Wildcard wildcard) {
                    for (String path : expandWildcard(input, wildcard).values()) {
                        Expr expr = translator.translateScalar(
                            new ExprNode.FieldRef(List.of(path.split("\\.")), wildcard.location()), "index");
                        fields.putIfAbsent(path, new Stage.IndexField(path, expr));
                    }
                } else if (item instanceof QueryItem.Reference reference) {
                    String path = String.join(".", reference.path());
                    Expr expr = translator.translateScalar(
                        new ExprNode.FieldRef(reference.path(), reference.location()), "index");
                    requireIndexable(path, expr, reference.location());
                    fields.putIfAbsent(path, new Stage.IndexField(path, expr));
                } else {
                    FieldDeclaration declaration = ((QueryItem.Definition) item).field();
                    Expr expr = translator.translateScalar(declaration.expression(), "index");
                    requireIndexable(declaration.name(), expr, declaration.location());
                    fields.putIfAbsent(declaration.name(), new Stage.IndexField(declaration.name(), expr));
                }
            }
            if (index.by() != null) {
                weight = indexWeight(translator, index.by(), index.location());
            }
        }
        if (fields.isEmpty()) {
            throw CompilationException.structural("index has no fields to index", location);
        }
        List<StageOutput> outputs = new Stage.Index(input, List.copyOf(fields.values()), weight, filters,
            List.of(), limit, sample, location).outputs();
        List<OrderSpec> orderBy = orderItems.isEmpty()
            ? List.of(new OrderSpec(Stage.Index.WEIGHT, OrderDirection.DESC, location))
            : resolveOrder(orderItems, outputs);
        return new Stage.Index(input, List.copyOf(fields.values()), weight, filters, orderBy, limit, sample, location);
    }

    private static void requireIndexable(String path, Expr expr, Location location) {
        if (expr.type().isNested()) {
            throw CompilationException.typeError("'" + path + "' holds nested data and cannot be indexed", location);
        }
    }

    private static Expr indexWeight(ExpressionTranslator translator, List<String> by, Location location) {
        Expr ref = translator.translate(new ExprNode.FieldRef(by, location));
        if (!(ref.type() instanceof NumberType)) {
            throw CompilationException.typeError("index weight '" + String.join(".", by) + "' must be a number",
                location);
        }
        if (ref.isAggregate()) {
            return ref;
        }
        return new Expr.Aggregate(AggregateFunction.SUM, ref, null, location);
    }

    // ==================== Shared ====================

    private static StageOutput.Field resolveItem(ExpressionTranslator translator, QueryItem item,
                                                 StageOutput.Role role, String context) {
        if (item instanceof QueryItem.Wildcard wildcard) {
            throw CompilationException.structural("Wildcards cannot be used in " + context, wildcard.location());
        }
        String name;
        ExprNode node;
        Location location = item.location();
        if (item instanceof QueryItem.Reference reference) {
            name = reference.outputName();
            node = new ExprNode.FieldRef(reference.path(), reference.location());
        } else {
            FieldDeclaration declaration = ((QueryItem.Definition) item).field();
            name = declaration.name();
            node = declaration.expression();
        }
        Expr expr = role == StageOutput.Role.AGGREGATE
            ? translator.translateAggregate(node, context)
            : translator.translateScalar(node, context);
        if (role == StageOutput.Role.GROUP_BY && expr.type().isNested()) {
            throw CompilationException.typeError("'" + name + "' holds nested data and cannot be grouped by",
                location);
        }
        return new StageOutput.Field(name, expr, role, location);
    }

    private static void addOutput(Map<String, StageOutput> outputs, StageOutput output) {
        if (outputs.containsKey(output.name())) {
            throw CompilationException.structural(
                "Output field '" + output.name() + "' is defined more than once", output.location());
        }
        outputs.put(output.name(), output);
    }

    /**
     * Expands {@code *} or {@code join.*} to output name and field path pairs.
     * Only dimensions are expanded; joins, measures and views are skipped.
     */
    private static Map<String, String> expandWildcard(SourceDef input, QueryItem.Wildcard wildcard) {
        SourceDef source = input;
        if (!wildcard.joinPath().isEmpty()) {
            List<JoinDef> joins = new ExpressionTranslator(new SourceSpace(input))
                .resolveJoinPath(wildcard.joinPath(), wildcard.location());
            source = joins.get(joins.size() - 1).source();
        }
        for (String excluded : wildcard.except()) {
            if (!source.namespace().contains(excluded)) {
                throw CompilationException.nameResolution(
                    "'" + excluded + "' is not defined", wildcard.location());
            }
        }
        String prefix = wildcard.joinPath().isEmpty() ? "" : String.join(".", wildcard.joinPath()) + ".";
        Map<String, String> expanded = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDef> entry : source.namespace().entries().entrySet()) {
            if (entry.getValue() instanceof DimensionDef dimension
                && !dimension.type().isNested()
                && !wildcard.except().contains(entry.getKey())) {
                expanded.put(entry.getKey(), prefix + entry.getKey());
            }
        }
        return expanded;
    }

    private static List<OrderSpec> resolveOrder(List<OrderItem> items, List<StageOutput> outputs) {
        List<OrderSpec> specs = new ArrayList<>();
        for (OrderItem item : items) {
            StageOutput output;
            if (item.ordinal() != null) {
                int ordinal = item.ordinal();
                if (ordinal < 1 || ordinal > outputs.size()) {
                    throw CompilationException.nameResolution(
                        "order_by position " + ordinal + " is out of range 1-" + outputs.size(), item.location());
                }
                output = outputs.get(ordinal - 1);
            } else {
                output = null;
                for (StageOutput candidate : outputs) {
                    if (candidate.name().equals(item.field())) {
                        output = candidate;
                    }
                }
                if (output == null) {
                    throw CompilationException.nameResolution(
                        "'" + item.field() + "' is not an output of this stage and cannot be used in order_by",
                        item.location());
                }
            }
            if (output instanceof StageOutput.Nest) {
                throw CompilationException.typeError(
                    "'" + output.name() + "' is nested data and cannot be used in order_by", item.location());
            }
            OrderDirection direction = item.direction() != null ? item.direction() : OrderDirection.ASC;
            specs.add(new OrderSpec(output.name(), direction, item.location()));
        }
        return specs;
    }

    /**
     * Orders by the first time or aggregate output descending, or else by the
     * first other scalar output ascending.
     */
    private static List<OrderSpec> defaultOrder(List<StageOutput> outputs) {
        StageOutput ascending = null;
        for (StageOutput output : outputs) {
            if (!(output instanceof StageOutput.Field field)) {
                continue;
            }
            if (field.type().isTemporal() || field.role() == StageOutput.Role.AGGREGATE) {
                return List.of(new OrderSpec(field.name(), OrderDirection.DESC, field.location()));
            }
            if (ascending == null) {
                ascending = field;
            }
        }
        if (ascending != null) {
            return List.of(new OrderSpec(ascending.name(), OrderDirection.ASC, ascending.location()));
        }
        return List.of();
    }

    /**
     * Field space of {@code having}: the stage's input fields plus its outputs.
     */
    private static final class OutputSpace implements FieldSpace {
        private final FieldSpace input;
        private final Map<String, StageOutput> outputs;

        OutputSpace(FieldSpace input, Map<String, StageOutput> outputs) {
            this.input = input;
            this.outputs = outputs;
        }

        @Override
        public FieldDef lookup(String name) {
            return input.lookup(name);
        }

        @Override
        public Expr output(String name) {
            StageOutput output = outputs.get(name);
            return output instanceof StageOutput.Field field ? field.expression() : null;
        }
    }
}
