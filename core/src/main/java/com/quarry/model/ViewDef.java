package com.quarry.model;

import com.quarry.ast.StageNode;
import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * A named view of a source ({@code query: name is …} inside an explore).
 *
 * <p>The pipeline is kept as syntax and resolved against the source the view is
 * used from, so a view keeps working on refinements of its source. The declaring
 * source validates it once when it is built.
 */
public final class ViewDef implements FieldDef {

    private final String name;
    private final List<StageNode> pipeline;
    private final Location location;

    public ViewDef(String name, List<StageNode> pipeline, Location location) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.pipeline = List.copyOf(pipeline);
        this.location = location != null ? location : Location.UNKNOWN;
    }

    @Override
    public String name() {
        return name;
    }

    public List<StageNode> pipeline() {
        return pipeline;
    }

    @Override
    public Location location() {
        return location;
    }

    @Override
    public String toString() {
        return "View(" + name + ")";
    }
}
