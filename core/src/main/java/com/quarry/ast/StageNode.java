package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * One {@code ->} step of a pipeline.
 */
public sealed interface StageNode {

    Location location();

    /** {@code -> { properties }} */
    record Inline(List<StageProperty> properties, Location location) implements StageNode {
        public Inline {
            properties = List.copyOf(properties);
        }
    }

    /** {@code -> viewName} or {@code -> viewName { refinements }} */
    record ViewReference(String viewName, List<StageProperty> refinements, Location location) implements StageNode {
        public ViewReference {
            Objects.requireNonNull(viewName, "viewName must not be null");
            refinements = List.copyOf(refinements);
        }
    }
}
