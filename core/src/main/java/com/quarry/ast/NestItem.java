package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * An entry of {@code nest:}.
 */
public sealed interface NestItem {

    String outputName();

    Location location();

    /** {@code nest: viewName} or {@code nest: viewName { refinements }} */
    record ViewReference(String viewName, List<StageProperty> refinements, Location location) implements NestItem {
        public ViewReference {
            Objects.requireNonNull(viewName, "viewName must not be null");
            refinements = List.copyOf(refinements);
        }

        @Override
        public String outputName() {
            return viewName;
        }
    }

    /** {@code nest: name is { … } -> { … }} */
    record Definition(String name, List<StageNode> pipeline, Location location) implements NestItem {
        public Definition {
            Objects.requireNonNull(name, "name must not be null");
            pipeline = List.copyOf(pipeline);
            if (pipeline.isEmpty()) {
                throw new IllegalArgumentException("nested pipeline must not be empty");
            }
        }

        @Override
        public String outputName() {
            return name;
        }
    }
}
