package com.quarry.model;

import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * A resolved query: the source it starts from and its pipeline.
 */
public record QueryDef(String name, SourceDef source, List<Stage> pipeline, Location location) {

    public QueryDef {
        Objects.requireNonNull(source, "source must not be null");
        pipeline = List.copyOf(pipeline);
        if (pipeline.isEmpty()) {
            throw new IllegalArgumentException("query pipeline must not be empty");
        }
    }

    public Stage lastStage() {
        return pipeline.get(pipeline.size() - 1);
    }

    public List<StageOutput> outputs() {
        return lastStage().outputs();
    }
}
