package com.quarry.model;

import com.quarry.diagnostic.Location;

import java.util.Objects;

/**
 * A resolved ordering term: an output column and a direction.
 */
public record OrderSpec(String field, OrderDirection direction, Location location) {

    public OrderSpec {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }
}
