package com.quarry.ast;

import com.quarry.diagnostic.Location;
import com.quarry.model.OrderDirection;

/**
 * An {@code order_by} entry naming an output field or a 1-based output ordinal.
 * Exactly one of {@code field} and {@code ordinal} is set; a null direction keeps
 * the natural direction of the field.
 */
public record OrderItem(String field, Integer ordinal, OrderDirection direction, Location location) {

    public OrderItem {
        if ((field == null) == (ordinal == null)) {
            throw new IllegalArgumentException("exactly one of field and ordinal must be set");
        }
    }

    public static OrderItem byName(String field, OrderDirection direction, Location location) {
        return new OrderItem(field, null, direction, location);
    }

    public static OrderItem byOrdinal(int ordinal, OrderDirection direction, Location location) {
        return new OrderItem(null, ordinal, direction, location);
    }
}
