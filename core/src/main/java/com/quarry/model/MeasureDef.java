package com.quarry.model;

import com.quarry.diagnostic.Location;
import com.quarry.expression.Expr;
import com.quarry.types.DataType;

import java.util.Objects;

/**
 * An aggregate field.
 */
public final class MeasureDef implements FieldDef {

    private final String name;
    private final Expr expression;
    private final Location location;

    public MeasureDef(String name, Expr expression, Location location) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.location = location != null ? location : Location.UNKNOWN;
    }

    @Override
    public String name() {
        return name;
    }

    public Expr expression() {
        return expression;
    }

    public DataType type() {
        return expression.type();
    }

    @Override
    public Location location() {
        return location;
    }

    @Override
    public String toString() {
        return "Measure(" + name + ": " + type().typeName() + ")";
    }
}
