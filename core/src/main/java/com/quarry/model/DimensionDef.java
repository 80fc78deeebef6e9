package com.quarry.model;

import com.quarry.diagnostic.Location;
import com.quarry.expression.Expr;
import com.quarry.types.DataType;

import java.util.Objects;

/**
 * A scalar, per-row field. Table columns are dimensions whose expression is a
 * {@link Expr.Column}.
 */
public final class DimensionDef implements FieldDef {

    private final String name;
    private final Expr expression;
    private final Location location;

    public DimensionDef(String name, Expr expression, Location location) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.location = location != null ? location : Location.UNKNOWN;
    }

    /**
     * Creates the dimension for a physical column.
     *
     * @param name the column name
     * @param type the column type
     * @return a column dimension
     */
    public static DimensionDef column(String name, DataType type) {
        return new DimensionDef(name, new Expr.Column(name, type), Location.UNKNOWN);
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
        return "Dimension(" + name + ": " + type().typeName() + ")";
    }
}
