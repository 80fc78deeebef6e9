package com.quarry.types;

/**
 * Data type representing a number value.
 *
 * <p>The modeling language does not distinguish integers from floating point
 * numbers; the SQL type of a number is decided by the dialect.
 */
public final class NumberType implements DataType {

    private static final NumberType INSTANCE = new NumberType();

    private NumberType() {}

    public static NumberType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "number";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NumberType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
