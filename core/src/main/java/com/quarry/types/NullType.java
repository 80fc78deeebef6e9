package com.quarry.types;

/**
 * Type of the {@code null} literal; compatible with every other type.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public String toString() {
        return "NullType";
    }
}
