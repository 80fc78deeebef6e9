package com.quarry.types;

import java.util.Objects;

/**
 * Represents a repeated record: an array whose elements are {@link StructType} rows.
 *
 * <p>Arrays appear as the output of a {@code nest:} entry and as repeated record
 * columns in table schemas. A field of this type is navigated like a
 * {@code join_many}.
 */
public final class ArrayType implements DataType {

    private final StructType elementType;

    /**
     * Creates an array type.
     *
     * @param elementType the type of each element
     */
    public ArrayType(StructType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    /**
     * Returns the element type.
     *
     * @return the element struct type
     */
    public StructType elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "array";
    }

    @Override
    public boolean isNested() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        return elementType.equals(((ArrayType) o).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName(), elementType);
    }

    @Override
    public String toString() {
        return "ArrayType(" + elementType + ")";
    }
}
