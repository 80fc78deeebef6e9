package com.quarry.types;

/**
 * Sealed interface for all data types in the quarry type system.
 *
 * <p>This represents the type of a field or expression as seen by the modeling
 * language. The type system is intentionally small: the language has one numeric
 * type, and nested data is either a record ({@link StructType}) or a repeated
 * record ({@link ArrayType}).
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Atomic types: StringType, NumberType, BooleanType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Nested types: StructType, ArrayType</li>
 *   <li>UnsupportedType for columns whose SQL type the language cannot express</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, NumberType, StringType, DateType, TimestampType,
            ArrayType, StructType, NullType, UnsupportedType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether values of this type are dates or timestamps.
     *
     * @return true for temporal types
     */
    default boolean isTemporal() {
        return false;
    }

    /**
     * Returns whether values of this type are records or repeated records.
     *
     * @return true for nested types
     */
    default boolean isNested() {
        return false;
    }
}
