package com.quarry.types;

import java.util.Objects;

/**
 * Type of a column whose SQL type the modeling language cannot express.
 *
 * <p>Such columns may be projected and grouped by, but no operator accepts them.
 */
public final class UnsupportedType implements DataType {

    private final String sqlType;

    public UnsupportedType(String sqlType) {
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType must not be null");
    }

    /**
     * Returns the raw SQL type reported by the schema provider.
     *
     * @return the SQL type text
     */
    public String sqlType() {
        return sqlType;
    }

    @Override
    public String typeName() {
        return "unsupported";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnsupportedType && sqlType.equals(((UnsupportedType) o).sqlType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName(), sqlType);
    }

    @Override
    public String toString() {
        return "unsupported(" + sqlType + ")";
    }
}
