package com.quarry.types;

import java.util.Locale;

/**
 * Maps SQL column types reported by a schema provider to quarry DataTypes, and
 * language type names (as written after {@code ::}) to DataTypes.
 *
 * <p>The SQL side accepts the type spellings of every supported dialect:
 * <pre>
 *   "INTEGER", "INT64", "BIGINT", "DOUBLE PRECISION", "DECIMAL(10,2)" → number
 *   "VARCHAR", "TEXT", "STRING", "CHARACTER VARYING(20)"           → string
 *   "TIMESTAMP", "DATETIME", "TIMESTAMP WITH TIME ZONE"             → timestamp
 * </pre>
 *
 * <p>Unknown types map to {@link UnsupportedType} instead of failing, so that a
 * single exotic column does not make a whole table unusable.
 *
 * @see DataType
 */
public class TypeMapper {

    private TypeMapper() {}

    /**
     * Converts a SQL type string to a quarry DataType.
     *
     * @param sqlType the SQL type string
     * @return the data type, never null
     * @throws IllegalArgumentException if sqlType is null or empty
     */
    public static DataType fromSqlType(String sqlType) {
        if (sqlType == null || sqlType.isEmpty()) {
            throw new IllegalArgumentException("sqlType must not be null or empty");
        }

        String normalized = sqlType.trim().toUpperCase(Locale.ROOT);
        int paren = normalized.indexOf('(');
        String base = paren >= 0 ? normalized.substring(0, paren).trim() : normalized;

        switch (base) {
            case "TINYINT":
            case "SMALLINT":
            case "INTEGER":
            case "INT":
            case "INT2":
            case "INT4":
            case "INT8":
            case "INT64":
            case "BIGINT":
            case "HUGEINT":
            case "UTINYINT":
            case "USMALLINT":
            case "UINTEGER":
            case "UBIGINT":
            case "FLOAT":
            case "FLOAT4":
            case "FLOAT8":
            case "FLOAT64":
            case "REAL":
            case "DOUBLE":
            case "DOUBLE PRECISION":
            case "DECIMAL":
            case "NUMERIC":
            case "BIGNUMERIC":
                return NumberType.get();
            case "VARCHAR":
            case "CHAR":
            case "CHARACTER":
            case "CHARACTER VARYING":
            case "TEXT":
            case "STRING":
            case "UUID":
                return StringType.get();
            case "BOOLEAN":
            case "BOOL":
                return BooleanType.get();
            case "DATE":
                return DateType.get();
            case "TIMESTAMP":
            case "TIMESTAMP WITHOUT TIME ZONE":
            case "TIMESTAMP WITH TIME ZONE":
            case "TIMESTAMPTZ":
            case "DATETIME":
                return TimestampType.get();
            default:
                return new UnsupportedType(sqlType.trim());
        }
    }

    /**
     * Converts a language type name, as written in a cast, to a DataType.
     *
     * @param typeName one of {@code string, number, boolean, date, timestamp}
     * @return the data type, or null if the name is not a castable type
     */
    public static DataType fromTypeName(String typeName) {
        if (typeName == null) {
            return null;
        }
        switch (typeName.trim().toLowerCase(Locale.ROOT)) {
            case "string":
                return StringType.get();
            case "number":
                return NumberType.get();
            case "boolean":
                return BooleanType.get();
            case "date":
                return DateType.get();
            case "timestamp":
                return TimestampType.get();
            default:
                return null;
        }
    }
}
