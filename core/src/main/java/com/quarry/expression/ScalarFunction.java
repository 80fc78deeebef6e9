package com.quarry.expression;

import com.quarry.types.DataType;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;

import java.util.Locale;

/**
 * Built-in scalar functions.
 *
 * <p>Each function has a fixed arity range and result type. A {@code null}
 * result type means the result has the type of the first argument.
 */
public enum ScalarFunction {
    CONCAT("concat", 1, Integer.MAX_VALUE, StringType.get()),
    LOWER("lower", 1, 1, StringType.get()),
    UPPER("upper", 1, 1, StringType.get()),
    LENGTH("length", 1, 1, NumberType.get()),
    TRIM("trim", 1, 1, StringType.get()),
    SUBSTR("substr", 2, 3, StringType.get()),
    ROUND("round", 1, 2, NumberType.get()),
    FLOOR("floor", 1, 1, NumberType.get()),
    CEIL("ceil", 1, 1, NumberType.get()),
    ABS("abs", 1, 1, NumberType.get()),
    COALESCE("coalesce", 1, Integer.MAX_VALUE, null);

    private final String keyword;
    private final int minArgs;
    private final int maxArgs;
    private final DataType resultType;

    ScalarFunction(String keyword, int minArgs, int maxArgs, DataType resultType) {
        this.keyword = keyword;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.resultType = resultType;
    }

    public String keyword() {
        return keyword;
    }

    public int minArgs() {
        return minArgs;
    }

    public int maxArgs() {
        return maxArgs;
    }

    /**
     * Returns the fixed result type, or null when the result follows the first argument.
     *
     * @return the result type or null
     */
    public DataType resultType() {
        return resultType;
    }

    /**
     * Looks up a function by name.
     *
     * @param name the function name as written
     * @return the function, or null if unknown
     */
    public static ScalarFunction fromKeyword(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (ScalarFunction function : values()) {
            if (function.keyword.equals(normalized)) {
                return function;
            }
        }
        return null;
    }
}
