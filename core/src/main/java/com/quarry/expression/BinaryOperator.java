package com.quarry.expression;

/**
 * Binary operators of the modeling language.
 *
 * <p>Precedence is already encoded by the shape of the parse tree, so operators
 * only carry their SQL symbol and operand class.
 */
public enum BinaryOperator {
    // Arithmetic operators
    ADD("+", "addition"),
    SUBTRACT("-", "subtraction"),
    MULTIPLY("*", "multiplication"),
    DIVIDE("/", "division"),
    MODULO("%", "modulo"),

    // Comparison operators
    EQUAL("=", "equal"),
    NOT_EQUAL("!=", "not equal"),
    LESS_THAN("<", "less than"),
    LESS_THAN_OR_EQUAL("<=", "less than or equal"),
    GREATER_THAN(">", "greater than"),
    GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),

    // Pattern match operators
    MATCHES("~", "like"),
    NOT_MATCHES("!~", "not like"),

    // Logical operators
    AND("AND", "logical AND"),
    OR("OR", "logical OR"),

    // Null coalescing
    COALESCE("??", "coalesce");

    private final String symbol;
    private final String description;

    BinaryOperator(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String symbol() {
        return symbol;
    }

    public String description() {
        return description;
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY ||
               this == DIVIDE || this == MODULO;
    }

    public boolean isComparison() {
        return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
               this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
               this == GREATER_THAN_OR_EQUAL;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isMatch() {
        return this == MATCHES || this == NOT_MATCHES;
    }
}
