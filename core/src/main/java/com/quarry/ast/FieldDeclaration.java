package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.Objects;

/**
 * {@code name is expression}
 */
public record FieldDeclaration(String name, ExprNode expression, Location location) {

    public FieldDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
