package com.quarry.expression;

import com.quarry.exception.SuppressedReferenceException;
import com.quarry.model.FieldDef;

/**
 * The names an expression can see.
 */
public interface FieldSpace {

    /**
     * Looks up a top-level name.
     *
     * @param name the name
     * @return the field, or null if the name is unknown
     * @throws SuppressedReferenceException if the name belongs to a field whose
     *         definition failed
     */
    FieldDef lookup(String name);

    /**
     * Looks up an output column of the current stage, visible to {@code having}
     * and {@code order_by} only.
     *
     * @param name the output name
     * @return the output's defining expression, or null
     */
    default Expr output(String name) {
        return null;
    }
}
