package com.quarry.expression;

import com.quarry.exception.SuppressedReferenceException;
import com.quarry.model.FieldDef;
import com.quarry.model.Namespace;
import com.quarry.model.SourceDef;

import java.util.Objects;

/**
 * Field space of a completely built source.
 */
public final class SourceSpace implements FieldSpace {

    private final Namespace namespace;

    public SourceSpace(SourceDef source) {
        this(Objects.requireNonNull(source, "source must not be null").namespace());
    }

    public SourceSpace(Namespace namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
    }

    @Override
    public FieldDef lookup(String name) {
        if (namespace.isInvalid(name)) {
            throw new SuppressedReferenceException(name);
        }
        return namespace.lookup(name);
    }
}
