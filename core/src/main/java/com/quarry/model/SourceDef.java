package com.quarry.model;

import com.quarry.diagnostic.Location;
import com.quarry.expression.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A source (explore): a relation plus the namespace of fields defined on it.
 *
 * <p>Sources are immutable. Refinements build a new source that shares the
 * field definitions of the one it refines.
 */
public final class SourceDef {

    private final String name;
    private final SourceOrigin origin;
    private final Namespace namespace;
    private final String primaryKey;
    private final List<Expr> filters;
    private final Location location;

    public SourceDef(String name, SourceOrigin origin, Namespace namespace, String primaryKey,
                     List<Expr> filters, Location location) {
        this.name = name;
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.primaryKey = primaryKey;
        this.filters = List.copyOf(filters);
        this.location = location != null ? location : Location.UNKNOWN;
    }

    /**
     * Returns the name of the source, or null for anonymous sources.
     *
     * @return the source name
     */
    public String name() {
        return name;
    }

    public SourceOrigin origin() {
        return origin;
    }

    public Namespace namespace() {
        return namespace;
    }

    /**
     * Returns the exposed name of the primary key field, or null.
     *
     * @return the primary key name
     */
    public String primaryKey() {
        return primaryKey;
    }

    /**
     * Returns the primary key field, or null if the source has none or the key
     * field is no longer exposed.
     *
     * @return the primary key dimension
     */
    public DimensionDef primaryKeyField() {
        if (primaryKey == null) {
            return null;
        }
        FieldDef field = namespace.lookup(primaryKey);
        return field instanceof DimensionDef ? (DimensionDef) field : null;
    }

    /**
     * Returns the filters ANDed into every query against this source.
     *
     * @return the source-level filters
     */
    public List<Expr> filters() {
        return filters;
    }

    public Location location() {
        return location;
    }

    public SourceDef withName(String newName) {
        return new SourceDef(newName, origin, namespace, primaryKey, filters, location);
    }

    public SourceDef withNamespace(Namespace newNamespace) {
        return new SourceDef(name, origin, newNamespace, primaryKey, filters, location);
    }

    public SourceDef withPrimaryKey(String newPrimaryKey) {
        return new SourceDef(name, origin, namespace, newPrimaryKey, filters, location);
    }

    public SourceDef withFilters(List<Expr> additional) {
        List<Expr> combined = new ArrayList<>(filters);
        combined.addAll(additional);
        return new SourceDef(name, origin, namespace, primaryKey, combined, location);
    }

    @Override
    public String toString() {
        return "Source(" + (name != null ? name : "<anonymous>") + ", " + namespace + ")";
    }
}
