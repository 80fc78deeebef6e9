package com.quarry.model;

import com.quarry.diagnostic.Location;

/**
 * A named member of a source's namespace.
 *
 * <p>Field definitions are shared by identity: a source built with
 * {@code accept}, {@code except} or {@code rename} exposes the very same
 * {@code FieldDef} objects under possibly different names, so a computed
 * expression is never duplicated.
 */
public sealed interface FieldDef permits DimensionDef, MeasureDef, JoinDef, ViewDef {

    /**
     * Returns the name the field was declared with.
     *
     * @return the declared name
     */
    String name();

    /**
     * Returns where the field was declared.
     *
     * @return the declaration location
     */
    Location location();
}
