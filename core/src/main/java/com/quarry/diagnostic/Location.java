package com.quarry.diagnostic;

import java.util.Objects;

/**
 * A position in a source document: document URI plus 1-based line and column.
 */
public record Location(String url, int line, int column) {

    /** Location used for entities that have no source text, such as schema columns. */
    public static final Location UNKNOWN = new Location("internal://unknown", 0, 0);

    public Location {
        Objects.requireNonNull(url, "url must not be null");
    }

    @Override
    public String toString() {
        return url + ":" + line + ":" + column;
    }
}
