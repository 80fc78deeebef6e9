package com.quarry.ast;

import com.quarry.diagnostic.Location;

import java.util.List;
import java.util.Objects;

/**
 * An entry of {@code group_by:}, {@code aggregate:}, {@code project:} or {@code index:}.
 */
public sealed interface QueryItem {

    Location location();

    /** A reference to an existing field, output under its last path element. */
    record Reference(List<String> path, Location location) implements QueryItem {
        public Reference {
            path = List.copyOf(path);
            if (path.isEmpty()) {
                throw new IllegalArgumentException("path must not be empty");
            }
        }

        public String outputName() {
            return path.get(path.size() - 1);
        }
    }

    /** {@code name is expression} */
    record Definition(FieldDeclaration field) implements QueryItem {
        public Definition {
            Objects.requireNonNull(field, "field must not be null");
        }

        @Override
        public Location location() {
            return field.location();
        }
    }

    /** {@code *} or {@code join.*}, optionally with names excluded. */
    record Wildcard(List<String> joinPath, List<String> except, Location location) implements QueryItem {
        public Wildcard {
            joinPath = List.copyOf(joinPath);
            except = List.copyOf(except);
        }
    }
}
