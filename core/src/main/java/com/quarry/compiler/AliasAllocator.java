package com.quarry.compiler;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hands out table aliases that are unique within one SQL statement.
 *
 * <p>One allocator is shared by every subquery of a compiled statement, so a
 * correlated subquery never shadows an alias of an enclosing query.
 */
final class AliasAllocator {

    private final Set<String> used = new HashSet<>();

    /**
     * Returns a fresh alias derived from a hint.
     *
     * @param hint a readable base name, such as a join name
     * @return the hint itself if unused, otherwise the hint with a numeric suffix
     */
    String allocate(String hint) {
        String base = sanitize(hint);
        String alias = base;
        int suffix = 1;
        // aliases are compared case-insensitively since some databases fold them
        while (!used.add(alias.toLowerCase(Locale.ROOT))) {
            alias = base + "_" + suffix++;
        }
        return alias;
    }

    private static String sanitize(String hint) {
        if (hint == null || hint.isEmpty()) {
            return "t";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : hint.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
