package com.quarry.dialect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Registry of the built-in dialects, looked up by name.
 *
 * <p>Dialects are stateless, so each lookup may share one instance.
 */
public final class Dialects {

    private static final Map<String, Dialect> DIALECTS;

    static {
        Map<String, Dialect> dialects = new LinkedHashMap<>();
        register(dialects, DuckDBDialect::new);
        register(dialects, PostgresDialect::new);
        Dialect standardSql = register(dialects, StandardSQLDialect::new);
        dialects.put("bigquery", standardSql);
        register(dialects, MySQLDialect::new);
        DIALECTS = Collections.unmodifiableMap(dialects);
    }

    private Dialects() {
    }

    private static Dialect register(Map<String, Dialect> dialects, Supplier<Dialect> factory) {
        Dialect dialect = factory.get();
        dialects.put(dialect.name(), dialect);
        return dialect;
    }

    /**
     * Returns the dialect registered under a name.
     *
     * @param name the dialect name, case-insensitive
     * @return the dialect
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static Dialect get(String name) {
        Dialect dialect = name == null ? null : DIALECTS.get(name.toLowerCase(Locale.ROOT));
        if (dialect == null) {
            throw new IllegalArgumentException(
                "Unknown dialect: '" + name + "'. Known dialects: " + DIALECTS.keySet());
        }
        return dialect;
    }

    public static boolean isKnown(String name) {
        return name != null && DIALECTS.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return DIALECTS.keySet();
    }
}
