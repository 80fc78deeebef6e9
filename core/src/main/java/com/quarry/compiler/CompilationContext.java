package com.quarry.compiler;

import com.quarry.config.CompilerSettings;
import com.quarry.dialect.Dialect;

import java.util.Objects;

/**
 * State shared by every SELECT of one compiled statement.
 */
final class CompilationContext {

    private final Dialect dialect;
    private final CompilerSettings settings;
    private final AliasAllocator aliases = new AliasAllocator();

    CompilationContext(Dialect dialect, CompilerSettings settings) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    Dialect dialect() {
        return dialect;
    }

    CompilerSettings settings() {
        return settings;
    }

    AliasAllocator aliases() {
        return aliases;
    }

    String quote(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    /**
     * Renders {@code alias.column} with both parts quoted.
     */
    String qualified(String alias, String column) {
        return dialect.quoteIdentifier(alias) + "." + dialect.quoteIdentifier(column);
    }
}
