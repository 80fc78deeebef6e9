package com.quarry.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable compiler settings.
 *
 * <p>{@link #fromSystemProperties()} reads each setting from a system property
 * and falls back to the default when the property is absent or malformed.
 */
public final class CompilerSettings {
    private static final Logger logger = LoggerFactory.getLogger(CompilerSettings.class);

    /** Default dialect used by the model loader */
    public static final String DEFAULT_DIALECT = "duckdb";

    /** Default row count for {@code sample: true} */
    public static final long DEFAULT_SAMPLE_ROWS = 50_000L;

    /** Default bound on translate/update rounds */
    public static final int DEFAULT_MAX_TRANSLATE_ROUNDS = 100;

    /** System property for the default dialect */
    public static final String PROP_DIALECT = "quarry.dialect";

    /** System property for the default sample row count */
    public static final String PROP_SAMPLE_DEFAULT_ROWS = "quarry.sample.defaultRows";

    /** System property for the translate/update round limit */
    public static final String PROP_MAX_TRANSLATE_ROUNDS = "quarry.maxTranslateRounds";

    private static final CompilerSettings DEFAULTS =
        new CompilerSettings(DEFAULT_DIALECT, DEFAULT_SAMPLE_ROWS, DEFAULT_MAX_TRANSLATE_ROUNDS);

    private final String dialect;
    private final long sampleDefaultRows;
    private final int maxTranslateRounds;

    public CompilerSettings(String dialect, long sampleDefaultRows, int maxTranslateRounds) {
        if (dialect == null || dialect.isEmpty()) {
            throw new IllegalArgumentException("dialect must not be null or empty");
        }
        if (sampleDefaultRows <= 0) {
            throw new IllegalArgumentException("sampleDefaultRows must be positive: " + sampleDefaultRows);
        }
        if (maxTranslateRounds <= 0) {
            throw new IllegalArgumentException("maxTranslateRounds must be positive: " + maxTranslateRounds);
        }
        this.dialect = dialect;
        this.sampleDefaultRows = sampleDefaultRows;
        this.maxTranslateRounds = maxTranslateRounds;
    }

    public static CompilerSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the settings from system properties.
     *
     * @return the configured settings
     */
    public static CompilerSettings fromSystemProperties() {
        String dialect = System.getProperty(PROP_DIALECT);
        return new CompilerSettings(
            dialect == null || dialect.isBlank() ? DEFAULT_DIALECT : dialect.trim(),
            getConfiguredLong(PROP_SAMPLE_DEFAULT_ROWS, DEFAULT_SAMPLE_ROWS),
            (int) getConfiguredLong(PROP_MAX_TRANSLATE_ROUNDS, DEFAULT_MAX_TRANSLATE_ROUNDS));
    }

    public String dialect() {
        return dialect;
    }

    public long sampleDefaultRows() {
        return sampleDefaultRows;
    }

    public int maxTranslateRounds() {
        return maxTranslateRounds;
    }

    public CompilerSettings withDialect(String newDialect) {
        return new CompilerSettings(newDialect, sampleDefaultRows, maxTranslateRounds);
    }

    public CompilerSettings withSampleDefaultRows(long rows) {
        return new CompilerSettings(dialect, rows, maxTranslateRounds);
    }

    public CompilerSettings withMaxTranslateRounds(int rounds) {
        return new CompilerSettings(dialect, sampleDefaultRows, rounds);
    }

    // ========== Configuration Helpers ==========

    private static long getConfiguredLong(String property, long defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed > 0 && parsed <= Integer.MAX_VALUE) {
                    return parsed;
                }
                logger.warn("Ignoring out of range value '{}' for {}, using {}", value, property, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed value '{}' for {}, using {}", value, property, defaultValue);
            }
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "CompilerSettings(dialect=" + dialect + ", sampleDefaultRows=" + sampleDefaultRows +
            ", maxTranslateRounds=" + maxTranslateRounds + ")";
    }
}
