package com.quarry.types;

import java.util.Locale;

/**
 * Time granularities used by truncation, extraction, offsets and ranges.
 */
public enum TimeUnit {
    SECOND("second", false),
    MINUTE("minute", false),
    HOUR("hour", false),
    DAY("day", true),
    WEEK("week", true),
    MONTH("month", true),
    QUARTER("quarter", true),
    YEAR("year", true);

    private final String keyword;
    private final boolean dateUnit;

    TimeUnit(String keyword, boolean dateUnit) {
        this.keyword = keyword;
        this.dateUnit = dateUnit;
    }

    /**
     * Returns the lower-case unit keyword, as written in the language and in SQL.
     *
     * @return the unit keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Returns whether this unit can be applied to a date (day or coarser).
     *
     * @return true for day, week, month, quarter and year
     */
    public boolean isDateUnit() {
        return dateUnit;
    }

    /**
     * Parses a unit keyword, accepting the plural form ({@code days}).
     *
     * @param text the keyword
     * @return the unit
     * @throws IllegalArgumentException if the keyword is not a time unit
     */
    public static TimeUnit parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("time unit must not be null");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("s")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (TimeUnit unit : values()) {
            if (unit.keyword.equals(normalized)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown time unit: '" + text + "'");
    }
}
