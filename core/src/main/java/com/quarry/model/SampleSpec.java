package com.quarry.model;

/**
 * Sampling requested by a stage's {@code sample:} property.
 */
public sealed interface SampleSpec {

    /** {@code sample: true}: the configured default number of rows. */
    record Default() implements SampleSpec {
    }

    /** {@code sample: N rows} */
    record Rows(long rows) implements SampleSpec {
        public Rows {
            if (rows <= 0) {
                throw new IllegalArgumentException("sample rows must be positive: " + rows);
            }
        }
    }

    /** {@code sample: P%} */
    record Percent(double percent) implements SampleSpec {
        public Percent {
            if (percent <= 0 || percent > 100) {
                throw new IllegalArgumentException("sample percent must be in (0, 100]: " + percent);
            }
        }
    }
}
