package com.trendwatch.core.trend;

/**
 * Raised when a trend definition (or a set of definitions for a subsystem)
 * is invalid. Always fatal to the creation of that definition: invalid
 * input is never coerced.
 *
 * @since 1.0.0
 */
public class TrendValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    /** What was wrong with the definition. */
    public enum Kind {
        /** Name, description or a histogram name is missing or blank. */
        WRONG_TYPE,
        /** The histogram name collection itself is missing. */
        NOT_COLLECTION,
        /** The histogram name collection is empty. */
        NO_HISTOGRAMS,
        /** The metric is missing or not a known variant. */
        WRONG_METRIC,
        /** An attached alarm is not an alarm reference. */
        WRONG_ALARM_TYPE,
        /** Two trends of one subsystem share a name. */
        DUPLICATE_NAME
    }

    private final Kind kind;

    public TrendValidationException(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
