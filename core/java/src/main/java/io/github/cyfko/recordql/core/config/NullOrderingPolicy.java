package io.github.cyfko.recordql.core.config;

/**
 * Policies for ordering comparators (LT, LTE, GT, GTE) meeting a {@code null} operand.
 */
public enum NullOrderingPolicy {
    /** The condition does not match. */
    NO_MATCH,
    /** Throw an UnsupportedComparisonTypeException. */
    STRICT_EXCEPTION
}
