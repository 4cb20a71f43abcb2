package io.github.cyfko.recordql.core.config;

/**
 * Mode used to compare text values.
 */
public enum TextMatchMode {
    /** Compare text exactly (case-sensitive). */
    CASE_SENSITIVE,
    /** Compare text ignoring case. */
    CASE_INSENSITIVE
}
