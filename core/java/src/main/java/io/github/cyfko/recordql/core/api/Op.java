package io.github.cyfko.recordql.core.api;

/**
 * Enumeration of the comparators a field condition can apply.
 * <p>
 * Each comparator defines its own display symbol and the kind of comparison it performs.
 * Comparators are deliberately enumerated rather than derived from the value types, so that
 * every coercion rule and every unsupported combination (for example ordering on an
 * identifier) is an explicit decision of the engine.
 * </p>
 *
 * <p><strong>Comparator Categories:</strong></p>
 * <pre>{@code
 * // Equality
 * account.Name == 'Foo'          -> Op.EQ
 * account.Name != 'Foo'          -> Op.NE
 *
 * // Ordering (numeric, temporal and text fields only)
 * account.Revenue < 1000         -> Op.LT
 * account.Revenue <= 1000        -> Op.LTE
 * account.Revenue > 1000         -> Op.GT
 * account.Revenue >= 1000        -> Op.GTE
 *
 * // Membership
 * account.Type IN ('A', 'B')     -> Op.IN
 * account.Type NOT IN ('A', 'B') -> Op.NOT_IN
 *
 * // Presence (no operand)
 * account.Phone HAS VALUE        -> Op.HAS_VALUE
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    /** Equality operator: "=" */
    EQ("="),

    /** Not equal operator: "!=" */
    NE("!="),

    /** Less than operator: "&lt;" */
    LT("<"),

    /** Less than or equal operator: "&lt;=" */
    LTE("<="),

    /** Greater than operator: "&gt;" */
    GT(">"),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">="),

    /** Set membership operator: "IN" */
    IN("IN"),

    /** Negated set membership operator: "NOT IN" */
    NOT_IN("NOT IN"),

    /** Presence operator: "HAS VALUE" */
    HAS_VALUE("HAS VALUE");

    private final String symbol;

    Op(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the display symbol of the operator, such as "=", "IN" or "HAS VALUE".
     *
     * @return the symbol representing the operator
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Indicates whether this operator needs a comparison value.
     *
     * @return {@code false} for {@link #HAS_VALUE}, {@code true} otherwise
     */
    public boolean requiresValue() {
        return this != HAS_VALUE;
    }

    /**
     * Indicates whether this operator orders values ({@link #LT}, {@link #LTE}, {@link #GT}, {@link #GTE}).
     *
     * @return {@code true} for ordering operators
     */
    public boolean isOrdering() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Indicates whether this operator expects a set of values ({@link #IN}, {@link #NOT_IN}).
     *
     * @return {@code true} for membership operators
     */
    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }
}
