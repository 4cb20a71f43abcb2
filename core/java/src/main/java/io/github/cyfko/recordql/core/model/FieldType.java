package io.github.cyfko.recordql.core.model;

import io.github.cyfko.recordql.core.extract.ValueKind;

import java.util.Optional;

/**
 * Declared type of a record field.
 * <p>
 * Every primitive type maps to exactly one {@link ValueKind}. {@link #RELATION} fields hold
 * another {@link DataRecord} (or {@code null}) and have no primitive kind.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FieldType {
    /** true/false flag */
    BOOLEAN(ValueKind.BOOLEAN),
    /** calendar date without time */
    DATE(ValueKind.DATE),
    /** date and time, without zone */
    DATETIME(ValueKind.DATETIME),
    /** any number, held as BigDecimal */
    NUMERIC(ValueKind.NUMERIC),
    /** record identifier */
    IDENTIFIER(ValueKind.IDENTIFIER),
    /** free text */
    TEXT(ValueKind.TEXT),
    /** reference to a related record */
    RELATION(null);

    private final ValueKind<?> valueKind;

    FieldType(ValueKind<?> valueKind) {
        this.valueKind = valueKind;
    }

    /**
     * Returns the primitive kind of values held by fields of this type.
     *
     * @return the kind, or empty for {@link #RELATION}
     */
    public Optional<ValueKind<?>> valueKind() {
        return Optional.ofNullable(valueKind);
    }

    /**
     * Indicates whether fields of this type support ordering comparators.
     *
     * @return {@code true} for NUMERIC, DATE, DATETIME and TEXT
     */
    public boolean isOrderable() {
        return valueKind != null && valueKind.isOrderable();
    }
}
