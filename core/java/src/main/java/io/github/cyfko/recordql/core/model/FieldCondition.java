package io.github.cyfko.recordql.core.model;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.api.Op;

/**
 * Immutable (field, comparator, value) triple: one condition of a
 * {@link io.github.cyfko.recordql.core.match.FieldsMatch}.
 * <p>
 * Only structural rules are checked on construction. Whether the value fits the field's declared
 * type, and whether an {@code IN} set holds supported elements, is decided when the condition is
 * evaluated against a record, since only then is the declared type known.
 * </p>
 *
 * @param field the field reference, never {@code null}
 * @param op    the comparator, never {@code null}
 * @param value the comparison value; must be {@code null} for {@link Op#HAS_VALUE}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FieldCondition(FieldRef field, Op op, Object value) {

    public FieldCondition {
        if (field == null)
            throw new IllegalArgumentException("field cannot be null");
        if (op == null)
            throw new IllegalArgumentException("operator cannot be null");
        if (!op.requiresValue() && value != null)
            throw new IllegalArgumentException("value must be null for operator " + op);
    }

    @Override
    public String toString() {
        return op.requiresValue()
                ? field.path() + " " + op.getSymbol() + " " + value
                : field.path() + " " + op.getSymbol();
    }
}
