package io.github.cyfko.recordql.core.utils;

import io.github.cyfko.recordql.core.api.Op;
import io.github.cyfko.recordql.core.extract.ValueKind;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldType;

import java.util.Collection;
import java.util.Optional;

/**
 * Static validation of comparison values against an operator and a declared field type.
 * <p>
 * Centralizes the rules deciding which (operator, field type, value) combinations can be evaluated:
 * </p>
 * <ul>
 *     <li>EQ/NE: the value must be {@code null} or coercible to the field's kind; relations compare records</li>
 *     <li>LT/LTE/GT/GTE: the field type must be orderable (NUMERIC, DATE, DATETIME, TEXT)</li>
 *     <li>IN/NOT_IN: the value must be a collection whose non-null elements are all of one
 *         supported primitive kind, compatible with the field</li>
 *     <li>HAS_VALUE: always valid, the value is ignored</li>
 * </ul>
 * <p>
 * A {@code null} declared type means the field's type is unknown (a {@code null} relation whose
 * schema was declared by name only); only the shape of the value is checked then.
 * </p>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorValidationUtils {

    private OperatorValidationUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates the compatibility between an operator, a comparison value and a declared field type.
     *
     * @param op           the operator, not null
     * @param target       the comparison value
     * @param declaredType the declared type of the field, {@code null} if unknown
     * @return the reason the combination cannot be evaluated, or empty if it is valid
     * @throws NullPointerException if {@code op} is null
     */
    public static Optional<String> validateTargetForOperator(Op op, Object target, FieldType declaredType) {
        if (op == null) {
            throw new NullPointerException("Operator cannot be null");
        }

        return switch (op) {
            case EQ, NE -> validateEqualityTarget(op, target, declaredType);
            case LT, LTE, GT, GTE -> validateOrderingTarget(op, target, declaredType);
            case IN, NOT_IN -> validateMembershipTarget(op, target, declaredType);
            case HAS_VALUE -> Optional.empty();
        };
    }

    private static Optional<String> validateEqualityTarget(Op op, Object target, FieldType declaredType) {
        if (target == null || declaredType == null) {
            return Optional.empty();
        }
        if (declaredType == FieldType.RELATION) {
            return target instanceof DataRecord
                    ? Optional.empty()
                    : Optional.of(String.format(
                            "Value of type %s is not compatible with field type RELATION for operator %s",
                            target.getClass().getSimpleName(), op));
        }
        return validateScalar(op, target, declaredType);
    }

    private static Optional<String> validateOrderingTarget(Op op, Object target, FieldType declaredType) {
        if (declaredType != null && !declaredType.isOrderable()) {
            return Optional.of(String.format(
                    "Operator %s cannot order values of field type %s", op, declaredType));
        }
        if (target == null) {
            return Optional.empty();
        }
        if (declaredType == null) {
            Optional<ValueKind<?>> kind = ValueKind.detect(target);
            return kind.isPresent() && kind.get().isOrderable()
                    ? Optional.empty()
                    : Optional.of(String.format(
                            "Operator %s cannot order values of type %s", op, target.getClass().getSimpleName()));
        }
        return validateScalar(op, target, declaredType);
    }

    private static Optional<String> validateMembershipTarget(Op op, Object target, FieldType declaredType) {
        if (!(target instanceof Collection<?> values)) {
            return Optional.of(String.format(
                    "Operator %s requires a set of values, got %s",
                    op, target == null ? "null" : target.getClass().getSimpleName()));
        }
        if (declaredType == FieldType.RELATION) {
            return Optional.of(String.format(
                    "Operator %s cannot test membership on field type RELATION", op));
        }

        ValueKind<?> elementKind = null;
        for (Object element : values) {
            if (element == null) {
                continue;
            }
            Optional<ValueKind<?>> detected = ValueKind.detect(element);
            if (detected.isEmpty()) {
                return Optional.of(String.format(
                        "Operator %s requires elements of one supported primitive kind, got %s",
                        op, element.getClass().getSimpleName()));
            }
            if (declaredType != null) {
                ValueKind<?> fieldKind = declaredType.valueKind().orElseThrow();
                if (!fieldKind.accepts(element)) {
                    return Optional.of(String.format(
                            "Set element of type %s is not compatible with field type %s for operator %s",
                            element.getClass().getSimpleName(), declaredType, op));
                }
            } else if (elementKind != null && elementKind != detected.get()) {
                return Optional.of(String.format(
                        "Operator %s requires elements of one kind, got both %s and %s",
                        op, elementKind, detected.get()));
            }
            elementKind = detected.get();
        }
        return Optional.empty();
    }

    private static Optional<String> validateScalar(Op op, Object target, FieldType declaredType) {
        ValueKind<?> kind = declaredType.valueKind().orElseThrow();
        if (!kind.accepts(target)) {
            return Optional.of(String.format(
                    "Value of type %s is not compatible with field type %s for operator %s",
                    target.getClass().getSimpleName(), declaredType, op));
        }
        return Optional.empty();
    }
}
