package io.github.cyfko.recordql.core.compare;

import io.github.cyfko.recordql.core.api.Op;
import io.github.cyfko.recordql.core.config.MatchConfig;
import io.github.cyfko.recordql.core.config.NullOrderingPolicy;
import io.github.cyfko.recordql.core.config.TextMatchMode;
import io.github.cyfko.recordql.core.exception.UnsupportedComparisonTypeException;
import io.github.cyfko.recordql.core.extract.ValueKind;
import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.resolve.ResolvedValue;
import io.github.cyfko.recordql.core.utils.OperatorValidationUtils;

import java.util.Collection;
import java.util.Objects;

/**
 * Evaluates one comparator against a resolved field value.
 * <p>
 * Dispatch is by comparator; coercion is by the declared type of the field. The comparison value
 * is coerced to the field's {@link ValueKind} before comparing, so {@code equalTo(1000)} matches a
 * NUMERIC field holding {@code 1000.00}.
 * </p>
 *
 * <table border="1">
 * <caption>Comparator semantics</caption>
 * <tr><th>Operator</th><th>Semantics</th></tr>
 * <tr><td>EQ / NE</td><td>value equality by declared type; {@code null} equals {@code null}</td></tr>
 * <tr><td>LT / LTE / GT / GTE</td><td>NUMERIC, DATE, DATETIME, TEXT only; {@code null} operands follow {@link NullOrderingPolicy}</td></tr>
 * <tr><td>IN / NOT_IN</td><td>membership by value equality in a set of one primitive kind</td></tr>
 * <tr><td>HAS_VALUE</td><td>the value is not {@code null}</td></tr>
 * </table>
 *
 * <p>Unsupported combinations raise {@link UnsupportedComparisonTypeException}; they are never
 * silently {@code false}. This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueComparator {

    private ValueComparator() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Compares a resolved field value with a comparison value.
     *
     * @param resolved the resolved field value, not null
     * @param op       the comparator, not null
     * @param target   the comparison value; a collection for IN/NOT_IN, ignored for HAS_VALUE
     * @param config   the evaluation strategies, not null
     * @return the outcome of the comparison
     * @throws UnsupportedComparisonTypeException if the comparison cannot be performed on these types
     */
    public static boolean compare(ResolvedValue resolved, Op op, Object target, MatchConfig config) {
        Objects.requireNonNull(resolved, "resolved value cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        OperatorValidationUtils.validateTargetForOperator(op, target, resolved.declaredType())
                .ifPresent(error -> {
                    throw new UnsupportedComparisonTypeException(error);
                });

        return switch (op) {
            case HAS_VALUE -> !resolved.isNull();
            case EQ -> areEqual(resolved, target, config);
            case NE -> !areEqual(resolved, target, config);
            case LT, LTE, GT, GTE -> order(resolved, op, target, config);
            case IN -> isMember(resolved, (Collection<?>) target, config);
            case NOT_IN -> !isMember(resolved, (Collection<?>) target, config);
        };
    }

    private static boolean areEqual(ResolvedValue resolved, Object target, MatchConfig config) {
        Object raw = resolved.value();
        if (raw == null || target == null) {
            return raw == null && target == null;
        }
        if (resolved.declaredType() == FieldType.RELATION) {
            return raw.equals(target);
        }
        return sameValue(kindOf(resolved, target), raw, target, config);
    }

    private static boolean order(ResolvedValue resolved, Op op, Object target, MatchConfig config) {
        Object raw = resolved.value();
        if (raw == null || target == null) {
            if (config.getNullOrderingPolicy() == NullOrderingPolicy.STRICT_EXCEPTION) {
                throw new UnsupportedComparisonTypeException(String.format(
                        "Operator %s cannot order a null %s", op, raw == null ? "field value" : "comparison value"));
            }
            return false;
        }

        int comparison = compareValues(kindOf(resolved, target), raw, target, config);
        return switch (op) {
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            default -> throw new IllegalStateException("Not an ordering operator: " + op);
        };
    }

    private static boolean isMember(ResolvedValue resolved, Collection<?> values, MatchConfig config) {
        Object raw = resolved.value();
        for (Object element : values) {
            if (element == null || raw == null) {
                if (element == raw) return true;
                continue;
            }
            if (sameValue(kindOf(resolved, element), raw, element, config)) {
                return true;
            }
        }
        return false;
    }

    private static ValueKind<?> kindOf(ResolvedValue resolved, Object target) {
        if (resolved.declaredType() != null) {
            return resolved.declaredType().valueKind().orElseThrow();
        }
        Object sample = resolved.value() != null ? resolved.value() : target;
        return ValueKind.detect(sample).orElseThrow(() -> new UnsupportedComparisonTypeException(
                "Cannot compare values of type " + sample.getClass().getSimpleName()));
    }

    private static <T> boolean sameValue(ValueKind<T> kind, Object raw, Object target, MatchConfig config) {
        T left = coerce(kind, raw);
        T right = coerce(kind, target);
        if (ValueKind.TEXT.equals(kind) && config.getTextMatchMode() == TextMatchMode.CASE_INSENSITIVE) {
            return ((String) left).equalsIgnoreCase((String) right);
        }
        return kind.sameValue(left, right);
    }

    private static <T> int compareValues(ValueKind<T> kind, Object raw, Object target, MatchConfig config) {
        T left = coerce(kind, raw);
        T right = coerce(kind, target);
        if (ValueKind.TEXT.equals(kind) && config.getTextMatchMode() == TextMatchMode.CASE_INSENSITIVE) {
            return String.CASE_INSENSITIVE_ORDER.compare((String) left, (String) right);
        }
        return kind.compare(left, right);
    }

    private static <T> T coerce(ValueKind<T> kind, Object value) {
        try {
            return kind.coerce(value);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedComparisonTypeException(e.getMessage(), e);
        }
    }
}
