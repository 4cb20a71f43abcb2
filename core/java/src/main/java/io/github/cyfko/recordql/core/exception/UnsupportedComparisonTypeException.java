package io.github.cyfko.recordql.core.exception;

/**
 * Exception thrown when a comparator is applied to values it cannot compare.
 * <p>
 * Raised at evaluation time, when the declared type of the resolved field is known:
 * </p>
 * <ul>
 *   <li>{@code IN}/{@code NOT_IN} given something other than a collection, or a collection whose
 *       elements are not all of one supported primitive kind compatible with the field</li>
 *   <li>an ordering comparator on a BOOLEAN, IDENTIFIER or RELATION field</li>
 *   <li>an equality target that cannot be coerced to the field's type</li>
 *   <li>a {@code null} operand to an ordering comparator under
 *       {@link io.github.cyfko.recordql.core.config.NullOrderingPolicy#STRICT_EXCEPTION}</li>
 * </ul>
 *
 * <pre>{@code
 * // → "Operator IN requires elements of one supported primitive kind, got Object"
 * view.filter(Match.field("Name").isIn(Set.of(new Object())));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnsupportedComparisonTypeException extends RuntimeException {

    /**
     * @param message the description of the unsupported combination
     */
    public UnsupportedComparisonTypeException(String message) {
        super(message);
    }

    /**
     * @param message the description of the unsupported combination
     * @param cause   the underlying conversion failure
     */
    public UnsupportedComparisonTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
