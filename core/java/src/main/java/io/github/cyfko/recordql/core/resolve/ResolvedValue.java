package io.github.cyfko.recordql.core.resolve;

import io.github.cyfko.recordql.core.model.FieldType;

import java.util.Optional;

/**
 * Raw value of a resolved field, tagged with the field's declared type.
 *
 * @param value        the raw value, possibly {@code null}
 * @param declaredType the declared type of the terminal field, or {@code null} when a relation on
 *                     the path was {@code null} and its schema could not be resolved
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResolvedValue(Object value, FieldType declaredType) {

    private static final ResolvedValue UNREACHED = new ResolvedValue(null, null);

    /**
     * @return the value of a path interrupted by a {@code null} relation of unknown schema
     */
    public static ResolvedValue unreached() {
        return UNREACHED;
    }

    /**
     * @param declaredType the declared type of the terminal field, {@code null} if unknown
     * @return the value of a path interrupted by a {@code null} relation
     */
    public static ResolvedValue unreached(FieldType declaredType) {
        return declaredType == null ? UNREACHED : new ResolvedValue(null, declaredType);
    }

    public boolean isNull() {
        return value == null;
    }

    public Optional<FieldType> type() {
        return Optional.ofNullable(declaredType);
    }
}
