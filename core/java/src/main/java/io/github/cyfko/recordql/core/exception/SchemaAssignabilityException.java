package io.github.cyfko.recordql.core.exception;

/**
 * Exception thrown when records are not assignable to a requested schema or Java type.
 * <p>
 * Typical sources are {@code RecordView.asList(Class)} on records of another class, and
 * {@code RecordView.mapAll(...)} returning a record of a foreign schema.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SchemaAssignabilityException extends RuntimeException {

    public SchemaAssignabilityException(String message) {
        super(message);
    }

    public SchemaAssignabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
