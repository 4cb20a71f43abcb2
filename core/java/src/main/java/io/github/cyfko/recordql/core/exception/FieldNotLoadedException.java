package io.github.cyfko.recordql.core.exception;

import io.github.cyfko.recordql.core.model.DataRecord;

/**
 * Exception thrown when a field or relation is read on a record that never populated it.
 * <p>
 * A field that was populated with {@code null} is <em>loaded</em>; only a field the host never
 * fetched for that row is reported. The error is not retriable: the caller has to load the field
 * before filtering, grouping or plucking on it.
 * </p>
 *
 * <pre>{@code
 * try {
 *     view.filter(Match.field("Parent.Name").equalTo("Acme"));
 * } catch (FieldNotLoadedException e) {
 *     // e.getSchemaName() -> "Account", e.getFieldName() -> "Parent"
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see DataRecord#isLoaded(String)
 */
public class FieldNotLoadedException extends RuntimeException {

    private final String schemaName;
    private final String fieldName;

    /**
     * Creates an exception for {@code fieldName} missing on a record of {@code schemaName}.
     *
     * @param schemaName the schema of the inspected record
     * @param fieldName  the field that was never populated
     */
    public FieldNotLoadedException(String schemaName, String fieldName) {
        super(String.format("Field '%s' was not loaded on %s record", fieldName, schemaName));
        this.schemaName = schemaName;
        this.fieldName = fieldName;
    }

    /**
     * Creates an exception carrying the path being resolved when the unloaded field was hit.
     *
     * @param schemaName the schema of the inspected record
     * @param fieldName  the field that was never populated
     * @param path       the full dotted path being resolved
     * @param cause      the host failure, if any
     */
    public FieldNotLoadedException(String schemaName, String fieldName, String path, Throwable cause) {
        super(String.format("Field '%s' was not loaded on %s record while resolving '%s'", fieldName, schemaName, path), cause);
        this.schemaName = schemaName;
        this.fieldName = fieldName;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
