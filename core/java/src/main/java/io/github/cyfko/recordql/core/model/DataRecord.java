package io.github.cyfko.recordql.core.model;

import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;

import java.util.Set;

/**
 * Host-provided structured record: a row of a {@link RecordSchema} whose fields may or may not
 * have been populated.
 * <p>
 * This interface is the boundary between the engine and the host record system. The engine only
 * reads records through it, and produces new ones through {@link #copyOnly(Set)}. It never
 * mutates a record it was given.
 * </p>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>{@link #isLoaded(String)} distinguishes "never fetched" from "fetched, value is null"</li>
 *   <li>A relation field returns another {@code DataRecord} or {@code null}</li>
 *   <li>Unknown field names fail with {@link IllegalArgumentException}</li>
 *   <li>{@code equals}/{@code hashCode} define the deduplication of {@code RecordView.asSet()}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see MapRecord
 */
public interface DataRecord {

    /**
     * @return the schema of this record, never {@code null}
     */
    RecordSchema getSchema();

    /**
     * Tells whether {@code field} was populated on this record.
     *
     * @param field a field name of this record's schema
     * @return {@code true} if the field holds a value, possibly {@code null}
     * @throws IllegalArgumentException if the schema does not declare {@code field}
     */
    boolean isLoaded(String field);

    /**
     * Returns the raw value of {@code field}.
     *
     * @param field a field name of this record's schema
     * @return the value, a {@code DataRecord} for relations, possibly {@code null}
     * @throws FieldNotLoadedException  if the field was never populated
     * @throws IllegalArgumentException if the schema does not declare {@code field}
     */
    Object get(String field);

    /**
     * @return the names of the populated fields, in schema declaration order
     */
    Set<String> getPopulatedFields();

    /**
     * Creates a new record of the same schema where only {@code fields} are populated, with the
     * values they hold on this record. Every other field is explicitly unset.
     *
     * @param fields direct field names to keep; fields not loaded on this record stay unset
     * @return a new record, never {@code this}
     * @throws IllegalArgumentException if the schema does not declare one of {@code fields}
     */
    DataRecord copyOnly(Set<String> fields);
}
