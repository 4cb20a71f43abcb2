package io.github.cyfko.recordql.core.resolve;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldDescriptor;
import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.model.RecordSchema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves {@link FieldRef}s against records.
 * <p>
 * A direct reference reads one field. A path reference walks relations segment by segment and
 * reads the terminal field on the last related record:
 * </p>
 * <pre>{@code
 * ResolvedValue name = FieldPathResolver.resolve(contact, FieldRef.parse("Account.Parent.Name"));
 * }</pre>
 *
 * <h2>Failure rules</h2>
 * <ul>
 *   <li>A segment never populated on the record being walked raises {@link FieldNotLoadedException}</li>
 *   <li>A {@code null} relation is not an error: resolution stops and yields a {@code null} value that
 *       still carries the terminal field's declared type, worked out from the related schemas</li>
 *   <li>An unknown segment, or a non-relation segment before the terminal one, raises {@link IllegalArgumentException}</li>
 * </ul>
 *
 * <p>Resolution is a pure lookup; this class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldPathResolver {

    private FieldPathResolver() {
        throw new UnsupportedOperationException("FieldPathResolver is a utility class and cannot be instantiated");
    }

    /**
     * Resolves {@code ref} against {@code record}.
     *
     * @param record the record to read, not null
     * @param ref    the field or relation path, not null
     * @return the raw value tagged with the declared type of the terminal field
     * @throws FieldNotLoadedException  if a segment was never populated
     * @throws IllegalArgumentException if a segment is unknown or cannot be navigated
     */
    public static ResolvedValue resolve(DataRecord record, FieldRef ref) {
        Objects.requireNonNull(record, "record cannot be null");
        Objects.requireNonNull(ref, "field reference cannot be null");

        List<String> segments = ref.segments();
        DataRecord current = record;

        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            boolean terminal = i == segments.size() - 1;
            String schemaName = current.getSchema().getName();
            FieldDescriptor descriptor = current.getSchema().requireField(segment);

            if (!terminal && !descriptor.isRelation()) {
                throw new IllegalArgumentException(
                        String.format("Cannot navigate through non-relationship field '%s' in %s", segment, schemaName));
            }
            if (!current.isLoaded(segment)) {
                throw segments.size() == 1
                        ? new FieldNotLoadedException(schemaName, segment)
                        : new FieldNotLoadedException(schemaName, segment, ref.path(), null);
            }

            Object value = current.get(segment);
            if (terminal) {
                return new ResolvedValue(value, descriptor.type());
            }
            if (value == null) {
                return ResolvedValue.unreached(typeBeyond(current.getSchema(), segments, i));
            }
            if (!(value instanceof DataRecord related)) {
                throw new IllegalStateException(String.format(
                        "Relation '%s' of %s holds a %s instead of a record", segment, schemaName, value.getClass().getName()));
            }
            current = related;
        }

        // FieldRef guarantees at least one segment
        throw new IllegalStateException("Empty field reference");
    }

    /**
     * Works out the declared type of {@code ref} from schemas alone.
     *
     * @param schema the schema the path starts from, not null
     * @param ref    the field or relation path, not null
     * @return the terminal field's declared type, or empty if a relation on the path was declared
     *         by name only and its schema cannot be resolved
     * @throws IllegalArgumentException if a segment is unknown or cannot be navigated
     */
    public static Optional<FieldType> declaredType(RecordSchema schema, FieldRef ref) {
        Objects.requireNonNull(schema, "schema cannot be null");
        Objects.requireNonNull(ref, "field reference cannot be null");

        List<String> segments = ref.segments();
        if (segments.size() == 1) {
            return Optional.of(schema.requireField(segments.get(0)).type());
        }
        requireRelation(schema, segments.get(0));
        return Optional.ofNullable(typeBeyond(schema, segments, 0));
    }

    // segments[relationIndex] is a relation of schema; walks the rest of the path through schemas
    private static FieldType typeBeyond(RecordSchema schema, List<String> segments, int relationIndex) {
        RecordSchema current = schema;
        for (int i = relationIndex; i < segments.size() - 1; i++) {
            Optional<RecordSchema> related = current.getRelatedSchema(segments.get(i));
            if (related.isEmpty()) {
                return null;
            }
            current = related.get();
            if (i + 1 < segments.size() - 1) {
                requireRelation(current, segments.get(i + 1));
            }
        }
        return current.requireField(segments.get(segments.size() - 1)).type();
    }

    private static void requireRelation(RecordSchema schema, String segment) {
        if (!schema.requireField(segment).isRelation()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot navigate through non-relationship field '%s' in %s", segment, schema.getName()));
        }
    }
}
