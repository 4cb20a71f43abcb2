package io.github.cyfko.recordql.core.model;

import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;
import io.github.cyfko.recordql.core.extract.ValueKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Immutable in-memory {@link DataRecord} backed by a map of field values.
 * <p>
 * A field is <em>loaded</em> when the map holds a key for it, even if the value is {@code null}.
 * Values are checked against the declared field type and normalized on write (numbers become
 * {@link java.math.BigDecimal}, UUIDs become strings, instants become UTC date-times...), so that
 * two records holding the same logical values are equal.
 * </p>
 *
 * <pre>{@code
 * MapRecord foo = MapRecord.of(account)
 *         .with("Name", "Foo")
 *         .with("Revenue", 1000);
 *
 * foo.isLoaded("Revenue");             // true
 * foo.isLoaded("Parent");              // false
 * foo.with("Revenue", 1000.0).equals(foo); // true, numerics compare by magnitude
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MapRecord implements DataRecord {

    private final RecordSchema schema;
    private final Map<String, Object> values;

    private MapRecord(RecordSchema schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = values;
    }

    /**
     * Creates a record of {@code schema} with no field populated.
     */
    public static MapRecord of(RecordSchema schema) {
        Objects.requireNonNull(schema, "schema cannot be null");
        return new MapRecord(schema, Collections.emptyMap());
    }

    /**
     * Creates a record of {@code schema} populated with {@code values}.
     *
     * @throws IllegalArgumentException if a key is not a field of the schema or a value does not fit its field
     */
    public static MapRecord of(RecordSchema schema, Map<String, ?> values) {
        Objects.requireNonNull(values, "values cannot be null");
        Map<String, Object> normalized = new HashMap<>();
        values.forEach((field, value) -> normalized.put(field, normalize(schema, field, value)));
        return new MapRecord(schema, Collections.unmodifiableMap(normalized));
    }

    /**
     * Returns a copy of this record where {@code field} holds {@code value}.
     *
     * @param field a field of this record's schema
     * @param value the value, {@code null} to populate the field with no value
     * @return a new record
     * @throws IllegalArgumentException if the field is unknown or the value does not fit its type
     */
    public MapRecord with(String field, Object value) {
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(field, normalize(schema, field, value));
        return new MapRecord(schema, Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a copy of this record where {@code field} is unset (not loaded).
     */
    public MapRecord without(String field) {
        schema.requireField(field);
        if (!values.containsKey(field)) {
            return this;
        }
        Map<String, Object> copy = new HashMap<>(values);
        copy.remove(field);
        return new MapRecord(schema, Collections.unmodifiableMap(copy));
    }

    @Override
    public RecordSchema getSchema() {
        return schema;
    }

    @Override
    public boolean isLoaded(String field) {
        schema.requireField(field);
        return values.containsKey(field);
    }

    @Override
    public Object get(String field) {
        if (!isLoaded(field)) {
            throw new FieldNotLoadedException(schema.getName(), field);
        }
        return values.get(field);
    }

    @Override
    public Set<String> getPopulatedFields() {
        Set<String> populated = new LinkedHashSet<>();
        for (FieldDescriptor descriptor : schema.getFields()) {
            if (values.containsKey(descriptor.name())) {
                populated.add(descriptor.name());
            }
        }
        return Collections.unmodifiableSet(populated);
    }

    @Override
    public MapRecord copyOnly(Set<String> fields) {
        Map<String, Object> kept = new HashMap<>();
        for (String field : fields) {
            schema.requireField(field);
            if (values.containsKey(field)) {
                kept.put(field, values.get(field));
            }
        }
        return new MapRecord(schema, Collections.unmodifiableMap(kept));
    }

    private static Object normalize(RecordSchema schema, String field, Object value) {
        FieldDescriptor descriptor = schema.requireField(field);
        if (value == null) {
            return null;
        }
        if (descriptor.isRelation()) {
            if (!(value instanceof DataRecord related)) {
                throw new IllegalArgumentException(String.format(
                        "Relation '%s' of %s expects a record, got %s", field, schema.getName(), value.getClass().getName()));
            }
            if (!related.getSchema().getName().equals(descriptor.relatedSchema())) {
                throw new IllegalArgumentException(String.format(
                        "Relation '%s' of %s expects a %s record, got %s",
                        field, schema.getName(), descriptor.relatedSchema(), related.getSchema().getName()));
            }
            return related;
        }
        ValueKind<?> kind = descriptor.type().valueKind().orElseThrow();
        try {
            return kind.coerce(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(
                    "Value '%s' does not fit field '%s' (%s) of %s", value, field, descriptor.type(), schema.getName()), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> boolean sameValue(ValueKind<T> kind, Object left, Object right) {
        return kind.sameValue((T) left, (T) right);
    }

    @SuppressWarnings("unchecked")
    private static <T> Object canonical(ValueKind<T> kind, Object value) {
        return kind.canonicalKey((T) value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MapRecord that)) return false;
        if (!schema.equals(that.schema) || !values.keySet().equals(that.values.keySet())) return false;

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object other = that.values.get(entry.getKey());
            ValueKind<?> kind = schema.requireField(entry.getKey()).type().valueKind().orElse(null);
            boolean same = kind == null
                    ? Objects.equals(entry.getValue(), other)
                    : sameValue(kind, entry.getValue(), other);
            if (!same) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = schema.getName().hashCode();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            ValueKind<?> kind = schema.requireField(entry.getKey()).type().valueKind().orElse(null);
            Object key = kind == null ? entry.getValue() : canonical(kind, entry.getValue());
            hash += entry.getKey().hashCode() ^ Objects.hashCode(key);
        }
        return hash;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", schema.getName() + "{", "}");
        for (String field : getPopulatedFields()) {
            joiner.add(field + "=" + values.get(field));
        }
        return joiner.toString();
    }
}
