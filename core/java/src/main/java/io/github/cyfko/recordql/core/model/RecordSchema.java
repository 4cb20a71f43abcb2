package io.github.cyfko.recordql.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Immutable description of a record type: its name, its fields and, optionally, which field
 * identifies a record.
 * <p>
 * Schemas are built once through {@link #builder(String)} and shared by every record of that type.
 * Field order is the declaration order.
 * </p>
 * <p>
 * A relation declared with the related {@link RecordSchema} itself (or a supplier of it, for
 * schemas that reference each other) lets paths be typed without any record at hand. A relation
 * to the schema being built resolves to that schema. A relation declared by name only to another
 * schema stays unresolved.
 * </p>
 *
 * <pre>{@code
 * RecordSchema account = RecordSchema.builder("Account")
 *         .idField("Id")
 *         .field("Name", FieldType.TEXT)
 *         .field("Revenue", FieldType.NUMERIC)
 *         .relation("Parent", "Account")
 *         .build();
 *
 * RecordSchema contact = RecordSchema.builder("Contact")
 *         .field("LastName", FieldType.TEXT)
 *         .relation("Account", account)
 *         .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecordSchema {

    private final String name;
    private final Map<String, FieldDescriptor> fields;
    private final String idField;
    private final Map<String, Supplier<RecordSchema>> relatedSchemas;

    private RecordSchema(Builder builder) {
        this.name = builder.name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.idField = builder.idField;
        this.relatedSchemas = Map.copyOf(builder.relatedSchemas);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Returns every field of this schema in declaration order.
     *
     * @return an unmodifiable collection of descriptors
     */
    public Collection<FieldDescriptor> getFields() {
        return fields.values();
    }

    public Optional<FieldDescriptor> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Returns the descriptor of {@code fieldName}.
     *
     * @param fieldName the field name
     * @return the descriptor
     * @throws IllegalArgumentException if the schema does not declare that field
     */
    public FieldDescriptor requireField(String fieldName) {
        FieldDescriptor descriptor = fields.get(fieldName);
        if (descriptor == null) {
            throw new IllegalArgumentException(
                    String.format("Field '%s' not found in schema %s", fieldName, name));
        }
        return descriptor;
    }

    /**
     * Returns the identifier field, if the schema declares one.
     *
     * @return the identifier field descriptor
     */
    public Optional<FieldDescriptor> getIdField() {
        return idField == null ? Optional.empty() : Optional.of(fields.get(idField));
    }

    /**
     * Returns the schema of the records held by relation {@code fieldName}.
     *
     * @param fieldName a relation field of this schema
     * @return the related schema, or empty if the relation was declared by name only
     * @throws IllegalArgumentException if the field is unknown or is not a relation
     * @throws IllegalStateException    if the supplied schema does not carry the declared name
     */
    public Optional<RecordSchema> getRelatedSchema(String fieldName) {
        FieldDescriptor descriptor = requireField(fieldName);
        if (!descriptor.isRelation()) {
            throw new IllegalArgumentException(
                    String.format("Field '%s' of schema %s is not a relation", fieldName, name));
        }
        if (descriptor.relatedSchema().equals(name)) {
            return Optional.of(this);
        }
        Supplier<RecordSchema> resolver = relatedSchemas.get(fieldName);
        if (resolver == null) {
            return Optional.empty();
        }
        RecordSchema related = Objects.requireNonNull(resolver.get(),
                () -> "Relation '" + fieldName + "' of " + name + " resolved to no schema");
        if (!related.name.equals(descriptor.relatedSchema())) {
            throw new IllegalStateException(String.format("Relation '%s' of %s declares schema %s but resolved to %s",
                    fieldName, name, descriptor.relatedSchema(), related.name));
        }
        return Optional.of(related);
    }

    /**
     * Checks whether records of {@code other} can stand where records of this schema are expected.
     * Schemas are nominal: two schemas are assignable when they carry the same name.
     *
     * @param other the candidate schema
     * @return {@code true} if records of {@code other} are assignable to this schema
     */
    public boolean isAssignableFrom(RecordSchema other) {
        return other != null && name.equals(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordSchema that)) return false;
        return name.equals(that.name) && fields.equals(that.fields) && Objects.equals(idField, that.idField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields, idField);
    }

    @Override
    public String toString() {
        return "RecordSchema[" + name + ", fields=" + fields.keySet() + "]";
    }

    /**
     * Builder for {@link RecordSchema}.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private String idField;
        private final Map<String, Supplier<RecordSchema>> relatedSchemas = new LinkedHashMap<>();

        private Builder(String name) {
            Objects.requireNonNull(name, "schema name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("schema name cannot be blank");
            }
            this.name = name;
        }

        /**
         * Declares the identifier field, typed {@link FieldType#IDENTIFIER}.
         */
        public Builder idField(String fieldName) {
            if (idField != null) {
                throw new IllegalStateException("Schema " + name + " already declares id field '" + idField + "'");
            }
            add(FieldDescriptor.of(fieldName, FieldType.IDENTIFIER));
            this.idField = fieldName;
            return this;
        }

        public Builder field(String fieldName, FieldType type) {
            return add(FieldDescriptor.of(fieldName, type));
        }

        /**
         * Declares a relation by schema name. Only a relation to the schema being built can be
         * resolved later; use {@link #relation(String, RecordSchema)} for any other schema.
         */
        public Builder relation(String fieldName, String relatedSchema) {
            return add(FieldDescriptor.relation(fieldName, relatedSchema));
        }

        public Builder relation(String fieldName, RecordSchema relatedSchema) {
            Objects.requireNonNull(relatedSchema, "related schema cannot be null");
            return relation(fieldName, relatedSchema.getName(), () -> relatedSchema);
        }

        /**
         * Declares a relation whose schema is looked up on first use, for schemas that reference
         * each other.
         *
         * @param fieldName     the relation field
         * @param relatedSchema the name of the related schema
         * @param resolver      supplies the related schema; must return a schema named {@code relatedSchema}
         */
        public Builder relation(String fieldName, String relatedSchema, Supplier<RecordSchema> resolver) {
            Objects.requireNonNull(resolver, "schema resolver cannot be null");
            add(FieldDescriptor.relation(fieldName, relatedSchema));
            relatedSchemas.put(fieldName, resolver);
            return this;
        }

        public Builder add(FieldDescriptor descriptor) {
            Objects.requireNonNull(descriptor, "descriptor cannot be null");
            if (fields.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException(
                        String.format("Field '%s' is declared twice in schema %s", descriptor.name(), name));
            }
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(this);
        }
    }
}
