package io.github.cyfko.recordql.core.model;

import java.util.Objects;

/**
 * Describes one field of a {@link RecordSchema}: its name, its declared type and, for relations,
 * the name of the related schema.
 *
 * @param name          the field name, unique within its schema
 * @param type          the declared type
 * @param relatedSchema the related schema name for {@link FieldType#RELATION} fields, {@code null} otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FieldDescriptor(String name, FieldType type, String relatedSchema) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid field name: '" + name + "'");
        }
        if (type == FieldType.RELATION && (relatedSchema == null || relatedSchema.isBlank())) {
            throw new IllegalArgumentException("Relation field '" + name + "' requires a related schema name");
        }
        if (type != FieldType.RELATION && relatedSchema != null) {
            throw new IllegalArgumentException("Only relation fields declare a related schema, got " + type + " for '" + name + "'");
        }
    }

    /**
     * Creates a descriptor for a primitive field.
     *
     * @param name the field name
     * @param type the declared type, anything but {@link FieldType#RELATION}
     * @return the descriptor
     */
    public static FieldDescriptor of(String name, FieldType type) {
        return new FieldDescriptor(name, type, null);
    }

    /**
     * Creates a descriptor for a relation field.
     *
     * @param name          the field name
     * @param relatedSchema the name of the schema of the related record
     * @return the descriptor
     */
    public static FieldDescriptor relation(String name, String relatedSchema) {
        return new FieldDescriptor(name, FieldType.RELATION, relatedSchema);
    }

    public boolean isRelation() {
        return type == FieldType.RELATION;
    }
}
