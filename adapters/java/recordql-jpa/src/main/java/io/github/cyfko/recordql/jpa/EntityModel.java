package io.github.cyfko.recordql.jpa;

import io.github.cyfko.recordql.core.model.RecordSchema;

import java.lang.reflect.Field;
import java.util.Map;

/**
 * Reflective model of an entity class: its record schema and the Java field backing each record field.
 *
 * @param entityClass the mapped class
 * @param schema      the record schema derived from the class
 * @param fields      record field name to accessible Java field, in schema order
 */
record EntityModel(Class<?> entityClass, RecordSchema schema, Map<String, Field> fields) {

    Field field(String name) {
        schema.requireField(name);
        return fields.get(name);
    }
}
