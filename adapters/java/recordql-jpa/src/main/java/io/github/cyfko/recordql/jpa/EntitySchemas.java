package io.github.cyfko.recordql.jpa;

import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.model.RecordSchema;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Transient;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Derives {@link RecordSchema}s from JPA-annotated classes.
 * <p>
 * The schema of an entity lists its persistent single-valued attributes, including those inherited
 * from superclasses, parents first:
 * </p>
 * <table border="1">
 * <caption>Attribute mapping</caption>
 * <tr><th>Java attribute</th><th>Field type</th></tr>
 * <tr><td>{@code @Id} (any type)</td><td>IDENTIFIER, declared as the schema id field</td></tr>
 * <tr><td>boolean, Boolean</td><td>BOOLEAN</td></tr>
 * <tr><td>numeric primitives, Number</td><td>NUMERIC</td></tr>
 * <tr><td>LocalDate</td><td>DATE</td></tr>
 * <tr><td>LocalDateTime, Instant, OffsetDateTime, ZonedDateTime, Date</td><td>DATETIME</td></tr>
 * <tr><td>UUID</td><td>IDENTIFIER</td></tr>
 * <tr><td>String, char, enum</td><td>TEXT</td></tr>
 * <tr><td>{@code @Entity} or {@code @Embeddable} class</td><td>RELATION</td></tr>
 * </table>
 * <p>
 * Static, {@code transient} and {@code @Transient} fields are skipped, as are collection, map and
 * array attributes and any type not listed above. The schema name is the JPA entity name.
 * </p>
 *
 * <p>Models are computed once per class and cached; this class is thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EntitySchemas {

    private static final Logger logger = Logger.getLogger(EntitySchemas.class.getName());

    private static final Map<Class<?>, EntityModel> MODEL_CACHE = new ConcurrentHashMap<>();

    private EntitySchemas() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Returns the record schema of {@code entityClass}.
     *
     * @param entityClass a class annotated with {@code @Entity} or {@code @Embeddable}, or a subclass of one
     * @return the cached schema
     * @throws IllegalArgumentException if the class is not a JPA entity or embeddable
     */
    public static RecordSchema schemaFor(Class<?> entityClass) {
        return modelFor(entityClass).schema();
    }

    /**
     * Returns the schema name of {@code entityClass}: the {@code @Entity} name when set, the simple
     * name of the mapped class otherwise.
     *
     * @throws IllegalArgumentException if the class is not a JPA entity or embeddable
     */
    public static String schemaName(Class<?> entityClass) {
        Class<?> mapped = mappedClass(entityClass).orElseThrow(() -> new IllegalArgumentException(
                entityClass.getName() + " is neither an @Entity nor an @Embeddable"));
        Entity entity = mapped.getAnnotation(Entity.class);
        return entity != null && !entity.name().isEmpty() ? entity.name() : mapped.getSimpleName();
    }

    /**
     * Clears the model cache. Intended for tests.
     */
    public static void clearCache() {
        MODEL_CACHE.clear();
    }

    static EntityModel modelFor(Class<?> entityClass) {
        return MODEL_CACHE.computeIfAbsent(entityClass, EntitySchemas::buildModel);
    }

    private static EntityModel buildModel(Class<?> entityClass) {
        Class<?> mapped = mappedClass(entityClass).orElseThrow(() -> new IllegalArgumentException(
                entityClass.getName() + " is neither an @Entity nor an @Embeddable"));
        RecordSchema.Builder builder = RecordSchema.builder(schemaName(mapped));
        Map<String, Field> fields = new LinkedHashMap<>();

        for (Class<?> type : hierarchyOf(mapped)) {
            for (Field field : type.getDeclaredFields()) {
                if (isSkipped(field) || fields.containsKey(field.getName())) {
                    continue;
                }
                if (field.isAnnotationPresent(Id.class) || field.isAnnotationPresent(EmbeddedId.class)) {
                    builder.idField(field.getName());
                } else if (isMapped(field.getType())) {
                    Class<?> relatedType = field.getType();
                    builder.relation(field.getName(), schemaName(relatedType), () -> schemaFor(relatedType));
                } else {
                    Optional<FieldType> fieldType = fieldTypeOf(field.getType());
                    if (fieldType.isEmpty()) {
                        logger.fine(() -> String.format("Skipping %s.%s: unsupported type %s",
                                type.getSimpleName(), field.getName(), field.getType().getName()));
                        continue;
                    }
                    builder.field(field.getName(), fieldType.get());
                }
                field.setAccessible(true);
                fields.put(field.getName(), field);
            }
        }

        RecordSchema schema = builder.build();
        logger.fine(() -> String.format("Derived schema %s for %s: %s", schema.getName(), entityClass.getName(), fields.keySet()));
        return new EntityModel(mapped, schema, Collections.unmodifiableMap(fields));
    }

    /**
     * Maps a Java attribute type to a primitive field type.
     *
     * @param type the attribute type
     * @return the field type, or empty when the type is not supported
     */
    static Optional<FieldType> fieldTypeOf(Class<?> type) {
        if (type == boolean.class || type == Boolean.class) {
            return Optional.of(FieldType.BOOLEAN);
        }
        if ((type.isPrimitive() && type != char.class && type != void.class) || Number.class.isAssignableFrom(type)) {
            return Optional.of(FieldType.NUMERIC);
        }
        if (type == LocalDate.class) {
            return Optional.of(FieldType.DATE);
        }
        if (type == LocalDateTime.class || type == Instant.class || type == OffsetDateTime.class
                || type == ZonedDateTime.class || Date.class.isAssignableFrom(type)) {
            return Optional.of(FieldType.DATETIME);
        }
        if (type == UUID.class) {
            return Optional.of(FieldType.IDENTIFIER);
        }
        if (type == String.class || type == char.class || type == Character.class || type.isEnum()) {
            return Optional.of(FieldType.TEXT);
        }
        return Optional.empty();
    }

    private static boolean isSkipped(Field field) {
        int modifiers = field.getModifiers();
        return Modifier.isStatic(modifiers)
                || Modifier.isTransient(modifiers)
                || field.isSynthetic()
                || field.isAnnotationPresent(Transient.class)
                || Collection.class.isAssignableFrom(field.getType())
                || Map.class.isAssignableFrom(field.getType())
                || field.getType().isArray();
    }

    private static boolean isMapped(Class<?> type) {
        return type.isAnnotationPresent(Entity.class) || type.isAnnotationPresent(Embeddable.class);
    }

    // Provider proxies subclass the entity, so the mapped class may sit higher in the hierarchy.
    private static Optional<Class<?>> mappedClass(Class<?> type) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            if (isMapped(current)) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    private static Deque<Class<?>> hierarchyOf(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.addFirst(current);
        }
        return hierarchy;
    }
}
