package io.github.cyfko.recordql.jpa;

import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldDescriptor;
import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.model.RecordSchema;
import io.github.cyfko.recordql.jpa.exception.EntityAccessException;
import jakarta.persistence.Persistence;
import jakarta.persistence.PersistenceUtil;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DataRecord} view of a JPA entity instance.
 * <p>
 * The loaded state of an attribute comes from the persistence provider through
 * {@link PersistenceUtil#isLoaded(Object, String)}: a lazy attribute that was never fetched reads
 * as "not loaded" instead of triggering a fetch. Records produced by {@link #copyOnly(Set)} wrap a
 * fresh detached instance and track their populated fields explicitly.
 * </p>
 *
 * <pre>{@code
 * EntityRecord record = EntityRecord.of(account);
 * record.isLoaded("parent");   // false while the lazy association is uninitialized
 * record.get("name");          // reads the field reflectively
 * }</pre>
 *
 * <p>Values are normalized the way {@link io.github.cyfko.recordql.core.model.MapRecord} does;
 * relation attributes are returned as {@code EntityRecord}s sharing this record's persistence util.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EntityRecord implements DataRecord {

    private final Object entity;
    private final EntityModel model;
    private final PersistenceUtil persistenceUtil;
    private final Set<String> populated;

    private EntityRecord(Object entity, EntityModel model, PersistenceUtil persistenceUtil, Set<String> populated) {
        this.entity = entity;
        this.model = model;
        this.persistenceUtil = persistenceUtil;
        this.populated = populated;
    }

    /**
     * Wraps {@code entity}, asking the bootstrap {@link Persistence#getPersistenceUtil()} for loaded states.
     */
    public static EntityRecord of(Object entity) {
        return of(entity, Persistence.getPersistenceUtil());
    }

    /**
     * Wraps {@code entity}, asking {@code persistenceUtil} for loaded states.
     *
     * @throws IllegalArgumentException if the entity's class is not a JPA entity or embeddable
     */
    public static EntityRecord of(Object entity, PersistenceUtil persistenceUtil) {
        Objects.requireNonNull(entity, "entity cannot be null");
        Objects.requireNonNull(persistenceUtil, "persistenceUtil cannot be null");
        return new EntityRecord(entity, EntitySchemas.modelFor(entity.getClass()), persistenceUtil, null);
    }

    /**
     * @return the wrapped entity instance
     */
    public Object getEntity() {
        return entity;
    }

    @Override
    public RecordSchema getSchema() {
        return model.schema();
    }

    @Override
    public boolean isLoaded(String field) {
        model.schema().requireField(field);
        return populated != null ? populated.contains(field) : persistenceUtil.isLoaded(entity, field);
    }

    @Override
    public Object get(String field) {
        if (!isLoaded(field)) {
            throw new FieldNotLoadedException(model.schema().getName(), field);
        }
        FieldDescriptor descriptor = model.schema().requireField(field);
        return toRecordValue(descriptor, read(model.field(field)));
    }

    @Override
    public Set<String> getPopulatedFields() {
        Set<String> fields = new LinkedHashSet<>();
        for (FieldDescriptor descriptor : model.schema().getFields()) {
            if (isLoaded(descriptor.name())) {
                fields.add(descriptor.name());
            }
        }
        return Collections.unmodifiableSet(fields);
    }

    /**
     * Copies the listed attributes into a new instance of the entity class.
     *
     * @throws EntityAccessException if the entity class cannot be instantiated
     */
    @Override
    public EntityRecord copyOnly(Set<String> fields) {
        Object copy = instantiate(model.entityClass());
        Set<String> kept = new LinkedHashSet<>();
        for (String field : fields) {
            if (isLoaded(field)) {
                Field javaField = model.field(field);
                write(javaField, copy, read(javaField));
                kept.add(field);
            }
        }
        return new EntityRecord(copy, model, persistenceUtil, Collections.unmodifiableSet(kept));
    }

    private Object toRecordValue(FieldDescriptor descriptor, Object raw) {
        if (raw == null) {
            return null;
        }
        if (descriptor.type() == FieldType.RELATION) {
            return new EntityRecord(raw, EntitySchemas.modelFor(raw.getClass()), persistenceUtil, null);
        }
        if (descriptor.type() == FieldType.IDENTIFIER || raw instanceof Character) {
            return raw.toString();
        }
        return descriptor.type().valueKind().orElseThrow().coerce(raw);
    }

    private Object read(Field field) {
        try {
            return field.get(entity);
        } catch (IllegalAccessException e) {
            throw new EntityAccessException("Cannot read " + model.entityClass().getSimpleName() + "." + field.getName(), e);
        }
    }

    private static void write(Field field, Object target, Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new EntityAccessException("Cannot write " + target.getClass().getSimpleName() + "." + field.getName(), e);
        }
    }

    private static Object instantiate(Class<?> type) {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new EntityAccessException(type.getName() + " has no no-argument constructor", e);
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new EntityAccessException("Cannot instantiate " + type.getName(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRecord that)) return false;
        return entity == that.entity && Objects.equals(populated, that.populated);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(entity);
    }

    @Override
    public String toString() {
        return "EntityRecord[" + model.schema().getName() + ", " + entity + "]";
    }
}
