package io.github.cyfko.recordql.jpa;

import io.github.cyfko.recordql.core.exception.SchemaAssignabilityException;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.view.RecordView;
import jakarta.persistence.Persistence;
import jakarta.persistence.PersistenceUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Bridges JPA entities and {@link RecordView}s.
 *
 * <pre>{@code
 * List<Account> accounts = entityManager.createQuery("from Account", Account.class).getResultList();
 *
 * RecordView view = EntityRecords.view(Account.class, accounts);
 * List<Account> big = EntityRecords.toEntities(
 *         view.filter(Match.field("revenue").greaterThan(1_000_000)), Account.class);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EntityRecords {

    private static final Logger logger = Logger.getLogger(EntityRecords.class.getName());

    private EntityRecords() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Creates a view of {@code entities} declaring the schema of {@code entityClass}.
     */
    public static <E> RecordView view(Class<E> entityClass, Collection<? extends E> entities) {
        return view(entityClass, entities, Persistence.getPersistenceUtil());
    }

    /**
     * Creates a view of {@code entities} declaring the schema of {@code entityClass}, reading loaded
     * states from {@code persistenceUtil}.
     */
    public static <E> RecordView view(Class<E> entityClass, Collection<? extends E> entities, PersistenceUtil persistenceUtil) {
        Objects.requireNonNull(entityClass, "entityClass cannot be null");
        List<EntityRecord> records = wrap(entities, persistenceUtil);
        logger.fine(() -> String.format("Wrapped %d %s entities", records.size(), entityClass.getSimpleName()));
        return RecordView.of(EntitySchemas.schemaFor(entityClass), records);
    }

    /**
     * Creates a view of {@code entities}, inferring the schema when they all share one.
     */
    public static RecordView view(Collection<?> entities) {
        return RecordView.of(wrap(entities, Persistence.getPersistenceUtil()));
    }

    /**
     * Unwraps the entities behind a view.
     *
     * @param view        a view of {@link EntityRecord}s
     * @param entityClass the expected entity class
     * @return the entities, in view order
     * @throws SchemaAssignabilityException if a record is not an {@code EntityRecord} wrapping an {@code entityClass} instance
     */
    public static <E> List<E> toEntities(RecordView view, Class<E> entityClass) {
        Objects.requireNonNull(view, "view cannot be null");
        Objects.requireNonNull(entityClass, "entityClass cannot be null");
        List<E> entities = new ArrayList<>(view.size());
        for (DataRecord record : view.asList()) {
            if (!(record instanceof EntityRecord entityRecord) || !entityClass.isInstance(entityRecord.getEntity())) {
                throw new SchemaAssignabilityException(String.format(
                        "Record %s does not wrap a %s", record, entityClass.getName()));
            }
            entities.add(entityClass.cast(entityRecord.getEntity()));
        }
        return Collections.unmodifiableList(entities);
    }

    private static List<EntityRecord> wrap(Collection<?> entities, PersistenceUtil persistenceUtil) {
        Objects.requireNonNull(entities, "entities cannot be null");
        List<EntityRecord> records = new ArrayList<>(entities.size());
        for (Object entity : entities) {
            records.add(EntityRecord.of(entity, persistenceUtil));
        }
        return records;
    }
}
