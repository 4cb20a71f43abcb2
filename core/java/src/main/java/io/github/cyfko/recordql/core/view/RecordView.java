package io.github.cyfko.recordql.core.view;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.config.MatchConfig;
import io.github.cyfko.recordql.core.exception.SchemaAssignabilityException;
import io.github.cyfko.recordql.core.extract.ValueExtractor;
import io.github.cyfko.recordql.core.extract.ValueKind;
import io.github.cyfko.recordql.core.match.RecordPredicate;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldDescriptor;
import io.github.cyfko.recordql.core.model.RecordSchema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable view over a sequence of records, exposing functional operations.
 * <p>
 * A view owns a private copy of its record sequence. Every transforming operation builds a new
 * view over a new sequence; neither the source collection nor any previous view is ever altered.
 * Records themselves are not copied (except by {@link #pick(Set)}), so several views may share them.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RecordView accounts = RecordView.of(records);
 *
 * RecordView foos = accounts.filter(Match.field("Name").equalTo("Foo"));
 * RecordView others = accounts.remove(Match.field("Name").equalTo("Foo"));
 *
 * List<String> names = accounts.pluckStrings("Name");                 // ["Foo", "Bar"]
 * Map<String, List<DataRecord>> byName = accounts.groupByStrings("Name");
 *
 * RecordView renamed = accounts.mapSome(
 *         Match.field("Name").equalTo("Foo"),
 *         r -> ((MapRecord) r).with("Name", "Foo Inc."));
 *
 * RecordView updates = accounts.pick("Id", "Name");  // safe partial records for a later update
 * }</pre>
 *
 * <h2>Schema</h2>
 * <p>
 * A view may declare the schema of its records. {@link #of(Collection)} infers it when all records
 * share one schema; {@link #of(RecordSchema, Collection)} declares it explicitly. A declared schema
 * is enforced by {@link #mapAll(UnaryOperator)} and {@link #mapSome(RecordPredicate, UnaryOperator)}.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * Operations either complete or throw; no partial view is ever returned. A field that was never
 * loaded raises {@link io.github.cyfko.recordql.core.exception.FieldNotLoadedException}, an
 * unsupported comparison raises {@link io.github.cyfko.recordql.core.exception.UnsupportedComparisonTypeException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecordView {

    private static final Logger logger = Logger.getLogger(RecordView.class.getName());

    private final List<DataRecord> records;
    private final RecordSchema schema;
    private final MatchConfig config;

    private RecordView(List<DataRecord> records, RecordSchema schema, MatchConfig config) {
        this.records = records;
        this.schema = schema;
        this.config = config;
    }

    // ========================================
    // Factories
    // ========================================

    /**
     * Creates a view over {@code records}, inferring the schema when all records share one.
     *
     * @param records the records, in iteration order; a set keeps its own iteration order
     * @return a new view
     * @throws NullPointerException if {@code records} or one of its elements is {@code null}
     */
    public static RecordView of(Collection<? extends DataRecord> records) {
        List<DataRecord> copy = copyOf(records);
        return new RecordView(copy, commonSchema(copy), MatchConfig.defaults());
    }

    /**
     * Creates a view over {@code records} declaring their schema.
     *
     * @throws SchemaAssignabilityException if a record is not assignable to {@code schema}
     */
    public static RecordView of(RecordSchema schema, Collection<? extends DataRecord> records) {
        Objects.requireNonNull(schema, "schema cannot be null");
        List<DataRecord> copy = copyOf(records);
        for (DataRecord record : copy) {
            requireAssignable(schema, record);
        }
        return new RecordView(copy, schema, MatchConfig.defaults());
    }

    /**
     * Creates an empty view of {@code schema}.
     */
    public static RecordView empty(RecordSchema schema) {
        return new RecordView(List.of(), Objects.requireNonNull(schema, "schema cannot be null"), MatchConfig.defaults());
    }

    /**
     * Returns a view over the same records evaluating predicates with {@code config}.
     */
    public RecordView withConfig(MatchConfig config) {
        return new RecordView(records, schema, Objects.requireNonNull(config, "config cannot be null"));
    }

    // ========================================
    // Predicate-driven operations
    // ========================================

    /**
     * Keeps the records matching {@code predicate}, in their original order.
     */
    public RecordView filter(RecordPredicate predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        List<DataRecord> kept = new ArrayList<>();
        for (DataRecord record : records) {
            if (predicate.matches(record, config)) {
                kept.add(record);
            }
        }
        logger.fine(() -> String.format("filter %s kept %d of %d records", predicate, kept.size(), records.size()));
        return derive(kept);
    }

    /**
     * Keeps the records not matching {@code predicate}, in their original order.
     * Together with {@link #filter(RecordPredicate)} it partitions this view.
     */
    public RecordView remove(RecordPredicate predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return filter(predicate.negate());
    }

    /**
     * Returns the first record matching {@code predicate}.
     */
    public Optional<DataRecord> find(RecordPredicate predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        for (DataRecord record : records) {
            if (predicate.matches(record, config)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    // ========================================
    // Transformations
    // ========================================

    /**
     * Applies {@code transform} to every record.
     *
     * @param transform a function returning a record assignable to this view's schema
     * @return a view of the same size
     * @throws SchemaAssignabilityException if a transformed record has a foreign schema
     */
    public RecordView mapAll(UnaryOperator<DataRecord> transform) {
        Objects.requireNonNull(transform, "transform cannot be null");
        List<DataRecord> mapped = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            mapped.add(checkMapped(transform.apply(record)));
        }
        return derive(mapped);
    }

    /**
     * Applies {@code transform} to the records matching {@code predicate}; the others pass through unchanged.
     *
     * @throws SchemaAssignabilityException if a transformed record has a foreign schema
     */
    public RecordView mapSome(RecordPredicate predicate, UnaryOperator<DataRecord> transform) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        Objects.requireNonNull(transform, "transform cannot be null");
        List<DataRecord> mapped = new ArrayList<>(records.size());
        int transformed = 0;
        for (DataRecord record : records) {
            if (predicate.matches(record, config)) {
                mapped.add(checkMapped(transform.apply(record)));
                transformed++;
            } else {
                mapped.add(record);
            }
        }
        int count = transformed;
        logger.fine(() -> String.format("mapSome %s transformed %d of %d records", predicate, count, records.size()));
        return derive(mapped);
    }

    /**
     * Replaces every record by a copy of the same schema where only {@code fields} are populated.
     * <p>
     * The other fields are explicitly unset, so persisting a picked record cannot overwrite them.
     * </p>
     *
     * @param fields direct field names; relation paths are not accepted
     * @return a view of copies
     * @throws IllegalArgumentException if a name is a dotted path or not a field of a record's schema
     */
    public RecordView pick(Set<String> fields) {
        Objects.requireNonNull(fields, "fields cannot be null");
        for (String field : fields) {
            if (field.contains(".")) {
                throw new IllegalArgumentException("pick accepts direct fields only, got path '" + field + "'");
            }
        }
        Set<String> picked = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        List<DataRecord> copies = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            copies.add(record.copyOnly(picked));
        }
        return derive(copies);
    }

    public RecordView pick(String... fields) {
        return pick(new LinkedHashSet<>(Arrays.asList(fields)));
    }

    // ========================================
    // Grouping
    // ========================================

    /**
     * Partitions the records by the raw value of {@code field}.
     * Keys keep their first-seen order; {@code null} is a valid key.
     */
    public Map<Object, List<DataRecord>> groupBy(String field) {
        return groupBy(FieldRef.parse(field));
    }

    public Map<Object, List<DataRecord>> groupBy(FieldRef field) {
        return ValueExtractor.groupBy(records, field);
    }

    public <T> Map<T, List<DataRecord>> groupBy(String field, ValueKind<T> kind) {
        return groupBy(FieldRef.parse(field), kind);
    }

    public <T> Map<T, List<DataRecord>> groupBy(FieldRef field, ValueKind<T> kind) {
        return ValueExtractor.groupBy(records, field, kind);
    }

    public Map<Boolean, List<DataRecord>> groupByBooleans(String field) {
        return groupBy(field, ValueKind.BOOLEAN);
    }

    public Map<LocalDate, List<DataRecord>> groupByDates(String field) {
        return groupBy(field, ValueKind.DATE);
    }

    public Map<LocalDateTime, List<DataRecord>> groupByDatetimes(String field) {
        return groupBy(field, ValueKind.DATETIME);
    }

    public Map<BigDecimal, List<DataRecord>> groupByNumbers(String field) {
        return groupBy(field, ValueKind.NUMERIC);
    }

    public Map<String, List<DataRecord>> groupByIds(String field) {
        return groupBy(field, ValueKind.IDENTIFIER);
    }

    public Map<String, List<DataRecord>> groupByStrings(String field) {
        return groupBy(field, ValueKind.TEXT);
    }

    // ========================================
    // Plucking
    // ========================================

    /**
     * Projects the raw value of {@code field} for every record; the result has one entry per record,
     * {@code null}s included.
     */
    public List<Object> pluck(String field) {
        return pluck(FieldRef.parse(field));
    }

    public List<Object> pluck(FieldRef field) {
        return ValueExtractor.pluck(records, field);
    }

    public <T> List<T> pluck(String field, ValueKind<T> kind) {
        return pluck(FieldRef.parse(field), kind);
    }

    public <T> List<T> pluck(FieldRef field, ValueKind<T> kind) {
        return ValueExtractor.pluck(records, field, kind);
    }

    public List<Boolean> pluckBooleans(String field) {
        return pluck(field, ValueKind.BOOLEAN);
    }

    public List<LocalDate> pluckDates(String field) {
        return pluck(field, ValueKind.DATE);
    }

    public List<LocalDateTime> pluckDatetimes(String field) {
        return pluck(field, ValueKind.DATETIME);
    }

    public List<BigDecimal> pluckNumbers(String field) {
        return pluck(field, ValueKind.NUMERIC);
    }

    public List<String> pluckIds(String field) {
        return pluck(field, ValueKind.IDENTIFIER);
    }

    /**
     * Plucks the identifier field of the view's schema.
     *
     * @throws IllegalStateException if the view has no schema, or its schema declares no identifier field
     */
    public List<String> pluckIds() {
        if (schema == null) {
            throw new IllegalStateException("pluckIds() requires a view with a known schema");
        }
        FieldDescriptor idField = schema.getIdField().orElseThrow(() ->
                new IllegalStateException("Schema " + schema.getName() + " declares no identifier field"));
        return pluckIds(idField.name());
    }

    public List<String> pluckStrings(String field) {
        return pluck(field, ValueKind.TEXT);
    }

    // ========================================
    // Materialization
    // ========================================

    /**
     * @return the records, in order, as an unmodifiable list
     */
    public List<DataRecord> asList() {
        return records;
    }

    /**
     * Returns the records as instances of {@code type}.
     *
     * @throws SchemaAssignabilityException if a record is not an instance of {@code type}
     */
    public <T extends DataRecord> List<T> asList(Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        List<T> narrowed = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            if (!type.isInstance(record)) {
                throw new SchemaAssignabilityException(String.format(
                        "Record %s is a %s, not a %s", record, record.getClass().getName(), type.getName()));
            }
            narrowed.add(type.cast(record));
        }
        return Collections.unmodifiableList(narrowed);
    }

    /**
     * Returns the records, checking they are all assignable to {@code schema}.
     *
     * @throws SchemaAssignabilityException if a record's schema is not assignable to {@code schema}
     */
    public List<DataRecord> asList(RecordSchema schema) {
        Objects.requireNonNull(schema, "schema cannot be null");
        for (DataRecord record : records) {
            requireAssignable(schema, record);
        }
        return records;
    }

    /**
     * @return the distinct records (by {@code equals}), in first-seen order, as an unmodifiable set
     */
    public Set<DataRecord> asSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(records));
    }

    public <T extends DataRecord> Set<T> asSet(Class<T> type) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(asList(type)));
    }

    // ========================================
    // Accessors
    // ========================================

    /**
     * @return the declared or inferred schema, empty when unknown
     */
    public Optional<RecordSchema> getSchema() {
        return Optional.ofNullable(schema);
    }

    public MatchConfig getConfig() {
        return config;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return "RecordView[" + (schema == null ? "?" : schema.getName()) + ", size=" + records.size() + "]";
    }

    // ========================================
    // Internals
    // ========================================

    private RecordView derive(List<DataRecord> derived) {
        return new RecordView(Collections.unmodifiableList(derived), schema, config);
    }

    private DataRecord checkMapped(DataRecord mapped) {
        if (mapped == null) {
            throw new NullPointerException("transform returned null");
        }
        if (schema != null) {
            requireAssignable(schema, mapped);
        }
        return mapped;
    }

    private static void requireAssignable(RecordSchema schema, DataRecord record) {
        if (!schema.isAssignableFrom(record.getSchema())) {
            throw new SchemaAssignabilityException(String.format(
                    "Record of schema %s is not assignable to schema %s", record.getSchema().getName(), schema.getName()));
        }
    }

    private static List<DataRecord> copyOf(Collection<? extends DataRecord> records) {
        Objects.requireNonNull(records, "records cannot be null");
        List<DataRecord> copy = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            copy.add(Objects.requireNonNull(record, "records cannot contain null"));
        }
        return Collections.unmodifiableList(copy);
    }

    private static RecordSchema commonSchema(List<DataRecord> records) {
        RecordSchema common = null;
        for (DataRecord record : records) {
            if (common == null) {
                common = record.getSchema();
            } else if (!common.isAssignableFrom(record.getSchema())) {
                return null;
            }
        }
        return common;
    }
}
