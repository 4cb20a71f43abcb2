package io.github.cyfko.recordql.core.extract;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.resolve.FieldPathResolver;
import io.github.cyfko.recordql.core.resolve.ResolvedValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Extracts field values from records, either as a plain sequence (pluck) or as a partition of the
 * records keyed by value (groupBy).
 * <p>
 * One generic path serves every primitive kind; the kind decides the result type and the coercion:
 * </p>
 * <pre>{@code
 * List<String> names = ValueExtractor.pluck(records, FieldRef.parse("Name"), ValueKind.TEXT);
 * Map<LocalDate, List<DataRecord>> byCloseDate =
 *         ValueExtractor.groupBy(records, FieldRef.parse("CloseDate"), ValueKind.DATE);
 * }</pre>
 *
 * <h2>Kind compatibility</h2>
 * <p>
 * The declared type of the field must map to the requested kind. IDENTIFIER and TEXT fields are
 * interchangeable since both hold strings. Any other mismatch raises {@link IllegalArgumentException}.
 * A field behind a {@code null} relation extracts as {@code null}.
 * </p>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueExtractor {

    private ValueExtractor() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Projects the raw value of {@code field} for every record, in order, keeping {@code null}s.
     *
     * @param records the records to read
     * @param field   the field or relation path to extract
     * @return an unmodifiable list with one entry per record
     */
    public static List<Object> pluck(List<? extends DataRecord> records, FieldRef field) {
        return collect(records, record -> FieldPathResolver.resolve(record, field).value());
    }

    /**
     * Projects the value of {@code field} for every record, in order, keeping {@code null}s.
     *
     * @param records the records to read
     * @param field   the field or relation path to extract
     * @param kind    the kind of the field's values
     * @param <T>     the normalized type of the kind
     * @return an unmodifiable list with one entry per record
     * @throws IllegalArgumentException if the field's declared type does not map to {@code kind}
     */
    public static <T> List<T> pluck(List<? extends DataRecord> records, FieldRef field, ValueKind<T> kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        return collect(records, record -> extract(record, field, kind));
    }

    /**
     * Partitions records by the raw value of {@code field}.
     * <p>
     * Keys keep the order in which they were first seen; records keep their relative order within a
     * group. {@code null} is a valid key. Numbers equal by magnitude share a group, keyed by the first
     * one seen.
     * </p>
     *
     * @param records the records to partition
     * @param field   the field or relation path to group by
     * @return an unmodifiable map of unmodifiable lists
     */
    public static Map<Object, List<DataRecord>> groupBy(List<? extends DataRecord> records, FieldRef field) {
        return partition(records,
                record -> FieldPathResolver.resolve(record, field).value(),
                key -> key instanceof BigDecimal decimal ? ValueKind.NUMERIC.canonicalKey(decimal) : key);
    }

    /**
     * Partitions records by the typed value of {@code field}, with the ordering rules of
     * {@link #groupBy(List, FieldRef)}.
     *
     * @throws IllegalArgumentException if the field's declared type does not map to {@code kind}
     */
    public static <T> Map<T, List<DataRecord>> groupBy(List<? extends DataRecord> records, FieldRef field, ValueKind<T> kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        return partition(records, record -> extract(record, field, kind), kind::canonicalKey);
    }

    private static <T> T extract(DataRecord record, FieldRef field, ValueKind<T> kind) {
        ResolvedValue resolved = FieldPathResolver.resolve(record, field);
        FieldType declared = resolved.declaredType();
        if (declared != null && !isExtractableAs(declared, kind)) {
            throw new IllegalArgumentException(String.format(
                    "Field '%s' of %s is declared %s and cannot be extracted as %s",
                    field.path(), record.getSchema().getName(), declared, kind));
        }
        return kind.coerce(resolved.value());
    }

    private static boolean isExtractableAs(FieldType declared, ValueKind<?> kind) {
        ValueKind<?> declaredKind = declared.valueKind().orElse(null);
        if (declaredKind == null) {
            return false;
        }
        if (declaredKind == kind) {
            return true;
        }
        return (declaredKind == ValueKind.TEXT || declaredKind == ValueKind.IDENTIFIER)
                && (kind == ValueKind.TEXT || kind == ValueKind.IDENTIFIER);
    }

    private static <T> List<T> collect(List<? extends DataRecord> records, Function<DataRecord, T> extractor) {
        Objects.requireNonNull(records, "records cannot be null");
        List<T> values = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            values.add(extractor.apply(record));
        }
        return Collections.unmodifiableList(values);
    }

    private static <K> Map<K, List<DataRecord>> partition(List<? extends DataRecord> records,
                                                          Function<DataRecord, K> keyOf,
                                                          Function<K, Object> canonical) {
        Objects.requireNonNull(records, "records cannot be null");
        Map<Object, K> firstKeys = new HashMap<>();
        Map<K, List<DataRecord>> groups = new LinkedHashMap<>();

        for (DataRecord record : records) {
            K key = keyOf.apply(record);
            K groupKey = firstKeys.computeIfAbsent(canonical.apply(key), c -> key);
            groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(record);
        }

        Map<K, List<DataRecord>> frozen = new LinkedHashMap<>();
        groups.forEach((key, group) -> frozen.put(key, Collections.unmodifiableList(group)));
        return Collections.unmodifiableMap(frozen);
    }
}
